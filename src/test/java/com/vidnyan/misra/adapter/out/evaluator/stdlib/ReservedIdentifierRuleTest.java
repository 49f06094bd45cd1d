package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.VariableFlag;
import com.vidnyan.misra.domain.rule.CollectingSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReservedIdentifierRuleTest {

    private final ReservedIdentifierRule rule = new ReservedIdentifierRule();

    @Test
    void evaluate_ShouldReportReservedDeclarationsOnce() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "int _x ;")
                .line(2, "static int _y ;")
                .line(3, "int __z ;")
                .line(4, "int errno ;")
                .line(5, "void _Run ( ) ;")
                .line(6, "int value ;");
        b.variable(b.find("_x"), b.find("int"), b.find("int"), -1, EnumSet.of(VariableFlag.GLOBAL));
        b.variable(b.find("_y"), b.find("int", 1), b.find("int", 1), -1,
                EnumSet.of(VariableFlag.GLOBAL, VariableFlag.STATIC));
        b.variable(b.find("__z"), b.find("int", 2), b.find("int", 2), -1, EnumSet.of(VariableFlag.GLOBAL));
        b.variable(b.find("errno"), b.find("int", 3), b.find("int", 3), -1, EnumSet.of(VariableFlag.GLOBAL));
        b.variable(b.find("value"), b.find("int", 4), b.find("int", 4), -1, EnumSet.of(VariableFlag.GLOBAL));
        b.function("_Run", b.find("_Run"), false, Map.of());

        assertEquals(List.of("1:21.1", "3:21.1", "4:21.1", "5:21.1"), CollectingSink.run(rule, b.unit()).reports());
    }

    @Test
    void evaluate_ShouldReportReservedMacroDefinitions() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .directive(1, "#define _BUFFER 16")
                .directive(2, "#define errno 0")
                .directive(3, "#define _lower 1")
                .directive(4, "#define BUFFER 16");

        assertEquals(List.of("1:21.1", "2:21.1"), CollectingSink.run(rule, b.unit()).reports());
    }
}
