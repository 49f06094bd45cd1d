package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.NodeArena;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.model.VariableFlag;
import com.vidnyan.misra.domain.rule.CollectingSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArrayAndArithmeticRulesTest {

    @Test
    void pointerArithmetic_ShouldReportAdditiveOperatorsOnPointers() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "p + 1 ;")
                .line(2, "p -= n ;")
                .line(3, "a + b ;");
        ValueType intType = ValueType.of("int", "signed");
        b.ast(1, 0, 2).valueType(0, ValueType.pointerTo("int", 1)).valueType(2, intType);
        b.ast(5, 4, 6).valueType(4, ValueType.pointerTo("char", 1)).valueType(6, intType);
        b.ast(9, 8, 10).valueType(8, intType).valueType(10, intType);

        assertEquals(List.of("1:18.4", "2:18.4"), CollectingSink.run(new PointerArithmeticRule(), b.unit()).reports());
    }

    @Test
    void flexibleArrayMember_ShouldReportUnsizedLastMember() {
        // Arrange
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "struct S { int n ; int data [ ] ; } ;")
                .line(2, "struct T { int n ; int data [ 4 ] ; } ;")
                .line(3, "struct U { struct { int x [ ] ; } inner ; int n ; } ;");
        b.scope(ScopeType.STRUCT, "S", 2, 11, -1);
        b.scope(ScopeType.STRUCT, "T", 15, 25, -1);
        b.scope(ScopeType.STRUCT, "U", 29, 43, -1);

        // Act
        List<String> reports = CollectingSink.run(new FlexibleArrayMemberRule(), b.unit()).reports();

        // Assert
        assertEquals(List.of("1:18.7"), reports);
    }

    @Test
    void variableLengthArray_ShouldReportNonConstantDimension() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "void f ( int n ) {")
                .line(2, "int a [ n ] ;")
                .line(3, "int c [ 4 ] ;")
                .line(4, "}");
        EnumSet<VariableFlag> localArray = EnumSet.of(VariableFlag.LOCAL, VariableFlag.ARRAY);
        b.variable(4, 3, 3, NodeArena.NONE, EnumSet.of(VariableFlag.ARGUMENT), 10);
        b.variable(8, 7, 7, NodeArena.NONE, localArray);
        b.variable(14, 13, 13, NodeArena.NONE, localArray);
        b.ast(9, 8, 10).ast(15, 14, 16);

        assertEquals(List.of("2:18.8"), CollectingSink.run(new VariableLengthArrayRule(), b.unit()).reports());
    }
}
