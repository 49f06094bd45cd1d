package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.rule.CollectingSink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionalDirectiveFileRuleTest {

    private final ConditionalDirectiveFileRule rule = new ConditionalDirectiveFileRule();

    @Test
    void evaluate_ShouldAcceptBalancedConditionalsPerFile() {
        ModelBuilder b = ModelBuilder.file("a.c")
                .directive("a.c", 1, "#ifdef A")
                .directive("a.h", 1, "#ifndef A_H")
                .directive("a.h", 9, "#endif")
                .directive("a.c", 3, "#else")
                .directive("a.c", 5, "#endif");

        assertTrue(CollectingSink.run(rule, b.unit()).reports().isEmpty());
    }

    @Test
    void evaluate_ShouldReportDirectivesClosingAnotherFilesConditional() {
        ModelBuilder b = ModelBuilder.file("a.c")
                .directive("a.h", 1, "#if X")
                .directive("a.c", 4, "#elif Y")
                .directive("a.c", 6, "#endif")
                .directive("a.c", 8, "#endif");

        assertEquals(List.of("4:20.14", "6:20.14", "8:20.14"), CollectingSink.run(rule, b.unit()).reports());
    }
}
