package com.vidnyan.misra.adapter.out.evaluator;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.rule.CollectingSink;
import com.vidnyan.misra.domain.rule.RuleScope;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ForbiddenTokenRuleTest {

    @Test
    void evaluate_ShouldReportEveryOccurrence() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "goto end ;")
                .line(2, "x = 1 ;")
                .line(3, "goto end ;");

        ForbiddenTokenRule rule = new ForbiddenTokenRule(15, 1, "goto", RuleScope.CONFIGURATION);

        assertEquals(List.of("1:15.1", "3:15.1"), CollectingSink.run(rule, b.unit()).reports());
    }

    @Test
    void evaluate_ShouldReadRawTokensForRawScope() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "int * restrict p ;");
        // the configuration has no tokens, only the raw stream does
        ModelBuilder empty = ModelBuilder.file("test.c");

        ForbiddenTokenRule rule = new ForbiddenTokenRule(8, 14, "restrict", RuleScope.RAW_TOKENS);

        assertEquals(RuleScope.RAW_TOKENS, rule.scope());
        assertEquals(List.of("1:8.14"), CollectingSink.run(rule, b.unit(empty.configuration())).reports());
    }
}
