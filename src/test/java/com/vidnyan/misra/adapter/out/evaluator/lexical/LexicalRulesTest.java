package com.vidnyan.misra.adapter.out.evaluator.lexical;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.rule.CollectingSink;
import com.vidnyan.misra.domain.rule.RuleScope;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexicalRulesTest {

    @Test
    void nestedComment_ShouldReportCommentOpenersInsideComments() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "/* outer /* inner */")
                .line(2, "x = 1 ; // see http://example.org")
                .line(3, "/* see // here */")
                .line(4, "// a /* b");

        NestedCommentRule rule = new NestedCommentRule();

        assertEquals(RuleScope.RAW_TOKENS, rule.scope());
        assertEquals(List.of("1:3.1", "3:3.1", "4:3.1"), CollectingSink.run(rule, b.unit()).reports());
    }

    @Test
    void lineSplicedComment_ShouldReportCommentsContinuedOnTheSameLine() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "// plain")
                .line(2, "x = 1 ;")
                .line(3, "// spliced ??/")
                .line(4, "y = 2 ;");

        assertEquals(List.of("3:3.2"), CollectingSink.run(new LineSplicedCommentRule(), b.unit()).reports());
    }

    @Test
    void trigraph_ShouldReportStringLiteralsContainingTrigraphs() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "s = \"what??!\" ;")
                .line(2, "t = \"what?!\" ;");

        assertEquals(List.of("1:4.2"), CollectingSink.run(new TrigraphRule(), b.unit()).reports());
    }

    @Test
    void unterminatedEscape_ShouldRequireTerminatedNumericEscapes() {
        assertTrue(UnterminatedEscapeSequenceRule.hasUnterminatedEscape("\"\\x41g\""));
        assertTrue(UnterminatedEscapeSequenceRule.hasUnterminatedEscape("'\\0a'"));
        assertFalse(UnterminatedEscapeSequenceRule.hasUnterminatedEscape("\"\\x41\""));
        assertFalse(UnterminatedEscapeSequenceRule.hasUnterminatedEscape("\"\\0\""));
        assertFalse(UnterminatedEscapeSequenceRule.hasUnterminatedEscape("\"\\n\""));
        assertFalse(UnterminatedEscapeSequenceRule.hasUnterminatedEscape("x"));
    }
}
