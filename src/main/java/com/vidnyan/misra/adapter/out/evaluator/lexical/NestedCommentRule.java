package com.vidnyan.misra.adapter.out.evaluator.lexical;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 3.1: the character sequences {@code /*} and {@code //} shall not be
 * used within a comment.
 */
public class NestedCommentRule extends RawTokenRule {

    public NestedCommentRule() {
        super(3, 1);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            boolean lineComment = token.str().startsWith("//");
            if (!lineComment && !token.str().startsWith("/*")) {
                continue;
            }
            String body = stripLeadingSlashes(token.str());
            if ((!lineComment && body.contains("//")) || body.contains("/*")) {
                report(sink, token);
            }
        }
    }

    private static String stripLeadingSlashes(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == '/') {
            i++;
        }
        return text.substring(i);
    }
}
