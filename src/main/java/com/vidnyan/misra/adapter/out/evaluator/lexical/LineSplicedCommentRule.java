package com.vidnyan.misra.adapter.out.evaluator.lexical;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 3.2: line-splicing shall not be used in {@code //} comments.
 */
public class LineSplicedCommentRule extends RawTokenRule {

    public LineSplicedCommentRule() {
        super(3, 2);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            if (!token.str().startsWith("//")) {
                continue;
            }
            // trailing ??/ becomes a backslash after trigraph replacement
            if (token.str().endsWith("??/")) {
                report(sink, token);
                continue;
            }
            // the splicing backslash is not part of the token; the next token
            // then shares the comment's line
            Token next = token.next();
            if (next != null && next.line() == token.line()) {
                report(sink, token);
            }
        }
    }
}
