package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 20.3: the {@code #include} directive shall be followed by either a
 * {@code <filename>} or {@code "filename"} sequence. Exactly one non-comment
 * token must follow on the directive line.
 */
public class IncludeSyntaxRule extends RawTokenRule {

    public IncludeSyntaxRule() {
        super(20, 3);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        int line = -1;
        for (Token token : rawTokens) {
            if (token.str().startsWith("/") || token.line() == line) {
                continue;
            }
            line = token.line();
            if (!TokenPatterns.simpleMatch(token, "# include")) {
                continue;
            }
            int headerTokens = 0;
            for (Token header = token.next().next(); header != null && header.line() == line; header = header.next()) {
                if (!header.isComment()) {
                    headerTokens++;
                }
            }
            if (headerTokens != 1) {
                report(sink, token);
            }
        }
    }
}
