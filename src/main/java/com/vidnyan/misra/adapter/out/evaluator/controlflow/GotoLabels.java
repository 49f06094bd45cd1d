package com.vidnyan.misra.adapter.out.evaluator.controlflow;

import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;

/**
 * Label lookup for {@code goto} statements.
 */
final class GotoLabels {

    private GotoLabels() {
    }

    static boolean hasLabelName(Token gotoToken) {
        return gotoToken.is("goto") && gotoToken.next() != null && gotoToken.next().isName();
    }

    /**
     * Searches forward from the {@code goto} to the end of the enclosing
     * function body. A label declared before the jump is not found.
     */
    static Token findLabelAfter(Token gotoToken) {
        String label = gotoToken.next().str();
        for (Token tok = gotoToken.next().next(); tok != null; tok = tok.next()) {
            if (tok.is("}") && tok.scope() != null && tok.scope().is(ScopeType.FUNCTION)) {
                break;
            }
            if (tok.is(label) && tok.next() != null && tok.next().is(":")) {
                return tok;
            }
        }
        return null;
    }
}
