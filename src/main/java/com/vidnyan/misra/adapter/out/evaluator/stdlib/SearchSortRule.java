package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 21.9: the library functions {@code bsearch} and {@code qsort} of
 * {@code <stdlib.h>} shall not be used. The name token is reported.
 */
public class SearchSortRule extends TokenRule {

    public SearchSortRule() {
        super(21, 9);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        return TokenPatterns.simpleMatch(token, "bsearch (") || TokenPatterns.simpleMatch(token, "qsort (");
    }
}
