package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.essential.EssentialRank;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Optional;

/**
 * Rule 10.3: the value of an expression shall not be assigned to an object
 * with a narrower essential type. Fires when the integer rank of the
 * right-hand side exceeds that of the assigned object.
 */
public class NarrowingAssignmentRule extends TokenRule {

    public NarrowingAssignmentRule() {
        super(10, 3);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is("=") || token.astOperand1() == null || token.astOperand2() == null) {
            return false;
        }
        Optional<EssentialRank> target = IntegerRanks.of(token.astOperand1().valueType());
        if (target.isEmpty()) {
            return false;
        }
        Optional<EssentialRank> source = IntegerRanks.ofSource(token.astOperand2(), context.essentialTypes());
        return source.isPresent() && source.get().compareTo(target.get()) > 0;
    }
}
