package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.essential.EssentialRank;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Optional;

/**
 * Rule 10.6: the value of a composite expression shall not be assigned to an
 * object with wider essential type.
 */
public class CompositeAssignmentWideningRule extends TokenRule {

    public CompositeAssignmentWideningRule() {
        super(10, 6);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.is("=") || token.astOperand1() == null || token.astOperand2() == null) {
            return false;
        }
        Token rhs = token.astOperand2();
        if (!Expressions.COMPOSITE_OPERATORS.contains(rhs.str()) && !Expressions.isCast(rhs)) {
            return false;
        }
        ValueType vt2 = rhs.valueType();
        if (vt2 == null || vt2.isPointer()) {
            return false;
        }
        Optional<EssentialRank> target = IntegerRanks.of(token.astOperand1().valueType());
        if (target.isEmpty()) {
            return false;
        }
        Optional<EssentialRank> source = IntegerRanks.ofSource(rhs, context.essentialTypes());
        return source.isPresent() && target.get().compareTo(source.get()) > 0;
    }
}
