package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.essential.EssentialCategory;
import com.vidnyan.misra.domain.essential.EssentialRank;
import com.vidnyan.misra.domain.essential.EssentialTypes;
import com.vidnyan.misra.domain.essential.EssentialTypes.CategoryPair;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Objects;
import java.util.Optional;

/**
 * Rule 10.8: the value of a composite expression shall not be cast to a
 * different essential type category or a wider essential type.
 */
public class CompositeCastRule extends TokenRule {

    public CompositeCastRule() {
        super(10, 8);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!Expressions.isCast(token)) {
            return false;
        }
        if (token.valueType() == null || token.valueType().isPointer()) {
            return false;
        }
        Token inner = token.astOperand1();
        if (inner.valueType() == null || inner.valueType().isPointer() || inner.astOperand1() == null) {
            return false;
        }
        if (!Expressions.COMPOSITE_OPERATORS.contains(inner.str())) {
            return false;
        }
        if (!inner.is("~") && inner.astOperand2() == null) {
            return false;
        }

        EssentialTypes types = context.essentialTypes();
        EssentialCategory operandCategory;
        if (inner.is("~")) {
            operandCategory = types.category(inner.astOperand1()).orElse(null);
        } else {
            CategoryPair pair = types.categories(inner.astOperand1(), inner.astOperand2());
            if (!Objects.equals(pair.left(), pair.right())) {
                return false;
            }
            operandCategory = pair.left();
        }

        EssentialCategory castCategory = types.category(token).orElse(null);
        if (!Objects.equals(castCategory, operandCategory)) {
            return true;
        }
        Optional<EssentialRank> target = IntegerRanks.of(token.valueType());
        Optional<EssentialRank> source = types.rank(inner).filter(r -> r.isInteger() && r != EssentialRank.BOOL);
        return target.isPresent() && source.isPresent() && target.get().compareTo(source.get()) > 0;
    }
}
