package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.essential.EssentialCategory;
import com.vidnyan.misra.domain.essential.EssentialTypes;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Optional;

/**
 * Rule 10.1: operands shall not be of an inappropriate essential type.
 * Only shift operators are checked: the left operand must be essentially
 * unsigned, and so must a right operand that is not a literal.
 */
public class ShiftOperandTypeRule extends TokenRule {

    public ShiftOperandTypeRule() {
        super(10, 1);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!token.isOp() || !(token.is("<<") || token.is(">>"))) {
            return false;
        }
        EssentialTypes types = context.essentialTypes();
        Optional<EssentialCategory> e1 = types.category(token.astOperand1());
        Optional<EssentialCategory> e2 = types.category(token.astOperand2());
        if (e1.isEmpty() || e2.isEmpty()) {
            return false;
        }
        if (!e1.get().is(EssentialCategory.Kind.UNSIGNED)) {
            return true;
        }
        return !e2.get().is(EssentialCategory.Kind.UNSIGNED) && !token.astOperand2().isNumber();
    }
}
