package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.pattern.OperatorPrecedence;
import com.vidnyan.misra.domain.pattern.TokenPatterns;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

/**
 * Rule 12.1: the precedence of operators within expressions should be made explicit.
 *
 * <p>An operand that binds tighter than its parent operator must be
 * parenthesized, unless both operators are additive or multiplicative.
 */
public class ImplicitPrecedenceRule extends TokenRule {

    public ImplicitPrecedenceRule() {
        super(12, 1);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        int p = OperatorPrecedence.of(token);
        if (p < OperatorPrecedence.CONDITIONAL || p > OperatorPrecedence.MULTIPLICATIVE) {
            return false;
        }
        Token op1 = token.astOperand1();
        if (bindsTighter(p, OperatorPrecedence.of(op1)) && TokenPatterns.hasNoParenthesesBetween(op1, token)) {
            return true;
        }
        Token op2 = token.astOperand2();
        return bindsTighter(p, OperatorPrecedence.of(op2)) && TokenPatterns.hasNoParenthesesBetween(token, op2);
    }

    private static boolean bindsTighter(int parent, int operand) {
        if (operand <= parent || operand > OperatorPrecedence.MULTIPLICATIVE) {
            return false;
        }
        return !(OperatorPrecedence.isArithmetic(parent) && OperatorPrecedence.isArithmetic(operand));
    }
}
