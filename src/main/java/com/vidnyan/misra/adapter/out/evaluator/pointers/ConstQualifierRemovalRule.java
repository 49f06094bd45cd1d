package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Function;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.List;
import java.util.Map;

/**
 * Rule 11.8: a cast shall not remove any const or volatile qualification from
 * the type pointed to by a pointer. Checks explicit casts and pointer
 * arguments passed to non-const parameters.
 */
public class ConstQualifierRemovalRule extends TokenRule {

    public ConstQualifierRemovalRule() {
        super(11, 8);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (Expressions.isCast(token)) {
            CastOperands cast = CastOperands.of(token);
            if (cast == null || !cast.target().isPointer() || !cast.source().isPointer()) {
                return false;
            }
            return dropsConst(cast.target().constness(), cast.source().constness());
        }
        if (token.is("(") && token.astOperand1() != null && token.astOperand2() != null
                && token.astOperand1().function() != null) {
            return passesConstToMutable(token, token.astOperand1().function());
        }
        return false;
    }

    private static boolean passesConstToMutable(Token call, Function function) {
        List<Token> arguments = Expressions.arguments(call);
        for (Map.Entry<Integer, Variable> entry : function.arguments().entrySet()) {
            int position = entry.getKey();
            Variable parameter = entry.getValue();
            if (position < 1 || position > arguments.size() || !parameter.isPointer()) {
                continue;
            }
            Token argument = arguments.get(position - 1);
            if (argument.valueType() == null || !argument.valueType().isPointer()) {
                continue;
            }
            if (dropsConst(parameter.constness(), argument.valueType().constness())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Bit 0 of the constness mask is the pointed-to type.
     */
    private static boolean dropsConst(int targetConstness, int sourceConstness) {
        return targetConstness % 2 < sourceConstness % 2;
    }
}
