package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.essential.EssentialCategory;
import com.vidnyan.misra.domain.essential.EssentialTypes.CategoryPair;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.TokenRule;

import java.util.Set;

/**
 * Rule 10.4: both operands of an operator in which the usual arithmetic
 * conversions are performed shall have the same essential type category.
 *
 * <p>When an operand is itself such an operator, its adjacent inner operand is
 * compared instead, so {@code a + b + c} compares {@code b} with {@code c}.
 * Anonymous enum constants mix freely with signed and unsigned operands.
 */
public class OperandCategoryMismatchRule extends TokenRule {

    private static final Set<String> OPERATORS = Set.of("+", "-", "*", "/", "%", "&", "|", "^", "+=", "-=", ":");

    public OperandCategoryMismatchRule() {
        super(10, 4);
    }

    @Override
    protected boolean matches(Token token, EvaluationContext context) {
        if (!isConvertingOperator(token)) {
            return false;
        }
        Token op1 = token.astOperand1();
        Token op2 = token.astOperand2();
        if (op1 == null || op2 == null || op1.valueType() == null || op2.valueType() == null) {
            return false;
        }
        Token left = isConvertingOperator(op1) ? op1.astOperand2() : op1;
        Token right = isConvertingOperator(op2) ? op2.astOperand1() : op2;
        CategoryPair pair = context.essentialTypes().categories(left, right);
        if (!pair.isKnown()) {
            return false;
        }
        if (anonymousEnumWithInteger(pair.left(), pair.right()) || anonymousEnumWithInteger(pair.right(), pair.left())) {
            return false;
        }
        return pair.differ();
    }

    private static boolean isConvertingOperator(Token token) {
        return OPERATORS.contains(token.str()) || token.isComparisonOp();
    }

    private static boolean anonymousEnumWithInteger(EssentialCategory e1, EssentialCategory e2) {
        return e1.isAnonymousEnum() && e2.isSignedOrUnsigned();
    }
}
