package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Value;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.Set;

/**
 * Rule 11.9: the macro {@code NULL} shall be the only permitted form of
 * integer null pointer constant.
 */
public class NullPointerConstantRule extends AbstractRule {

    private static final Set<String> OPERATORS = Set.of("=", "==", "!=", "?", ":");

    public NullPointerConstantRule() {
        super(11, 9);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Token token : context.configuration().tokens()) {
            if (!OPERATORS.contains(token.str()) || token.astOperand1() == null || token.astOperand2() == null) {
                continue;
            }
            ValueType vt1 = token.astOperand1().valueType();
            ValueType vt2 = token.astOperand2().valueType();
            if (vt1 == null || vt2 == null || !vt1.isPointer() || vt2.isPointer()) {
                continue;
            }
            if (token.astOperand2().is("NULL")) {
                continue;
            }
            for (Value value : token.astOperand2().values()) {
                if (value.intValue() != null && value.intValue() == 0) {
                    report(sink, token);
                }
            }
        }
    }
}
