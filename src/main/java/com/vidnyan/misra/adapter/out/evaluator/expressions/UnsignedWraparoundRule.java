package com.vidnyan.misra.adapter.out.evaluator.expressions;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Value;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import lombok.extern.slf4j.Slf4j;

/**
 * Rule 12.4: evaluation of constant expressions should not lead to unsigned
 * integer wrap-around. Only checked for 16 and 32 bit {@code int}.
 */
@Slf4j
public class UnsignedWraparoundRule extends AbstractRule {

    public UnsignedWraparoundRule() {
        super(12, 4);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        long maxUnsigned;
        switch (context.platform().intBit()) {
            case 16 -> maxUnsigned = 0xffffL;
            case 32 -> maxUnsigned = 0xffffffffL;
            default -> {
                log.debug("Skipping rule {} for int width {}", ruleId(), context.platform().intBit());
                return;
            }
        }
        for (Token token : context.configuration().tokens()) {
            if (!token.hasValues() || !Expressions.isConstantExpression(token) || !Expressions.isUnsignedInt(token)) {
                continue;
            }
            for (Value value : token.values()) {
                Long v = value.intValue();
                if (v != null && (v < 0 || v > maxUnsigned)) {
                    report(sink, token);
                    break;
                }
            }
        }
    }
}
