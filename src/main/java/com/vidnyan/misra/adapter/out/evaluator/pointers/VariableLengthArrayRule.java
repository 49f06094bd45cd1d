package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.pattern.Expressions;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 18.8: variable-length array types shall not be used.
 */
public class VariableLengthArrayRule extends AbstractRule {

    public VariableLengthArrayRule() {
        super(18, 8);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Variable variable : context.configuration().variables()) {
            if (!variable.isArray() || !variable.isLocal() || variable.nameToken() == null) {
                continue;
            }
            // array dimensions only exist as tokens after the name
            Token bracket = variable.nameToken().next();
            if (bracket == null || !bracket.is("[") || bracket.astOperand2() == null) {
                continue;
            }
            if (!Expressions.isConstantExpression(bracket.astOperand2())) {
                report(sink, variable.nameToken());
            }
        }
    }
}
