package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

/**
 * Rule 20.7: expressions resulting from the expansion of macro parameters
 * shall be enclosed in parentheses. Brackets count as enclosing too.
 */
public class MacroParameterParenthesesRule extends AbstractRule {

    public MacroParameterParenthesesRule() {
        super(20, 7);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        for (Directive directive : context.configuration().directives()) {
            MacroDefinition macro = MacroDefinition.parse(directive);
            String expansion = "(" + macro.expansion() + ")";
            for (String parameter : macro.parameters()) {
                if (hasUnparenthesizedUse(expansion, parameter)) {
                    report(sink, directive);
                }
            }
        }
    }

    /**
     * {@code expansion} is wrapped in parentheses, so every match has a
     * character on both sides.
     */
    static boolean hasUnparenthesizedUse(String expansion, String parameter) {
        int pos = 0;
        while (pos < expansion.length()) {
            pos = expansion.indexOf(parameter, pos);
            if (pos < 0) {
                return false;
            }
            int before = pos - 1;
            int after = pos + parameter.length();
            pos = after;
            if (isIdentifierChar(expansion.charAt(before)) || isIdentifierChar(expansion.charAt(after))) {
                continue;
            }
            while (expansion.charAt(before) == ' ') {
                before--;
            }
            if (expansion.charAt(before) != '(' && expansion.charAt(before) != '[') {
                return true;
            }
            while (expansion.charAt(after) == ' ') {
                after++;
            }
            if (expansion.charAt(after) != ')' && expansion.charAt(after) != ']') {
                return true;
            }
        }
        return false;
    }

    private static boolean isIdentifierChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
