package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.Configuration;
import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.model.Function;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.Variable;
import com.vidnyan.misra.domain.rule.AbstractRule;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rule 21.1: {@code #define} and {@code #undef} shall not be used on a
 * reserved identifier or reserved macro name.
 * <p>
 * Also flags declared identifiers that are reserved: {@code errno}, names
 * starting with {@code __} or {@code _} followed by an uppercase letter, and
 * names starting with {@code _} outside file scope static storage.
 */
public class ReservedIdentifierRule extends AbstractRule {

    private static final Pattern RESERVED_DEFINE = Pattern.compile("#define (errno|_[_A-Z]+)");

    public ReservedIdentifierRule() {
        super(21, 1);
    }

    @Override
    public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
        Configuration cfg = context.configuration();
        for (Directive directive : cfg.directives()) {
            if (RESERVED_DEFINE.matcher(directive.str()).lookingAt()) {
                report(sink, directive);
            }
        }
        for (Token token : declaredNames(cfg)) {
            if (isReserved(token)) {
                report(sink, token);
            }
        }
    }

    private static Collection<Token> declaredNames(Configuration cfg) {
        Map<Integer, Token> names = new LinkedHashMap<>();
        for (Variable variable : cfg.variables()) {
            if (variable.nameToken() != null) {
                names.put(variable.nameToken().index(), variable.nameToken());
            }
        }
        for (Function function : cfg.functions()) {
            if (function.tokenDef() != null) {
                names.put(function.tokenDef().index(), function.tokenDef());
            }
        }
        for (Token token : cfg.tokens()) {
            if (token.typeScope() != null || token.valueTypeScope() != null) {
                names.putIfAbsent(token.index(), token);
            }
        }
        return names.values();
    }

    private static boolean isReserved(Token token) {
        String name = token.str();
        if (name.length() < 2) {
            return false;
        }
        if (name.equals("errno")) {
            return true;
        }
        if (name.charAt(0) != '_') {
            return false;
        }
        char second = name.charAt(1);
        if (second == '_' || Character.isUpperCase(second)) {
            return true;
        }
        Variable variable = token.variable();
        return variable == null || !(variable.isGlobal() && variable.isStatic());
    }
}
