package com.vidnyan.misra.adapter.out.evaluator.preprocessor;

import com.vidnyan.misra.domain.model.Directive;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parameters and expansion list of a function-like {@code #define}.
 * Object-like macros and other directives yield no parameters and an empty expansion.
 */
record MacroDefinition(List<String> parameters, String expansion) {

    private static final Pattern FUNCTION_LIKE =
            Pattern.compile("#define [A-Za-z0-9_]+\\(([A-Za-z0-9_,]+)\\)[ ]+(.*)");

    static MacroDefinition parse(Directive directive) {
        Matcher m = FUNCTION_LIKE.matcher(directive.str());
        if (!m.lookingAt()) {
            return new MacroDefinition(List.of(), "");
        }
        List<String> parameters = Arrays.stream(m.group(1).split(","))
                .filter(p -> !p.isEmpty())
                .toList();
        return new MacroDefinition(parameters, m.group(2));
    }
}
