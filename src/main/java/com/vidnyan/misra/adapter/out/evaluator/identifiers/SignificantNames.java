package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.Directive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for comparing identifiers on their significant initial characters.
 */
final class SignificantNames {

    /** Significant characters for external identifiers in C90. */
    static final int C90_LENGTH = 31;

    private static final Pattern DEFINE_NAME = Pattern.compile("#define ([a-zA-Z0-9_]+)");
    private static final Pattern DEFINE_PARAMS = Pattern.compile("#define ([a-zA-Z0-9_]+)[(]([a-zA-Z0-9_, ]+)[)]");

    private SignificantNames() {
    }

    static String prefix(String name, int length) {
        return name.length() <= length ? name : name.substring(0, length);
    }

    /**
     * Macro name of a {@code #define} directive, null for other directives.
     */
    static String macroName(Directive directive) {
        Matcher m = DEFINE_NAME.matcher(directive.str());
        return m.lookingAt() ? m.group(1) : null;
    }

    /**
     * Parameter names of a function-like macro; empty for object-like macros.
     */
    static List<String> macroParameters(Directive directive) {
        Matcher m = DEFINE_PARAMS.matcher(directive.str());
        if (!m.lookingAt()) {
            return Collections.emptyList();
        }
        List<String> params = new ArrayList<>();
        for (String param : m.group(2).split(",")) {
            params.add(param.replace(" ", ""));
        }
        return params;
    }
}
