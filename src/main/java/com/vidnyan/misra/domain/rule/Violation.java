package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.model.Location;

/**
 * A reported rule violation.
 * Immutable value object.
 */
public record Violation(
    Location location,
    RuleId rule,
    String message,
    DomainSeverity severity
) {

    /** Severity understood by the host analyzer. */
    public static final String TOOL_SEVERITY = "style";
    public static final String CATEGORY = "misra";

    public String errorId() {
        return rule.errorId();
    }

    /**
     * Format as {@code [file:line:column] (style) message [misra-c2012-X.Y]}.
     */
    public String format() {
        return "[" + location.format() + "] (" + TOOL_SEVERITY + ") " + message
                + " [" + CATEGORY + "-" + errorId() + "]";
    }
}
