package com.vidnyan.misra.domain.rule;

/**
 * MISRA classification of a rule.
 */
public enum DomainSeverity {
    MANDATORY("Mandatory"),
    REQUIRED("Required"),
    ADVISORY("Advisory"),
    UNDEFINED("Undefined");

    private final String text;

    DomainSeverity(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * Parse the rule-text severity. Anything unrecognized is {@link #UNDEFINED}.
     */
    public static DomainSeverity fromText(String text) {
        if (text == null) {
            return UNDEFINED;
        }
        for (DomainSeverity severity : values()) {
            if (severity.text.equalsIgnoreCase(text.trim())) {
                return severity;
            }
        }
        return UNDEFINED;
    }
}
