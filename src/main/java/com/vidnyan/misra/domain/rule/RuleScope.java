package com.vidnyan.misra.domain.rule;

/**
 * What a rule iterates over.
 */
public enum RuleScope {
    /** Decorated tokens and symbol tables; runs once per configuration. */
    CONFIGURATION,
    /** Raw lexical stream; runs once per file. */
    RAW_TOKENS
}
