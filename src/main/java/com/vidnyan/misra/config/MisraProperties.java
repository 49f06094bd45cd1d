package com.vidnyan.misra.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the rule engine.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "misra")
public class MisraProperties {

    /**
     * Run the check on startup.
     */
    private boolean enabled = true;

    /**
     * Program model documents to check.
     */
    private List<String> dumpFiles = new ArrayList<>();

    /**
     * Prefix to strip from file names when matching suppressions.
     */
    private String filePrefix;

    /**
     * Comma separated rules to suppress everywhere, e.g. "15.1,11.3".
     */
    private String suppressRules;

    /**
     * Resource location of the rule texts, e.g. "file:misra-rules.json".
     */
    private String ruleTexts;

    /**
     * Compare reports against the rule ids written in source comments.
     */
    private boolean verify;

    /**
     * Only list engine rules that have no rule text, then stop.
     */
    private boolean verifyRuleTexts;

    /**
     * Print the coverage table, then stop.
     */
    private boolean generateTable;

    private boolean showSummary = true;

    private boolean showSuppressedRules;
}
