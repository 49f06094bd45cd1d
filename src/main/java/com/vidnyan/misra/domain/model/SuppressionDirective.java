package com.vidnyan.misra.domain.model;

/**
 * Inline suppression extracted by the analyzer.
 *
 * @param errorId    rule id, e.g. {@code misra-c2012-15.1}, {@code misra_15_1} or {@code 15.1}
 * @param fileName   file the suppression applies to, null for all files
 * @param lineNumber line the suppression applies to, null for the whole file
 * @param symbolName symbol the suppression applies to, may be null
 */
public record SuppressionDirective(
    String errorId,
    String fileName,
    Integer lineNumber,
    String symbolName
) {
}
