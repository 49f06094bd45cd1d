package com.vidnyan.misra.domain.rule;

import java.util.List;

/**
 * Outcome of checking one translation unit.
 *
 * @param verifyMismatches "Expected but not seen" / "Not expected" lines, verify mode only
 * @param suppressed       number of reports dropped by suppressions
 * @param failed           the unit's model could not be loaded
 */
public record UnitReport(
    String sourceFile,
    List<Violation> violations,
    List<String> verifyMismatches,
    int suppressed,
    boolean failed
) {

    public UnitReport {
        violations = List.copyOf(violations);
        verifyMismatches = List.copyOf(verifyMismatches);
    }

    public static UnitReport of(String sourceFile, List<Violation> violations, int suppressed) {
        return new UnitReport(sourceFile, violations, List.of(), suppressed, false);
    }

    public static UnitReport verified(String sourceFile, List<String> verifyMismatches) {
        return new UnitReport(sourceFile, List.of(), verifyMismatches, 0, false);
    }

    public static UnitReport failed(String sourceFile) {
        return new UnitReport(sourceFile, List.of(), List.of(), 0, true);
    }
}
