package com.vidnyan.misra.application.port.in;

import com.vidnyan.misra.domain.rule.UnitReport;
import com.vidnyan.misra.report.CheckReport;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: check program models against the MISRA C:2012 rules.
 * This is the main entry point to the application.
 */
public interface CheckUseCase {

    /**
     * Check every unit of the request.
     * A unit that cannot be loaded is reported as failed; the others still run.
     */
    CheckResult check(CheckRequest request);

    /**
     * Check request parameters.
     *
     * @param filePrefix    prefix stripped from file names when matching suppressions, may be null
     * @param suppressRules comma separated rule list suppressed everywhere, e.g. {@code "15.1,11.3"}
     */
    record CheckRequest(
        List<Path> dumpFiles,
        String filePrefix,
        String suppressRules
    ) {
        public static CheckRequest forFiles(List<Path> dumpFiles) {
            return new CheckRequest(dumpFiles, null, null);
        }
    }

    /**
     * Check result.
     */
    record CheckResult(
        List<UnitReport> units,
        CheckReport report,
        long durationMs
    ) {
        public boolean hasFailures() {
            return report.hasFailures();
        }
    }
}
