package com.vidnyan.misra.adapter.out.report;

import com.vidnyan.misra.application.port.out.ViolationReporter;
import com.vidnyan.misra.domain.rule.UnitReport;
import com.vidnyan.misra.domain.rule.Violation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes each violation as one log line in the analyzer's message layout,
 * {@code [file:line:column] (style) message [misra-c2012-X.Y]}.
 */
@Slf4j
@Component
public class LoggingViolationReporter implements ViolationReporter {

    @Override
    public void report(UnitReport report) {
        if (report.failed()) {
            log.error("{}: program model could not be loaded", report.sourceFile());
            return;
        }
        for (Violation violation : report.violations()) {
            log.info("{}", violation.format());
        }
        for (String mismatch : report.verifyMismatches()) {
            log.info("{}", mismatch);
        }
    }
}
