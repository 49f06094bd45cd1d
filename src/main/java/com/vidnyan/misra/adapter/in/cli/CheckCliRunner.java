package com.vidnyan.misra.adapter.in.cli;

import com.vidnyan.misra.application.port.in.CheckUseCase;
import com.vidnyan.misra.application.port.in.CheckUseCase.CheckRequest;
import com.vidnyan.misra.application.port.in.CheckUseCase.CheckResult;
import com.vidnyan.misra.application.port.out.RuleCatalog;
import com.vidnyan.misra.application.port.out.RuleTextRepository;
import com.vidnyan.misra.config.MisraProperties;
import com.vidnyan.misra.domain.rule.DomainSeverity;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleText;
import com.vidnyan.misra.domain.suppression.SuppressionRegistry;
import com.vidnyan.misra.report.CheckReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI Runner for checking program models.
 * Runs the check over the files listed in misra.dump-files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckCliRunner implements CommandLineRunner {

    private final CheckUseCase checkUseCase;
    private final RuleCatalog ruleCatalog;
    private final RuleTextRepository ruleTextRepository;
    private final MisraProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        if (!properties.isEnabled()) {
            log.info("Rule engine disabled. Set misra.enabled=true to run.");
            return;
        }

        int exitCode = 0;
        try {
            if (properties.isGenerateTable()) {
                ruleCatalog.coverageTable().forEach(line -> log.info("{}", line));
                return;
            }
            if (properties.isVerifyRuleTexts()) {
                exitCode = verifyRuleTexts();
                return;
            }
            if (properties.getDumpFiles().isEmpty()) {
                log.info("No input files. Set misra.dump-files property.");
                return;
            }

            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              MISRA C:2012 - Rule Engine                       ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Checking: {} file(s)", properties.getDumpFiles().size());
            log.info("╚══════════════════════════════════════════════════════════════╝");

            List<Path> dumpFiles = properties.getDumpFiles().stream().map(Path::of).toList();
            CheckResult result = checkUseCase.check(new CheckRequest(
                    dumpFiles, properties.getFilePrefix(), properties.getSuppressRules()));

            if (properties.isVerify()) {
                printVerifyResults(result.report());
            } else if (properties.isShowSummary()) {
                printResults(result);
            }
            if (properties.isShowSuppressedRules()) {
                printSuppressedRules(result.report());
            }

            exitCode = result.hasFailures() ? 1 : 0;
            log.info("");
            log.info("Check complete!");
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private int verifyRuleTexts() {
        if (ruleTextRepository.size() == 0) {
            log.error("Please specify the rule texts file with misra.rule-texts");
            return 1;
        }
        List<RuleId> missing = ruleTextRepository.missingRuleTexts(ruleCatalog.engineRules());
        if (missing.isEmpty()) {
            log.info("All {} engine rules have a rule text", ruleCatalog.engineRules().size());
            return 0;
        }
        missing.forEach(rule -> log.info("Rule text missing for {}", rule));
        return 0;
    }

    private void printVerifyResults(CheckReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" VERIFY RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        if (report.getVerifyMismatches().isEmpty()) {
            log.info(" All expected violations seen, nothing unexpected.");
            return;
        }
        report.getVerifyMismatches().forEach(m -> log.info(" {}", m));
    }

    private void printResults(CheckResult result) {
        CheckReport report = result.report();
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CHECK RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Units checked:    {}", report.getUnitsChecked());
        log.info(" Units failed:     {}", report.getUnitsFailed());
        log.info(" Suppressed:       {}", report.getSuppressedCount());
        log.info(" Duration:         {}ms", result.durationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (report.getViolations().isEmpty()) {
            log.info("");
            log.info("✅ No MISRA violations found.");
            return;
        }

        log.info(" MISRA rules violations found:");
        for (DomainSeverity severity : DomainSeverity.values()) {
            int count = report.violationCount(severity);
            if (count > 0) {
                log.info("   {}: {}", severity.text(), count);
            }
        }
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" MISRA rules violated:");
        for (Map.Entry<RuleId, Integer> entry : report.getViolationsByRule().entrySet()) {
            String severity = ruleTextRepository.findByRule(entry.getKey())
                    .map(RuleText::severity)
                    .map(DomainSeverity::text)
                    .orElse("-");
            log.info("   {} ({}): {}", String.format("%15s", "misra-" + entry.getKey().errorId()),
                    severity, entry.getValue());
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printSuppressedRules(CheckReport report) {
        log.info("");
        log.info(" Suppressed Rules List:");
        for (SuppressionRegistry.Entry entry : report.getSuppressions()) {
            log.info("   {}", entry.format());
        }
    }
}
