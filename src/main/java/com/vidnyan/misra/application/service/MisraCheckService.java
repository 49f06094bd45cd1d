package com.vidnyan.misra.application.service;

import com.vidnyan.misra.application.port.in.CheckUseCase;
import com.vidnyan.misra.application.port.out.ProgramModelException;
import com.vidnyan.misra.application.port.out.ProgramModelSource;
import com.vidnyan.misra.application.port.out.RuleCatalog;
import com.vidnyan.misra.application.port.out.ViolationReporter;
import com.vidnyan.misra.domain.model.Configuration;
import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.RuleEvaluator;
import com.vidnyan.misra.domain.rule.RuleScope;
import com.vidnyan.misra.domain.rule.UnitReport;
import com.vidnyan.misra.domain.suppression.SuppressionRegistry;
import com.vidnyan.misra.report.CheckReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Main application service that orchestrates the check workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MisraCheckService implements CheckUseCase {

    private final ProgramModelSource programModelSource;
    private final RuleCatalog ruleCatalog;
    private final DiagnosticsSinkFactory sinkFactory;
    private final ViolationReporter violationReporter;

    @Override
    public CheckResult check(CheckRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting check of {} unit(s)", request.dumpFiles().size());

        List<UnitReport> units = new ArrayList<>();
        List<SuppressionRegistry.Entry> suppressions = new ArrayList<>();

        for (Path dumpFile : request.dumpFiles()) {
            log.info("Checking {}...", dumpFile);

            // Step 1: Load program model
            TranslationUnit unit;
            try {
                unit = programModelSource.load(dumpFile);
            } catch (ProgramModelException e) {
                log.error("Failed to load {}: {}", dumpFile, e.getMessage());
                UnitReport failed = UnitReport.failed(dumpFile.toString());
                units.add(failed);
                violationReporter.report(failed);
                continue;
            }

            // Step 2: Build suppression registry
            SuppressionRegistry registry = buildRegistry(unit, request);
            log.debug("Suppressions for {}: {}", unit.sourceFile(), registry);

            // Step 3: Evaluate rules
            UnitReport report = checkUnit(unit, registry);
            units.add(report);
            suppressions.addAll(registry.entries());
            violationReporter.report(report);
        }

        CheckReport report = CheckReport.build(units, suppressions);
        Duration totalDuration = Duration.between(startTime, Instant.now());

        log.info("Check complete: {} violations in {}ms",
                report.getViolations().size(), totalDuration.toMillis());

        return new CheckResult(units, report, totalDuration.toMillis());
    }

    /**
     * Run the catalog over every configuration of {@code unit}. Raw token rules
     * only run with the first configuration; globally suppressed rules never run.
     */
    UnitReport checkUnit(TranslationUnit unit, SuppressionRegistry registry) {
        DiagnosticsSink sink = sinkFactory.create(unit, registry);
        List<RuleEvaluator> evaluators = ruleCatalog.evaluators().stream()
                .filter(e -> !registry.isGloballySuppressed(e.ruleId()))
                .toList();
        log.debug("{} of {} evaluators active", evaluators.size(), ruleCatalog.evaluators().size());

        List<Configuration> configurations = unit.configurations();
        for (int i = 0; i < configurations.size(); i++) {
            Configuration cfg = configurations.get(i);
            if (configurations.size() > 1) {
                log.info("  Checking {}, config \"{}\"...", unit.sourceFile(), cfg.name());
            }
            EvaluationContext context = EvaluationContext.of(unit, cfg);
            for (RuleEvaluator evaluator : evaluators) {
                if (evaluator.scope() == RuleScope.RAW_TOKENS && i > 0) {
                    continue;
                }
                evaluate(evaluator, context, sink);
            }
        }

        UnitReport report = sink.finish();
        log.info("  {}: {} violations, {} suppressed",
                unit.sourceFile(), report.violations().size(), report.suppressed());
        return report;
    }

    private void evaluate(RuleEvaluator evaluator, EvaluationContext context, DiagnosticsSink sink) {
        try {
            evaluator.evaluate(context, sink);
        } catch (RuntimeException e) {
            log.warn("Rule {} abstains for config \"{}\": {}",
                    evaluator.ruleId(), context.configuration().name(), e.toString());
        }
    }

    private SuppressionRegistry buildRegistry(TranslationUnit unit, CheckRequest request) {
        SuppressionRegistry registry = new SuppressionRegistry(request.filePrefix());
        registry.addAll(unit.suppressions());
        if (request.suppressRules() != null && !request.suppressRules().isBlank()) {
            registry.addList(request.suppressRules());
        }
        return registry;
    }
}
