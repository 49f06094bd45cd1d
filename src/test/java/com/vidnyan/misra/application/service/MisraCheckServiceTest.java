package com.vidnyan.misra.application.service;

import com.vidnyan.misra.application.port.in.CheckUseCase.CheckRequest;
import com.vidnyan.misra.application.port.in.CheckUseCase.CheckResult;
import com.vidnyan.misra.application.port.out.ProgramModelException;
import com.vidnyan.misra.application.port.out.ProgramModelSource;
import com.vidnyan.misra.application.port.out.RuleCatalog;
import com.vidnyan.misra.application.port.out.RuleTextRepository;
import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.EvaluationContext;
import com.vidnyan.misra.domain.rule.RuleEvaluator;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleScope;
import com.vidnyan.misra.domain.rule.RuleText;
import com.vidnyan.misra.domain.rule.UnitReport;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MisraCheckServiceTest {

    private final List<String> calls = new ArrayList<>();
    private final List<UnitReport> reported = new ArrayList<>();

    @Test
    void check_ShouldRunRawRulesOncePerFile() {
        // Arrange
        RuleEvaluator raw = firstTokenRule(RuleId.of(3, 1), RuleScope.RAW_TOKENS);
        RuleEvaluator perConfig = firstTokenRule(RuleId.of(15, 1), RuleScope.CONFIGURATION);
        MisraCheckService service = service(path -> twoConfigurations(), raw, perConfig);

        // Act
        CheckResult result = service.check(CheckRequest.forFiles(List.of(Path.of("a.c.dump"))));

        // Assert
        assertEquals(List.of("3.1@A", "15.1@A", "15.1@B"), calls);
        assertEquals(3, result.report().getViolations().size());
        assertTrue(result.hasFailures());
        assertEquals(1, reported.size());
    }

    @Test
    void check_ShouldSkipGloballySuppressedRules() {
        RuleEvaluator gotoRule = firstTokenRule(RuleId.of(15, 1), RuleScope.CONFIGURATION);
        RuleEvaluator union = firstTokenRule(RuleId.of(19, 2), RuleScope.CONFIGURATION);
        MisraCheckService service = service(path -> twoConfigurations(), gotoRule, union);

        CheckResult result = service.check(new CheckRequest(List.of(Path.of("a.c.dump")), null, "15.1, 21.3"));

        assertEquals(List.of("19.2@A", "19.2@B"), calls);
        Set<String> listed = result.report().getSuppressions().stream()
                .map(e -> e.rule().toString())
                .collect(Collectors.toSet());
        assertEquals(Set.of("15.1", "21.3"), listed);
    }

    @Test
    void check_ShouldCountLocationSuppressions() {
        ModelBuilder b = ModelBuilder.file("a.c")
                .line(1, "x = 1 ;")
                .suppression("misra-c2012-15.1", "a.c", 1);
        RuleEvaluator rule = firstTokenRule(RuleId.of(15, 1), RuleScope.CONFIGURATION);
        MisraCheckService service = service(path -> b.unit(), rule);

        CheckResult result = service.check(CheckRequest.forFiles(List.of(Path.of("a.c.dump"))));

        assertTrue(result.report().getViolations().isEmpty());
        assertEquals(1, result.report().getSuppressedCount());
        assertEquals(1, result.report().getSuppressions().get(0).hits());
        assertFalse(result.hasFailures());
    }

    @Test
    void check_ShouldIsolateFailingRule() {
        RuleEvaluator broken = new RuleEvaluator() {
            @Override
            public RuleId ruleId() {
                return RuleId.of(10, 4);
            }

            @Override
            public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
                throw new IllegalStateException("inconsistent model");
            }
        };
        RuleEvaluator healthy = firstTokenRule(RuleId.of(15, 1), RuleScope.CONFIGURATION);
        MisraCheckService service = service(path -> twoConfigurations(), broken, healthy);

        CheckResult result = service.check(CheckRequest.forFiles(List.of(Path.of("a.c.dump"))));

        assertEquals(2, result.report().getViolations().size());
        assertEquals(0, result.report().getUnitsFailed());
    }

    @Test
    void check_ShouldReportUnloadableUnitAndContinue() {
        ProgramModelSource source = path -> {
            if (path.toString().startsWith("bad")) {
                throw new ProgramModelException("Malformed program model: " + path);
            }
            return twoConfigurations();
        };
        MisraCheckService service = service(source, firstTokenRule(RuleId.of(15, 1), RuleScope.CONFIGURATION));

        CheckResult result = service.check(CheckRequest.forFiles(List.of(Path.of("bad.dump"), Path.of("a.c.dump"))));

        assertEquals(2, result.report().getUnitsChecked());
        assertEquals(1, result.report().getUnitsFailed());
        assertTrue(result.units().get(0).failed());
        assertEquals(2, result.units().get(1).violations().size());
        assertEquals(2, reported.size());
    }

    private MisraCheckService service(ProgramModelSource source, RuleEvaluator... evaluators) {
        RuleCatalog catalog = new RuleCatalog() {
            @Override
            public List<RuleEvaluator> evaluators() {
                return List.of(evaluators);
            }

            @Override
            public Set<RuleId> engineRules() {
                return Set.of();
            }

            @Override
            public Set<RuleId> analyzerRules() {
                return Set.of();
            }

            @Override
            public List<String> coverageTable() {
                return List.of();
            }
        };
        DiagnosticsSinkFactory sinks = (unit, registry) -> new ReportingSink(unit.sourceFile(), registry, new NoRuleTexts());
        return new MisraCheckService(source, catalog, sinks, reported::add);
    }

    /**
     * Reports the first token it sees and records {@code rule@config}.
     */
    private RuleEvaluator firstTokenRule(RuleId id, RuleScope scope) {
        return new RuleEvaluator() {
            @Override
            public RuleId ruleId() {
                return id;
            }

            @Override
            public RuleScope scope() {
                return scope;
            }

            @Override
            public void evaluate(EvaluationContext context, DiagnosticsSink sink) {
                calls.add(id + "@" + context.configuration().name());
                sink.report(context.rawTokens().tokens().get(0), id);
            }
        };
    }

    private static TranslationUnit twoConfigurations() {
        ModelBuilder b = ModelBuilder.file("a.c").line(1, "x = 1 ;");
        return b.unit(b.configuration("A"), b.configuration("B"));
    }

    private static class NoRuleTexts implements RuleTextRepository {

        @Override
        public Optional<RuleText> findByRule(RuleId rule) {
            return Optional.empty();
        }

        @Override
        public int size() {
            return 0;
        }
    }
}
