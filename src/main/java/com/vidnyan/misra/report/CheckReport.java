package com.vidnyan.misra.report;

import com.vidnyan.misra.domain.rule.DomainSeverity;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.UnitReport;
import com.vidnyan.misra.domain.rule.Violation;
import com.vidnyan.misra.domain.suppression.SuppressionRegistry;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Report Model - aggregated output of a check run.
 * Counts violations per domain severity and per rule.
 */
@Value
@Builder
public class CheckReport {
    int unitsChecked;
    int unitsFailed;
    List<Violation> violations;
    Map<DomainSeverity, Integer> violationsBySeverity;
    SortedMap<RuleId, Integer> violationsByRule;
    List<String> verifyMismatches;
    List<SuppressionRegistry.Entry> suppressions;
    int suppressedCount;

    /**
     * Build report from unit reports and the suppressions in effect.
     * Suppression entries that occur in several units are merged and their hits summed.
     */
    public static CheckReport build(List<UnitReport> units, List<SuppressionRegistry.Entry> suppressions) {
        List<Violation> violations = new ArrayList<>();
        List<String> mismatches = new ArrayList<>();
        int failed = 0;
        int suppressed = 0;
        for (UnitReport unit : units) {
            violations.addAll(unit.violations());
            mismatches.addAll(unit.verifyMismatches());
            suppressed += unit.suppressed();
            if (unit.failed()) {
                failed++;
            }
        }

        Map<DomainSeverity, Integer> bySeverity = new EnumMap<>(DomainSeverity.class);
        SortedMap<RuleId, Integer> byRule = new TreeMap<>();
        for (Violation v : violations) {
            bySeverity.merge(v.severity(), 1, Integer::sum);
            byRule.merge(v.rule(), 1, Integer::sum);
        }

        return CheckReport.builder()
                .unitsChecked(units.size())
                .unitsFailed(failed)
                .violations(List.copyOf(violations))
                .violationsBySeverity(bySeverity)
                .violationsByRule(byRule)
                .verifyMismatches(List.copyOf(mismatches))
                .suppressions(merge(suppressions))
                .suppressedCount(suppressed)
                .build();
    }

    private static List<SuppressionRegistry.Entry> merge(List<SuppressionRegistry.Entry> entries) {
        Map<String, SuppressionRegistry.Entry> merged = new LinkedHashMap<>();
        for (SuppressionRegistry.Entry e : entries) {
            String key = e.rule() + "|" + e.file() + "|" + e.line();
            merged.merge(key, e, (a, b) -> new SuppressionRegistry.Entry(a.rule(), a.file(), a.line(), a.hits() + b.hits()));
        }
        return merged.values().stream()
                .sorted(Comparator.comparing(SuppressionRegistry.Entry::format).reversed())
                .toList();
    }

    public int violationCount(DomainSeverity severity) {
        return violationsBySeverity.getOrDefault(severity, 0);
    }

    /**
     * A run fails when a unit could not be loaded, any violation was reported
     * or verify mode found a mismatch.
     */
    public boolean hasFailures() {
        return unitsFailed > 0 || !violations.isEmpty() || !verifyMismatches.isEmpty();
    }
}
