package com.vidnyan.misra.application.service;

import com.vidnyan.misra.application.port.out.RuleTextRepository;
import com.vidnyan.misra.domain.model.Locatable;
import com.vidnyan.misra.domain.model.Location;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.DomainSeverity;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleText;
import com.vidnyan.misra.domain.rule.UnitReport;
import com.vidnyan.misra.domain.rule.Violation;
import com.vidnyan.misra.domain.suppression.SuppressionRegistry;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Normal mode: drops suppressed reports and turns the rest into violations
 * carrying the rule's text and severity.
 */
@RequiredArgsConstructor
public class ReportingSink implements DiagnosticsSink {

    static final String GENERIC_MESSAGE = "misra violation (use --rule-texts=<file> to get proper output)";

    private final String sourceFile;
    private final SuppressionRegistry registry;
    private final RuleTextRepository ruleTexts;

    private final List<Violation> violations = new ArrayList<>();
    private int suppressed;

    @Override
    public void report(Locatable node, RuleId rule) {
        Location location = node.location();
        if (registry.isSuppressed(location.file(), location.line(), rule)) {
            registry.recordHit(rule);
            suppressed++;
            return;
        }
        Optional<RuleText> text = ruleTexts.findByRule(rule);
        String message = text.map(RuleText::text).orElse(GENERIC_MESSAGE);
        DomainSeverity severity = text.map(RuleText::severity).orElse(DomainSeverity.UNDEFINED);
        violations.add(new Violation(location, rule, message, severity));
    }

    @Override
    public UnitReport finish() {
        return UnitReport.of(sourceFile, violations, suppressed);
    }
}
