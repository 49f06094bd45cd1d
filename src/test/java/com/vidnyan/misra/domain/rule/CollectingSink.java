package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.model.Locatable;
import com.vidnyan.misra.domain.model.Location;

import java.util.ArrayList;
import java.util.List;

/**
 * Records every report as {@code line:rule}, e.g. {@code "3:10.3"}.
 */
public class CollectingSink implements DiagnosticsSink {

    private final List<String> reports = new ArrayList<>();
    private final List<Location> locations = new ArrayList<>();

    @Override
    public void report(Locatable location, RuleId rule) {
        reports.add(location.line() + ":" + rule);
        locations.add(location.location());
    }

    @Override
    public UnitReport finish() {
        return UnitReport.of("test.c", List.of(), 0);
    }

    public List<String> reports() {
        return reports;
    }

    public List<Location> locations() {
        return locations;
    }

    /**
     * Run {@code evaluator} against the unit's first configuration.
     */
    public static CollectingSink run(RuleEvaluator evaluator, com.vidnyan.misra.domain.model.TranslationUnit unit) {
        CollectingSink sink = new CollectingSink();
        evaluator.evaluate(EvaluationContext.of(unit, unit.configurations().get(0)), sink);
        return sink;
    }
}
