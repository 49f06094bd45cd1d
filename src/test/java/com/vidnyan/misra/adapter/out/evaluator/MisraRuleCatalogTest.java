package com.vidnyan.misra.adapter.out.evaluator;

import com.vidnyan.misra.domain.rule.RuleEvaluator;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleScope;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MisraRuleCatalogTest {

    private final MisraRuleCatalog catalog = new MisraRuleCatalog();

    @Test
    void evaluators_ShouldHaveOneEvaluatorPerRule() {
        List<RuleEvaluator> evaluators = catalog.evaluators();
        Set<RuleId> ids = evaluators.stream().map(RuleEvaluator::ruleId).collect(Collectors.toSet());

        // 12.1 has a raw and a configuration part
        assertEquals(evaluators.size() - 1, ids.size());
        assertEquals(ids, catalog.engineRules());
    }

    @Test
    void evaluators_ShouldMarkLexicalRulesAsRawScoped() {
        Set<String> raw = catalog.evaluators().stream()
                .filter(e -> e.scope() == RuleScope.RAW_TOKENS)
                .map(e -> e.ruleId().toString())
                .collect(Collectors.toSet());

        assertEquals(Set.of("3.1", "3.2", "4.1", "4.2", "7.1", "7.3", "8.14", "9.5",
                "12.1", "15.6", "16.3", "17.6", "20.3"), raw);
    }

    @Test
    void coverageTable_ShouldListEveryRuleOfTheStandard() {
        List<String> table = catalog.coverageTable();

        assertEquals(143, table.size());
        assertEquals("1.1", table.get(0));
        assertTrue(table.contains("1.3     X (Analyzer)"));
        assertTrue(table.contains("15.1    X (Engine)"));
        assertTrue(table.contains("12.2    X (Engine)"));
        assertEquals("22.6    X (Analyzer)", table.get(table.size() - 1));
    }

    @Test
    void analyzerRules_ShouldBeParsedRuleIds() {
        assertTrue(catalog.analyzerRules().contains(RuleId.of(17, 5)));
        assertFalse(catalog.analyzerRules().contains(RuleId.of(15, 1)));
    }
}
