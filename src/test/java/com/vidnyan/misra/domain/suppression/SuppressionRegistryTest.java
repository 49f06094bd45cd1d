package com.vidnyan.misra.domain.suppression;

import com.vidnyan.misra.domain.model.SuppressionDirective;
import com.vidnyan.misra.domain.rule.RuleId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuppressionRegistryTest {

    private static final RuleId R15_1 = RuleId.of(15, 1);
    private static final RuleId R11_3 = RuleId.of(11, 3);

    @Test
    void add_ShouldBeIdempotent() {
        SuppressionRegistry registry = new SuppressionRegistry(null);

        registry.add(R15_1, "src/a.c", 10, null);
        registry.add(R15_1, "src/./a.c", 10, null);
        registry.add(R15_1, "src/a.c", 10, null);

        assertEquals(1, registry.size());
    }

    @Test
    void globalSuppression_ShouldCoverEveryFileAndLine() {
        SuppressionRegistry registry = new SuppressionRegistry(null);
        registry.add(R15_1);

        assertTrue(registry.isSuppressed("/any/where/x.c", 1, R15_1));
        assertTrue(registry.isSuppressed("y.c", 99, R15_1));
        assertTrue(registry.isGloballySuppressed(R15_1));
        assertFalse(registry.isSuppressed("y.c", 99, R11_3));
    }

    @Test
    void lineSuppression_ShouldMatchBaseNameWithoutPrefix() {
        SuppressionRegistry registry = new SuppressionRegistry(null);
        registry.add(R15_1, "a.c", 10, null);

        assertTrue(registry.isSuppressed("/home/user/project/a.c", 10, R15_1));
        assertFalse(registry.isSuppressed("/home/user/project/a.c", 11, R15_1));
        assertFalse(registry.isGloballySuppressed(R15_1));
    }

    @Test
    void fileSuppression_ShouldCoverAllLinesOfThatFile() {
        SuppressionRegistry registry = new SuppressionRegistry(null);
        registry.add(R15_1, "a.c", null, null);

        assertTrue(registry.isSuppressed("a.c", 1, R15_1));
        assertTrue(registry.isSuppressed("a.c", 500, R15_1));
        assertFalse(registry.isSuppressed("b.c", 1, R15_1));
    }

    @Test
    void filePrefix_ShouldBeStrippedBeforeLookup() {
        SuppressionRegistry registry = new SuppressionRegistry("/home/user/project");
        registry.add(R15_1, "src/a.c", 3, null);

        assertTrue(registry.isSuppressed("/home/user/project/src/a.c", 3, R15_1));
        assertFalse(registry.isSuppressed("/other/src/a.c", 3, R15_1));
    }

    @Test
    void removeFilePrefix_ShouldStripLeadingSeparators() {
        assertEquals("file.c", SuppressionRegistry.removeFilePrefix("/remove/this/path/file.c", "/remove/this/path"));
        assertEquals("/keep/file.c", SuppressionRegistry.removeFilePrefix("/keep/file.c", "/remove"));
    }

    @Test
    void addAll_ShouldParseAnalyzerSuppressionIds() {
        SuppressionRegistry registry = new SuppressionRegistry(null);

        registry.addAll(List.of(
                new SuppressionDirective("misra_15_1", "a.c", 4, null),
                new SuppressionDirective("misra.21.11", null, null, null),
                new SuppressionDirective("misra-c2012-11.3", "a.c", null, null),
                new SuppressionDirective("unusedFunction", "a.c", 1, null)));

        assertTrue(registry.isSuppressed("a.c", 4, R15_1));
        assertTrue(registry.isGloballySuppressed(RuleId.of(21, 11)));
        assertTrue(registry.isSuppressed("a.c", 77, R11_3));
        assertEquals(3, registry.size());
    }

    @Test
    void addList_ShouldAddGlobalSentinels() {
        SuppressionRegistry registry = new SuppressionRegistry(null);

        registry.addList("15.1, 11.3,bogus");

        assertTrue(registry.isGloballySuppressed(R15_1));
        assertTrue(registry.isGloballySuppressed(R11_3));
        assertEquals(2, registry.size());
    }

    @Test
    void entries_ShouldCarryHitCountsSortedDescending() {
        SuppressionRegistry registry = new SuppressionRegistry(null);
        registry.add(R11_3);
        registry.add(R15_1, "a.c", 10, null);
        registry.recordHit(R15_1);
        registry.recordHit(R15_1);

        List<SuppressionRegistry.Entry> entries = registry.entries();

        assertEquals(2, entries.size());
        assertEquals("15.1: a.c: 10 (2 locations suppressed)", entries.get(0).format());
        assertEquals("11.3: None: None (0 locations suppressed)", entries.get(1).format());
    }
}
