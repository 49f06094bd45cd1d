package com.vidnyan.misra.application.service;

import com.vidnyan.misra.application.port.out.RuleTextRepository;
import com.vidnyan.misra.domain.model.Location;
import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.rule.DomainSeverity;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleText;
import com.vidnyan.misra.domain.rule.UnitReport;
import com.vidnyan.misra.domain.rule.Violation;
import com.vidnyan.misra.domain.suppression.SuppressionRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SinksTest {

    private static final RuleId GOTO = RuleId.of(15, 1);
    private static final RuleId UNION = RuleId.of(19, 2);

    @Test
    void reportingSink_ShouldAttachRuleTextAndSeverity() {
        RuleTextRepository texts = repository(Map.of(GOTO,
                new RuleText(GOTO, "The goto statement should not be used", DomainSeverity.ADVISORY)));
        ReportingSink sink = new ReportingSink("a.c", new SuppressionRegistry(null), texts);

        sink.report(() -> new Location("a.c", 4, 5), GOTO);
        sink.report(() -> new Location("a.c", 9, 1), UNION);
        UnitReport report = sink.finish();

        assertEquals(2, report.violations().size());
        Violation first = report.violations().get(0);
        assertEquals(DomainSeverity.ADVISORY, first.severity());
        assertEquals("[a.c:4:5] (style) The goto statement should not be used [misra-c2012-15.1]", first.format());
        Violation second = report.violations().get(1);
        assertEquals(DomainSeverity.UNDEFINED, second.severity());
        assertEquals(ReportingSink.GENERIC_MESSAGE, second.message());
    }

    @Test
    void reportingSink_ShouldCountSuppressedReports() {
        SuppressionRegistry registry = new SuppressionRegistry(null);
        registry.add(GOTO, "a.c", 4, null);
        ReportingSink sink = new ReportingSink("a.c", registry, repository(Map.of()));

        sink.report(() -> new Location("src/a.c", 4, 5), GOTO);
        sink.report(() -> new Location("src/a.c", 5, 5), GOTO);
        UnitReport report = sink.finish();

        assertEquals(1, report.violations().size());
        assertEquals(1, report.suppressed());
        assertEquals(1, registry.hits(GOTO));
    }

    @Test
    void verifySink_ShouldCompareAnnotatedAndReportedIds() {
        ModelBuilder b = ModelBuilder.file("a.c")
                .line(10, "goto end ; // 15.1")
                .line(11, "union u ; // 19.2 see 19.2")
                .line(12, "x = 1 ; // TODO 10.3")
                .line(13, "y = 2 ;");
        TranslationUnit unit = b.unit();
        VerifySink sink = new VerifySink(unit);

        sink.report(() -> Location.at("a.c", 10), GOTO);
        sink.report(() -> Location.at("a.c", 13), RuleId.of(10, 3));
        UnitReport report = sink.finish();

        assertEquals(List.of("Expected but not seen: 11:19.2", "Not expected: 13:10.3"), report.verifyMismatches());
        assertTrue(report.violations().isEmpty());
    }

    @Test
    void verifySink_ShouldReportAnnotationWithoutDetection() {
        ModelBuilder b = ModelBuilder.file("a.c").line(10, "goto end ; // 15.1");

        assertTrue(verify(b, 10).verifyMismatches().isEmpty());
        assertEquals(List.of("Expected but not seen: 10:15.1"), verify(b).verifyMismatches());
    }

    private static UnitReport verify(ModelBuilder b, int... gotoLines) {
        VerifySink sink = new VerifySink(b.unit());
        for (int line : gotoLines) {
            sink.report(() -> Location.at("a.c", line), GOTO);
        }
        return sink.finish();
    }

    @Test
    void expectedIds_ShouldUseRuleNumberPrefixOfEachWord() {
        ModelBuilder b = ModelBuilder.file("a.c")
                .line(3, "a = b ; // 10.4,12.1 note")
                .line(4, "/* 15.1 */ c = d ;");

        assertEquals(Set.of("3:10.4"), VerifySink.expectedIds(b.raw().tokens()));
    }

    private static RuleTextRepository repository(Map<RuleId, RuleText> texts) {
        return new RuleTextRepository() {
            @Override
            public Optional<RuleText> findByRule(RuleId rule) {
                return Optional.ofNullable(texts.get(rule));
            }

            @Override
            public int size() {
                return texts.size();
            }
        };
    }
}
