package com.vidnyan.misra.application.service;

import com.vidnyan.misra.domain.model.Locatable;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.UnitReport;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Verify mode: compares the reported {@code line:rule} ids against the ids
 * announced in {@code //} comments of the source, e.g. {@code x = 1; // 10.3 13.4}.
 * Suppressions are not consulted.
 */
public class VerifySink implements DiagnosticsSink {

    private static final Pattern RULE_WORD = Pattern.compile("^\\d+\\.\\d+");

    private final String sourceFile;
    private final Set<String> expected;
    private final Set<String> actual = new LinkedHashSet<>();

    public VerifySink(TranslationUnit unit) {
        this.sourceFile = unit.sourceFile();
        this.expected = expectedIds(unit.rawTokens().tokens());
    }

    static Set<String> expectedIds(List<Token> rawTokens) {
        Set<String> ids = new LinkedHashSet<>();
        for (Token token : rawTokens) {
            if (!token.str().startsWith("//") || token.str().contains("TODO")) {
                continue;
            }
            for (String word : token.str().substring(2).split(" ")) {
                Matcher m = RULE_WORD.matcher(word);
                if (m.find()) {
                    ids.add(token.line() + ":" + m.group());
                }
            }
        }
        return ids;
    }

    @Override
    public void report(Locatable node, RuleId rule) {
        actual.add(node.line() + ":" + rule);
    }

    @Override
    public UnitReport finish() {
        List<String> mismatches = new ArrayList<>();
        for (String id : expected) {
            if (!actual.contains(id)) {
                mismatches.add("Expected but not seen: " + id);
            }
        }
        for (String id : actual) {
            if (!expected.contains(id)) {
                mismatches.add("Not expected: " + id);
            }
        }
        return UnitReport.verified(sourceFile, mismatches);
    }
}
