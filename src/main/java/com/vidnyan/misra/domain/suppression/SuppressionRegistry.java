package com.vidnyan.misra.domain.suppression;

import com.vidnyan.misra.domain.model.SuppressionDirective;
import com.vidnyan.misra.domain.rule.RuleId;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hierarchical rule suppressions: rule, then file, then line/symbol.
 *
 * <p>Per rule the file map holds either the {@code null} key, meaning the rule
 * is suppressed everywhere, or file names mapped to their entries. Within a
 * file a {@code null} entry suppresses the whole file.
 *
 * <p>Built once before rule execution; afterwards only the hit counters change.
 */
@Slf4j
public class SuppressionRegistry {

    private static final Pattern DIRECTIVE_ID = Pattern.compile("^(?:(?:misra|MISRA)[-_.](?:c2012[-_.])?)?(\\d+)[_.](\\d+)");
    private static final Pattern LIST_ITEM = Pattern.compile("(\\d+)\\.(\\d+)");

    private final Map<Integer, Map<String, List<LineSymbol>>> suppressedRules = new LinkedHashMap<>();
    private final Map<Integer, Integer> hitCounts = new HashMap<>();
    private final String filePrefix;

    public SuppressionRegistry(String filePrefix) {
        this.filePrefix = filePrefix == null || filePrefix.isBlank() ? null : filePrefix;
    }

    /**
     * A suppressed location. Either part may be null but not both.
     */
    public record LineSymbol(Integer line, String symbol) {
    }

    /**
     * Suppression listing entry for the end-of-run report.
     *
     * @param file null for a global suppression
     * @param line null for a whole-file or global suppression
     */
    public record Entry(RuleId rule, String file, Integer line, int hits) {

        public String format() {
            return rule + ": " + (file == null ? "None" : file) + ": " + (line == null ? "None" : line)
                    + " (" + hits + " locations suppressed)";
        }
    }

    /**
     * Suppress {@code rule} everywhere.
     */
    public void add(RuleId rule) {
        add(rule, null, null, null);
    }

    /**
     * Add a suppression. Re-adding an identical entry has no effect.
     *
     * @param fileName null to suppress in all files
     * @param line     null together with {@code symbol} to suppress the whole file
     */
    public void add(RuleId rule, String fileName, Integer line, String symbol) {
        String normalized = fileName == null ? null : normalize(fileName);
        LineSymbol lineSymbol = line != null || symbol != null ? new LineSymbol(line, symbol) : null;

        Map<String, List<LineSymbol>> files = suppressedRules.computeIfAbsent(rule.number(), k -> new HashMap<>());
        List<LineSymbol> entries = files.get(normalized);
        if (entries == null) {
            entries = new ArrayList<>();
            entries.add(lineSymbol);
            files.put(normalized, entries);
            return;
        }
        if (!entries.contains(lineSymbol)) {
            entries.add(lineSymbol);
        }
    }

    /**
     * Register the analyzer's inline suppressions. Ids that are not MISRA
     * rule numbers are ignored.
     */
    public void addAll(List<SuppressionDirective> directives) {
        for (SuppressionDirective directive : directives) {
            Matcher m = DIRECTIVE_ID.matcher(directive.errorId() == null ? "" : directive.errorId());
            if (!m.find()) {
                log.debug("Ignoring non-MISRA suppression {}", directive.errorId());
                continue;
            }
            RuleId rule = RuleId.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            add(rule, directive.fileName(), directive.lineNumber(), directive.symbolName());
        }
    }

    /**
     * Suppress every rule of a comma separated list such as {@code 15.1,11.3}.
     */
    public void addList(String suppressionList) {
        if (suppressionList == null) {
            return;
        }
        for (String item : suppressionList.split(",")) {
            Matcher m = LIST_ITEM.matcher(item.trim());
            if (m.lookingAt()) {
                add(RuleId.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
            }
        }
    }

    public boolean isSuppressed(String filePath, int line, RuleId rule) {
        Map<String, List<LineSymbol>> files = suppressedRules.get(rule.number());
        if (files == null) {
            return false;
        }
        if (files.containsKey(null)) {
            return true;
        }
        List<LineSymbol> entries = files.get(lookupName(filePath));
        if (entries == null) {
            return false;
        }
        if (entries.contains(null)) {
            return true;
        }
        // symbol names are kept for the listing only; they may be patterns
        return entries.stream().anyMatch(e -> e != null && e.line() != null && e.line() == line);
    }

    public boolean isGloballySuppressed(RuleId rule) {
        Map<String, List<LineSymbol>> files = suppressedRules.get(rule.number());
        return files != null && files.containsKey(null);
    }

    public void recordHit(RuleId rule) {
        hitCounts.merge(rule.number(), 1, Integer::sum);
    }

    public int hits(RuleId rule) {
        return hitCounts.getOrDefault(rule.number(), 0);
    }

    public int size() {
        return suppressedRules.values().stream()
                .flatMap(files -> files.values().stream())
                .mapToInt(List::size)
                .sum();
    }

    /**
     * All suppressions with their rule's hit count, sorted descending by
     * formatted line.
     */
    public List<Entry> entries() {
        List<Entry> entries = new ArrayList<>();
        suppressedRules.forEach((number, files) -> files.forEach((file, items) -> {
            for (LineSymbol item : items) {
                RuleId rule = RuleId.fromNumber(number);
                entries.add(new Entry(rule, file, item == null ? null : item.line(), hits(rule)));
            }
        }));
        entries.sort(Comparator.comparing(Entry::format).reversed());
        return entries;
    }

    private String lookupName(String filePath) {
        if (filePath == null) {
            return null;
        }
        if (filePrefix != null) {
            return removeFilePrefix(filePath, filePrefix);
        }
        Path fileName = Path.of(filePath).getFileName();
        return fileName == null ? filePath : fileName.toString();
    }

    /**
     * Strip {@code prefix} and any directory separators left at the start.
     */
    static String removeFilePrefix(String filePath, String prefix) {
        if (!filePath.startsWith(prefix)) {
            return filePath;
        }
        String result = filePath.substring(prefix.length());
        int start = 0;
        while (start < result.length() && (result.charAt(start) == '/' || result.charAt(start) == '\\')) {
            start++;
        }
        return result.substring(start);
    }

    private static String normalize(String fileName) {
        String expanded = fileName;
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = System.getProperty("user.home") + expanded.substring(1);
        }
        String normalized = Path.of(expanded).normalize().toString();
        return normalized.isEmpty() ? "." : normalized;
    }

    @Override
    public String toString() {
        return "SuppressionRegistry" + Objects.toString(suppressedRules.keySet());
    }
}
