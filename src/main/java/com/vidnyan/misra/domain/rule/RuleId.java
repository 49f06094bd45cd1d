package com.vidnyan.misra.domain.rule;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MISRA C:2012 rule number, e.g. 15.1.
 */
public record RuleId(int major, int minor) implements Comparable<RuleId> {

    private static final Pattern RULE_PATTERN = Pattern.compile("^(\\d+)\\.(\\d+)$");
    private static final Comparator<RuleId> ORDER =
            Comparator.comparingInt(RuleId::major).thenComparingInt(RuleId::minor);

    public static RuleId of(int major, int minor) {
        return new RuleId(major, minor);
    }

    /**
     * Parse a {@code major.minor} string.
     *
     * @throws IllegalArgumentException when the text is not a rule number
     */
    public static RuleId parse(String text) {
        Matcher m = RULE_PATTERN.matcher(text == null ? "" : text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a rule number: " + text);
        }
        return new RuleId(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    /**
     * Rule number in hundreds format: 15.1 is 1501.
     */
    public int number() {
        return major * 100 + minor;
    }

    public static RuleId fromNumber(int number) {
        return new RuleId(number / 100, number % 100);
    }

    /**
     * Identifier used in reports, e.g. {@code c2012-15.1}.
     */
    public String errorId() {
        return "c2012-" + this;
    }

    @Override
    public int compareTo(RuleId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
