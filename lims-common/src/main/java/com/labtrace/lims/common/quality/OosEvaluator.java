package com.labtrace.lims.common.quality;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Out-of-specification evaluation of a recorded test result.
 * <p>
 * Numeric results are checked against min/max first, then against the threshold of the comparator. Non-numeric
 * results are only checked against the textual target, case-insensitively.
 */
public final class OosEvaluator {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?)");

    private OosEvaluator() {}

    public static boolean isOutOfSpecification(String result, SpecificationRule rule) {
        return evaluate(result, rule).outOfSpecification();
    }

    public static OosVerdict evaluate(String result, SpecificationRule rule) {
        if (rule == null) {
            return new OosVerdict(false, "In Specification (No specification defined)");
        }
        if (result == null || result.isBlank()) {
            return new OosVerdict(false, "In Specification (No result recorded)");
        }
        Optional<BigDecimal> numeric = parseNumber(result);
        if (numeric.isEmpty()) {
            if (rule.target() != null && !rule.target().isBlank()) {
                boolean mismatch = !result.trim().toLowerCase(Locale.ROOT).equals(rule.target().trim().toLowerCase(Locale.ROOT));
                return mismatch
                    ? new OosVerdict(true, "Out of Specification: Result \"" + result.trim() + "\" does not match target \"" + rule.target().trim() + "\"")
                    : inSpecification();
            }
            return inSpecification();
        }
        BigDecimal value = numeric.get();
        if (rule.min() != null && value.compareTo(rule.min()) < 0) {
            return new OosVerdict(true, "Out of Specification: Result " + value.toPlainString() + " is below minimum " + rule.min().toPlainString());
        }
        if (rule.max() != null && value.compareTo(rule.max()) > 0) {
            return new OosVerdict(true, "Out of Specification: Result " + value.toPlainString() + " exceeds maximum " + rule.max().toPlainString());
        }
        OosComparator comparator = rule.comparator() == null ? OosComparator.RANGE : rule.comparator();
        BigDecimal threshold = rule.threshold();
        if (comparator == OosComparator.RANGE || threshold == null) {
            return inSpecification();
        }
        boolean failed = switch (comparator) {
            case GTE -> value.compareTo(threshold) < 0;
            case LTE -> value.compareTo(threshold) > 0;
            case EQUALS -> value.compareTo(threshold) != 0;
            case RANGE -> false;
        };
        if (!failed) {
            return inSpecification();
        }
        String expectation = switch (comparator) {
            case GTE -> ">= ";
            case LTE -> "<= ";
            default -> "= ";
        };
        return new OosVerdict(true, "Out of Specification: Result " + value.toPlainString() + " fails rule " + expectation + threshold.toPlainString());
    }

    static Optional<BigDecimal> parseNumber(String raw) {
        Matcher matcher = LEADING_NUMBER.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(matcher.group(1)));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static OosVerdict inSpecification() {
        return new OosVerdict(false, "In Specification");
    }
}
