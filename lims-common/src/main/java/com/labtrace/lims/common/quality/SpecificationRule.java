package com.labtrace.lims.common.quality;

import java.math.BigDecimal;

/**
 * Acceptance criteria of one test specification. Every part is optional.
 *
 * @param min lower bound, inclusive
 * @param max upper bound, inclusive
 * @param target expected textual result for non-numeric tests (e.g. "Absent", "Pass")
 * @param comparator threshold comparison, {@code null} behaves like {@link OosComparator#RANGE}
 * @param threshold value used by GTE, LTE and EQUALS
 */
public record SpecificationRule(BigDecimal min, BigDecimal max, String target, OosComparator comparator, BigDecimal threshold) {
    public static SpecificationRule range(BigDecimal min, BigDecimal max) {
        return new SpecificationRule(min, max, null, OosComparator.RANGE, null);
    }

    public static SpecificationRule target(String target) {
        return new SpecificationRule(null, null, target, null, null);
    }

    public static SpecificationRule threshold(OosComparator comparator, BigDecimal threshold) {
        return new SpecificationRule(null, null, null, comparator, threshold);
    }
}
