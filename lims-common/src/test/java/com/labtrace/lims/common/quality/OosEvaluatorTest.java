package com.labtrace.lims.common.quality;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class OosEvaluatorTest {

    @Test
    void noRuleIsInSpecification() {
        assertThat(OosEvaluator.isOutOfSpecification("123", null)).isFalse();
    }

    @Test
    void rangeChecksBothBounds() {
        SpecificationRule rule = SpecificationRule.range(new BigDecimal("1"), new BigDecimal("10"));

        assertThat(OosEvaluator.isOutOfSpecification("5.5", rule)).isFalse();
        assertThat(OosEvaluator.isOutOfSpecification("10", rule)).isFalse();
        assertThat(OosEvaluator.isOutOfSpecification("15", rule)).isTrue();
        assertThat(OosEvaluator.isOutOfSpecification("0.5", rule)).isTrue();
        assertThat(OosEvaluator.evaluate("15", rule).message()).isEqualTo("Out of Specification: Result 15 exceeds maximum 10");
    }

    @Test
    void textualResultIsComparedWithTarget() {
        SpecificationRule rule = SpecificationRule.target("Absent");

        assertThat(OosEvaluator.isOutOfSpecification(" absent ", rule)).isFalse();
        assertThat(OosEvaluator.isOutOfSpecification("Present", rule)).isTrue();
    }

    @Test
    void textualResultWithoutTargetIsInSpecification() {
        assertThat(OosEvaluator.isOutOfSpecification("Conforms", SpecificationRule.range(BigDecimal.ONE, BigDecimal.TEN))).isFalse();
    }

    @Test
    void comparatorsUseThreshold() {
        assertThat(OosEvaluator.isOutOfSpecification("8", SpecificationRule.threshold(OosComparator.GTE, new BigDecimal("5")))).isFalse();
        assertThat(OosEvaluator.isOutOfSpecification("3", SpecificationRule.threshold(OosComparator.GTE, new BigDecimal("5")))).isTrue();
        assertThat(OosEvaluator.isOutOfSpecification("3", SpecificationRule.threshold(OosComparator.LTE, new BigDecimal("5")))).isFalse();
        assertThat(OosEvaluator.isOutOfSpecification("7", SpecificationRule.threshold(OosComparator.LTE, new BigDecimal("5")))).isTrue();
        assertThat(OosEvaluator.isOutOfSpecification("5.0", SpecificationRule.threshold(OosComparator.EQUALS, new BigDecimal("5")))).isFalse();
        assertThat(OosEvaluator.isOutOfSpecification("5.1", SpecificationRule.threshold(OosComparator.EQUALS, new BigDecimal("5")))).isTrue();
    }

    @Test
    void numericPrefixIsParsedLikeAMeasurement() {
        assertThat(OosEvaluator.parseNumber("12.5 mg/L")).contains(new BigDecimal("12.5"));
        assertThat(OosEvaluator.parseNumber("<10 cfu")).isEmpty();
    }
}
