package com.labtrace.lims.api.domain;

import com.labtrace.lims.common.quality.OosComparator;
import com.labtrace.lims.common.quality.SpecificationRule;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.math.BigDecimal;
import java.util.UUID;

/**
 * Acceptance criteria of a test: numeric bounds, textual target or a comparator against a threshold.
 */
@Entity
@Table(name = "specification")
public class Specification extends AbstractAuditingEntity<UUID> implements Serializable {

    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue
    @Column(name = "id", columnDefinition = "uuid")
    private UUID id;

    @Column(name = "code", nullable = false, unique = true, length = 64)
    private String code;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "target", length = 255)
    private String target;

    @Column(name = "min_value", precision = 19, scale = 6)
    private BigDecimal min;

    @Column(name = "max_value", precision = 19, scale = 6)
    private BigDecimal max;

    @Column(name = "unit", length = 32)
    private String unit;

    @Enumerated(EnumType.STRING)
    @Column(name = "oos_comparator", length = 16)
    private OosComparator comparator;

    @Column(name = "oos_threshold", precision = 19, scale = 6)
    private BigDecimal threshold;

    public SpecificationRule toRule() {
        return new SpecificationRule(min, max, target, comparator, threshold);
    }

    @Override
    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public BigDecimal getMin() {
        return min;
    }

    public void setMin(BigDecimal min) {
        this.min = min;
    }

    public BigDecimal getMax() {
        return max;
    }

    public void setMax(BigDecimal max) {
        this.max = max;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public OosComparator getComparator() {
        return comparator;
    }

    public void setComparator(OosComparator comparator) {
        this.comparator = comparator;
    }

    public BigDecimal getThreshold() {
        return threshold;
    }

    public void setThreshold(BigDecimal threshold) {
        this.threshold = threshold;
    }
}
