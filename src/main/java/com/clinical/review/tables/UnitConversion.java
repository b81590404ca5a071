package com.clinical.review.tables;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Scalar conversion from one unit to another. Converted values are rounded to two decimals.
 */
public final class UnitConversion {
    private final String fromUnit;
    private final BigDecimal factor;
    private final String targetUnit;

    public UnitConversion(String fromUnit, BigDecimal factor, String targetUnit) {
        this.fromUnit = Objects.requireNonNull(fromUnit, "fromUnit");
        this.factor = Objects.requireNonNull(factor, "factor");
        this.targetUnit = Objects.requireNonNull(targetUnit, "targetUnit");
    }

    public String getFromUnit() {
        return fromUnit;
    }

    public BigDecimal getFactor() {
        return factor;
    }

    public String getTargetUnit() {
        return targetUnit;
    }

    public BigDecimal apply(BigDecimal value) {
        return value.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }
}
