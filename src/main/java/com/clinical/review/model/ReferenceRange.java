package com.clinical.review.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Low/high bounds for a lab value. Either bound may be absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ReferenceRange {
    private final BigDecimal low;
    private final BigDecimal high;
    private final String text;

    public ReferenceRange(BigDecimal low, BigDecimal high, String text) {
        this.low = low;
        this.high = high;
        this.text = text;
    }

    public BigDecimal getLow() {
        return low;
    }

    public BigDecimal getHigh() {
        return high;
    }

    public String getText() {
        return text;
    }

    /**
     * @param value the value to test
     * @return true if the value falls below the low bound or above the high bound
     */
    public boolean isOutside(BigDecimal value) {
        if (value == null) {
            return false;
        }
        if (low != null && value.compareTo(low) < 0) {
            return true;
        }
        return high != null && value.compareTo(high) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReferenceRange other = (ReferenceRange) o;
        return Objects.equals(low, other.low)
                && Objects.equals(high, other.high)
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high, text);
    }
}
