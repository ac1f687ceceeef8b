package com.infomedia.abacox.feeschedule.component.feeengine;

import java.math.BigDecimal;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Value of an optional override field. Either an explicit amount, which may be zero,
 * or {@link #inherit()}, meaning the next broader scope decides.
 */
public final class OverrideAmount {

    private static final OverrideAmount INHERIT = new OverrideAmount(null);

    private final BigDecimal amount;

    private OverrideAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public static OverrideAmount of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new InvalidFeeConfigurationException("Override amount must not be negative: " + amount);
        }
        return new OverrideAmount(amount);
    }

    /**
     * Maps a nullable column value: {@code null} becomes {@link #inherit()}.
     */
    public static OverrideAmount ofNullable(BigDecimal amount) {
        return amount == null ? INHERIT : of(amount);
    }

    public static OverrideAmount inherit() {
        return INHERIT;
    }

    public boolean isOverride() {
        return amount != null;
    }

    public BigDecimal get() {
        if (amount == null) {
            throw new NoSuchElementException("Override amount inherits from the broader scope");
        }
        return amount;
    }

    public BigDecimal orElse(BigDecimal fallback) {
        return amount != null ? amount : fallback;
    }

    /**
     * Inverse of {@link #ofNullable(BigDecimal)}, for persistence and DTO mapping.
     */
    public BigDecimal toNullable() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OverrideAmount that = (OverrideAmount) o;
        if (amount == null || that.amount == null) {
            return amount == that.amount;
        }
        return amount.compareTo(that.amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount == null ? 0 : amount.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return amount == null ? "Inherit" : "Override(" + amount.toPlainString() + ")";
    }
}
