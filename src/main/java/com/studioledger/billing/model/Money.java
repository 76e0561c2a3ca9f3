package com.studioledger.billing.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Immutable currency amount held at two decimal places, rounded half-up.
 * Entities persist plain {@link BigDecimal} columns; all arithmetic on them goes through this type.
 */
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING);
    }

    public static Money of(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        return new Money(amount);
    }

    public static Money of(String amount) {
        return new Money(new BigDecimal(amount));
    }

    /** Null-tolerant variant for optional columns; null reads as zero. */
    public static Money ofNullable(BigDecimal amount) {
        return amount == null ? ZERO : new Money(amount);
    }

    /** Whether {@code value} is representable in whole cents without rounding. */
    public static boolean isWholeCents(BigDecimal value) {
        return value.stripTrailingZeros().scale() <= SCALE;
    }

    public BigDecimal toBigDecimal() {
        return amount;
    }

    public Money plus(Money other) {
        return new Money(amount.add(other.amount));
    }

    public Money minus(Money other) {
        return new Money(amount.subtract(other.amount));
    }

    /** {@code this * rate / 100}, rounded once. */
    public Money percent(BigDecimal rate) {
        return new Money(amount.multiply(rate).divide(HUNDRED, SCALE, ROUNDING));
    }

    /** Ratio of this amount to {@code whole} as a percentage, two decimals. Zero when whole is zero. */
    public BigDecimal percentOf(Money whole) {
        if (whole.isZero()) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return amount.multiply(HUNDRED).divide(whole.amount, SCALE, ROUNDING);
    }

    public Money negate() {
        return new Money(amount.negate());
    }

    public Money min(Money other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public Money max(Money other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean isNegative() {
        return amount.signum() < 0;
    }

    public boolean isPositive() {
        return amount.signum() > 0;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Money other) {
        return amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Money)) {
            return false;
        }
        return amount.compareTo(((Money) o).amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
