package com.flagship.bank_ledger.money;

import com.flagship.bank_ledger.exception.InvalidAmountException;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Exact monetary value with a fixed scale of two fractional digits.
 *
 * The value is held as a count of minor units (cents) in a {@code long}.
 * It is never converted through a binary floating point type: text and
 * {@link BigDecimal} are the only representations it is created from or
 * rendered to.
 *
 * Key invariants:
 * - Arithmetic is exact; overflow raises {@link ArithmeticException}
 * - {@link #minus(Money)} may produce a negative value, callers decide whether that is allowed
 * - {@code parse(m.toDisplayText())} equals {@code m} for every non-negative value
 */
@EqualsAndHashCode
public final class Money implements Comparable<Money> {

    public static final int SCALE = 2;

    public static final Money ZERO = new Money(0L);

    // 17 integer digits is the widest text that can still fit a long of cents.
    private static final Pattern AMOUNT_TEXT = Pattern.compile("^[0-9]{1,17}(\\.[0-9]{1,2})?$");

    private static final int MAX_ECHOED_LENGTH = 32;

    private final long minorUnits;

    private Money(long minorUnits) {
        this.minorUnits = minorUnits;
    }

    /**
     * Parses decimal text such as {@code "250.50"}, {@code "7"} or {@code "0.5"}.
     *
     * @param text non-negative decimal with at most two fractional digits
     * @return the parsed value
     * @throws InvalidAmountException if the text is malformed or its magnitude cannot be represented
     */
    public static Money parse(String text) {
        if (text == null) {
            throw new InvalidAmountException("Amount is required");
        }
        String trimmed = text.trim();
        if (!AMOUNT_TEXT.matcher(trimmed).matches()) {
            throw new InvalidAmountException("Malformed amount: " + echo(text));
        }
        try {
            return new Money(new BigDecimal(trimmed).movePointRight(SCALE).longValueExact());
        } catch (ArithmeticException e) {
            throw new InvalidAmountException("Amount out of range: " + echo(text));
        }
    }

    /**
     * Parses an amount to be moved: same grammar as {@link #parse(String)}
     * and additionally strictly positive.
     *
     * @throws InvalidAmountException if the text is malformed or the value is zero
     */
    public static Money parseAmount(String text) {
        Money amount = parse(text);
        if (!amount.isPositive()) {
            throw new InvalidAmountException("Amount must be positive: " + echo(text));
        }
        return amount;
    }

    public static Money ofMinorUnits(long minorUnits) {
        return new Money(minorUnits);
    }

    /**
     * Converts a database {@code NUMERIC} value. Fails if the value carries
     * more than two fractional digits or exceeds the minor-unit range.
     */
    public static Money of(BigDecimal value) {
        return new Money(value.setScale(SCALE, RoundingMode.UNNECESSARY)
                .movePointRight(SCALE)
                .longValueExact());
    }

    public Money plus(Money other) {
        return new Money(Math.addExact(minorUnits, other.minorUnits));
    }

    public Money minus(Money other) {
        return new Money(Math.subtractExact(minorUnits, other.minorUnits));
    }

    public boolean isPositive() {
        return minorUnits > 0;
    }

    public boolean isNonNegative() {
        return minorUnits >= 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    public long getMinorUnits() {
        return minorUnits;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(minorUnits, SCALE);
    }

    /**
     * Renders the value with exactly two fractional digits, e.g. {@code "0.00"}, {@code "749.50"}.
     */
    public String toDisplayText() {
        return toBigDecimal().toPlainString();
    }

    @Override
    public int compareTo(Money other) {
        return Long.compare(minorUnits, other.minorUnits);
    }

    @Override
    public String toString() {
        return toDisplayText();
    }

    private static String echo(String text) {
        if (text.length() <= MAX_ECHOED_LENGTH) {
            return "'" + text + "'";
        }
        return "'" + text.substring(0, MAX_ECHOED_LENGTH) + "...' (" + text.length() + " chars)";
    }
}
