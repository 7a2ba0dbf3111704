package com.flagship.bank_transfer.fee;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One bracket of the fee schedule.
 *
 * The bracket covers amounts in {@code (lowerExclusive, upperInclusive]}.
 * A null upper bound means the bracket is open-ended; a null cap means the
 * raw percentage is charged without limit.
 */
@Value
public class FeeTier {
    BigDecimal lowerExclusive;
    BigDecimal upperInclusive;
    BigDecimal rate;
    BigDecimal cap;

    public boolean contains(BigDecimal amount) {
        boolean aboveLower = amount.compareTo(lowerExclusive) > 0;
        boolean withinUpper = upperInclusive == null || amount.compareTo(upperInclusive) <= 0;
        return aboveLower && withinUpper;
    }

    /**
     * Unrounded fee for an amount inside this bracket.
     */
    public BigDecimal apply(BigDecimal amount) {
        BigDecimal raw = amount.multiply(rate);
        if (cap != null && raw.compareTo(cap) > 0) {
            return cap;
        }
        return raw;
    }
}
