package com.flagship.bank_transfer.fee;

import com.flagship.bank_transfer.exception.BankingException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Tiered, capped transfer fee schedule.
 *
 * Brackets are non-overlapping and boundary values belong to the lower bracket:
 * <pre>
 *   0.00      - 2,000.00    0%       no cap
 *   2,000.01  - 10,000.00   0.25%    20.00
 *   10,000.01 - 20,000.00   0.20%    25.00
 *   20,000.01 - 50,000.00   0.125%   40.00
 *   50,000.01 - 100,000.00  0.08%    50.00
 *   100,000.01 and above    0.05%    100.00
 * </pre>
 *
 * Arithmetic is exact; the only rounding is the final one to 2 fraction digits, HALF_UP.
 * Stateless and thread-safe.
 */
@Component
public class FeeCalculator {

    public static final int MONEY_SCALE = 2;

    private static final List<FeeTier> TIERS = List.of(
            new FeeTier(BigDecimal.ZERO, new BigDecimal("2000.00"), BigDecimal.ZERO, null),
            new FeeTier(new BigDecimal("2000.00"), new BigDecimal("10000.00"),
                    new BigDecimal("0.0025"), new BigDecimal("20.00")),
            new FeeTier(new BigDecimal("10000.00"), new BigDecimal("20000.00"),
                    new BigDecimal("0.0020"), new BigDecimal("25.00")),
            new FeeTier(new BigDecimal("20000.00"), new BigDecimal("50000.00"),
                    new BigDecimal("0.00125"), new BigDecimal("40.00")),
            new FeeTier(new BigDecimal("50000.00"), new BigDecimal("100000.00"),
                    new BigDecimal("0.0008"), new BigDecimal("50.00")),
            new FeeTier(new BigDecimal("100000.00"), null,
                    new BigDecimal("0.0005"), new BigDecimal("100.00"))
    );

    /**
     * Computes the fee for a strictly positive amount.
     *
     * @throws BankingException with {@code INVALID_AMOUNT} for null, zero or negative input
     */
    public BigDecimal fee(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw BankingException.invalidAmount("Amount must be greater than 0");
        }
        FeeTier tier = tierFor(amount);
        return tier.apply(amount).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    FeeTier tierFor(BigDecimal amount) {
        for (FeeTier tier : TIERS) {
            if (tier.contains(amount)) {
                return tier;
            }
        }
        // unreachable: the last tier is open-ended and amount is positive
        throw new IllegalStateException("No fee tier for amount " + amount);
    }

    public List<FeeTier> getTiers() {
        return TIERS;
    }
}
