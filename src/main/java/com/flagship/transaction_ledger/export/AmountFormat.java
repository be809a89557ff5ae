package com.flagship.transaction_ledger.export;

import java.math.BigDecimal;

/**
 * Renders account amounts for output.
 *
 * Finite values use the shortest decimal that round-trips to the same double,
 * in plain notation with at least one fractional digit: 25.11 stays "25.11",
 * 0.0 is "0.0", 1.0E7 becomes "10000000.0", 1.0E-4 becomes "0.0001".
 * Non-finite values fall back to {@link Double#toString(double)}.
 */
public final class AmountFormat {

    private AmountFormat() {
        // Utility class
    }

    public static String render(double amount) {
        if (!Double.isFinite(amount)) {
            return Double.toString(amount);
        }
        BigDecimal value = BigDecimal.valueOf(amount).stripTrailingZeros();
        if (value.scale() < 1) {
            value = value.setScale(1);
        }
        return value.toPlainString();
    }
}
