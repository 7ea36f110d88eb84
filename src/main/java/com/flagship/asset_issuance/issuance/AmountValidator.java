package com.flagship.asset_issuance.issuance;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Validates asset amounts against the ledger's fixed-point representation:
 * positive, at most 7 fractional digits, and no larger than the biggest
 * int64 count of stroops.
 */
public final class AmountValidator {

    public static final int MAX_SCALE = 7;
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("922337203685.4775807");

    private static final Pattern DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    private AmountValidator() {
    }

    /**
     * Parses and checks {@code amount}.
     *
     * @return the amount in plain decimal notation, without trailing zeros
     * @throws IllegalArgumentException if the amount is missing or out of range
     */
    public static String normalize(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("Amount is required");
        }
        String trimmed = amount.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Amount must be a plain positive decimal: " + amount);
        }
        BigDecimal value = new BigDecimal(trimmed);
        if (value.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amount);
        }
        if (value.stripTrailingZeros().scale() > MAX_SCALE) {
            throw new IllegalArgumentException(
                String.format("Amount supports at most %d fractional digits: %s", MAX_SCALE, amount));
        }
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new IllegalArgumentException("Amount exceeds the ledger maximum of " + MAX_AMOUNT);
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
