package com.flagship.asset_issuance.issuance;

/**
 * States of one issuance run.
 *
 * START → TRUSTLINE_BUILDING → TRUSTLINE_SUBMITTED → PAYMENT_BUILDING → PAYMENT_SUBMITTED
 *
 * FAILED is reachable from every non-terminal state. PAYMENT_SUBMITTED and
 * FAILED are terminal.
 */
public enum IssuanceState {
    START,
    TRUSTLINE_BUILDING,
    TRUSTLINE_SUBMITTED,
    PAYMENT_BUILDING,
    PAYMENT_SUBMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == PAYMENT_SUBMITTED || this == FAILED;
    }
}
