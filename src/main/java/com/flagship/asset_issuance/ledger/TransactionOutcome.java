package com.flagship.asset_issuance.ledger;

import lombok.Value;

/**
 * Result of one transaction submission that reached the ledger.
 *
 * Transport failures are not outcomes; they are raised as
 * {@link LedgerException}s.
 */
@Value
public class TransactionOutcome {
    boolean success;
    String transactionHash;
    String failureReason;

    public static TransactionOutcome accepted(String transactionHash) {
        return new TransactionOutcome(true, transactionHash, null);
    }

    public static TransactionOutcome rejected(String failureReason) {
        return new TransactionOutcome(false, null, failureReason);
    }
}
