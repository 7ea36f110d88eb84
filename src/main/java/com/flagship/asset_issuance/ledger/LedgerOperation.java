package com.flagship.asset_issuance.ledger;

/**
 * A single operation to be placed in a ledger transaction.
 */
public interface LedgerOperation {

    /**
     * Short human-readable description used in logs.
     */
    String describe();
}
