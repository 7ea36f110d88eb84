package com.flagship.asset_issuance.ledger;

import lombok.Value;

import java.util.List;

/**
 * Ledger state of one account at the moment it was loaded.
 *
 * A snapshot is good for building exactly one transaction: the sequence
 * number advances on every submission, so a reused snapshot is rejected
 * by the ledger.
 */
@Value
public class AccountSnapshot {
    String accountId;
    long sequenceNumber;
    List<BalanceEntry> balances;

    public AccountSnapshot(String accountId, long sequenceNumber, List<BalanceEntry> balances) {
        this.accountId = accountId;
        this.sequenceNumber = sequenceNumber;
        this.balances = balances == null ? List.of() : List.copyOf(balances);
    }
}
