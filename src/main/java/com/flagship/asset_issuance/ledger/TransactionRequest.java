package com.flagship.asset_issuance.ledger;

import com.flagship.asset_issuance.account.AccountKeys;
import lombok.Value;

import java.util.List;

/**
 * Everything the ledger client needs to build, sign and submit one
 * transaction.
 *
 * Invariant: the source snapshot was loaded for this request only, and
 * every signer is allowed to authorize operations of the source account.
 */
@Value
public class TransactionRequest {
    AccountSnapshot source;
    List<LedgerOperation> operations;
    List<AccountKeys> signers;
    long baseFee;

    private TransactionRequest(AccountSnapshot source, List<LedgerOperation> operations,
                               List<AccountKeys> signers, long baseFee) {
        if (source == null) {
            throw new IllegalArgumentException("Source account snapshot is required");
        }
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("At least one operation is required");
        }
        if (signers == null || signers.isEmpty()) {
            throw new IllegalArgumentException("At least one signer is required");
        }
        if (baseFee <= 0) {
            throw new IllegalArgumentException("Base fee must be positive");
        }
        this.source = source;
        this.operations = List.copyOf(operations);
        this.signers = List.copyOf(signers);
        this.baseFee = baseFee;
    }

    /**
     * Single-operation transaction signed by one key.
     */
    public static TransactionRequest of(AccountSnapshot source, LedgerOperation operation,
                                        AccountKeys signer, long baseFee) {
        return new TransactionRequest(source, List.of(operation), List.of(signer), baseFee);
    }
}
