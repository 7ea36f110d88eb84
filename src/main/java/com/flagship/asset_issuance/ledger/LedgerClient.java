package com.flagship.asset_issuance.ledger;

/**
 * Capabilities the orchestration layer needs from the ledger.
 *
 * All methods are blocking network calls bounded by a timeout. Failures are
 * raised as {@link LedgerException} subclasses:
 * <ul>
 *   <li>{@link AccountNotFoundException} - the account does not exist</li>
 *   <li>{@link LedgerTimeoutException} - the call timed out</li>
 *   <li>{@link LedgerUnavailableException} - any other transport or server failure</li>
 * </ul>
 * A transaction the ledger rejects is not an exception: {@link #submit}
 * returns a rejected {@link TransactionOutcome}.
 */
public interface LedgerClient {

    /**
     * Loads the current state of an account.
     */
    AccountSnapshot loadAccount(String accountId);

    /**
     * Recommended base fee per operation, in stroops.
     */
    long fetchBaseFee();

    /**
     * Builds, signs and submits one transaction against {@link #network()}.
     */
    TransactionOutcome submit(TransactionRequest request);

    /**
     * Network this client submits to.
     */
    LedgerNetwork network();
}
