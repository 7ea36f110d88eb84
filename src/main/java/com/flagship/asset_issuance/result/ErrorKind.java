package com.flagship.asset_issuance.result;

/**
 * Classification of failures reported by the orchestration layer.
 *
 * Every error result carries exactly one kind so callers can decide on
 * retry without parsing messages. Nothing in the core retries on its own.
 */
public enum ErrorKind {
    /**
     * Bad input. No network call was made.
     */
    VALIDATION,

    /**
     * Account missing on the ledger or could not be funded.
     */
    ACCOUNT_STATE,

    /**
     * Ledger rejected a transaction, or the network failed during submission.
     */
    SUBMISSION,

    /**
     * Balance query against an account that does not exist.
     */
    LOOKUP,

    /**
     * Unsupported network identifier or other bad configuration.
     */
    CONFIGURATION,

    /**
     * A ledger call exceeded its timeout. The outcome of a submitted
     * transaction is unknown in this case.
     */
    TIMEOUT
}
