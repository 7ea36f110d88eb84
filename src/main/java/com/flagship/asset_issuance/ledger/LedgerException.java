package com.flagship.asset_issuance.ledger;

import com.flagship.asset_issuance.result.ErrorKind;

/**
 * Base class for failures talking to the ledger.
 *
 * Callers at component boundaries convert these into tagged results; they
 * are never retried automatically.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * How this failure is reported when it ends a ledger-facing step.
     */
    public abstract ErrorKind getErrorKind();
}
