package com.flagship.asset_issuance.ledger;

import com.flagship.asset_issuance.result.ErrorKind;

/**
 * The ledger could not be reached or answered with an unexpected error.
 */
public class LedgerUnavailableException extends LedgerException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerUnavailableException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.SUBMISSION;
    }
}
