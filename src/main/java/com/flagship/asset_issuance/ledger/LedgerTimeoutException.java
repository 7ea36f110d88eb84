package com.flagship.asset_issuance.ledger;

import com.flagship.asset_issuance.result.ErrorKind;

/**
 * A ledger call did not complete within its timeout.
 */
public class LedgerTimeoutException extends LedgerException {

    public LedgerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerTimeoutException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.TIMEOUT;
    }
}
