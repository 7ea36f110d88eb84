package com.flagship.asset_issuance.ledger;

import com.flagship.asset_issuance.result.ErrorKind;
import lombok.Getter;

/**
 * The ledger has no account with the requested id (never funded, or merged).
 */
@Getter
public class AccountNotFoundException extends LedgerException {

    private final String accountId;

    public AccountNotFoundException(String accountId) {
        super("Account not found on ledger: " + accountId);
        this.accountId = accountId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.ACCOUNT_STATE;
    }
}
