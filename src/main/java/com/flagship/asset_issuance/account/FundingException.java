package com.flagship.asset_issuance.account;

/**
 * The funding faucet could not be reached or refused to fund an account.
 */
public class FundingException extends RuntimeException {

    public FundingException(String message) {
        super(message);
    }

    public FundingException(String message, Throwable cause) {
        super(message, cause);
    }
}
