package com.flagship.asset_issuance.account;

/**
 * Test-network faucet that creates and funds a new ledger account.
 */
public interface FundingClient {

    /**
     * Funds {@code publicKey} with native currency. One call, no retry.
     *
     * @throws FundingException if the faucet is unreachable or answers with a non-success status
     */
    void fund(String publicKey);
}
