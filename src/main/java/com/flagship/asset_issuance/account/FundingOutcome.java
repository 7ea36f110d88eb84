package com.flagship.asset_issuance.account;

import lombok.Value;

/**
 * What happened to an account's native-currency funding during provisioning.
 */
@Value
public class FundingOutcome {

    public enum Status {
        /**
         * Keys were supplied by the caller; no funding attempted.
         */
        PRE_CONFIGURED,

        /**
         * Fresh account funded by the test network faucet.
         */
        FUNDED,

        /**
         * Faucet unreachable or refused the request.
         */
        FUNDING_FAILED,

        /**
         * Public network: the account must be created by an out-of-band payment.
         */
        MANUAL_FUNDING_REQUIRED
    }

    Status status;
    String message;

    public static FundingOutcome preConfigured(Role role) {
        return new FundingOutcome(Status.PRE_CONFIGURED, role.getLabel() + " account pre-configured.");
    }

    public static FundingOutcome funded(String publicKey) {
        return new FundingOutcome(Status.FUNDED, "Account " + publicKey + " funded successfully.");
    }

    public static FundingOutcome failed(String reason) {
        return new FundingOutcome(Status.FUNDING_FAILED, reason);
    }

    public static FundingOutcome manualFundingRequired() {
        return new FundingOutcome(Status.MANUAL_FUNDING_REQUIRED, "Manual funding required for Public network.");
    }

    public boolean isFailed() {
        return status == Status.FUNDING_FAILED;
    }
}
