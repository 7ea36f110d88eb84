package com.flagship.asset_issuance.account;

import lombok.Value;

/**
 * Keys bound to a role together with the funding outcome of provisioning.
 */
@Value
public class ProvisionedAccount {
    Role role;
    AccountKeys keys;
    FundingOutcome funding;

    public String getPublicKey() {
        return keys.getPublicKey();
    }

    /**
     * False when funding failed; such keys are not bound to the role.
     */
    public boolean isUsable() {
        return !funding.isFailed();
    }
}
