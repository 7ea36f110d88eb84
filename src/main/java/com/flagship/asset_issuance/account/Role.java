package com.flagship.asset_issuance.account;

/**
 * Account roles in an issuance. Exactly one keypair is bound to each role.
 */
public enum Role {
    /**
     * Creates the custom asset and pays it out.
     */
    ISSUER("Issuer"),

    /**
     * Trusts the issuer's asset and receives the issued amount.
     */
    DISTRIBUTOR("Distributor");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
