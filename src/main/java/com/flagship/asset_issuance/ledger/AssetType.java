package com.flagship.asset_issuance.ledger;

/**
 * Balance entry categories as reported by the ledger.
 */
public enum AssetType {
    NATIVE,
    CREDIT,
    // liquidity pool shares; never matched by balance lookups
    OTHER;

    /**
     * Maps a Horizon {@code asset_type} value.
     */
    public static AssetType fromHorizon(String assetType) {
        if ("native".equals(assetType)) {
            return NATIVE;
        }
        if ("credit_alphanum4".equals(assetType) || "credit_alphanum12".equals(assetType)) {
            return CREDIT;
        }
        return OTHER;
    }
}
