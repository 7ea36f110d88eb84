package com.flagship.asset_issuance.ledger;

import lombok.Value;

/**
 * Authorizes the source account to hold {@code asset}.
 *
 * A null limit means unbounded (the ledger maximum).
 */
@Value
public class TrustlineOperation implements LedgerOperation {

    public static final String MAX_LIMIT = "922337203685.4775807";

    AssetDescriptor asset;
    String limit;

    public static TrustlineOperation unbounded(AssetDescriptor asset) {
        if (asset == null || asset.isNative()) {
            throw new IllegalArgumentException("Trustlines can only be created for custom assets");
        }
        return new TrustlineOperation(asset, null);
    }

    public String effectiveLimit() {
        return limit != null ? limit : MAX_LIMIT;
    }

    @Override
    public String describe() {
        return "change_trust " + asset + " limit=" + effectiveLimit();
    }
}
