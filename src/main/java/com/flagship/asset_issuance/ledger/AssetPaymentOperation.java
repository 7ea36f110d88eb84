package com.flagship.asset_issuance.ledger;

import lombok.Value;

/**
 * Pays {@code amount} units of {@code asset} from the source account to
 * {@code destination}.
 */
@Value
public class AssetPaymentOperation implements LedgerOperation {
    String destination;
    AssetDescriptor asset;
    String amount;

    @Override
    public String describe() {
        return "payment " + amount + " " + asset.getCode() + " to " + destination;
    }
}
