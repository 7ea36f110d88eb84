package com.flagship.asset_issuance.ledger;

import lombok.Value;

/**
 * One line of an account's balance list. Code and issuer are null for the
 * native entry.
 */
@Value
public class BalanceEntry {
    AssetType assetType;
    String assetCode;
    String assetIssuer;
    String amount;

    public static BalanceEntry nativeBalance(String amount) {
        return new BalanceEntry(AssetType.NATIVE, null, null, amount);
    }

    public static BalanceEntry credit(String assetCode, String assetIssuer, String amount) {
        return new BalanceEntry(AssetType.CREDIT, assetCode, assetIssuer, amount);
    }
}
