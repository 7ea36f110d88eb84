package com.flagship.asset_issuance.balance;

import com.flagship.asset_issuance.ledger.AccountNotFoundException;
import com.flagship.asset_issuance.ledger.AccountSnapshot;
import com.flagship.asset_issuance.ledger.AssetDescriptor;
import com.flagship.asset_issuance.ledger.AssetType;
import com.flagship.asset_issuance.ledger.BalanceEntry;
import com.flagship.asset_issuance.ledger.LedgerClient;
import com.flagship.asset_issuance.ledger.LedgerException;
import com.flagship.asset_issuance.observability.IssuanceMetrics;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Answers "how much of asset X does account A hold?".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceInspector {

    private final LedgerClient ledgerClient;
    private final IssuanceMetrics metrics;

    /**
     * Loads {@code accountId} and reads its holding of {@code asset}.
     *
     * A nonexistent account is a {@link ErrorKind#LOOKUP} error, never a
     * zero balance. Timeouts keep their own kind.
     */
    public BalanceResult lookup(String accountId, AssetDescriptor asset) {
        String assetKind = asset.isNative() ? "native" : "credit";
        if (accountId == null || accountId.isBlank()) {
            metrics.recordBalanceLookup(assetKind, "invalid");
            return BalanceResult.error(accountId, asset.getCode(), ErrorKind.VALIDATION, "Account id is required");
        }

        try {
            AccountSnapshot account = ledgerClient.loadAccount(accountId);
            BalanceResult result = balanceOf(account, asset);
            metrics.recordBalanceLookup(assetKind, "success");
            return result;
        } catch (AccountNotFoundException e) {
            metrics.recordBalanceLookup(assetKind, "not_found");
            log.warn("Balance lookup for missing account: accountId={}", accountId);
            return BalanceResult.error(accountId, asset.getCode(), ErrorKind.LOOKUP,
                    "Error checking balance: " + e.getMessage());
        } catch (LedgerException e) {
            metrics.recordBalanceLookup(assetKind, "error");
            log.error("Error checking balance: accountId={}, error={}", accountId, e.getMessage());
            ErrorKind kind = e.getErrorKind() == ErrorKind.TIMEOUT ? ErrorKind.TIMEOUT : ErrorKind.LOOKUP;
            return BalanceResult.error(accountId, asset.getCode(), kind, "Error checking balance: " + e.getMessage());
        }
    }

    /**
     * Scans the balances in ledger order and returns the first entry for
     * {@code asset}. The native sentinel matches the native entry; a custom
     * asset must match both code and issuer exactly.
     */
    public BalanceResult balanceOf(AccountSnapshot account, AssetDescriptor asset) {
        for (BalanceEntry entry : account.getBalances()) {
            if (matches(entry, asset)) {
                return BalanceResult.builder()
                    .status(OperationStatus.SUCCESS)
                    .accountId(account.getAccountId())
                    .assetCode(asset.getCode())
                    .assetIssuer(asset.getIssuerPublicKey())
                    .balance(entry.getAmount())
                    .build();
            }
        }

        return BalanceResult.builder()
            .status(OperationStatus.SUCCESS)
            .accountId(account.getAccountId())
            .assetCode(asset.getCode())
            .assetIssuer(asset.getIssuerPublicKey())
            .balance(BalanceResult.ZERO_BALANCE)
            .message(String.format("Asset %s not found or balance is zero for account %s.",
                    asset.getCode(), account.getAccountId()))
            .build();
    }

    private static boolean matches(BalanceEntry entry, AssetDescriptor asset) {
        if (asset.isNative()) {
            return entry.getAssetType() == AssetType.NATIVE;
        }
        return entry.getAssetType() == AssetType.CREDIT
            && Objects.equals(entry.getAssetCode(), asset.getCode())
            && Objects.equals(entry.getAssetIssuer(), asset.getIssuerPublicKey());
    }
}
