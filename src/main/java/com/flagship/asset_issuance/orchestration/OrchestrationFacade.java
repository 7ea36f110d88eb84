package com.flagship.asset_issuance.orchestration;

import com.flagship.asset_issuance.account.AccountKeyStore;
import com.flagship.asset_issuance.account.AccountKeys;
import com.flagship.asset_issuance.account.FundingOutcome;
import com.flagship.asset_issuance.account.KeyProvisioner;
import com.flagship.asset_issuance.account.ProvisionedAccount;
import com.flagship.asset_issuance.account.Role;
import com.flagship.asset_issuance.balance.BalanceInspector;
import com.flagship.asset_issuance.balance.BalanceResult;
import com.flagship.asset_issuance.config.ConfigurationException;
import com.flagship.asset_issuance.config.StellarProperties;
import com.flagship.asset_issuance.issuance.AssetIssuanceWorkflow;
import com.flagship.asset_issuance.issuance.IssuanceResult;
import com.flagship.asset_issuance.ledger.AssetDescriptor;
import com.flagship.asset_issuance.ledger.LedgerNetwork;
import com.flagship.asset_issuance.observability.IssuanceMetrics;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Single entry point for every external interface.
 *
 * Composes key provisioning, the issuance workflow and balance lookups
 * around the process-wide {@link AccountKeyStore}. Secrets stay inside
 * {@link AccountKeys}; no result produced here carries one.
 *
 * Setup holds the store lock while it funds accounts. Issuance and balance
 * lookups read bindings without it and see whatever setup has bound so far.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrchestrationFacade {

    private final KeyProvisioner keyProvisioner;
    private final AccountKeyStore keyStore;
    private final AssetIssuanceWorkflow workflow;
    private final BalanceInspector balanceInspector;
    private final LedgerNetwork network;
    private final StellarProperties properties;
    private final IssuanceMetrics metrics;

    /**
     * Provisions the issuer, then the distributor.
     *
     * Runs under the key store lock. Roles already bound are reported as
     * pre-configured; unbound roles use the configured secret or are
     * generated (and funded on the test network). A funding failure stops
     * setup: roles provisioned before it stay bound, the unfunded keys are
     * discarded, and a later call provisions only what is missing.
     */
    public SetupResult setupAccounts() {
        SetupResult result = keyStore.withLock(() -> {
            ProvisionedAccount issuer;
            ProvisionedAccount distributor;
            try {
                issuer = provision(Role.ISSUER);
                if (!issuer.isUsable()) {
                    return fundingFailed(issuer, null);
                }
                keyStore.bind(Role.ISSUER, issuer.getKeys());

                distributor = provision(Role.DISTRIBUTOR);
                if (!distributor.isUsable()) {
                    return fundingFailed(distributor, issuer);
                }
                keyStore.bind(Role.DISTRIBUTOR, distributor.getKeys());
            } catch (IllegalArgumentException e) {
                log.error("Configured account secret rejected: {}", e.getMessage());
                return SetupResult.builder()
                    .status(OperationStatus.ERROR)
                    .errorKind(ErrorKind.VALIDATION)
                    .message("Account keys are not properly set up: " + e.getMessage())
                    .build();
            }

            return SetupResult.builder()
                .status(OperationStatus.SUCCESS)
                .message("Accounts configured.")
                .issuerPublicKey(issuer.getPublicKey())
                .distributorPublicKey(distributor.getPublicKey())
                .issuerFunding(issuer.getFunding())
                .distributorFunding(distributor.getFunding())
                .build();
        });

        metrics.recordSetup(result.getStatus().getValue());
        return result;
    }

    /**
     * Issues {@code amount} of the configured asset from the bound issuer to
     * the bound distributor.
     */
    public IssuanceResult issue(String amount) {
        Optional<AccountKeys> issuer;
        Optional<AccountKeys> distributor;
        try {
            issuer = resolve(Role.ISSUER);
            distributor = resolve(Role.DISTRIBUTOR);
        } catch (ConfigurationException e) {
            return IssuanceResult.rejected(ErrorKind.CONFIGURATION, e.getMessage());
        }

        if (issuer.isEmpty() || distributor.isEmpty()) {
            return IssuanceResult.rejected(ErrorKind.VALIDATION,
                "Accounts not initialized. Run /setup-accounts first or configure the account secrets.");
        }

        AssetDescriptor asset = AssetDescriptor.credit(properties.assetCode(), issuer.get().getPublicKey());
        return workflow.issue(asset, distributor.get(), issuer.get(), amount);
    }

    /**
     * Sets up both accounts, then issues. A setup failure returns before
     * any trustline or payment is attempted.
     */
    public SetupAndIssueResult ensureAccountsThenIssue(String amount) {
        SetupResult setup = setupAccounts();
        if (!setup.isSuccess()) {
            log.warn("Skipping issuance, account setup failed: {}", setup.getMessage());
            return new SetupAndIssueResult(setup, null);
        }
        return new SetupAndIssueResult(setup, issue(amount));
    }

    /**
     * Balance of the configured custom asset. Needs a known issuer to
     * identify the asset.
     */
    public BalanceResult checkBalance(String accountId) {
        Optional<AccountKeys> issuer;
        try {
            issuer = resolve(Role.ISSUER);
        } catch (ConfigurationException e) {
            return BalanceResult.error(accountId, properties.assetCode(), ErrorKind.CONFIGURATION, e.getMessage());
        }
        if (issuer.isEmpty()) {
            return BalanceResult.error(accountId, properties.assetCode(), ErrorKind.VALIDATION,
                "Issuer public key not set. Cannot identify the asset. Run /setup-accounts.");
        }
        AssetDescriptor asset = AssetDescriptor.credit(properties.assetCode(), issuer.get().getPublicKey());
        return balanceInspector.lookup(accountId, asset);
    }

    /**
     * Native currency balance.
     */
    public BalanceResult checkNativeBalance(String accountId) {
        return balanceInspector.lookup(accountId, AssetDescriptor.NATIVE);
    }

    private ProvisionedAccount provision(Role role) {
        Optional<AccountKeys> bound = keyStore.find(role);
        if (bound.isPresent()) {
            return new ProvisionedAccount(role, bound.get(), FundingOutcome.preConfigured(role));
        }
        ProvisionedAccount account = keyProvisioner.provisionRole(role, configuredSecret(role), network);
        metrics.recordFunding(role.name(), account.getFunding().getStatus().name());
        return account;
    }

    /**
     * Bound keys for {@code role}, binding the configured secret on first use.
     * Only the bind step takes the store lock, so a running setup does not
     * hold up callers whose roles are already bound or unconfigured.
     *
     * @throws ConfigurationException if the configured secret is malformed
     */
    private Optional<AccountKeys> resolve(Role role) {
        Optional<AccountKeys> bound = keyStore.find(role);
        if (bound.isPresent()) {
            return bound;
        }
        String secret = configuredSecret(role);
        if (secret == null || secret.isBlank()) {
            return Optional.empty();
        }
        return keyStore.withLock(() -> {
            Optional<AccountKeys> raced = keyStore.find(role);
            if (raced.isPresent()) {
                return raced;
            }
            try {
                AccountKeys keys = AccountKeys.fromSecret(secret);
                keyStore.bind(role, keys);
                return Optional.of(keys);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(role.getLabel() + " secret is invalid: " + e.getMessage());
            }
        });
    }

    private String configuredSecret(Role role) {
        return role == Role.ISSUER ? properties.issuerSecret() : properties.distributorSecret();
    }

    private SetupResult fundingFailed(ProvisionedAccount failed, ProvisionedAccount issuer) {
        String message = String.format("Failed to fund %s: %s",
                failed.getRole().getLabel().toLowerCase(), failed.getFunding().getMessage());
        log.error(message);
        return SetupResult.builder()
            .status(OperationStatus.ERROR)
            .errorKind(ErrorKind.ACCOUNT_STATE)
            .message(message)
            .issuerPublicKey(issuer != null ? issuer.getPublicKey() : null)
            .issuerFunding(issuer != null ? issuer.getFunding() : failed.getFunding())
            .distributorFunding(issuer != null ? failed.getFunding() : null)
            .build();
    }
}
