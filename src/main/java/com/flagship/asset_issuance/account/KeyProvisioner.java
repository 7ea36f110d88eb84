package com.flagship.asset_issuance.account;

import com.flagship.asset_issuance.ledger.LedgerNetwork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates or loads the keypair for one role and funds it when it can.
 *
 * Rules:
 * - Secret supplied: derive the public key, never call the faucet
 * - No secret on the test network: generate, then exactly one faucet call
 * - No secret on the public network: generate, funding is left to the caller
 *
 * Not idempotent. Every call without a secret creates a distinct account,
 * and on the test network that account is funded on the ledger. Faucet
 * failures are reported, not retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KeyProvisioner {

    private final FundingClient fundingClient;

    /**
     * Provisions the account for {@code role}.
     *
     * @param role role being provisioned
     * @param existingSecret caller-supplied secret seed, or null to generate
     * @param network target network
     * @return keys with their funding outcome
     * @throws IllegalArgumentException if {@code existingSecret} is not a valid secret seed
     */
    public ProvisionedAccount provisionRole(Role role, String existingSecret, LedgerNetwork network) {
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        if (network == null) {
            throw new IllegalArgumentException("Network is required");
        }

        if (existingSecret != null && !existingSecret.isBlank()) {
            AccountKeys keys = AccountKeys.fromSecret(existingSecret);
            log.info("{} account pre-configured: accountId={}", role.getLabel(), keys.getPublicKey());
            return new ProvisionedAccount(role, keys, FundingOutcome.preConfigured(role));
        }

        AccountKeys keys = AccountKeys.generate();
        log.info("Generated {} keypair: accountId={}", role.getLabel(), keys.getPublicKey());

        if (!network.isTestnet()) {
            log.warn("{} account {} must be funded manually on the {} network",
                    role.getLabel(), keys.getPublicKey(), network);
            return new ProvisionedAccount(role, keys, FundingOutcome.manualFundingRequired());
        }

        try {
            fundingClient.fund(keys.getPublicKey());
            return new ProvisionedAccount(role, keys, FundingOutcome.funded(keys.getPublicKey()));
        } catch (FundingException e) {
            log.error("Funding {} account failed: accountId={}, error={}",
                    role.getLabel(), keys.getPublicKey(), e.getMessage());
            return new ProvisionedAccount(role, keys, FundingOutcome.failed(e.getMessage()));
        }
    }
}
