package com.flagship.asset_issuance.ledger;

import com.flagship.asset_issuance.config.ConfigurationException;
import org.stellar.sdk.Network;

import java.util.Locale;

/**
 * Ledger networks the service can target.
 */
public enum LedgerNetwork {
    TESTNET("Test SDF Network ; September 2015"),
    PUBLIC("Public Global Stellar Network ; September 2015");

    private final String passphrase;

    LedgerNetwork(String passphrase) {
        this.passphrase = passphrase;
    }

    public String getPassphrase() {
        return passphrase;
    }

    /**
     * Only the test network has a funding faucet.
     */
    public boolean isTestnet() {
        return this == TESTNET;
    }

    public Network toSdkNetwork() {
        return new Network(passphrase);
    }

    /**
     * Resolves a configured network identifier (case-insensitive).
     *
     * @throws ConfigurationException if the identifier names no supported network
     */
    public static LedgerNetwork fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new ConfigurationException("Network identifier is required (TESTNET or PUBLIC)");
        }
        String normalized = identifier.trim().toUpperCase(Locale.ROOT);
        for (LedgerNetwork network : values()) {
            if (network.name().equals(normalized)) {
                return network;
            }
        }
        throw new ConfigurationException(
            String.format("Unsupported network '%s'. Use TESTNET or PUBLIC.", identifier));
    }
}
