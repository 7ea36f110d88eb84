package com.flagship.asset_issuance.account;

import org.stellar.sdk.KeyPair;

import java.util.Arrays;
import java.util.Objects;

/**
 * Public/secret key pair of one ledger account.
 *
 * The secret seed lives only in process memory. It is excluded from
 * {@link #toString()} and has no getter that returns it as a String, so it
 * cannot end up in a log line or a JSON body by accident.
 */
public final class AccountKeys {

    private final String publicKey;
    private final char[] secretSeed;

    private AccountKeys(String publicKey, char[] secretSeed) {
        this.publicKey = publicKey;
        this.secretSeed = secretSeed;
    }

    /**
     * Generates a fresh random keypair.
     */
    public static AccountKeys generate() {
        KeyPair keyPair = KeyPair.random();
        return new AccountKeys(keyPair.getAccountId(), keyPair.getSecretSeed());
    }

    /**
     * Reconstructs a keypair from a secret seed ({@code S...}).
     *
     * @throws IllegalArgumentException if the seed is blank or malformed
     */
    public static AccountKeys fromSecret(String secretSeed) {
        if (secretSeed == null || secretSeed.isBlank()) {
            throw new IllegalArgumentException("Secret seed is required");
        }
        KeyPair keyPair;
        try {
            keyPair = KeyPair.fromSecretSeed(secretSeed.trim());
        } catch (RuntimeException e) {
            // the SDK message may echo the seed, so it is not propagated
            throw new IllegalArgumentException("Secret seed is not a valid ledger secret key");
        }
        return new AccountKeys(keyPair.getAccountId(), keyPair.getSecretSeed());
    }

    /**
     * Wraps already-derived key material without checking that the two
     * halves belong together.
     */
    public static AccountKeys of(String publicKey, char[] secretSeed) {
        return new AccountKeys(publicKey, secretSeed == null ? new char[0] : secretSeed.clone());
    }

    public String getPublicKey() {
        return publicKey;
    }

    public boolean hasPublicKey() {
        return publicKey != null && !publicKey.isBlank();
    }

    public boolean hasSecret() {
        return secretSeed.length > 0;
    }

    /**
     * Signing key for the ledger SDK. Only the ledger adapter calls this.
     */
    public KeyPair toSigningKeyPair() {
        return KeyPair.fromSecretSeed(secretSeed.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountKeys)) {
            return false;
        }
        AccountKeys other = (AccountKeys) o;
        return Objects.equals(publicKey, other.publicKey) && Arrays.equals(secretSeed, other.secretSeed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(publicKey);
    }

    @Override
    public String toString() {
        return "AccountKeys(publicKey=" + publicKey + ")";
    }
}
