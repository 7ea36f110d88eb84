package com.flagship.asset_issuance.ledger;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * Identifies an asset on the ledger.
 *
 * A custom asset is a (code, issuer) pair. The native currency is the
 * {@link #NATIVE} sentinel, which has no issuer.
 */
@Value
public class AssetDescriptor {

    public static final String NATIVE_CODE = "XLM";
    public static final AssetDescriptor NATIVE = new AssetDescriptor(NATIVE_CODE, null);

    private static final Pattern CODE_PATTERN = Pattern.compile("^[A-Za-z0-9]{1,12}$");

    String code;
    String issuerPublicKey;

    /**
     * Creates a custom asset descriptor.
     *
     * @throws IllegalArgumentException if the code is not 1-12 alphanumeric
     *         characters or the issuer is blank
     */
    public static AssetDescriptor credit(String code, String issuerPublicKey) {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            throw new IllegalArgumentException("Asset code must be 1-12 alphanumeric characters: " + code);
        }
        if (issuerPublicKey == null || issuerPublicKey.isBlank()) {
            throw new IllegalArgumentException("Asset issuer public key is required");
        }
        return new AssetDescriptor(code, issuerPublicKey);
    }

    public boolean isNative() {
        return issuerPublicKey == null;
    }

    @Override
    public String toString() {
        return isNative() ? NATIVE_CODE : code + ":" + issuerPublicKey;
    }
}
