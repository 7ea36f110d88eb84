package com.flagship.asset_issuance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ledger and asset settings bound from the {@code stellar.*} namespace.
 *
 * Secrets are optional. When absent, the matching role is generated on the
 * first call to {@code /setup-accounts}.
 */
@Validated
@ConfigurationProperties(prefix = "stellar")
public record StellarProperties(
        @NotBlank String network,
        @NotBlank String horizonTestnetUrl,
        @NotBlank String horizonPublicUrl,
        @NotBlank String friendbotUrl,
        @NotBlank
        @Pattern(regexp = "^[A-Za-z0-9]{1,12}$", message = "Asset code must be 1-12 alphanumeric characters")
        String assetCode,
        String issuerSecret,
        String distributorSecret,
        @NotNull @Positive Long transactionTimeoutSeconds,
        @NotNull @Valid Http http
) {

    /**
     * Secrets are reported as set or unset, never by value.
     */
    @Override
    public String toString() {
        return "StellarProperties[network=" + network
            + ", horizonTestnetUrl=" + horizonTestnetUrl
            + ", horizonPublicUrl=" + horizonPublicUrl
            + ", friendbotUrl=" + friendbotUrl
            + ", assetCode=" + assetCode
            + ", issuerSecret=" + mask(issuerSecret)
            + ", distributorSecret=" + mask(distributorSecret)
            + ", transactionTimeoutSeconds=" + transactionTimeoutSeconds
            + ", http=" + http + "]";
    }

    private static String mask(String secret) {
        return secret == null || secret.isBlank() ? "<unset>" : "****";
    }

    public record Http(
            @NotNull Duration connectTimeout,
            @NotNull Duration readTimeout
    ) {
    }
}
