package com.flagship.asset_issuance.config;

/**
 * Thrown when the service is configured with values it cannot run with,
 * such as an unsupported network identifier.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
