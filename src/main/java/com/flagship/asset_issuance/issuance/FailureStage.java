package com.flagship.asset_issuance.issuance;

/**
 * Step of the issuance run that failed.
 */
public enum FailureStage {
    VALIDATION,
    TRUSTLINE,
    PAYMENT
}
