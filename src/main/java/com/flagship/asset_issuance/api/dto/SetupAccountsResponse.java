package com.flagship.asset_issuance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_issuance.account.FundingOutcome;
import com.flagship.asset_issuance.orchestration.SetupResult;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Response for {@code GET /setup-accounts}. Public keys only.
 */
@Value
@Builder
public class SetupAccountsResponse {

    @JsonProperty("status")
    OperationStatus status;

    @JsonProperty("message")
    String message;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    @JsonProperty("issuer_public_key")
    String issuerPublicKey;

    @JsonProperty("distributor_public_key")
    String distributorPublicKey;

    @JsonProperty("issuer_funding_status")
    String issuerFundingStatus;

    @JsonProperty("distributor_funding_status")
    String distributorFundingStatus;

    public static SetupAccountsResponse from(SetupResult result) {
        return SetupAccountsResponse.builder()
            .status(result.getStatus())
            .message(result.getMessage())
            .errorKind(result.getErrorKind())
            .issuerPublicKey(result.getIssuerPublicKey())
            .distributorPublicKey(result.getDistributorPublicKey())
            .issuerFundingStatus(describe(result.getIssuerFunding()))
            .distributorFundingStatus(describe(result.getDistributorFunding()))
            .build();
    }

    private static String describe(FundingOutcome funding) {
        return funding != null ? funding.getMessage() : null;
    }
}
