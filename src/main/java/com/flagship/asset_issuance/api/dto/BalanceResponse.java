package com.flagship.asset_issuance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_issuance.balance.BalanceResult;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Response for the balance endpoints.
 */
@Value
@Builder
public class BalanceResponse {

    @JsonProperty("status")
    OperationStatus status;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("asset_code")
    String assetCode;

    @JsonProperty("issuer")
    String issuer;

    @JsonProperty("balance")
    String balance;

    @JsonProperty("message")
    String message;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    public static BalanceResponse from(BalanceResult result) {
        return BalanceResponse.builder()
            .status(result.getStatus())
            .accountId(result.getAccountId())
            .assetCode(result.getAssetCode())
            .issuer(result.getAssetIssuer())
            .balance(result.getBalance())
            .message(result.getMessage())
            .errorKind(result.getErrorKind())
            .build();
    }
}
