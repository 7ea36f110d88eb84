package com.flagship.asset_issuance.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.asset_issuance.issuance.FailureStage;
import com.flagship.asset_issuance.issuance.IssuanceResult;
import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Response for {@code POST /issue-asset}.
 *
 * A failed payment still reports {@code trustline_tx}: that transaction is on
 * the ledger and is not rolled back.
 */
@Value
@Builder
public class IssueAssetResponse {

    @JsonProperty("status")
    OperationStatus status;

    @JsonProperty("message")
    String message;

    @JsonProperty("failure_stage")
    FailureStage failureStage;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    @JsonProperty("trustline_tx")
    String trustlineTx;

    @JsonProperty("payment_tx")
    String paymentTx;

    public static IssueAssetResponse from(IssuanceResult result) {
        return IssueAssetResponse.builder()
            .status(result.getStatus())
            .message(result.getMessage())
            .failureStage(result.getFailureStage())
            .errorKind(result.getErrorKind())
            .trustlineTx(result.getTrustlineTxHash())
            .paymentTx(result.getPaymentTxHash())
            .build();
    }
}
