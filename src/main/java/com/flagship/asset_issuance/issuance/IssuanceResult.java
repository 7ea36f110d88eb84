package com.flagship.asset_issuance.issuance;

import com.flagship.asset_issuance.result.ErrorKind;
import com.flagship.asset_issuance.result.OperationStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an issuance as reported to callers.
 *
 * On success both hashes are present. On a payment failure the trustline
 * hash is still present: the trustline exists on the ledger even though the
 * issuance as a whole failed.
 */
@Value
@Builder
public class IssuanceResult {
    OperationStatus status;
    String message;
    FailureStage failureStage;
    ErrorKind errorKind;
    String trustlineTxHash;
    String paymentTxHash;

    public boolean isSuccess() {
        return status == OperationStatus.SUCCESS;
    }

    /**
     * Builds the result for a run that reached a terminal state.
     */
    public static IssuanceResult from(IssuanceRun run, String successMessage) {
        if (!run.getState().isTerminal()) {
            throw new IllegalStateException("Issuance run has not finished: " + run.getState());
        }
        if (run.isSucceeded()) {
            return IssuanceResult.builder()
                .status(OperationStatus.SUCCESS)
                .message(successMessage)
                .trustlineTxHash(run.getTrustlineTxHash())
                .paymentTxHash(run.getPaymentTxHash())
                .build();
        }
        return IssuanceResult.builder()
            .status(OperationStatus.ERROR)
            .message(run.getFailureReason())
            .failureStage(run.getFailureStage())
            .errorKind(run.getErrorKind())
            .trustlineTxHash(run.getTrustlineTxHash())
            .paymentTxHash(run.getPaymentTxHash())
            .build();
    }

    /**
     * Failure before any run was started, e.g. accounts not set up. Only
     * validation failures carry a stage; a configuration problem has none.
     */
    public static IssuanceResult rejected(ErrorKind kind, String message) {
        return IssuanceResult.builder()
            .status(OperationStatus.ERROR)
            .failureStage(kind == ErrorKind.VALIDATION ? FailureStage.VALIDATION : null)
            .errorKind(kind)
            .message(message)
            .build();
    }
}
