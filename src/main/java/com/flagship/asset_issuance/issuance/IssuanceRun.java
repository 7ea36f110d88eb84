package com.flagship.asset_issuance.issuance;

import com.flagship.asset_issuance.result.ErrorKind;
import lombok.Value;

/**
 * Immutable state of one trustline-then-payment run.
 *
 * Key principles:
 * - Every transition returns a new run and is validated against the current state
 * - The payment can only be built after the trustline was submitted successfully
 * - A failure keeps the hashes already obtained, so a persisted trustline stays visible
 */
@Value
public class IssuanceRun {
    IssuanceState state;
    FailureStage failureStage;
    ErrorKind errorKind;
    String failureReason;
    String trustlineTxHash;
    String paymentTxHash;

    public static IssuanceRun start() {
        return new IssuanceRun(IssuanceState.START, null, null, null, null, null);
    }

    public IssuanceRun beginTrustline() {
        requireTransition(IssuanceState.TRUSTLINE_BUILDING);
        return withState(IssuanceState.TRUSTLINE_BUILDING);
    }

    /**
     * @param transactionHash hash of the accepted trustline transaction
     */
    public IssuanceRun trustlineSubmitted(String transactionHash) {
        requireTransition(IssuanceState.TRUSTLINE_SUBMITTED);
        requireHash(transactionHash);
        return new IssuanceRun(IssuanceState.TRUSTLINE_SUBMITTED, null, null, null, transactionHash, null);
    }

    public IssuanceRun beginPayment() {
        requireTransition(IssuanceState.PAYMENT_BUILDING);
        return withState(IssuanceState.PAYMENT_BUILDING);
    }

    /**
     * @param transactionHash hash of the accepted payment transaction
     */
    public IssuanceRun paymentSubmitted(String transactionHash) {
        requireTransition(IssuanceState.PAYMENT_SUBMITTED);
        requireHash(transactionHash);
        return new IssuanceRun(IssuanceState.PAYMENT_SUBMITTED, null, null, null,
                this.trustlineTxHash, transactionHash);
    }

    /**
     * Transitions to FAILED. Allowed from any non-terminal state.
     *
     * @throws IllegalStateException if the run already ended
     */
    public IssuanceRun fail(FailureStage stage, ErrorKind kind, String reason) {
        if (!canTransitionTo(IssuanceState.FAILED)) {
            throw new IllegalStateException(
                String.format("Cannot fail issuance in %s state. Run has already ended.", state));
        }
        if (stage == null || kind == null) {
            throw new IllegalArgumentException("Failure stage and error kind are required");
        }
        return new IssuanceRun(IssuanceState.FAILED, stage, kind, reason,
                this.trustlineTxHash, this.paymentTxHash);
    }

    public boolean isFailed() {
        return state == IssuanceState.FAILED;
    }

    public boolean isSucceeded() {
        return state == IssuanceState.PAYMENT_SUBMITTED;
    }

    /**
     * Checks if a transition from the current state to {@code target} is allowed.
     */
    public boolean canTransitionTo(IssuanceState target) {
        return switch (state) {
            case START -> target == IssuanceState.TRUSTLINE_BUILDING || target == IssuanceState.FAILED;
            case TRUSTLINE_BUILDING -> target == IssuanceState.TRUSTLINE_SUBMITTED || target == IssuanceState.FAILED;
            case TRUSTLINE_SUBMITTED -> target == IssuanceState.PAYMENT_BUILDING || target == IssuanceState.FAILED;
            case PAYMENT_BUILDING -> target == IssuanceState.PAYMENT_SUBMITTED || target == IssuanceState.FAILED;
            case PAYMENT_SUBMITTED, FAILED -> false;
        };
    }

    private void requireTransition(IssuanceState target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException(
                String.format("Cannot move issuance to %s from %s.", target, state));
        }
    }

    private static void requireHash(String transactionHash) {
        if (transactionHash == null || transactionHash.isBlank()) {
            throw new IllegalArgumentException("Transaction hash is required");
        }
    }

    private IssuanceRun withState(IssuanceState next) {
        return new IssuanceRun(next, failureStage, errorKind, failureReason, trustlineTxHash, paymentTxHash);
    }
}
