package com.flagship.asset_issuance.issuance;

import com.flagship.asset_issuance.account.AccountKeys;
import com.flagship.asset_issuance.ledger.AccountSnapshot;
import com.flagship.asset_issuance.ledger.AssetDescriptor;
import com.flagship.asset_issuance.ledger.AssetPaymentOperation;
import com.flagship.asset_issuance.ledger.LedgerClient;
import com.flagship.asset_issuance.ledger.LedgerException;
import com.flagship.asset_issuance.ledger.LedgerOperation;
import com.flagship.asset_issuance.ledger.TransactionOutcome;
import com.flagship.asset_issuance.ledger.TransactionRequest;
import com.flagship.asset_issuance.ledger.TrustlineOperation;
import com.flagship.asset_issuance.observability.CorrelationContext;
import com.flagship.asset_issuance.observability.IssuanceMetrics;
import com.flagship.asset_issuance.result.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Issues a custom asset in two ledger transactions.
 *
 * 1. Trustline: the distributor declares it trusts the asset (signed by the distributor)
 * 2. Payment: the issuer pays the amount to the distributor (signed by the issuer)
 *
 * The ledger offers no atomic transaction across the two signers, so the
 * steps are strictly sequential and the run stops at the first failure. A
 * payment is never attempted unless the trustline was accepted, because the
 * ledger rejects payments of an asset the destination does not trust.
 *
 * Each step loads a fresh snapshot of its source account right before
 * building, since sequence numbers advance on every submission. Nothing is
 * retried; a failed run is reported with the stage it stopped at.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetIssuanceWorkflow {

    private final LedgerClient ledgerClient;
    private final IssuanceMetrics metrics;

    /**
     * Runs the trustline and payment steps.
     *
     * @param asset custom asset to issue; its issuer must be {@code issuer}'s public key
     * @param distributor keys of the receiving account
     * @param issuer keys of the issuing account
     * @param amount decimal amount with at most 7 fractional digits
     * @return the run outcome; never throws for ledger or validation failures
     */
    public IssuanceResult issue(AssetDescriptor asset, AccountKeys distributor, AccountKeys issuer, String amount) {
        long startTime = System.currentTimeMillis();
        IssuanceRun run = IssuanceRun.start();

        String normalizedAmount;
        try {
            validateAccounts(asset, distributor, issuer);
            normalizedAmount = AmountValidator.normalize(amount);
        } catch (IllegalArgumentException e) {
            log.warn("Issuance rejected before submission: {}", e.getMessage());
            run = run.fail(FailureStage.VALIDATION, ErrorKind.VALIDATION,
                    "Missing or invalid account or amount: " + e.getMessage());
            return finish(run, null, startTime);
        }

        log.info("Starting issuance: asset={}, amount={}, distributor={}",
                asset, normalizedAmount, distributor.getPublicKey());

        try {
            run = submitTrustline(run.beginTrustline(), asset, distributor);
            if (run.isFailed()) {
                return finish(run, null, startTime);
            }

            run = submitPayment(run.beginPayment(), asset, distributor, issuer, normalizedAmount);
            String message = String.format("Asset %s issued and %s sent to %s.",
                    asset.getCode(), normalizedAmount, distributor.getPublicKey());
            return finish(run, message, startTime);
        } finally {
            MDC.remove(CorrelationContext.STAGE_MDC_KEY);
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private IssuanceRun submitTrustline(IssuanceRun run, AssetDescriptor asset, AccountKeys distributor) {
        enterStage(FailureStage.TRUSTLINE, distributor);
        log.info("Building trustline transaction for {} to trust {}", distributor.getPublicKey(), asset);
        try {
            TransactionOutcome outcome = submitSigned(distributor, TrustlineOperation.unbounded(asset));
            if (!outcome.isSuccess()) {
                log.error("Trustline transaction rejected: reason={}", outcome.getFailureReason());
                return run.fail(FailureStage.TRUSTLINE, ErrorKind.SUBMISSION,
                        "Error creating trustline: " + outcome.getFailureReason());
            }
            log.info("Trustline transaction submitted: hash={}", outcome.getTransactionHash());
            return run.trustlineSubmitted(outcome.getTransactionHash());
        } catch (LedgerException e) {
            log.error("Error creating trustline: kind={}, error={}", e.getErrorKind(), e.getMessage());
            return run.fail(FailureStage.TRUSTLINE, e.getErrorKind(), "Error creating trustline: " + e.getMessage());
        }
    }

    private IssuanceRun submitPayment(IssuanceRun run, AssetDescriptor asset, AccountKeys distributor,
                                      AccountKeys issuer, String amount) {
        enterStage(FailureStage.PAYMENT, issuer);
        log.info("Building payment transaction from {} to {} for {} {}",
                issuer.getPublicKey(), distributor.getPublicKey(), amount, asset.getCode());
        try {
            TransactionOutcome outcome = submitSigned(issuer,
                    new AssetPaymentOperation(distributor.getPublicKey(), asset, amount));
            if (!outcome.isSuccess()) {
                log.error("Payment transaction rejected after trustline {}: reason={}",
                        run.getTrustlineTxHash(), outcome.getFailureReason());
                return run.fail(FailureStage.PAYMENT, ErrorKind.SUBMISSION,
                        "Error issuing asset: " + outcome.getFailureReason());
            }
            log.info("Payment transaction submitted: hash={}", outcome.getTransactionHash());
            return run.paymentSubmitted(outcome.getTransactionHash());
        } catch (LedgerException e) {
            log.error("Error issuing asset after trustline {}: kind={}, error={}",
                    run.getTrustlineTxHash(), e.getErrorKind(), e.getMessage());
            return run.fail(FailureStage.PAYMENT, e.getErrorKind(), "Error issuing asset: " + e.getMessage());
        }
    }

    /**
     * Loads the signer's account, fetches the fee, then builds, signs and
     * submits a single-operation transaction with the signer as source.
     */
    private TransactionOutcome submitSigned(AccountKeys signer, LedgerOperation operation) {
        AccountSnapshot source = ledgerClient.loadAccount(signer.getPublicKey());
        long baseFee = ledgerClient.fetchBaseFee();
        return ledgerClient.submit(TransactionRequest.of(source, operation, signer, baseFee));
    }

    private void validateAccounts(AssetDescriptor asset, AccountKeys distributor, AccountKeys issuer) {
        if (asset == null || asset.isNative()) {
            throw new IllegalArgumentException("a custom asset is required");
        }
        if (distributor == null || !distributor.hasPublicKey() || !distributor.hasSecret()) {
            throw new IllegalArgumentException("distributor keys are not set");
        }
        if (issuer == null || !issuer.hasPublicKey() || !issuer.hasSecret()) {
            throw new IllegalArgumentException("issuer keys are not set");
        }
        if (!asset.getIssuerPublicKey().equals(issuer.getPublicKey())) {
            throw new IllegalArgumentException("asset issuer does not match the issuer account");
        }
    }

    private void enterStage(FailureStage stage, AccountKeys source) {
        MDC.put(CorrelationContext.STAGE_MDC_KEY, stage.name().toLowerCase(Locale.ROOT));
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, source.getPublicKey());
    }

    private IssuanceResult finish(IssuanceRun run, String successMessage, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        String outcome = run.isSucceeded() ? "success" : run.getFailureStage().name().toLowerCase(Locale.ROOT);
        metrics.recordIssuance(outcome, duration);

        if (run.isSucceeded()) {
            log.info("Issuance completed: trustlineTx={}, paymentTx={}, duration={}ms",
                    run.getTrustlineTxHash(), run.getPaymentTxHash(), duration);
        } else {
            log.warn("Issuance failed: stage={}, kind={}, trustlineTx={}, duration={}ms",
                    run.getFailureStage(), run.getErrorKind(), run.getTrustlineTxHash(), duration);
        }
        return IssuanceResult.from(run, successMessage);
    }
}
