package com.flagship.asset_issuance.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.asset_issuance.account.AccountKeys;
import com.flagship.asset_issuance.config.StellarProperties;
import com.flagship.asset_issuance.observability.IssuanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.stellar.sdk.Account;
import org.stellar.sdk.Asset;
import org.stellar.sdk.AssetTypeNative;
import org.stellar.sdk.ChangeTrustAsset;
import org.stellar.sdk.ChangeTrustOperation;
import org.stellar.sdk.Operation;
import org.stellar.sdk.PaymentOperation;
import org.stellar.sdk.Transaction;
import org.stellar.sdk.TransactionBuilder;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LedgerClient} backed by a Horizon server.
 *
 * Account and fee queries go through Horizon's REST API. Transactions are
 * built, signed and encoded with the Stellar SDK, then posted as a base64
 * envelope to {@code /transactions}.
 */
@Component
@Slf4j
public class HorizonLedgerClient implements LedgerClient {

    static final long MIN_BASE_FEE = 100L;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final LedgerNetwork network;
    private final long transactionTimeoutSeconds;
    private final IssuanceMetrics metrics;

    public HorizonLedgerClient(@Qualifier("horizonRestClient") RestClient restClient,
                               ObjectMapper objectMapper,
                               LedgerNetwork network,
                               StellarProperties properties,
                               IssuanceMetrics metrics) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.network = network;
        this.transactionTimeoutSeconds = properties.transactionTimeoutSeconds();
        this.metrics = metrics;
    }

    @Override
    public AccountSnapshot loadAccount(String accountId) {
        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = restClient.get()
                .uri("/accounts/{accountId}", accountId)
                .retrieve()
                .body(JsonNode.class);
            if (response == null) {
                throw new LedgerUnavailableException("Horizon account response is empty");
            }
            metrics.recordLedgerCall("load_account", "success", System.currentTimeMillis() - startTime);
            return toSnapshot(accountId, response);
        } catch (RestClientResponseException e) {
            metrics.recordLedgerCall("load_account", "error", System.currentTimeMillis() - startTime);
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new AccountNotFoundException(accountId);
            }
            throw translate("load account " + accountId, e);
        } catch (RestClientException e) {
            metrics.recordLedgerCall("load_account", "error", System.currentTimeMillis() - startTime);
            throw translate("load account " + accountId, e);
        }
    }

    @Override
    public long fetchBaseFee() {
        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = restClient.get()
                .uri("/fee_stats")
                .retrieve()
                .body(JsonNode.class);
            metrics.recordLedgerCall("fee_stats", "success", System.currentTimeMillis() - startTime);
            if (response == null || !response.hasNonNull("last_ledger_base_fee")) {
                return MIN_BASE_FEE;
            }
            long fee = Long.parseLong(response.get("last_ledger_base_fee").asText());
            return Math.max(fee, MIN_BASE_FEE);
        } catch (NumberFormatException e) {
            log.warn("Unparseable base fee from Horizon, using minimum: error={}", e.getMessage());
            return MIN_BASE_FEE;
        } catch (RestClientException e) {
            metrics.recordLedgerCall("fee_stats", "error", System.currentTimeMillis() - startTime);
            throw translate("fetch base fee", e);
        }
    }

    @Override
    public TransactionOutcome submit(TransactionRequest request) {
        Transaction transaction = build(request);
        for (AccountKeys signer : request.getSigners()) {
            transaction.sign(signer.toSigningKeyPair());
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("tx", transaction.toEnvelopeXdrBase64());

        log.info("Submitting transaction: source={}, sequence={}, hash={}",
                request.getSource().getAccountId(), request.getSource().getSequenceNumber() + 1, transaction.hashHex());

        long startTime = System.currentTimeMillis();
        try {
            JsonNode response = restClient.post()
                .uri("/transactions")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
            metrics.recordLedgerCall("submit", "success", System.currentTimeMillis() - startTime);

            String hash = response != null ? response.path("hash").asText(null) : null;
            return TransactionOutcome.accepted(hash != null ? hash : transaction.hashHex());
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.BAD_REQUEST.value()) {
                metrics.recordLedgerCall("submit", "rejected", System.currentTimeMillis() - startTime);
                String reason = resultCodes(e.getResponseBodyAsString());
                log.warn("Transaction rejected by ledger: hash={}, resultCodes={}", transaction.hashHex(), reason);
                return TransactionOutcome.rejected(reason);
            }
            metrics.recordLedgerCall("submit", "error", System.currentTimeMillis() - startTime);
            throw translate("submit transaction " + transaction.hashHex(), e);
        } catch (RestClientException e) {
            metrics.recordLedgerCall("submit", "error", System.currentTimeMillis() - startTime);
            throw translate("submit transaction " + transaction.hashHex(), e);
        }
    }

    @Override
    public LedgerNetwork network() {
        return network;
    }

    private Transaction build(TransactionRequest request) {
        AccountSnapshot source = request.getSource();
        TransactionBuilder builder = new TransactionBuilder(
                new Account(source.getAccountId(), source.getSequenceNumber()),
                network.toSdkNetwork());
        for (LedgerOperation operation : request.getOperations()) {
            builder.addOperation(toSdkOperation(operation));
        }
        return builder
            .setBaseFee(request.getBaseFee())
            .setTimeout(transactionTimeoutSeconds)
            .build();
    }

    private Operation toSdkOperation(LedgerOperation operation) {
        if (operation instanceof TrustlineOperation) {
            TrustlineOperation trustline = (TrustlineOperation) operation;
            return new ChangeTrustOperation.Builder(
                    ChangeTrustAsset.create(toSdkAsset(trustline.getAsset())),
                    trustline.effectiveLimit())
                .build();
        }
        if (operation instanceof AssetPaymentOperation) {
            AssetPaymentOperation payment = (AssetPaymentOperation) operation;
            return new PaymentOperation.Builder(
                    payment.getDestination(),
                    toSdkAsset(payment.getAsset()),
                    payment.getAmount())
                .build();
        }
        throw new IllegalArgumentException("Unsupported ledger operation: " + operation.describe());
    }

    private Asset toSdkAsset(AssetDescriptor asset) {
        if (asset.isNative()) {
            return new AssetTypeNative();
        }
        return Asset.create(asset.getCode() + ":" + asset.getIssuerPublicKey());
    }

    private AccountSnapshot toSnapshot(String accountId, JsonNode account) {
        long sequence;
        try {
            sequence = Long.parseLong(account.path("sequence").asText());
        } catch (NumberFormatException e) {
            throw new LedgerUnavailableException("Horizon returned an invalid sequence for " + accountId, e);
        }

        List<BalanceEntry> balances = new ArrayList<>();
        for (JsonNode balance : account.path("balances")) {
            balances.add(new BalanceEntry(
                AssetType.fromHorizon(balance.path("asset_type").asText()),
                balance.path("asset_code").asText(null),
                balance.path("asset_issuer").asText(null),
                balance.path("balance").asText()
            ));
        }
        return new AccountSnapshot(account.path("account_id").asText(accountId), sequence, balances);
    }

    /**
     * Extracts {@code extras.result_codes} from a Horizon problem document,
     * e.g. {@code tx_failed [op_no_trust]}.
     */
    private String resultCodes(String body) {
        try {
            JsonNode codes = objectMapper.readTree(body).path("extras").path("result_codes");
            if (codes.isMissingNode()) {
                return "transaction rejected: " + body;
            }
            StringBuilder reason = new StringBuilder(codes.path("transaction").asText("tx_failed"));
            JsonNode operations = codes.path("operations");
            if (operations.isArray() && operations.size() > 0) {
                List<String> operationCodes = new ArrayList<>();
                operations.forEach(code -> operationCodes.add(code.asText()));
                reason.append(' ').append(operationCodes);
            }
            return reason.toString();
        } catch (JsonProcessingException e) {
            return "transaction rejected: " + body;
        }
    }

    private LedgerException translate(String action, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            int status = ((RestClientResponseException) e).getStatusCode().value();
            // Horizon answers 504 when the transaction did not make it into a ledger in time
            if (status == HttpStatus.GATEWAY_TIMEOUT.value()) {
                return new LedgerTimeoutException("Ledger timed out while trying to " + action, e);
            }
            return new LedgerUnavailableException(
                String.format("Ledger error while trying to %s: status=%d", action, status), e);
        }
        if (e instanceof ResourceAccessException) {
            Throwable cause = ((ResourceAccessException) e).getMostSpecificCause();
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return new LedgerTimeoutException("Ledger call timed out while trying to " + action, e);
            }
        }
        return new LedgerUnavailableException("Ledger unreachable while trying to " + action + ": " + e.getMessage(), e);
    }
}
