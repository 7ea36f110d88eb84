package com.flagship.asset_issuance.account;

import com.flagship.asset_issuance.observability.IssuanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Funds test-network accounts through Friendbot.
 *
 * Friendbot creates the account with a fixed native balance. It answers
 * 400 for an account that already exists, which is reported as a failure
 * like any other non-success status.
 */
@Component
@Slf4j
public class FriendbotFundingClient implements FundingClient {

    private final RestClient restClient;
    private final IssuanceMetrics metrics;

    public FriendbotFundingClient(@Qualifier("friendbotRestClient") RestClient restClient,
                                  IssuanceMetrics metrics) {
        this.restClient = restClient;
        this.metrics = metrics;
    }

    @Override
    public void fund(String publicKey) {
        long startTime = System.currentTimeMillis();
        try {
            restClient.get()
                .uri(uriBuilder -> uriBuilder.queryParam("addr", publicKey).build())
                .retrieve()
                .toBodilessEntity();
            metrics.recordLedgerCall("friendbot", "success", System.currentTimeMillis() - startTime);
            log.info("Friendbot funded account: accountId={}", publicKey);
        } catch (RestClientResponseException e) {
            metrics.recordLedgerCall("friendbot", "rejected", System.currentTimeMillis() - startTime);
            throw new FundingException(String.format("Friendbot request failed: status=%d, body=%s",
                e.getStatusCode().value(), e.getResponseBodyAsString()), e);
        } catch (RestClientException e) {
            metrics.recordLedgerCall("friendbot", "error", System.currentTimeMillis() - startTime);
            throw new FundingException("Friendbot request error: " + e.getMessage(), e);
        }
    }
}
