package com.flagship.asset_issuance.config;

import com.flagship.asset_issuance.ledger.LedgerNetwork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Wires the ledger and faucet HTTP clients.
 *
 * Both clients share the connect/read timeouts from {@code stellar.http}, so
 * every network call made by the service is bounded.
 */
@Configuration
@EnableConfigurationProperties(StellarProperties.class)
@Slf4j
public class LedgerClientConfig {

    @Bean
    public LedgerNetwork ledgerNetwork(StellarProperties properties) {
        LedgerNetwork network = LedgerNetwork.fromIdentifier(properties.network());
        log.info("Using {} network, Horizon at {}", network, horizonUrl(properties, network));
        return network;
    }

    @Bean
    public RestClient horizonRestClient(RestClient.Builder restClientBuilder,
                                        StellarProperties properties,
                                        LedgerNetwork network) {
        return restClientBuilder
            .baseUrl(horizonUrl(properties, network))
            .requestFactory(requestFactory(properties.http()))
            .build();
    }

    @Bean
    public RestClient friendbotRestClient(RestClient.Builder restClientBuilder,
                                          StellarProperties properties) {
        return restClientBuilder
            .baseUrl(properties.friendbotUrl())
            .requestFactory(requestFactory(properties.http()))
            .build();
    }

    private static String horizonUrl(StellarProperties properties, LedgerNetwork network) {
        return network.isTestnet() ? properties.horizonTestnetUrl() : properties.horizonPublicUrl();
    }

    private static SimpleClientHttpRequestFactory requestFactory(StellarProperties.Http http) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) http.connectTimeout().toMillis());
        factory.setReadTimeout((int) http.readTimeout().toMillis());
        return factory;
    }
}
