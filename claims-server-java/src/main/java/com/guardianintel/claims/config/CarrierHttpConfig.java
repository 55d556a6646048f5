package com.guardianintel.claims.config;

import java.util.concurrent.TimeUnit;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.pool.PoolConcurrencyPolicy;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import com.guardianintel.claims.integration.carrier.CarrierProperties;
import com.guardianintel.claims.integration.carrier.CarrierProperties.CarrierDefinition;
import com.guardianintel.claims.integration.carrier.statefarm.StateFarmAdapter;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class CarrierHttpConfig {

    private static final String STATE_FARM_DEFAULT_URL = "https://api-sandbox.statefarm.com/v1/claims";

    @Value("${claims.http.timeout.connect:5000}") private int connectTimeout;
    @Value("${claims.http.timeout.read:30000}") private int readTimeout;

    @Value("${claims.http.pool.max-total:50}") private int maxTotal;
    @Value("${claims.http.pool.max-per-route:20}") private int maxPerRoute;
    @Value("${claims.http.pool.ttl-minutes:10}") private int ttlMinutes;

    /**
     * Shared connection pool for every carrier API. Carriers are different routes,
     * so one slow carrier cannot take another carrier's connections.
     */
    @Bean
    public PoolingHttpClientConnectionManager carrierConnectionManager() {
        SocketConfig socketConfig = SocketConfig.custom()
                .setSoTimeout(Timeout.of(readTimeout, TimeUnit.MILLISECONDS))
                .build();

        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.of(connectTimeout, TimeUnit.MILLISECONDS))
                .setSocketTimeout(Timeout.of(readTimeout, TimeUnit.MILLISECONDS))
                .setTimeToLive(TimeValue.ofMinutes(ttlMinutes))
                .build();

        return PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultSocketConfig(socketConfig)
                .setDefaultConnectionConfig(connectionConfig)
                .setPoolConcurrencyPolicy(PoolConcurrencyPolicy.STRICT)
                .setMaxConnTotal(maxTotal)
                .setMaxConnPerRoute(maxPerRoute)
                .build();
    }

    @Bean
    public CloseableHttpClient carrierHttpClient(PoolingHttpClientConnectionManager manager) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.of(readTimeout, TimeUnit.MILLISECONDS))
                .build();

        return HttpClients.custom()
                .setConnectionManager(manager)
                .setDefaultRequestConfig(requestConfig)
                .evictExpiredConnections()
                .evictIdleConnections(TimeValue.ofMinutes(1))
                .build();
    }

    @Bean
    public RestClient stateFarmRestClient(@Qualifier("carrierHttpClient") CloseableHttpClient httpClient,
                                          CarrierProperties properties) {
        CarrierDefinition definition = properties.definition(StateFarmAdapter.CODE);
        String baseUrl = definition != null && definition.getBaseUrl() != null
                ? definition.getBaseUrl() : STATE_FARM_DEFAULT_URL;

        RestClient.Builder builder = RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient))
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);

        if (definition != null && definition.getApiKey() != null && !definition.getApiKey().isBlank()) {
            builder.defaultHeader("X-API-Key", definition.getApiKey());
        } else {
            log.warn("No API key configured for State Farm; requests will be rejected by the carrier");
        }

        log.info("State Farm client bound to {}", baseUrl);
        return builder.build();
    }
}
