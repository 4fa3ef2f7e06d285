package com.deepansh.kernel.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Shared HttpClient behind every RestClient: LLM drivers and web_fetch.
 *
 * Redirects are never followed. web_fetch validates the destination address before
 * connecting, and a redirect would skip that check.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${kernel.http.connect-timeout-ms:10000}")
    private long connectTimeoutMs;

    @Value("${kernel.http.response-timeout-ms:120000}")
    private long responseTimeoutMs;

    @Value("${kernel.http.max-connections:64}")
    private int maxConnections;

    @Bean
    public RestClient.Builder restClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxConnections)
                        .setMaxConnPerRoute(maxConnections)
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .disableRedirectHandling()
                .build();

        log.info("HttpClient configured [maxConnections={}, connectTimeout={}ms, responseTimeout={}ms]",
                maxConnections, connectTimeoutMs, responseTimeoutMs);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
