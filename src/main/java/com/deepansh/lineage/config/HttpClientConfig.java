package com.deepansh.lineage.config;

import com.deepansh.lineage.llm.LlmProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HttpClient shared by the generation and embedding clients.
 *
 * The generation server is the dominant latency source of a query, so both the
 * connect and the response timeout are bounded here. A call that exceeds them
 * surfaces as a ResourceAccessException, which the decision maker turns into
 * empty text.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder(LlmProperties llmProperties) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofSeconds(llmProperties.getConnectTimeoutSeconds()))
                .setSocketTimeout(Timeout.ofSeconds(llmProperties.getTimeoutSeconds()))
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setResponseTimeout(Timeout.ofSeconds(llmProperties.getTimeoutSeconds()))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .build())
                .setDefaultRequestConfig(requestConfig)
                .build();

        log.info("HttpClient configured [connectTimeout={}s, responseTimeout={}s]",
                llmProperties.getConnectTimeoutSeconds(), llmProperties.getTimeoutSeconds());

        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient))
                .baseUrl(llmProperties.getBaseUrl())
                .defaultHeader("Content-Type", "application/json");
    }
}
