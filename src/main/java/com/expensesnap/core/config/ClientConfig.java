package com.expensesnap.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Outbound HTTP clients and the clock. Every client gets explicit connect and read timeouts.
 */
@Configuration
public class ClientConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestClient extractionRestClient(RestClient.Builder builder, AppProperties props) {
        AppProperties.Extraction extraction = props.getExtraction();
        return builder
                .baseUrl(extraction.getBaseUrl())
                .requestFactory(requestFactory(extraction.getConnectTimeout(), extraction.getReadTimeout()))
                .build();
    }

    @Bean
    public RestClient ratesRestClient(RestClient.Builder builder, AppProperties props) {
        Duration timeout = props.getRates().getTimeout();
        return builder
                .requestFactory(requestFactory(timeout, timeout))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connect.toMillis());
        factory.setReadTimeout((int) read.toMillis());
        return factory;
    }
}
