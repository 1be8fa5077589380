package com.saletracker.tracker.application.config;

import java.net.http.HttpClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One {@link RestClient} per upstream host, both with bounded connect and read timeouts.
 */
@Slf4j
@Configuration
public class HttpClientConfig {

    @Bean
    @Qualifier("storeRestClient")
    public RestClient storeRestClient(TrackerProperties properties) {
        log.info("Initializing storeRestClient for {}", properties.price().baseUrl());
        return RestClient.builder()
                .baseUrl(properties.price().baseUrl())
                .requestFactory(requestFactory(properties.http()))
                .build();
    }

    @Bean
    @Qualifier("catalogRestClient")
    public RestClient catalogRestClient(TrackerProperties properties) {
        log.info("Initializing catalogRestClient for {}", properties.catalog().baseUrl());
        return RestClient.builder()
                .baseUrl(properties.catalog().baseUrl())
                .requestFactory(requestFactory(properties.http()))
                .build();
    }

    private static JdkClientHttpRequestFactory requestFactory(TrackerProperties.Http http) {
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(http.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        var factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(http.readTimeout());
        return factory;
    }
}
