package com.tradejournal.venue;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configuration properties and HTTP client for the Hyperliquid info API.
 *
 * <p>Binds to the {@code tradejournal.hyperliquid.*} prefix in application.properties. The info
 * endpoint is read-only and unauthenticated: every query is a JSON POST to the same path with a
 * {@code type} discriminator.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.hyperliquid")
@Getter
@Setter
public class HyperliquidConfig {

    /** Base URL of the venue API. */
    private String baseUrl = "https://api.hyperliquid.xyz";

    /** Path of the info endpoint, relative to the base URL. */
    private String infoPath = "/info";

    /** Maximum fills the venue returns per userFillsByTime request. */
    private int fillsPerPage = 2000;

    /** Epoch ms from which fill history is paged: 2022-11-01T00:00:00Z, before the venue launched. */
    private long historyStartMs = 1667260800000L;

    /** Pause between consecutive fill pages, in milliseconds. */
    private long pageDelayMs = 500;

    /** HTTP connect timeout in milliseconds. */
    private int connectTimeout = 5000;

    /** HTTP read timeout in milliseconds. */
    private int readTimeout = 30000;

    @Bean
    public RestClient hyperliquidRestClient() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .requestFactory(requestFactory)
                .build();
    }
}
