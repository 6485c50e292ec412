package com.tradejournal.venue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradejournal.exception.VenueException;
import com.tradejournal.timeseries.CandleInterval;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Read-only client for the Hyperliquid info endpoint.
 *
 * <p>Each public method is one POST, retried by the {@code hyperliquid} Resilience4j instance.
 * Transport and HTTP errors surface as {@link VenueException} once retries are exhausted.
 * Paging through full fill history lives in {@link FillHistoryLoader} so that every page
 * request goes through the retry proxy.
 */
@Component
public class HyperliquidInfoClient {

    private static final Logger log = LoggerFactory.getLogger(HyperliquidInfoClient.class);

    private static final TypeReference<List<HyperliquidFill>> FILL_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> RECORD_LIST = new TypeReference<>() {};

    private final RestClient hyperliquidRestClient;
    private final HyperliquidConfig hyperliquidConfig;
    private final ObjectMapper objectMapper;

    public HyperliquidInfoClient(
            RestClient hyperliquidRestClient, HyperliquidConfig hyperliquidConfig, ObjectMapper objectMapper) {
        this.hyperliquidRestClient = hyperliquidRestClient;
        this.hyperliquidConfig = hyperliquidConfig;
        this.objectMapper = objectMapper;
    }

    /**
     * Fills for a wallet from {@code startTime} (inclusive) up to {@code endTime} (inclusive,
     * now when null). Partial fills of the same crossing order are combined when
     * {@code aggregate} is set. A non-array response yields an empty list.
     */
    @Retry(name = "hyperliquid")
    public List<HyperliquidFill> fetchFillsByTime(String wallet, long startTime, Long endTime, boolean aggregate) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "userFillsByTime");
        payload.put("user", wallet);
        payload.put("startTime", startTime);
        payload.put("aggregateByTime", aggregate);
        if (endTime != null) {
            payload.put("endTime", endTime);
        }

        JsonNode result = post(payload, "fills");
        if (result == null || !result.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(result, FILL_LIST);
    }

    /** Current positions, margin summary and withdrawable balance for a wallet, as returned. */
    @Retry(name = "hyperliquid")
    public JsonNode fetchUserState(String wallet) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "clearinghouseState");
        payload.put("user", wallet);
        return post(payload, "account state");
    }

    /**
     * Raw candle records ({@code t, T, s, i, o, c, h, l, v, n}) for a coin over a time range.
     * A non-array response yields an empty list.
     */
    @Retry(name = "hyperliquid")
    public List<Map<String, Object>> fetchCandles(String coin, CandleInterval interval, long startTime, long endTime) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("coin", coin);
        request.put("interval", interval.getSuffix());
        request.put("startTime", startTime);
        request.put("endTime", endTime);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "candleSnapshot");
        payload.put("req", request);

        JsonNode result = post(payload, "candles");
        if (result == null || !result.isArray()) {
            return List.of();
        }
        return objectMapper.convertValue(result, RECORD_LIST);
    }

    private JsonNode post(Map<String, Object> payload, String what) {
        String query = String.valueOf(payload.get("type"));
        try {
            return hyperliquidRestClient
                    .post()
                    .uri(hyperliquidConfig.getInfoPath())
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("Hyperliquid {} request failed: {}", what, e.getMessage());
            throw new VenueException("Failed to fetch " + what + " from Hyperliquid: " + e.getMessage(), query, e);
        }
    }
}
