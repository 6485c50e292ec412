package com.tradejournal.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradejournal.api.dto.response.TradeResponse;
import com.tradejournal.mapper.TradeMapper;
import com.tradejournal.reporting.TradeStatistics;
import com.tradejournal.reporting.TradeStatisticsCalculator;
import com.tradejournal.service.TradeSyncService;
import com.tradejournal.timeseries.CandleInterval;
import com.tradejournal.venue.HyperliquidInfoClient;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for reconstructed trades, journal statistics and venue passthrough queries.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/trades?wallet=} -- stored trades, synced from the venue on first access</li>
 *   <li>{@code POST /api/trades/refresh?wallet=} -- force a re-sync and return the rebuilt trades</li>
 *   <li>{@code GET /api/trades/stats?wallet=} -- performance statistics over stored trades</li>
 *   <li>{@code GET /api/state?wallet=} -- current venue account state</li>
 *   <li>{@code GET /api/candles?coin=&interval=&start=&end=} -- raw venue candles for charts</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class TradeController {

    private final TradeSyncService tradeSyncService;
    private final TradeStatisticsCalculator tradeStatisticsCalculator;
    private final HyperliquidInfoClient hyperliquidInfoClient;
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    public TradeController(
            TradeSyncService tradeSyncService,
            TradeStatisticsCalculator tradeStatisticsCalculator,
            HyperliquidInfoClient hyperliquidInfoClient) {
        this.tradeSyncService = tradeSyncService;
        this.tradeStatisticsCalculator = tradeStatisticsCalculator;
        this.hyperliquidInfoClient = hyperliquidInfoClient;
    }

    @GetMapping("/trades")
    public List<TradeResponse> getTrades(@RequestParam String wallet) {
        return tradeMapper.toResponseList(tradeSyncService.getTrades(wallet));
    }

    @PostMapping("/trades/refresh")
    public List<TradeResponse> refreshTrades(@RequestParam String wallet) {
        return tradeMapper.toResponseList(tradeSyncService.refresh(wallet));
    }

    @GetMapping("/trades/stats")
    public TradeStatistics getStatistics(@RequestParam String wallet) {
        return tradeStatisticsCalculator.calculate(tradeSyncService.getTrades(wallet));
    }

    @GetMapping("/state")
    public JsonNode getState(@RequestParam String wallet) {
        return hyperliquidInfoClient.fetchUserState(wallet);
    }

    /**
     * @param interval candle interval suffix, e.g. "1m", "5m", "1h"
     * @param start    range start in epoch milliseconds
     * @param end      range end in epoch milliseconds, now when omitted
     */
    @GetMapping("/candles")
    public List<Map<String, Object>> getCandles(
            @RequestParam(defaultValue = "BTC") String coin,
            @RequestParam(defaultValue = "5m") String interval,
            @RequestParam(defaultValue = "0") long start,
            @RequestParam(required = false) Long end) {
        long endTime = end != null ? end : System.currentTimeMillis();
        return hyperliquidInfoClient.fetchCandles(coin, CandleInterval.fromSuffix(interval), start, endTime);
    }
}
