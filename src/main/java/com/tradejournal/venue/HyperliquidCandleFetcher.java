package com.tradejournal.venue;

import com.tradejournal.timeseries.CandleFetcher;
import com.tradejournal.timeseries.CandleInterval;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Live {@link CandleFetcher} backed by the venue's candle snapshot query. */
@Component
public class HyperliquidCandleFetcher implements CandleFetcher {

    private final HyperliquidInfoClient hyperliquidInfoClient;

    public HyperliquidCandleFetcher(HyperliquidInfoClient hyperliquidInfoClient) {
        this.hyperliquidInfoClient = hyperliquidInfoClient;
    }

    @Override
    public List<Map<String, Object>> fetch(String coin, CandleInterval interval, long startMs, long endMs) {
        return hyperliquidInfoClient.fetchCandles(coin, interval, startMs, endMs);
    }
}
