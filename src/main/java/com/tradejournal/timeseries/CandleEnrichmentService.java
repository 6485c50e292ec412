package com.tradejournal.timeseries;

import com.tradejournal.domain.model.Trade;
import com.tradejournal.engine.PositionMath;
import com.tradejournal.engine.PositionMath.Excursion;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Refines trade excursions (MAE/MFE) with market extremes from 1-minute candles.
 *
 * <p>Fill-based excursions only see the prices the account itself traded at. During the
 * holding period the market usually trades further in both directions, so this pass replaces
 * them with the lowest low and highest high of every candle overlapping the trade.
 *
 * <p>One candle request is issued per instrument, covering the span of all its trades, and
 * requests for different instruments run in parallel on the enrichment executor. Enrichment
 * is best-effort: an instrument whose fetch fails or yields no usable candles keeps its
 * fill-based excursions, and no failure aborts the batch.
 *
 * <p>The whole batch shares one deadline of {@code tradejournal.enrichment.timeout-seconds}.
 * Fetches still queued or running when it passes are cancelled, interrupting the worker.
 */
@Service
public class CandleEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(CandleEnrichmentService.class);

    static final CandleInterval ENRICHMENT_INTERVAL = CandleInterval.ONE_MINUTE;

    private final CandleParser candleParser;
    private final EnrichmentConfig enrichmentConfig;
    private final Executor enrichmentExecutor;

    public CandleEnrichmentService(
            CandleParser candleParser,
            EnrichmentConfig enrichmentConfig,
            @Qualifier("enrichmentExecutor") Executor enrichmentExecutor) {
        this.candleParser = candleParser;
        this.enrichmentConfig = enrichmentConfig;
        this.enrichmentExecutor = enrichmentExecutor;
    }

    /**
     * Returns the trades in their original order, with mae/mfe replaced wherever candles
     * overlapping the trade were available.
     */
    public List<Trade> enrich(List<Trade> trades, CandleFetcher candleFetcher) {
        if (trades.isEmpty()) {
            return trades;
        }

        Map<String, List<Trade>> byCoin = new LinkedHashMap<>();
        for (Trade trade : trades) {
            byCoin.computeIfAbsent(trade.getCoin(), coin -> new ArrayList<>()).add(trade);
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(enrichmentConfig.getTimeoutSeconds());
        Map<String, FutureTask<List<Candle>>> pending = new LinkedHashMap<>();
        byCoin.forEach((coin, coinTrades) -> {
            FutureTask<List<Candle>> task = new FutureTask<>(() -> fetchCandles(coin, coinTrades, candleFetcher));
            pending.put(coin, task);
            enrichmentExecutor.execute(task);
        });

        Map<String, List<Candle>> candlesByCoin = new LinkedHashMap<>();
        pending.forEach((coin, task) -> candlesByCoin.put(coin, await(coin, task, deadline)));

        List<Trade> enriched = new ArrayList<>(trades.size());
        int refined = 0;
        for (Trade trade : trades) {
            Trade result = applyCandles(trade, candlesByCoin.getOrDefault(trade.getCoin(), List.of()));
            if (result != trade) {
                refined++;
            }
            enriched.add(result);
        }

        log.info("Candle enrichment refined {} of {} trades across {} instruments", refined, trades.size(), byCoin.size());
        return enriched;
    }

    /**
     * Recomputes a trade's excursions from the extremes of the candles overlapping its holding
     * window. Returns the same instance when no candle overlaps.
     */
    Trade applyCandles(Trade trade, List<Candle> candles) {
        BigDecimal low = null;
        BigDecimal high = null;
        for (Candle candle : candles) {
            if (candle.getTimestamp() > trade.getCloseTime()) {
                break;
            }
            if (!candle.overlaps(trade.getOpenTime(), trade.getCloseTime())) {
                continue;
            }
            low = low == null ? candle.getLow() : low.min(candle.getLow());
            high = high == null ? candle.getHigh() : high.max(candle.getHigh());
        }

        if (low == null) {
            return trade;
        }

        Excursion excursion = PositionMath.excursion(trade.getSide(), trade.getEntryPrice(), low, high);
        return trade.toBuilder().mae(excursion.mae()).mfe(excursion.mfe()).build();
    }

    private List<Candle> fetchCandles(String coin, List<Trade> coinTrades, CandleFetcher candleFetcher) {
        long start = coinTrades.stream().mapToLong(Trade::getOpenTime).min().orElseThrow();
        long end = coinTrades.stream().mapToLong(Trade::getCloseTime).max().orElseThrow();

        List<Map<String, Object>> records;
        try {
            records = candleFetcher.fetch(coin, ENRICHMENT_INTERVAL, start, end);
        } catch (RuntimeException e) {
            log.warn("{}: candle fetch for [{}, {}] failed, keeping fill-based excursions: {}",
                    coin, start, end, e.getMessage());
            return List.of();
        }

        List<Candle> candles = candleParser.parse(coin, ENRICHMENT_INTERVAL, records);
        if (candles.isEmpty()) {
            log.warn("{}: no usable candles for [{}, {}], keeping fill-based excursions", coin, start, end);
        } else {
            log.debug("{}: {} candles for {} trades", coin, candles.size(), coinTrades.size());
        }
        return candles;
    }

    /** Waits for one instrument's fetch until the batch deadline, cancelling it if unfinished. */
    private List<Candle> await(String coin, FutureTask<List<Candle>> task, long deadline) {
        try {
            return task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted waiting for candles", coin);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.warn("{}: candle fetch missed the {}s batch deadline, keeping fill-based excursions",
                    coin, enrichmentConfig.getTimeoutSeconds());
        } catch (ExecutionException e) {
            log.warn("{}: candle fetch did not complete, keeping fill-based excursions", coin, e.getCause());
        }
        return List.of();
    }
}
