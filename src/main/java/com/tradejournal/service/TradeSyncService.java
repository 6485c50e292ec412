package com.tradejournal.service;

import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.engine.TradeAggregationService;
import com.tradejournal.mapper.FillMapper;
import com.tradejournal.timeseries.CandleEnrichmentService;
import com.tradejournal.timeseries.CandleFetcher;
import com.tradejournal.timeseries.EnrichmentConfig;
import com.tradejournal.venue.FillHistoryLoader;
import com.tradejournal.venue.HyperliquidFill;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps a wallet's reconstructed trades in step with its venue fill history.
 *
 * <p>A sync fetches the wallet's complete fill history, caches fills not seen before,
 * rebuilds round trips with {@link TradeAggregationService}, optionally refines their
 * excursions with {@link CandleEnrichmentService}, and hands the result to
 * {@link TradeStore#replaceTrades}. Venue calls run outside any transaction; only the
 * {@link TradeStore} writes are transactional. Reads are cache-first: a wallet with no stored
 * trades is synced on demand.
 */
@Service
public class TradeSyncService {

    private static final Logger log = LoggerFactory.getLogger(TradeSyncService.class);

    private final FillHistoryLoader fillHistoryLoader;
    private final TradeAggregationService tradeAggregationService;
    private final CandleEnrichmentService candleEnrichmentService;
    private final CandleFetcher candleFetcher;
    private final EnrichmentConfig enrichmentConfig;
    private final TradeStore tradeStore;
    private final FillMapper fillMapper = Mappers.getMapper(FillMapper.class);

    public TradeSyncService(
            FillHistoryLoader fillHistoryLoader,
            TradeAggregationService tradeAggregationService,
            CandleEnrichmentService candleEnrichmentService,
            CandleFetcher candleFetcher,
            EnrichmentConfig enrichmentConfig,
            TradeStore tradeStore) {
        this.fillHistoryLoader = fillHistoryLoader;
        this.tradeAggregationService = tradeAggregationService;
        this.candleEnrichmentService = candleEnrichmentService;
        this.candleFetcher = candleFetcher;
        this.enrichmentConfig = enrichmentConfig;
        this.tradeStore = tradeStore;
    }

    /** Stored trades for the wallet ordered by open time, syncing first when none are stored. */
    public List<Trade> getTrades(String wallet) {
        List<Trade> stored = tradeStore.loadTrades(wallet);
        if (!stored.isEmpty()) {
            return stored;
        }
        return refresh(wallet);
    }

    /**
     * Re-fetches the wallet's fill history and rebuilds its trades.
     *
     * @throws com.tradejournal.exception.VenueException if the venue cannot be reached
     */
    public List<Trade> refresh(String wallet) {
        log.info("Syncing fills for {}", wallet);
        List<HyperliquidFill> venueFills = fillHistoryLoader.fetchAllFills(wallet);
        if (venueFills.isEmpty()) {
            log.info("No fills for {}", wallet);
            return List.of();
        }

        List<Fill> fills = deduplicate(venueFills, wallet);
        int cached = tradeStore.cacheNewFills(fills);
        log.info("Got {} fills for {} ({} new), rebuilding trades", fills.size(), wallet, cached);

        List<Trade> trades = tradeAggregationService.aggregate(fills);
        if (enrichmentConfig.isEnabled()) {
            trades = candleEnrichmentService.enrich(trades, candleFetcher);
        }

        List<Trade> stored = tradeStore.replaceTrades(wallet, trades);
        log.info("Stored {} round-trip trades for {}", trades.size(), wallet);
        return stored;
    }

    /** Maps venue fills to domain fills, keeping the first occurrence of each fill id. */
    private List<Fill> deduplicate(List<HyperliquidFill> venueFills, String wallet) {
        Map<Long, Fill> byId = new LinkedHashMap<>();
        for (HyperliquidFill venueFill : venueFills) {
            Fill fill = fillMapper.fromVenue(venueFill, wallet);
            byId.putIfAbsent(fill.getId(), fill);
        }
        return List.copyOf(byId.values());
    }
}
