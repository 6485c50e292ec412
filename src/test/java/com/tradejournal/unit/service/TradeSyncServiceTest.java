package com.tradejournal.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradejournal.domain.enums.Side;
import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.engine.TradeAggregationService;
import com.tradejournal.exception.VenueException;
import com.tradejournal.service.TradeStore;
import com.tradejournal.service.TradeSyncService;
import com.tradejournal.timeseries.CandleEnrichmentService;
import com.tradejournal.timeseries.CandleFetcher;
import com.tradejournal.timeseries.EnrichmentConfig;
import com.tradejournal.venue.FillHistoryLoader;
import com.tradejournal.venue.HyperliquidFill;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.transaction.annotation.Transactional;

@ExtendWith(MockitoExtension.class)
class TradeSyncServiceTest {

    private static final String WALLET = "0xabc";

    @Mock
    private FillHistoryLoader fillHistoryLoader;

    @Mock
    private TradeAggregationService tradeAggregationService;

    @Mock
    private CandleEnrichmentService candleEnrichmentService;

    @Mock
    private CandleFetcher candleFetcher;

    @Mock
    private TradeStore tradeStore;

    @Captor
    private ArgumentCaptor<List<Fill>> fillsCaptor;

    @Captor
    private ArgumentCaptor<List<Fill>> cachedCaptor;

    private EnrichmentConfig enrichmentConfig;
    private TradeSyncService tradeSyncService;

    @BeforeEach
    void setUp() {
        enrichmentConfig = new EnrichmentConfig();
        tradeSyncService = new TradeSyncService(
                fillHistoryLoader,
                tradeAggregationService,
                candleEnrichmentService,
                candleFetcher,
                enrichmentConfig,
                tradeStore);
    }

    private static HyperliquidFill venueFill(long tid, String dir, String startPosition) {
        return HyperliquidFill.builder()
                .coin("BTC")
                .px("100")
                .sz("1")
                .side(dir.startsWith("Open") ? "B" : "A")
                .dir(dir)
                .time(tid * 10)
                .startPosition(startPosition)
                .closedPnl("0")
                .fee("0.1")
                .oid(tid)
                .tid(tid)
                .build();
    }

    private static Trade trade() {
        return Trade.builder()
                .account(WALLET)
                .coin("BTC")
                .side(Side.BUY)
                .entryPrice(new BigDecimal("100"))
                .exitPrice(new BigDecimal("100"))
                .size(BigDecimal.ONE)
                .pnl(BigDecimal.ZERO)
                .fees(new BigDecimal("0.2"))
                .openTime(10)
                .closeTime(20)
                .holdMs(10)
                .mae(BigDecimal.ZERO)
                .mfe(BigDecimal.ZERO)
                .fillIds("[1,2]")
                .build();
    }

    private static Trade stored() {
        return trade().toBuilder().id(1L).build();
    }

    @Nested
    @DisplayName("refresh")
    class Refresh {

        @Test
        @DisplayName("de-duplicates fills, caches them and replaces stored trades")
        void fullSync() {
            when(fillHistoryLoader.fetchAllFills(WALLET))
                    .thenReturn(List.of(
                            venueFill(1, "Open Long", "0"),
                            venueFill(2, "Close Long", "1"),
                            venueFill(2, "Close Long", "1")));
            when(tradeStore.cacheNewFills(anyList())).thenReturn(1);
            List<Trade> aggregated = List.of(trade());
            when(tradeAggregationService.aggregate(anyList())).thenReturn(aggregated);
            when(candleEnrichmentService.enrich(aggregated, candleFetcher)).thenReturn(aggregated);
            when(tradeStore.replaceTrades(WALLET, aggregated)).thenReturn(List.of(stored()));

            List<Trade> trades = tradeSyncService.refresh(WALLET);

            assertThat(trades).hasSize(1);
            assertThat(trades.get(0).getId()).isEqualTo(1L);

            verify(tradeAggregationService).aggregate(fillsCaptor.capture());
            assertThat(fillsCaptor.getValue()).extracting(Fill::getId).containsExactly(1L, 2L);
            verify(tradeStore).cacheNewFills(cachedCaptor.capture());
            assertThat(cachedCaptor.getValue()).extracting(Fill::getId).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("venue fetch and enrichment finish before the stored trades are replaced")
        void storeWritesFollowVenueCalls() {
            when(fillHistoryLoader.fetchAllFills(WALLET)).thenReturn(List.of(venueFill(1, "Open Long", "0")));
            List<Trade> aggregated = List.of(trade());
            when(tradeAggregationService.aggregate(anyList())).thenReturn(aggregated);
            when(candleEnrichmentService.enrich(aggregated, candleFetcher)).thenReturn(aggregated);
            when(tradeStore.replaceTrades(WALLET, aggregated)).thenReturn(aggregated);

            tradeSyncService.refresh(WALLET);

            InOrder order = inOrder(fillHistoryLoader, tradeStore, candleEnrichmentService);
            order.verify(fillHistoryLoader).fetchAllFills(WALLET);
            order.verify(tradeStore).cacheNewFills(anyList());
            order.verify(candleEnrichmentService).enrich(aggregated, candleFetcher);
            order.verify(tradeStore).replaceTrades(WALLET, aggregated);
            verifyNoMoreInteractions(tradeStore);
        }

        @Test
        @DisplayName("sync entry points do not open a transaction around venue I/O")
        void syncMethodsAreNotTransactional() throws NoSuchMethodException {
            assertThat(AnnotatedElementUtils.hasAnnotation(TradeSyncService.class, Transactional.class))
                    .isFalse();
            assertThat(AnnotatedElementUtils.hasAnnotation(
                            TradeSyncService.class.getMethod("refresh", String.class), Transactional.class))
                    .isFalse();
            assertThat(AnnotatedElementUtils.hasAnnotation(
                            TradeSyncService.class.getMethod("getTrades", String.class), Transactional.class))
                    .isFalse();
            assertThat(AnnotatedElementUtils.hasAnnotation(
                            TradeStore.class.getMethod("replaceTrades", String.class, List.class),
                            Transactional.class))
                    .isTrue();
        }

        @Test
        @DisplayName("skips enrichment when disabled")
        void enrichmentDisabled() {
            enrichmentConfig.setEnabled(false);
            when(fillHistoryLoader.fetchAllFills(WALLET)).thenReturn(List.of(venueFill(1, "Open Long", "0")));
            when(tradeAggregationService.aggregate(anyList())).thenReturn(List.of());
            when(tradeStore.replaceTrades(WALLET, List.of())).thenReturn(List.of());

            assertThat(tradeSyncService.refresh(WALLET)).isEmpty();
            verifyNoInteractions(candleEnrichmentService);
        }

        @Test
        @DisplayName("wallet without fills keeps stored trades untouched")
        void noFills() {
            when(fillHistoryLoader.fetchAllFills(WALLET)).thenReturn(List.of());

            assertThat(tradeSyncService.refresh(WALLET)).isEmpty();
            verifyNoInteractions(tradeAggregationService, tradeStore);
        }

        @Test
        @DisplayName("venue failure propagates before anything is written")
        void venueFailure() {
            when(fillHistoryLoader.fetchAllFills(WALLET)).thenThrow(new VenueException("timeout"));

            assertThrows(VenueException.class, () -> tradeSyncService.refresh(WALLET));
            verify(tradeStore, never()).replaceTrades(any(), anyList());
        }
    }

    @Nested
    @DisplayName("getTrades")
    class GetTrades {

        @Test
        @DisplayName("returns stored trades without syncing")
        void cacheHit() {
            when(tradeStore.loadTrades(WALLET)).thenReturn(List.of(stored()));

            List<Trade> trades = tradeSyncService.getTrades(WALLET);

            assertThat(trades).hasSize(1);
            assertThat(trades.get(0).getFillIds()).isEqualTo("[1,2]");
            verifyNoInteractions(fillHistoryLoader);
        }

        @Test
        @DisplayName("syncs when nothing is stored")
        void cacheMiss() {
            when(tradeStore.loadTrades(WALLET)).thenReturn(List.of());
            when(fillHistoryLoader.fetchAllFills(WALLET)).thenReturn(List.of());

            assertThat(tradeSyncService.getTrades(WALLET)).isEmpty();
            verify(fillHistoryLoader).fetchAllFills(WALLET);
        }
    }
}
