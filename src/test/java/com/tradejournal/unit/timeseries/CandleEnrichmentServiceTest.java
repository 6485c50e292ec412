package com.tradejournal.unit.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradejournal.domain.enums.Side;
import com.tradejournal.domain.model.Trade;
import com.tradejournal.timeseries.CandleEnrichmentService;
import com.tradejournal.timeseries.CandleFetcher;
import com.tradejournal.timeseries.CandleInterval;
import com.tradejournal.timeseries.CandleParser;
import com.tradejournal.timeseries.EnrichmentConfig;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CandleEnrichmentServiceTest {

    @Mock
    private CandleFetcher candleFetcher;

    private CandleEnrichmentService candleEnrichmentService;

    @BeforeEach
    void setUp() {
        candleEnrichmentService =
                new CandleEnrichmentService(new CandleParser(), new EnrichmentConfig(), Runnable::run);
    }

    private static Trade trade(String coin, Side side, String entry, long open, long close, String mae, String mfe) {
        return Trade.builder()
                .account("0xabc")
                .coin(coin)
                .side(side)
                .entryPrice(new BigDecimal(entry))
                .exitPrice(new BigDecimal(entry))
                .size(BigDecimal.ONE)
                .pnl(BigDecimal.ONE)
                .fees(BigDecimal.ZERO)
                .openTime(open)
                .closeTime(close)
                .holdMs(close - open)
                .mae(new BigDecimal(mae))
                .mfe(new BigDecimal(mfe))
                .fillIds("[1,2]")
                .build();
    }

    private static Map<String, Object> candle(long t, Object high, Object low) {
        return Map.of("t", t, "h", high, "l", low);
    }

    @Nested
    @DisplayName("Excursion refinement")
    class Refinement {

        @Test
        @DisplayName("overlapping candle low widens mae of a long")
        void candleLowWidensMae() {
            Trade trade = trade("BTC", Side.BUY, "100", 0, 120_000, "0.01", "0.02");
            when(candleFetcher.fetch("BTC", CandleInterval.ONE_MINUTE, 0, 120_000))
                    .thenReturn(List.of(candle(60_000, "103", "97.5")));

            List<Trade> enriched = candleEnrichmentService.enrich(List.of(trade), candleFetcher);

            assertThat(enriched).hasSize(1);
            assertThat(enriched.get(0).getMae()).isEqualByComparingTo("0.025");
            assertThat(enriched.get(0).getMfe()).isEqualByComparingTo("0.03");
            assertThat(enriched.get(0).getPnl()).isEqualByComparingTo(trade.getPnl());
        }

        @Test
        @DisplayName("short maps highs to mae and lows to mfe")
        void shortMapping() {
            Trade trade = trade("ETH", Side.SELL, "2000", 30_000, 90_000, "0", "0");
            when(candleFetcher.fetch("ETH", CandleInterval.ONE_MINUTE, 30_000, 90_000))
                    .thenReturn(List.of(candle(0, "2010", "1990"), candle(60_000, "2100", "1900")));

            Trade enriched = candleEnrichmentService.enrich(List.of(trade), candleFetcher).get(0);

            assertThat(enriched.getMae()).isEqualByComparingTo("0.05");
            assertThat(enriched.getMfe()).isEqualByComparingTo("0.05");
        }

        @Test
        @DisplayName("candles outside the holding window are ignored")
        void nonOverlappingCandlesIgnored() {
            Trade trade = trade("BTC", Side.BUY, "100", 120_000, 150_000, "0.01", "0.02");
            when(candleFetcher.fetch("BTC", CandleInterval.ONE_MINUTE, 120_000, 150_000))
                    .thenReturn(List.of(
                            // ends exactly at open time
                            candle(60_000, "200", "50"),
                            candle(120_000, "101", "99"),
                            // starts after close time
                            candle(180_000, "300", "10")));

            Trade enriched = candleEnrichmentService.enrich(List.of(trade), candleFetcher).get(0);

            assertThat(enriched.getMae()).isEqualByComparingTo("0.01");
            assertThat(enriched.getMfe()).isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("candle starting exactly at close time still counts")
        void candleAtCloseTimeIncluded() {
            Trade trade = trade("BTC", Side.BUY, "100", 0, 120_000, "0.01", "0.02");
            when(candleFetcher.fetch("BTC", CandleInterval.ONE_MINUTE, 0, 120_000))
                    .thenReturn(List.of(candle(60_000, "101", "99"), candle(120_000, "101", "90")));

            Trade enriched = candleEnrichmentService.enrich(List.of(trade), candleFetcher).get(0);

            assertThat(enriched.getMae()).isEqualByComparingTo("0.1");
            assertThat(enriched.getMfe()).isEqualByComparingTo("0.01");
        }

        @Test
        @DisplayName("trade with no overlapping candle is returned unchanged")
        void noOverlapKeepsTrade() {
            Trade trade = trade("BTC", Side.BUY, "100", 0, 10_000, "0.01", "0.02");
            when(candleFetcher.fetch("BTC", CandleInterval.ONE_MINUTE, 0, 10_000))
                    .thenReturn(List.of(candle(600_000, "150", "50")));

            assertThat(candleEnrichmentService.enrich(List.of(trade), candleFetcher)).containsExactly(trade);
        }
    }

    @Nested
    @DisplayName("Fetching")
    class Fetching {

        @Test
        @DisplayName("one fetch per instrument spanning all its trades")
        void oneFetchPerInstrument() {
            Trade first = trade("BTC", Side.BUY, "100", 0, 60_000, "0", "0");
            Trade other = trade("ETH", Side.BUY, "10", 30_000, 40_000, "0", "0");
            Trade second = trade("BTC", Side.SELL, "100", 200_000, 500_000, "0", "0");
            when(candleFetcher.fetch(eq("BTC"), eq(CandleInterval.ONE_MINUTE), anyLong(), anyLong()))
                    .thenReturn(List.of());
            when(candleFetcher.fetch(eq("ETH"), eq(CandleInterval.ONE_MINUTE), anyLong(), anyLong()))
                    .thenReturn(List.of());

            List<Trade> enriched = candleEnrichmentService.enrich(List.of(first, other, second), candleFetcher);

            assertThat(enriched).containsExactly(first, other, second);
            verify(candleFetcher, times(1)).fetch("BTC", CandleInterval.ONE_MINUTE, 0, 500_000);
            verify(candleFetcher, times(1)).fetch("ETH", CandleInterval.ONE_MINUTE, 30_000, 40_000);
        }

        @Test
        @DisplayName("failed fetch for one instrument keeps its trades and enriches the rest")
        void failureIsIsolated() {
            Trade btc = trade("BTC", Side.BUY, "100", 0, 60_000, "0.01", "0.02");
            Trade eth = trade("ETH", Side.BUY, "100", 0, 60_000, "0.01", "0.02");
            when(candleFetcher.fetch(eq("BTC"), eq(CandleInterval.ONE_MINUTE), anyLong(), anyLong()))
                    .thenThrow(new IllegalStateException("venue down"));
            when(candleFetcher.fetch(eq("ETH"), eq(CandleInterval.ONE_MINUTE), anyLong(), anyLong()))
                    .thenReturn(List.of(candle(0, "110", "95")));

            List<Trade> enriched = candleEnrichmentService.enrich(List.of(btc, eth), candleFetcher);

            assertThat(enriched.get(0)).isSameAs(btc);
            assertThat(enriched.get(1).getMae()).isEqualByComparingTo("0.05");
            assertThat(enriched.get(1).getMfe()).isEqualByComparingTo("0.1");
        }

        @Test
        @DisplayName("malformed candle records are skipped")
        void malformedRecordsSkipped() {
            Trade trade = trade("BTC", Side.BUY, "100", 0, 60_000, "0", "0");
            when(candleFetcher.fetch("BTC", CandleInterval.ONE_MINUTE, 0, 60_000))
                    .thenReturn(List.of(
                            Map.of("t", 0L, "h", "n/a", "l", "90"),
                            Map.of("h", "300", "l", "1"),
                            candle(0, "104", "98")));

            Trade enriched = candleEnrichmentService.enrich(List.of(trade), candleFetcher).get(0);

            assertThat(enriched.getMae()).isEqualByComparingTo("0.02");
            assertThat(enriched.getMfe()).isEqualByComparingTo("0.04");
        }

        @Test
        @DisplayName("empty trade list makes no requests")
        void emptyTrades() {
            assertThat(candleEnrichmentService.enrich(List.of(), candleFetcher)).isEmpty();
            verifyNoInteractions(candleFetcher);
        }
    }

    @Nested
    @DisplayName("Batch deadline")
    class Deadline {

        @Test
        @DisplayName("slow instruments share one deadline and are cancelled when it passes")
        void slowFetchesShareOneDeadline() throws InterruptedException {
            EnrichmentConfig config = new EnrichmentConfig();
            config.setTimeoutSeconds(1);
            ExecutorService pool = Executors.newSingleThreadExecutor();
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch interrupted = new CountDownLatch(1);
            CandleFetcher hangingFetcher = (coin, interval, start, end) -> {
                if (coin.equals("BTC")) {
                    return List.of(candle(0, "110", "95"));
                }
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("cancelled", e);
                }
                return List.of(candle(0, "500", "1"));
            };
            CandleEnrichmentService service = new CandleEnrichmentService(new CandleParser(), config, pool);

            Trade btc = trade("BTC", Side.BUY, "100", 0, 60_000, "0.01", "0.02");
            Trade eth = trade("ETH", Side.BUY, "100", 0, 60_000, "0.01", "0.02");
            Trade sol = trade("SOL", Side.BUY, "100", 0, 60_000, "0.01", "0.02");
            Trade doge = trade("DOGE", Side.BUY, "100", 0, 60_000, "0.01", "0.02");

            try {
                long startedAt = System.nanoTime();
                List<Trade> enriched = service.enrich(List.of(btc, eth, sol, doge), hangingFetcher);
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

                assertThat(elapsedMs).isLessThan(1_900);
                assertThat(enriched.get(0).getMae()).isEqualByComparingTo("0.05");
                assertThat(enriched.subList(1, 4)).containsExactly(eth, sol, doge);
                assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
            } finally {
                release.countDown();
                pool.shutdownNow();
            }
        }
    }
}
