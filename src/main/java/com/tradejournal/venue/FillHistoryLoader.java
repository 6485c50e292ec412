package com.tradejournal.venue;

import com.tradejournal.exception.VenueException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pages through a wallet's complete fill history.
 *
 * <p>The venue caps each {@code userFillsByTime} response at {@code fillsPerPage} fills. Paging
 * starts at the configured history start and restarts one millisecond after the latest fill of
 * each full page; a short or empty page ends the walk. Fills sharing the boundary millisecond of
 * a full page can appear twice, so callers de-duplicate by fill id.
 */
@Component
public class FillHistoryLoader {

    private static final Logger log = LoggerFactory.getLogger(FillHistoryLoader.class);

    private final HyperliquidInfoClient hyperliquidInfoClient;
    private final HyperliquidConfig hyperliquidConfig;

    public FillHistoryLoader(HyperliquidInfoClient hyperliquidInfoClient, HyperliquidConfig hyperliquidConfig) {
        this.hyperliquidInfoClient = hyperliquidInfoClient;
        this.hyperliquidConfig = hyperliquidConfig;
    }

    public List<HyperliquidFill> fetchAllFills(String wallet) {
        List<HyperliquidFill> allFills = new ArrayList<>();
        long startTime = hyperliquidConfig.getHistoryStartMs();

        while (true) {
            List<HyperliquidFill> page = hyperliquidInfoClient.fetchFillsByTime(wallet, startTime, null, true);
            if (page.isEmpty()) {
                break;
            }

            allFills.addAll(page);
            log.info("Fetched {} fills for {} (total: {})", page.size(), wallet, allFills.size());

            if (page.size() < hyperliquidConfig.getFillsPerPage()) {
                break;
            }

            long lastTime = page.stream().mapToLong(HyperliquidFill::getTime).max().orElse(startTime);
            startTime = lastTime + 1;
            pause();
        }

        return allFills;
    }

    private void pause() {
        long delay = hyperliquidConfig.getPageDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueException("Interrupted while paging fill history", e);
        }
    }
}
