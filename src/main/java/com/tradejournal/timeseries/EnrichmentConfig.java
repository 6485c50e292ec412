package com.tradejournal.timeseries;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for candle-based excursion enrichment.
 *
 * <p>Binds to the {@code tradejournal.enrichment.*} prefix in application.properties.
 * When {@code enabled} is false, trades keep the excursions computed from the account's own
 * fills and no candle requests are made.
 */
@Configuration
@ConfigurationProperties(prefix = "tradejournal.enrichment")
@Getter
@Setter
public class EnrichmentConfig {

    /** Whether synced trades are refined with market candle extremes. */
    private boolean enabled = true;

    /** Seconds to wait for all per-instrument candle fetches of one batch. */
    private long timeoutSeconds = 120;
}
