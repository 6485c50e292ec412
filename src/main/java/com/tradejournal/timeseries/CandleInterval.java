package com.tradejournal.timeseries;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed-length candle intervals served by the venue's {@code candleSnapshot} query, keyed by
 * the suffix used on the wire and in the {@code /api/candles} query string.
 *
 * <p>The venue's calendar-month interval is not listed since its length varies.
 */
public enum CandleInterval {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    THREE_MINUTES("3m", Duration.ofMinutes(3)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    TWO_HOURS("2h", Duration.ofHours(2)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    EIGHT_HOURS("8h", Duration.ofHours(8)),
    TWELVE_HOURS("12h", Duration.ofHours(12)),
    ONE_DAY("1d", Duration.ofDays(1)),
    THREE_DAYS("3d", Duration.ofDays(3)),
    ONE_WEEK("1w", Duration.ofDays(7));

    private static final Map<String, CandleInterval> BY_SUFFIX =
            Arrays.stream(values()).collect(Collectors.toMap(CandleInterval::getSuffix, Function.identity()));

    private final String suffix;
    private final Duration duration;

    CandleInterval(String suffix, Duration duration) {
        this.suffix = suffix;
        this.duration = duration;
    }

    public String getSuffix() {
        return suffix;
    }

    public long getDurationMs() {
        return duration.toMillis();
    }

    /** @throws IllegalArgumentException for a suffix the venue does not serve */
    public static CandleInterval fromSuffix(String suffix) {
        CandleInterval interval = BY_SUFFIX.get(suffix);
        if (interval == null) {
            throw new IllegalArgumentException("Unknown candle interval suffix: " + suffix);
        }
        return interval;
    }
}
