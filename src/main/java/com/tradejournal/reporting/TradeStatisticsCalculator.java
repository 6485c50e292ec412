package com.tradejournal.reporting;

import com.tradejournal.domain.model.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes journal-level performance metrics across a wallet's trades.
 *
 * <p>A trade with positive realized PnL is a win, one with negative PnL a loss. For streaks,
 * break-even trades count as losses. Sharpe and Sortino ratios are computed over realized PnL
 * summed per UTC calendar day of trade open time and annualized with 252 trading days.
 */
@Service
public class TradeStatisticsCalculator {

    private static final Logger log = LoggerFactory.getLogger(TradeStatisticsCalculator.class);

    private static final int SCALE = 6;

    private static final double TRADING_DAYS_PER_YEAR = 252;

    public TradeStatistics calculate(List<Trade> trades) {
        if (trades.isEmpty()) {
            return TradeStatistics.empty();
        }

        List<Trade> wins = filter(trades, t -> t.getPnl().signum() > 0);
        List<Trade> losses = filter(trades, t -> t.getPnl().signum() < 0);

        BigDecimal realizedPnl = sum(trades, Trade::getPnl);
        BigDecimal totalFees = sum(trades, Trade::getFees);
        BigDecimal grossProfit = sum(wins, Trade::getPnl);
        BigDecimal grossLoss = sum(losses, Trade::getPnl).abs();

        BigDecimal winFraction = ratio(BigDecimal.valueOf(wins.size()), trades.size());
        BigDecimal avgWin = ratio(grossProfit, wins.size());
        BigDecimal avgLoss = ratio(grossLoss, losses.size());

        // Profit factor = gross profit / gross loss, 0 when nothing was lost
        BigDecimal profitFactor = grossLoss.signum() > 0
                ? grossProfit.divide(grossLoss, SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        BigDecimal avgRiskReward = avgLoss.signum() > 0
                ? avgWin.divide(avgLoss, SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        BigDecimal expectancy = winFraction.multiply(avgWin)
                .subtract(BigDecimal.ONE.subtract(winFraction).multiply(avgLoss))
                .setScale(SCALE, RoundingMode.HALF_UP);

        List<Trade> chronological = trades.stream()
                .sorted(Comparator.comparingLong(Trade::getOpenTime))
                .toList();

        List<Double> dailyPnl = dailyPnl(trades);

        List<Trade> longs = filter(trades, t -> t.getSide().isLong());
        List<Trade> shorts = filter(trades, t -> !t.getSide().isLong());

        TradeStatistics statistics = TradeStatistics.builder()
                .totalTrades(trades.size())
                .wins(wins.size())
                .losses(losses.size())
                .winRate(winFraction.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP))
                .realizedPnl(realizedPnl)
                .totalFees(totalFees)
                .netPnl(realizedPnl.subtract(totalFees))
                .avgWin(avgWin)
                .avgLoss(avgLoss)
                .profitFactor(profitFactor)
                .avgRR(avgRiskReward)
                .expectancy(expectancy)
                .sharpe(calculateSharpe(dailyPnl))
                .sortino(calculateSortino(dailyPnl))
                .maxDrawdown(calculateMaxDrawdown(chronological))
                .avgHoldMs(averageHoldMs(trades))
                .longCount(longs.size())
                .shortCount(shorts.size())
                .longPnl(sum(longs, Trade::getPnl))
                .shortPnl(sum(shorts, Trade::getPnl))
                .bestTrade(wins.stream().map(Trade::getPnl).max(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .worstTrade(losses.stream().map(Trade::getPnl).min(Comparator.naturalOrder()).orElse(BigDecimal.ZERO))
                .longestWinStreak(longestStreak(chronological, true))
                .longestLossStreak(longestStreak(chronological, false))
                .avgMae(averagePositive(trades, Trade::getMae))
                .avgMfe(averagePositive(trades, Trade::getMfe))
                .build();

        log.debug(
                "Statistics over {} trades: {}% win rate, PF={}, maxDD={}",
                trades.size(), statistics.getWinRate(), profitFactor, statistics.getMaxDrawdown());
        return statistics;
    }

    /** Largest peak-to-trough decline of cumulative net PnL (PnL minus fees), in trade order. */
    BigDecimal calculateMaxDrawdown(List<Trade> chronological) {
        BigDecimal peak = BigDecimal.ZERO;
        BigDecimal maxDrawdown = BigDecimal.ZERO;
        BigDecimal cumulative = BigDecimal.ZERO;

        for (Trade trade : chronological) {
            cumulative = cumulative.add(trade.getPnl()).subtract(trade.getFees());
            if (cumulative.compareTo(peak) > 0) {
                peak = cumulative;
            }
            BigDecimal drawdown = peak.subtract(cumulative);
            if (drawdown.compareTo(maxDrawdown) > 0) {
                maxDrawdown = drawdown;
            }
        }
        return maxDrawdown;
    }

    /** Realized PnL per UTC calendar day of open time, in date order. */
    List<Double> dailyPnl(List<Trade> trades) {
        Map<LocalDate, Double> byDay = new TreeMap<>();
        for (Trade trade : trades) {
            LocalDate day = Instant.ofEpochMilli(trade.getOpenTime()).atZone(ZoneOffset.UTC).toLocalDate();
            byDay.merge(day, trade.getPnl().doubleValue(), Double::sum);
        }
        return List.copyOf(byDay.values());
    }

    /**
     * Annualized mean daily PnL over its population standard deviation. A zero deviation is
     * taken as 1, so a single trading day yields the annualized mean itself.
     */
    BigDecimal calculateSharpe(List<Double> dailyPnl) {
        double mean = dailyPnl.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = dailyPnl.stream()
                .mapToDouble(pnl -> Math.pow(pnl - mean, 2))
                .average()
                .orElse(0);
        return annualize(mean, Math.sqrt(variance));
    }

    /** Like Sharpe, but the deviation only counts losing days (averaged over all days). */
    BigDecimal calculateSortino(List<Double> dailyPnl) {
        double mean = dailyPnl.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double downsideVariance = dailyPnl.stream()
                .mapToDouble(pnl -> pnl < 0 ? pnl * pnl : 0)
                .average()
                .orElse(0);
        return annualize(mean, Math.sqrt(downsideVariance));
    }

    private static BigDecimal annualize(double mean, double deviation) {
        double divisor = deviation == 0 ? 1 : deviation;
        return BigDecimal.valueOf(mean / divisor * Math.sqrt(TRADING_DAYS_PER_YEAR))
                .setScale(2, RoundingMode.HALF_UP);
    }

    int longestStreak(List<Trade> chronological, boolean winning) {
        int longest = 0;
        int current = 0;
        for (Trade trade : chronological) {
            boolean win = trade.getPnl().signum() > 0;
            current = win == winning ? current + 1 : 0;
            longest = Math.max(longest, current);
        }
        return longest;
    }

    private long averageHoldMs(List<Trade> trades) {
        return (long) trades.stream()
                .mapToLong(Trade::getHoldMs)
                .filter(hold -> hold > 0)
                .average()
                .orElse(0);
    }

    private BigDecimal averagePositive(List<Trade> trades, Function<Trade, BigDecimal> field) {
        List<BigDecimal> values = trades.stream()
                .map(field)
                .filter(v -> v != null && v.signum() > 0)
                .toList();
        BigDecimal total = values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return ratio(total, values.size());
    }

    private static List<Trade> filter(List<Trade> trades, Predicate<Trade> predicate) {
        return trades.stream().filter(predicate).toList();
    }

    private static BigDecimal sum(List<Trade> trades, Function<Trade, BigDecimal> field) {
        return trades.stream().map(field).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal ratio(BigDecimal numerator, int count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(BigDecimal.valueOf(count), SCALE, RoundingMode.HALF_UP);
    }
}
