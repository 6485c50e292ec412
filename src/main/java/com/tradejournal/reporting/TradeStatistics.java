package com.tradejournal.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate performance metrics over a wallet's round-trip trades.
 *
 * <p>{@code realizedPnl} is gross of fees; {@code netPnl} subtracts them. {@code winRate} is a
 * percentage. {@code avgLoss} is reported as a positive magnitude and {@code avgRR} is
 * {@code avgWin / avgLoss}. Average MAE/MFE only count
 * trades with a positive excursion.
 */
@Data
@Builder
public class TradeStatistics {

    private int totalTrades;
    private int wins;
    private int losses;
    private BigDecimal winRate;
    private BigDecimal realizedPnl;
    private BigDecimal totalFees;
    private BigDecimal netPnl;
    private BigDecimal avgWin;
    private BigDecimal avgLoss;
    private BigDecimal profitFactor;
    private BigDecimal avgRR;
    private BigDecimal expectancy;
    private BigDecimal sharpe;
    private BigDecimal sortino;
    private BigDecimal maxDrawdown;
    private long avgHoldMs;
    private int longCount;
    private int shortCount;
    private BigDecimal longPnl;
    private BigDecimal shortPnl;
    private BigDecimal bestTrade;
    private BigDecimal worstTrade;
    private int longestWinStreak;
    private int longestLossStreak;
    private BigDecimal avgMae;
    private BigDecimal avgMfe;

    public static TradeStatistics empty() {
        return TradeStatistics.builder()
                .winRate(BigDecimal.ZERO)
                .realizedPnl(BigDecimal.ZERO)
                .totalFees(BigDecimal.ZERO)
                .netPnl(BigDecimal.ZERO)
                .avgWin(BigDecimal.ZERO)
                .avgLoss(BigDecimal.ZERO)
                .profitFactor(BigDecimal.ZERO)
                .avgRR(BigDecimal.ZERO)
                .expectancy(BigDecimal.ZERO)
                .sharpe(BigDecimal.ZERO)
                .sortino(BigDecimal.ZERO)
                .maxDrawdown(BigDecimal.ZERO)
                .longPnl(BigDecimal.ZERO)
                .shortPnl(BigDecimal.ZERO)
                .bestTrade(BigDecimal.ZERO)
                .worstTrade(BigDecimal.ZERO)
                .avgMae(BigDecimal.ZERO)
                .avgMfe(BigDecimal.ZERO)
                .build();
    }
}
