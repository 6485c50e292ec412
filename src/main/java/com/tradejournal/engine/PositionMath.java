package com.tradejournal.engine;

import com.tradejournal.domain.enums.Side;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Numeric conventions shared by the aggregation engine and candle enrichment.
 *
 * <p>Position sizes are compared against {@link #EPSILON} rather than exact zero because the
 * venue reports sizes as decimal strings whose sums can leave sub-lot residue.
 */
public final class PositionMath {

    public static final BigDecimal EPSILON = new BigDecimal("1e-9");

    public static final MathContext MC = MathContext.DECIMAL64;

    public static final int PRICE_SCALE = 8;
    public static final int SIZE_SCALE = 8;
    public static final int PNL_SCALE = 6;
    public static final int EXCURSION_SCALE = 6;

    private PositionMath() {}

    /** True when |value| is within epsilon of zero. */
    public static boolean isFlat(BigDecimal value) {
        return value.abs().compareTo(EPSILON) < 0;
    }

    /** True when both positions are non-flat and on opposite sides of zero. */
    public static boolean crossesZero(BigDecimal before, BigDecimal after) {
        return !isFlat(before) && !isFlat(after) && before.signum() != after.signum();
    }

    /** value / divisor, or the fallback when the divisor is not positive. */
    public static BigDecimal averageOrElse(BigDecimal value, BigDecimal divisor, BigDecimal fallback) {
        if (divisor.signum() <= 0) {
            return fallback;
        }
        return value.divide(divisor, MC);
    }

    /**
     * Maximum adverse and favorable excursion of a position as fractions of its entry price.
     *
     * <p>For a long, the adverse extreme is the lowest price and the favorable extreme the highest;
     * a short swaps them. Both are zero when the entry price is not positive.
     */
    public static Excursion excursion(Side side, BigDecimal entryPrice, BigDecimal low, BigDecimal high) {
        if (entryPrice == null || entryPrice.signum() <= 0) {
            return Excursion.NONE;
        }
        BigDecimal adverse = side.isLong() ? low : high;
        BigDecimal favorable = side.isLong() ? high : low;
        return new Excursion(fraction(adverse, entryPrice), fraction(favorable, entryPrice));
    }

    private static BigDecimal fraction(BigDecimal price, BigDecimal entryPrice) {
        return price.subtract(entryPrice)
                .abs()
                .divide(entryPrice, MC)
                .setScale(EXCURSION_SCALE, RoundingMode.HALF_UP);
    }

    /** MAE/MFE pair, already rounded to {@link #EXCURSION_SCALE} places. */
    public record Excursion(BigDecimal mae, BigDecimal mfe) {

        static final Excursion NONE = new Excursion(
                BigDecimal.ZERO.setScale(EXCURSION_SCALE), BigDecimal.ZERO.setScale(EXCURSION_SCALE));
    }
}
