package com.tradejournal.engine;

import com.tradejournal.domain.enums.Side;
import com.tradejournal.domain.model.Fill;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * In-progress aggregation of one round trip in a single instrument.
 *
 * <p>Owned exclusively by the loop processing that instrument's fills; never shared across
 * instruments or threads. The {@link PositionStateMachine} decides which mutation applies
 * to each fill, and {@link TradeFinalizer} turns a completed accumulator into a trade.
 */
@Getter
public class TradeAccumulator {

    private final String account;
    private final String coin;
    private final Side side;
    private final long openTime;

    private BigDecimal entryValue;
    private BigDecimal entrySize;
    private BigDecimal exitValue = BigDecimal.ZERO;
    private BigDecimal exitSize = BigDecimal.ZERO;
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private BigDecimal fees;

    private long lastTime;
    private BigDecimal lastPrice;
    private BigDecimal maxPrice;
    private BigDecimal minPrice;

    private final List<Long> fillIds = new ArrayList<>();
    private boolean orphan;

    private TradeAccumulator(Fill fill) {
        this.account = fill.getAccount();
        this.coin = fill.getCoin();
        this.side = fill.getSide();
        this.openTime = fill.getTime();
        this.entryValue = fill.getPrice().multiply(fill.getSize());
        this.entrySize = fill.getSize();
        this.fees = fill.getFee();
        this.lastTime = fill.getTime();
        this.lastPrice = fill.getPrice();
        this.maxPrice = fill.getPrice();
        this.minPrice = fill.getPrice();
        this.fillIds.add(fill.getId());
    }

    /** Seeds a new accumulator as if the fill opened the position. */
    public static TradeAccumulator openedBy(Fill fill) {
        return new TradeAccumulator(fill);
    }

    /**
     * Seeds an orphan accumulator from a closing fill whose opening fills are not visible.
     * The fill's realized PnL is booked immediately.
     */
    public static TradeAccumulator orphanClosedBy(Fill fill) {
        TradeAccumulator accumulator = new TradeAccumulator(fill);
        accumulator.orphan = true;
        accumulator.realizedPnl = accumulator.realizedPnl.add(fill.getClosedPnl());
        return accumulator;
    }

    /** Adds an opening fill to the existing position. Side and last price are left alone. */
    void scaleIn(Fill fill) {
        entryValue = entryValue.add(fill.getPrice().multiply(fill.getSize()));
        entrySize = entrySize.add(fill.getSize());
        fees = fees.add(fill.getFee());
        touch(fill);
    }

    /** Books a closing fill: realized PnL, fee, exit value/size and last price/time. */
    void reduce(Fill fill) {
        realizedPnl = realizedPnl.add(fill.getClosedPnl());
        fees = fees.add(fill.getFee());
        touch(fill);
        addExit(fill);
    }

    /**
     * Books a fill with an unrecognized direction tag against a live position. Only fills that
     * carry realized PnL count towards the exit.
     */
    void absorb(Fill fill) {
        fees = fees.add(fill.getFee());
        fillIds.add(fill.getId());
        if (fill.getClosedPnl().signum() != 0) {
            realizedPnl = realizedPnl.add(fill.getClosedPnl());
            exitValue = exitValue.add(fill.getPrice().multiply(fill.getSize()));
            exitSize = exitSize.add(fill.getSize());
        }
        extendBounds(fill.getPrice());
        lastPrice = fill.getPrice();
        lastTime = fill.getTime();
    }

    public List<Long> getFillIds() {
        return Collections.unmodifiableList(fillIds);
    }

    private void touch(Fill fill) {
        fillIds.add(fill.getId());
        extendBounds(fill.getPrice());
    }

    private void addExit(Fill fill) {
        exitValue = exitValue.add(fill.getPrice().multiply(fill.getSize()));
        exitSize = exitSize.add(fill.getSize());
        lastPrice = fill.getPrice();
        lastTime = fill.getTime();
    }

    private void extendBounds(BigDecimal price) {
        maxPrice = maxPrice.max(price);
        minPrice = minPrice.min(price);
    }
}
