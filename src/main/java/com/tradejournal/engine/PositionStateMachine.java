package com.tradejournal.engine;

import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.Trade;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-instrument state machine that folds chronologically ordered fills into round trips.
 *
 * <p>State is the live accumulator for the instrument, or none when the position is flat.
 * Each fill is one transition: {@code (accumulator-or-none, fill) -> (accumulator-or-none,
 * emitted trade-or-none)}. The caller threads {@link Transition#next()} into the next call.
 *
 * <p>Transitions are driven by the venue's direction tag:
 * <ul>
 *   <li><b>OPEN</b> seeds a new accumulator, or scales into the live one.</li>
 *   <li><b>CLOSE</b> reduces the live accumulator, or seeds an orphan when none is live.
 *       The round trip completes once the post-fill position is flat.</li>
 *   <li><b>UNKNOWN</b> falls back to the position snapshot: a fill that crosses zero is split
 *       into a close of the old position and an open of the new one at the same price; any
 *       other fill opens when flat and is absorbed close-like otherwise.</li>
 * </ul>
 *
 * <p>The post-fill position always comes from the fill's {@code startPosition} snapshot, never
 * from a locally tracked total.
 */
@Component
public class PositionStateMachine {

    private static final Logger log = LoggerFactory.getLogger(PositionStateMachine.class);

    private final TradeFinalizer tradeFinalizer;

    public PositionStateMachine(TradeFinalizer tradeFinalizer) {
        this.tradeFinalizer = tradeFinalizer;
    }

    /**
     * Apply one fill to the instrument's current state.
     *
     * @param current live accumulator, or null when no position is being tracked
     * @param fill    next fill of the same instrument in chronological order
     * @return the next state and the trade completed by this fill, if any
     */
    public Transition apply(TradeAccumulator current, Fill fill) {
        return switch (fill.getDirection()) {
            case OPEN -> open(current, fill);
            case CLOSE -> close(current, fill);
            case UNKNOWN -> PositionMath.crossesZero(fill.getStartPosition(), fill.endPosition())
                    ? flip(current, fill)
                    : unknown(current, fill);
        };
    }

    private Transition open(TradeAccumulator current, Fill fill) {
        if (current == null) {
            return Transition.carry(TradeAccumulator.openedBy(fill));
        }
        current.scaleIn(fill);
        return Transition.carry(current);
    }

    private Transition close(TradeAccumulator current, Fill fill) {
        TradeAccumulator accumulator;
        if (current == null) {
            log.debug(
                    "Close fill {} in {} with no visible open, tracking as orphan", fill.getId(), fill.getCoin());
            accumulator = TradeAccumulator.orphanClosedBy(fill);
        } else {
            current.reduce(fill);
            accumulator = current;
        }
        return completeIfFlat(accumulator, fill.endPosition());
    }

    private Transition unknown(TradeAccumulator current, Fill fill) {
        if (current == null) {
            if (PositionMath.isFlat(fill.endPosition())) {
                return Transition.FLAT;
            }
            return Transition.carry(TradeAccumulator.openedBy(fill));
        }
        current.absorb(fill);
        return completeIfFlat(current, fill.endPosition());
    }

    /**
     * A single fill that takes the position through zero. The part that flattens the old
     * position is booked as a close carrying all of the fill's realized PnL; the remainder opens
     * the new position. The fee is apportioned by size.
     */
    private Transition flip(TradeAccumulator current, Fill fill) {
        BigDecimal closeSize = fill.getStartPosition().abs();
        BigDecimal openSize = fill.endPosition().abs();
        BigDecimal closeFee = fill.getSize().signum() > 0
                ? fill.getFee().multiply(closeSize).divide(fill.getSize(), PositionMath.MC)
                : fill.getFee();

        Fill closingPart = fill.toBuilder().size(closeSize).fee(closeFee).build();
        Fill openingPart = fill.toBuilder()
                .size(openSize)
                .fee(fill.getFee().subtract(closeFee))
                .closedPnl(BigDecimal.ZERO)
                .startPosition(BigDecimal.ZERO)
                .build();

        log.debug(
                "Fill {} in {} flips position {} -> {}, splitting into close {} and open {}",
                fill.getId(),
                fill.getCoin(),
                fill.getStartPosition(),
                fill.endPosition(),
                closeSize,
                openSize);

        Transition closed = close(current, closingPart);
        Transition opened = open(closed.next(), openingPart);
        return new Transition(opened.next(), closed.emitted());
    }

    private Transition completeIfFlat(TradeAccumulator accumulator, BigDecimal endPosition) {
        if (!PositionMath.isFlat(endPosition)) {
            return Transition.carry(accumulator);
        }
        Optional<Trade> trade = tradeFinalizer.finalizeTrade(accumulator);
        return new Transition(null, trade.orElse(null));
    }

    /**
     * Outcome of applying one fill.
     *
     * @param next    accumulator to carry into the next fill, or null when the position is flat
     * @param emitted trade completed by this fill, or null
     */
    public record Transition(TradeAccumulator next, Trade emitted) {

        static final Transition FLAT = new Transition(null, null);

        static Transition carry(TradeAccumulator accumulator) {
            return new Transition(accumulator, null);
        }

        public Optional<Trade> emittedTrade() {
            return Optional.ofNullable(emitted);
        }
    }
}
