package com.tradejournal.engine;

import com.tradejournal.domain.model.Trade;
import com.tradejournal.engine.PositionMath.Excursion;
import com.tradejournal.mapper.JsonHelper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts a completed {@link TradeAccumulator} into an immutable {@link Trade}.
 *
 * <p>Entry and exit prices are size-weighted averages, each falling back to the last traded
 * price when no size was booked on that leg. Excursions use the running min/max price across
 * every fill that touched the position.
 *
 * <p>Round trips with zero realized PnL and zero fees are bookkeeping artifacts and are
 * dropped, unless they are orphans (those always carry information about a position the
 * account held before the visible history began).
 */
@Component
public class TradeFinalizer {

    private static final Logger log = LoggerFactory.getLogger(TradeFinalizer.class);

    /**
     * @return the finalized trade, or empty when the accumulator is a zero-PnL, zero-fee artifact
     */
    public Optional<Trade> finalizeTrade(TradeAccumulator accumulator) {
        BigDecimal entryPrice = PositionMath.averageOrElse(
                accumulator.getEntryValue(), accumulator.getEntrySize(), accumulator.getLastPrice());
        BigDecimal exitPrice = PositionMath.averageOrElse(
                accumulator.getExitValue(), accumulator.getExitSize(), accumulator.getLastPrice());

        if (isArtifact(accumulator)) {
            log.debug(
                    "Dropping zero-PnL, zero-fee round trip in {} opened at {} (fills {})",
                    accumulator.getCoin(),
                    accumulator.getOpenTime(),
                    accumulator.getFillIds());
            return Optional.empty();
        }

        Excursion excursion = PositionMath.excursion(
                accumulator.getSide(), entryPrice, accumulator.getMinPrice(), accumulator.getMaxPrice());

        return Optional.of(Trade.builder()
                .account(accumulator.getAccount())
                .coin(accumulator.getCoin())
                .side(accumulator.getSide())
                .entryPrice(entryPrice.setScale(PositionMath.PRICE_SCALE, RoundingMode.HALF_UP))
                .exitPrice(exitPrice.setScale(PositionMath.PRICE_SCALE, RoundingMode.HALF_UP))
                .size(accumulator.getEntrySize().setScale(PositionMath.SIZE_SCALE, RoundingMode.HALF_UP))
                .pnl(accumulator.getRealizedPnl().setScale(PositionMath.PNL_SCALE, RoundingMode.HALF_UP))
                .fees(accumulator.getFees().setScale(PositionMath.PNL_SCALE, RoundingMode.HALF_UP))
                .openTime(accumulator.getOpenTime())
                .closeTime(accumulator.getLastTime())
                .holdMs(accumulator.getLastTime() - accumulator.getOpenTime())
                .mae(excursion.mae())
                .mfe(excursion.mfe())
                .fillIds(JsonHelper.fillIdsToJson(accumulator.getFillIds()))
                .orphan(accumulator.isOrphan())
                .build());
    }

    private boolean isArtifact(TradeAccumulator accumulator) {
        return PositionMath.isFlat(accumulator.getRealizedPnl())
                && PositionMath.isFlat(accumulator.getFees())
                && !accumulator.isOrphan();
    }
}
