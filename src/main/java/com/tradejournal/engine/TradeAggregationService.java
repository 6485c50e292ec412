package com.tradejournal.engine;

import com.tradejournal.domain.model.Fill;
import com.tradejournal.domain.model.Trade;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Reconstructs round-trip trades from an account's raw fills.
 *
 * <p>Pipeline: {@link FillNormalizer} partitions fills per instrument in chronological order,
 * {@link PositionStateMachine} folds each instrument's sequence into completed round trips
 * (finalized by {@link TradeFinalizer}), and the union is sorted by open time.
 *
 * <p>Pure in-memory transformation with no I/O. Instruments share no state, so each
 * sequence is processed with its own accumulator. Positions still open at the end of the
 * input are not reported.
 */
@Service
public class TradeAggregationService {

    private static final Logger log = LoggerFactory.getLogger(TradeAggregationService.class);

    private final FillNormalizer fillNormalizer;
    private final PositionStateMachine positionStateMachine;

    public TradeAggregationService(FillNormalizer fillNormalizer, PositionStateMachine positionStateMachine) {
        this.fillNormalizer = fillNormalizer;
        this.positionStateMachine = positionStateMachine;
    }

    /**
     * @param fills an account's fills, de-duplicated by id, in any order
     * @return completed round trips sorted by open time ascending
     */
    public List<Trade> aggregate(Collection<Fill> fills) {
        Map<String, List<Fill>> byCoin = fillNormalizer.partitionByInstrument(fills);

        List<Trade> trades = new ArrayList<>();
        byCoin.forEach((coin, coinFills) -> trades.addAll(processInstrument(coin, coinFills)));

        // List.sort is stable, so trades opened at the same instant keep instrument order
        trades.sort(Comparator.comparingLong(Trade::getOpenTime));

        log.info("Aggregated {} fills across {} instruments into {} trades", fills.size(), byCoin.size(), trades.size());
        return trades;
    }

    /** Folds one instrument's chronologically ordered fills into its completed round trips. */
    List<Trade> processInstrument(String coin, List<Fill> fills) {
        List<Trade> trades = new ArrayList<>();
        TradeAccumulator current = null;

        for (Fill fill : fills) {
            PositionStateMachine.Transition transition = positionStateMachine.apply(current, fill);
            transition.emittedTrade().ifPresent(trades::add);
            current = transition.next();
        }

        if (current != null) {
            log.debug(
                    "{}: position opened at {} still open after {} fills, not reported",
                    coin,
                    current.getOpenTime(),
                    current.getFillIds().size());
        }
        return trades;
    }
}
