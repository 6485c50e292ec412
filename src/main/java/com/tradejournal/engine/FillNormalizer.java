package com.tradejournal.engine;

import com.tradejournal.domain.model.Fill;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Orders an account's fills chronologically and partitions them by instrument.
 *
 * <p>The sort is stable: fills sharing a timestamp keep their input order. Instruments are
 * keyed in a sorted map, but callers must not rely on instrument order for the final trade
 * order, which is restored by an explicit sort on open time.
 */
@Component
public class FillNormalizer {

    public Map<String, List<Fill>> partitionByInstrument(Collection<Fill> fills) {
        List<Fill> sorted = new ArrayList<>(fills);
        sorted.sort(Comparator.comparingLong(Fill::getTime));

        Map<String, List<Fill>> byCoin = new TreeMap<>();
        for (Fill fill : sorted) {
            byCoin.computeIfAbsent(fill.getCoin(), coin -> new ArrayList<>()).add(fill);
        }
        return byCoin;
    }
}
