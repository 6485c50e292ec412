package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.Side;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A completed round trip in one instrument: flat, then non-flat, then flat again.
 *
 * <p>Prices and size carry 8 decimal places, PnL, fees and excursions 6. {@code mae} and
 * {@code mfe} are fractions of the entry price. {@code fillIds} is the JSON array of
 * contributing fill ids in the order they were seen.
 *
 * <p>Orphan trades were reconstructed from closing fills whose opening fills predate the
 * available history; their entry price is the last traded price.
 */
@Value
@Builder(toBuilder = true)
public class Trade {

    Long id;
    String account;
    String coin;
    Side side;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal size;
    BigDecimal pnl;
    BigDecimal fees;
    long openTime;
    long closeTime;
    long holdMs;
    BigDecimal mae;
    BigDecimal mfe;
    String fillIds;
    boolean orphan;
}
