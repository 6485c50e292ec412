package com.tradejournal.domain.model;

import com.tradejournal.domain.enums.FillDirection;
import com.tradejournal.domain.enums.Side;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A single execution reported by the venue for one account.
 *
 * <p>{@code startPosition} is the venue's snapshot of the signed position size immediately
 * before this fill. It is authoritative: the aggregation engine derives the post-fill position
 * from it rather than from a locally tracked running total, which keeps the engine correct when
 * history is truncated or fills arrive out of order.
 */
@Value
@Builder(toBuilder = true)
public class Fill {

    /** Venue trade id; falls back to the order id when the venue omits it. */
    long id;

    /** Instrument symbol (e.g. "BTC"). */
    String coin;

    BigDecimal price;

    /** Unsigned executed size. */
    BigDecimal size;

    Side side;

    /** Raw venue direction tag, kept for persistence. Empty when the venue sent none. */
    String directionTag;

    /** Epoch milliseconds. Not guaranteed unique. */
    long time;

    /** Signed position size before this fill. */
    BigDecimal startPosition;

    /** Realized PnL attributed to this fill by the venue. */
    BigDecimal closedPnl;

    BigDecimal fee;

    long orderId;

    String hash;

    boolean crossed;

    /** Owning account (wallet address). */
    String account;

    public FillDirection getDirection() {
        return FillDirection.fromTag(directionTag);
    }

    /** Size with the position sign of this fill's side applied. */
    public BigDecimal signedSize() {
        return side.signed(size);
    }

    /** Signed position size after this fill: start position plus signed size. */
    public BigDecimal endPosition() {
        return startPosition.add(signedSize());
    }
}
