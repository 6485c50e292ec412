package com.tradejournal.venue;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A fill as returned by the venue's {@code userFillsByTime} query. Decimal fields arrive as
 * strings; {@code dir} is the direction tag ("Open Long", "Close Short", "Long &gt; Short", ...).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HyperliquidFill {

    private String coin;
    private String px;
    private String sz;

    /** "B" for buy, "A" for sell. */
    private String side;

    private String dir;
    private long time;
    private String startPosition;
    private String closedPnl;
    private String fee;
    private Long oid;
    private Long tid;
    private String hash;
    private Boolean crossed;
}
