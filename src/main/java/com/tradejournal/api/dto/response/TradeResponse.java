package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * DTO for a reconstructed round-trip trade.
 *
 * <p>Field names are snake_case and {@code side} uses the venue codes ("B" long, "A" short):
 * existing journal clients read this shape. {@code fill_ids} is the JSON array text of the
 * contributing fill ids in discovery order.
 */
@Data
@Builder
public class TradeResponse {

    private Long id;
    private String coin;
    private String side;

    @JsonProperty("entry_px")
    private BigDecimal entryPrice;

    @JsonProperty("exit_px")
    private BigDecimal exitPrice;

    private BigDecimal size;
    private BigDecimal pnl;
    private BigDecimal fees;

    @JsonProperty("open_time")
    private long openTime;

    @JsonProperty("close_time")
    private long closeTime;

    @JsonProperty("hold_ms")
    private long holdMs;

    private BigDecimal mae;
    private BigDecimal mfe;

    @JsonProperty("fill_ids")
    private String fillIds;

    private boolean orphan;
}
