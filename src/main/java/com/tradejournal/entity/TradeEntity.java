package com.tradejournal.entity;

import com.tradejournal.domain.enums.Side;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 * Reconstructed round trips per wallet; the whole set is replaced on every sync.
 */
@Entity
@Table(
        name = "trades",
        indexes = {
            @Index(name = "idx_trades_account", columnList = "account"),
            @Index(name = "idx_trades_account_time", columnList = "account, open_time")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 64, nullable = false)
    private String account;

    @Column(length = 20, nullable = false)
    private String coin;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private Side side;

    @Column(name = "entry_price", precision = 30, scale = 8, nullable = false)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", precision = 30, scale = 8)
    private BigDecimal exitPrice;

    @Column(precision = 30, scale = 8, nullable = false)
    private BigDecimal size;

    @Column(precision = 30, scale = 6, nullable = false)
    private BigDecimal pnl;

    @Column(precision = 30, scale = 6, nullable = false)
    private BigDecimal fees;

    @Column(name = "open_time", nullable = false)
    private long openTime;

    @Column(name = "close_time")
    private long closeTime;

    @Column(name = "hold_ms")
    private long holdMs;

    @Column(precision = 20, scale = 6)
    private BigDecimal mae;

    @Column(precision = 20, scale = 6)
    private BigDecimal mfe;

    @Column(name = "fill_ids", columnDefinition = "TEXT", nullable = false)
    private String fillIds;

    private boolean orphan;
}
