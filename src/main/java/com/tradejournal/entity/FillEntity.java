package com.tradejournal.entity;

import com.tradejournal.domain.enums.Side;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
 * JPA entity for the fills table.
 * Raw venue executions cached per wallet, keyed by the venue trade id.
 */
@Entity
@Table(
        name = "fills",
        indexes = {
            @Index(name = "idx_fills_account_time", columnList = "account, fill_time"),
            @Index(name = "idx_fills_account_coin", columnList = "account, coin")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillEntity {

    @Id
    private Long id;

    @Column(length = 20, nullable = false)
    private String coin;

    @Column(precision = 30, scale = 10, nullable = false)
    private BigDecimal price;

    @Column(precision = 30, scale = 10, nullable = false)
    private BigDecimal size;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)", nullable = false)
    private Side side;

    @Column(name = "direction_tag", length = 30, nullable = false)
    private String directionTag;

    @Column(name = "fill_time", nullable = false)
    private long time;

    @Column(name = "start_position", precision = 30, scale = 10, nullable = false)
    private BigDecimal startPosition;

    @Column(name = "closed_pnl", precision = 30, scale = 10, nullable = false)
    private BigDecimal closedPnl;

    @Column(precision = 30, scale = 10, nullable = false)
    private BigDecimal fee;

    @Column(name = "order_id", nullable = false)
    private long orderId;

    @Column(length = 80)
    private String hash;

    private boolean crossed;

    @Column(length = 64, nullable = false)
    private String account;
}
