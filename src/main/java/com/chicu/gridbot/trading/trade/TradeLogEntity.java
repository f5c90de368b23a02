package com.chicu.gridbot.trading.trade;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Журнал исполнений: одна строка на каждое замеченное исполнение уровня.
 */
@Entity
@Table(name = "trade_logs", indexes = @Index(name = "ix_trade_logs_symbol", columnList = "symbol"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String symbol;
    private Integer levelIndex;
    private String side; // BUY / SELL

    private String orderRef;

    @Column(precision = 38, scale = 18)
    private BigDecimal entryPrice;
    @Column(precision = 38, scale = 18)
    private BigDecimal price;
    @Column(precision = 38, scale = 18)
    private BigDecimal volume;
    @Column(precision = 38, scale = 18)
    private BigDecimal pnl;
    @Column(precision = 38, scale = 18)
    private BigDecimal pnlPct;

    private Instant filledAt;
}
