package com.chicu.gridbot.trading.trade.model;

import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Исполнение уровня в виде, удобном для логов и уведомлений.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLogEntry {

    private String symbol;
    private Integer levelIndex;
    private String side; // BUY / SELL
    private String orderRef;

    /** Цена исполнения, породившая этот ордер; null у обычного уровня сетки */
    private BigDecimal entryPrice;
    private BigDecimal price;
    private BigDecimal volume;
    private BigDecimal pnl;
    private BigDecimal pnlPct;

    private Instant filledAt;
}
