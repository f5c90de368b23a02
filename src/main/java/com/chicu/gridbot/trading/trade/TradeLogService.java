package com.chicu.gridbot.trading.trade;

import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.trading.trade.model.TradeLogEntry;

import java.math.BigDecimal;
import java.util.Optional;

public interface TradeLogService {

    /**
     * Записать исполнение уровня. Если у уровня есть entryPrice (зеркальный ордер),
     * считается реализованный PnL пары сделок.
     */
    TradeLogEntry logFill(GridLevel filled);

    /** Суммарный реализованный PnL по символу */
    Optional<BigDecimal> getTotalPnl(String symbol);
}
