package com.chicu.gridbot.strategy.grid.service;

import com.chicu.gridbot.exchange.enums.OrderSide;

import java.math.BigDecimal;

/**
 * Проверка свободного капитала перед размещением одного ордера.
 * Ничего не кэширует и ничего не меняет: каждый вызов заново спрашивает биржу.
 */
public interface BalanceGuard {

    BalanceVerdict check(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price);
}
