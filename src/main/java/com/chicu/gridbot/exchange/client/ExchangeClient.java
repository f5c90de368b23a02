package com.chicu.gridbot.exchange.client;

import com.chicu.gridbot.exchange.enums.OrderStatus;
import com.chicu.gridbot.exchange.model.OrderInfo;
import com.chicu.gridbot.exchange.model.OrderRequest;
import com.chicu.gridbot.exchange.model.TickerInfo;

import java.math.BigDecimal;
import java.util.List;

/**
 * Шлюз биржи для сеточного движка. Все вызовы синхронные; таймауты — забота реализации.
 * Любая ошибка сети или разбора ответа выбрасывается как
 * {@link com.chicu.gridbot.exchange.exception.ExchangeException} или её наследник.
 */
public interface ExchangeClient {

    /**
     * Текущие bid/ask/last/объём.
     *
     * @throws com.chicu.gridbot.exchange.exception.MarketDataException символ неизвестен или биржа недоступна
     */
    TickerInfo getTicker(String symbol);

    /**
     * Свободный баланс валюты (0, если валюты на счёте нет).
     */
    BigDecimal getFreeBalance(String currency);

    /**
     * Открытые ордера.
     *
     * @param symbol тикер или {@code null} — все символы аккаунта
     */
    List<OrderInfo> getOpenOrders(String symbol);

    /**
     * Размещение лимитного ордера.
     *
     * @return ID ордера на бирже
     * @throws com.chicu.gridbot.exchange.exception.OrderRejectedException отказ биржи
     */
    String placeLimitOrder(OrderRequest request);

    /**
     * Статус конкретного ордера.
     *
     * @throws com.chicu.gridbot.exchange.exception.OrderNotFoundException ордер бирже неизвестен
     */
    OrderStatus getOrderStatus(String orderId, String symbol);

    /**
     * Отменить ордер.
     *
     * @throws com.chicu.gridbot.exchange.exception.OrderNotFoundException ордер уже не существует
     */
    void cancelOrder(String orderId, String symbol);
}
