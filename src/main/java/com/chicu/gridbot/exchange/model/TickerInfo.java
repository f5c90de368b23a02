// src/main/java/com/chicu/gridbot/exchange/model/TickerInfo.java
package com.chicu.gridbot.exchange.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Снимок тикера по одному символу. Все поля обязательны:
 * клиент биржи не подставляет значения по умолчанию.
 */
@Value
@Builder
public class TickerInfo {
    BigDecimal bid;
    BigDecimal ask;
    /** Цена последней сделки, используется как опорная цена сетки */
    BigDecimal last;
    /** Объём за 24ч в базовой валюте */
    BigDecimal volume;
}
