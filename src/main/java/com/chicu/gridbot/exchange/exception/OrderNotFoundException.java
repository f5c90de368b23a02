package com.chicu.gridbot.exchange.exception;

import lombok.Getter;

/**
 * Биржа не знает такой ордер. Это неоднозначно: ордер мог исполниться и уйти из истории,
 * а мог и не существовать вовсе. Вызывающий код не должен предполагать ни то, ни другое.
 */
@Getter
public class OrderNotFoundException extends ExchangeException {

    private final String orderId;

    public OrderNotFoundException(String orderId, String symbol) {
        super("Ордер " + orderId + " (" + symbol + ") не найден на бирже");
        this.orderId = orderId;
    }
}
