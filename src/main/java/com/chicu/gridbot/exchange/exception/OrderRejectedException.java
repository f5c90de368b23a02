package com.chicu.gridbot.exchange.exception;

import lombok.Getter;

/** Биржа отклонила ордер: нехватка маржи, неверный шаг цены и т.п. */
@Getter
public class OrderRejectedException extends ExchangeException {

    private final String reason;

    public OrderRejectedException(String reason) {
        super("Ордер отклонён: " + reason);
        this.reason = reason;
    }
}
