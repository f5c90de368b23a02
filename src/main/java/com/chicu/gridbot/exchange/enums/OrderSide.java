package com.chicu.gridbot.exchange.enums;

public enum OrderSide {
    BUY,
    SELL;

    /** Противоположная сторона: для зеркального ордера. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
