package com.chicu.gridbot.exchange.exception;

/** Неизвестный символ, недоступная биржа или ответ без обязательного поля. */
public class MarketDataException extends ExchangeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
