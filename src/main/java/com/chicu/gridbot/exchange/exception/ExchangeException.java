package com.chicu.gridbot.exchange.exception;

/**
 * Базовая ошибка шлюза биржи. Считается временной: вызывающий код
 * логирует её и повторяет операцию на следующем тике.
 */
public class ExchangeException extends RuntimeException {

    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
