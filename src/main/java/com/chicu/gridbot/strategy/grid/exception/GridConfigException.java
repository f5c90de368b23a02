package com.chicu.gridbot.strategy.grid.exception;

/** Неверная конфигурация сетки. Фатальна: процесс не должен стартовать. */
public class GridConfigException extends RuntimeException {

    public GridConfigException(String message) {
        super(message);
    }

    public GridConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
