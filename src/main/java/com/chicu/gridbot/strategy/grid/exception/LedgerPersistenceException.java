package com.chicu.gridbot.strategy.grid.exception;

/**
 * Запись в журнал уровней не прошла. Переход состояния, который не удалось сохранить,
 * не считается совершённым; ошибка фатальна для процесса.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message) {
        super(message);
    }

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
