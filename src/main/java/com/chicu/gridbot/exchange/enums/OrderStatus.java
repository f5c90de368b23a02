package com.chicu.gridbot.exchange.enums;

import java.util.Locale;

/**
 * Нормализованный статус ордера на бирже.
 * Частичное исполнение не моделируем: PARTIALLY_FILLED считается ещё открытым ордером.
 */
public enum OrderStatus {
    NEW,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED,
    EXPIRED,
    UNKNOWN;

    public boolean isOpen() {
        return this == NEW || this == PARTIALLY_FILLED;
    }

    /** Ордер снят биржей или пользователем, исполнения не было. */
    public boolean isCancelledLike() {
        return this == CANCELLED || this == REJECTED || this == EXPIRED;
    }

    /**
     * Bybit отдаёт статусы в CamelCase: New / PartiallyFilled / Filled / Cancelled /
     * PartiallyFilledCanceled / Rejected / Deactivated ...
     */
    public static OrderStatus fromExchange(String raw) {
        if (raw == null || raw.isBlank()) return UNKNOWN;
        String s = raw.trim().replace("_", "").toUpperCase(Locale.ROOT);
        return switch (s) {
            case "NEW", "CREATED", "UNTRIGGERED", "ACTIVE" -> NEW;
            case "PARTIALLYFILLED" -> PARTIALLY_FILLED;
            case "FILLED" -> FILLED;
            case "CANCELLED", "CANCELED", "PARTIALLYFILLEDCANCELED", "DEACTIVATED" -> CANCELLED;
            case "REJECTED" -> REJECTED;
            case "EXPIRED" -> EXPIRED;
            default -> UNKNOWN;
        };
    }
}
