package com.chicu.gridbot.strategy.grid.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import lombok.Value;

import java.util.Optional;

/**
 * Идентичность уровня: (symbol, levelIndex, side). В журнале не может быть двух строк с одним ключом.
 * Этот же ключ зашит в clientOrderId ордера, чтобы после падения опознать свой ордер на бирже.
 */
@Value
public class LevelKey {

    private static final String PREFIX = "g";
    /** Bybit: orderLinkId не длиннее 36 символов */
    private static final int MAX_CLIENT_ID = 36;

    String symbol;
    int levelIndex;
    OrderSide side;

    public static LevelKey of(GridLevel level) {
        return new LevelKey(level.getSymbol(), level.getLevelIndex(), level.getSide());
    }

    public String toClientOrderId(long nonce) {
        String id = PREFIX + "-" + symbol + "-" + levelIndex + "-" + side.name().charAt(0) + "-" + Long.toString(nonce, 36);
        return id.length() <= MAX_CLIENT_ID ? id : id.substring(0, MAX_CLIENT_ID);
    }

    /** g-DOGEUSDT-3-B-lq2x9k0a → (DOGEUSDT, 3, BUY); чужие идентификаторы → empty. */
    public static Optional<LevelKey> fromClientOrderId(String clientOrderId) {
        if (clientOrderId == null) return Optional.empty();
        String[] parts = clientOrderId.split("-");
        if (parts.length != 5 || !PREFIX.equals(parts[0])) return Optional.empty();
        OrderSide side = switch (parts[3]) {
            case "B" -> OrderSide.BUY;
            case "S" -> OrderSide.SELL;
            default -> null;
        };
        if (side == null) return Optional.empty();
        try {
            return Optional.of(new LevelKey(parts[1], Integer.parseInt(parts[2]), side));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return symbol + "#" + levelIndex + "/" + side;
    }
}
