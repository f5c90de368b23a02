package com.chicu.gridbot.strategy.grid.service;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.strategy.grid.model.LevelStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Долговременное хранилище уровней, ключ — (symbol, levelIndex, side).
 * Каждая запись синхронная: метод возвращается только после того, как строка сохранена.
 * Ошибка хранилища выбрасывается как
 * {@link com.chicu.gridbot.strategy.grid.exception.LedgerPersistenceException}.
 */
public interface LevelLedger {

    /** Вставка или полная перезапись строки значениями уровня. */
    default GridLevel upsertLevel(GridLevel level) {
        return upsertLevel(level, false);
    }

    /**
     * Вставка или перезапись. При {@code preserveOrderState = true} у существующей строки
     * обновляются только amount и price, а orderRef/status/entryPrice остаются прежними.
     *
     * @return уровень в том виде, в каком он сохранён
     */
    GridLevel upsertLevel(GridLevel level, boolean preserveOrderState);

    /** Все сетки: символ → уровни, отсортированные по (levelIndex, side). По ключу — только самая свежая строка. */
    Map<String, List<GridLevel>> loadGrids();

    GridLevel updateStatus(String symbol, int levelIndex, OrderSide side, LevelStatus status);

    GridLevel updateOrder(String symbol, int levelIndex, OrderSide side,
                          BigDecimal price, String orderRef, LevelStatus status);

    /**
     * Одноразовая чистка старых дублей: по каждому ключу остаётся самая свежая строка.
     *
     * @return сколько строк удалено
     */
    int compact();
}
