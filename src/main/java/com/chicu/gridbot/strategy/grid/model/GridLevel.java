package com.chicu.gridbot.strategy.grid.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Одна ступень сетки. Рабочая копия строки журнала уровней.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GridLevel {

    private String symbol;
    private int levelIndex;
    private OrderSide side;

    private BigDecimal price;
    /** Объём в BASE, одинаковый для всех уровней сетки */
    private BigDecimal baseAmount;

    /** ID ордера на бирже, null пока ордер не выставлен */
    private String orderRef;
    private LevelStatus status;

    /**
     * Цена исполнения, породившая зеркальный ордер на этом слоте.
     * Нужна для PnL и чтобы отложенное зеркало сохранило свою цену.
     */
    private BigDecimal entryPrice;

    private Instant updatedAt;

    public LevelKey key() {
        return LevelKey.of(this);
    }

    /** Слот занят живым ордером на бирже. */
    public boolean isLive() {
        return status == LevelStatus.ACTIVE && orderRef != null;
    }

    /** Отложенное зеркало: ждёт средств по своей цене, а не по текущей рыночной. */
    public boolean isDeferredMirror() {
        return status == LevelStatus.PENDING && entryPrice != null;
    }
}
