package com.chicu.gridbot.strategy.grid.model;

import com.chicu.gridbot.strategy.grid.exception.GridConfigException;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Arrays;

/**
 * Фиксированная таблица уровней риска. Выбирается один раз при старте по RISK_LEVEL 1..5.
 */
@Getter
public enum RiskProfile {

    CONSERVATIVE(1, 60, 8, "0.002", "Консервативный"),
    MODERATE(2, 70, 10, "0.0015", "Умеренный"),
    ACTIVE(3, 80, 12, "0.001", "Активный"),
    AGGRESSIVE(4, 90, 15, "0.0008", "Агрессивный"),
    EXTREME(5, 95, 20, "0.0005", "Экстремальный");

    private final int id;
    /** Какая доля депозита идёт в торговлю, % */
    private final int depositPercent;
    private final int levelCount;
    private final BigDecimal spread;
    private final String label;

    RiskProfile(int id, int depositPercent, int levelCount, String spread, String label) {
        this.id = id;
        this.depositPercent = depositPercent;
        this.levelCount = levelCount;
        this.spread = new BigDecimal(spread);
        this.label = label;
    }

    public static RiskProfile byId(int id) {
        return Arrays.stream(values())
                .filter(p -> p.id == id)
                .findFirst()
                .orElseThrow(() -> new GridConfigException(
                        "Уровень риска должен быть от 1 до " + values().length + ", получен: " + id));
    }
}
