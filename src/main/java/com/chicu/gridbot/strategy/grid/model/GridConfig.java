package com.chicu.gridbot.strategy.grid.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Параметры сетки на всё время жизни процесса. Создаётся один раз при старте
 * ({@link com.chicu.gridbot.strategy.grid.service.RiskProfileResolver}) и дальше только читается.
 */
@Value
@Builder(toBuilder = true)
public class GridConfig {

    /** Порядок символов = приоритет обработки в тике */
    @Singular
    List<String> symbols;

    String quoteCurrency;

    int levelCount;

    /** Базовое расстояние до ближнего уровня, доля (0.001 = 0.1%) */
    BigDecimal spread;

    /** QUOTE на один уровень */
    BigDecimal levelNotional;

    /** Множитель логарифмической сетки, >= 1 */
    BigDecimal logMultiplier;

    @Builder.Default
    int priceDecimals = 6;

    @Builder.Default
    int amountDecimals = 8;

    /**
     * Относительное расстояние уровня от опорной цены: spread * logMultiplier^i.
     * При множителе 1 сетка становится равномерной: spread * (i + 1).
     */
    public BigDecimal distance(int levelIndex) {
        if (logMultiplier.compareTo(BigDecimal.ONE) == 0) {
            return spread.multiply(BigDecimal.valueOf(levelIndex + 1L));
        }
        return spread.multiply(logMultiplier.pow(levelIndex));
    }

    /** DOGEUSDT → DOGE */
    public String baseCurrency(String symbol) {
        return symbol.substring(0, symbol.length() - quoteCurrency.length());
    }
}
