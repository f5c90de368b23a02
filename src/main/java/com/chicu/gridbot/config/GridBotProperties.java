package com.chicu.gridbot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Параметры сетки из application.properties (префикс {@code grid}).
 * Сырые значения: проверяются и сворачиваются в неизменяемый GridConfig при старте.
 */
@ConfigurationProperties(prefix = "grid")
@Data
public class GridBotProperties {

    /** Торговые пары в порядке приоритета, например DOGEUSDT,XRPUSDT */
    private List<String> symbols = new ArrayList<>();

    private String quoteCurrency = "USDT";

    /**
     * Профиль риска 1..5. Используется, если явная тройка
     * levelCount/spread/levelNotional не задана.
     */
    private Integer riskLevel = 3;

    // явная тройка: либо все три, либо ни одного
    private Integer levelCount;
    private BigDecimal spread;
    private BigDecimal levelNotional;

    private BigDecimal logMultiplier = new BigDecimal("1.5");

    private int priceDecimals = 6;
    private int amountDecimals = 8;

    private Duration tickInterval = Duration.ofSeconds(10);

    /** Запускать цикл сразу после старта приложения */
    private boolean autostart = true;

    private Backoff backoff = new Backoff();

    public boolean hasExplicitTriple() {
        return levelCount != null || spread != null || levelNotional != null;
    }

    @Data
    public static class Backoff {
        /** Пауза после первой ошибки символа */
        private Duration initial = Duration.ofSeconds(10);
        /** Потолок экспоненциальной паузы */
        private Duration max = Duration.ofMinutes(5);
        /** Сколько ошибок подряд до отключения символа */
        private int failureThreshold = 5;
        private Duration suspendFor = Duration.ofMinutes(30);
    }
}
