package com.chicu.gridbot.config;

import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.exception.ExchangeException;
import com.chicu.gridbot.strategy.grid.exception.GridConfigException;
import com.chicu.gridbot.strategy.grid.model.GridConfig;
import com.chicu.gridbot.strategy.grid.service.RiskProfileResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;

@Slf4j
@Configuration(proxyBeanMethods = false)
public class GridEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Неизменяемые параметры сетки. Ошибка здесь останавливает запуск приложения.
     * Для профиля риска депозит = свободный баланс валюты котировки на момент старта.
     */
    @Bean
    public GridConfig gridConfig(GridBotProperties props, RiskProfileResolver resolver, ExchangeClient exchange) {
        return resolver.resolve(props, () -> {
            try {
                BigDecimal deposit = exchange.getFreeBalance(props.getQuoteCurrency());
                log.info("💼 Депозит для расчёта профиля риска: {} {}", deposit.toPlainString(), props.getQuoteCurrency());
                return deposit;
            } catch (ExchangeException e) {
                throw new GridConfigException("Не удалось получить депозит " + props.getQuoteCurrency()
                                              + " для профиля риска: " + e.getMessage(), e);
            }
        });
    }
}
