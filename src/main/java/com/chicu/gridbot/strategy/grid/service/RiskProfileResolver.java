package com.chicu.gridbot.strategy.grid.service;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.strategy.grid.exception.GridConfigException;
import com.chicu.gridbot.strategy.grid.model.GridConfig;
import com.chicu.gridbot.strategy.grid.model.RiskProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Превращает настройки в неизменяемый {@link GridConfig}.
 * Два пути: профиль риска + депозит, либо явная тройка levelCount/spread/levelNotional.
 * Все проверки собраны в {@link #validate(GridConfig)}.
 */
@Slf4j
@Component
public class RiskProfileResolver {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final MathContext MC = MathContext.DECIMAL64;

    /**
     * Выбор пути по настройкам. Депозит запрашивается только для профиля риска.
     */
    public GridConfig resolve(GridBotProperties props, Supplier<BigDecimal> totalDeposit) {
        if (props.hasExplicitTriple()) {
            return explicit(props);
        }
        if (props.getRiskLevel() == null) {
            throw new GridConfigException("Не задан ни grid.risk-level, ни явная тройка level-count/spread/level-notional");
        }
        return fromRiskProfile(props.getRiskLevel(), totalDeposit.get(), props);
    }

    public GridConfig fromRiskProfile(int riskSelector, BigDecimal totalDeposit, GridBotProperties props) {
        RiskProfile profile = RiskProfile.byId(riskSelector);
        List<String> symbols = normalizeSymbols(props.getSymbols(), props.getQuoteCurrency());
        if (totalDeposit == null || totalDeposit.signum() <= 0) {
            throw new GridConfigException("Депозит должен быть > 0, получено: " + totalDeposit);
        }

        // (депозит * % / 100 / кол-во символов) / кол-во уровней
        BigDecimal notional = totalDeposit
                .multiply(BigDecimal.valueOf(profile.getDepositPercent()))
                .divide(HUNDRED, MC)
                .divide(BigDecimal.valueOf(symbols.size()), MC)
                .divide(BigDecimal.valueOf(profile.getLevelCount()), MC);

        GridConfig config = baseBuilder(props, symbols)
                .levelCount(profile.getLevelCount())
                .spread(profile.getSpread())
                .levelNotional(notional)
                .build();

        log.info("🎯 Профиль риска {} ({}): депозит={} {}, уровней={}, spread={}, на уровень={}",
                profile.getId(), profile.getLabel(), totalDeposit, config.getQuoteCurrency(),
                config.getLevelCount(), config.getSpread(), notional.toPlainString());
        return validate(config);
    }

    public GridConfig explicit(GridBotProperties props) {
        if (props.getLevelCount() == null || props.getSpread() == null || props.getLevelNotional() == null) {
            throw new GridConfigException("Явная тройка задана не полностью: level-count=" + props.getLevelCount()
                                          + ", spread=" + props.getSpread() + ", level-notional=" + props.getLevelNotional());
        }
        List<String> symbols = normalizeSymbols(props.getSymbols(), props.getQuoteCurrency());
        GridConfig config = baseBuilder(props, symbols)
                .levelCount(props.getLevelCount())
                .spread(props.getSpread())
                .levelNotional(props.getLevelNotional())
                .build();
        log.info("🎯 Явные параметры сетки: уровней={}, spread={}, на уровень={}",
                config.getLevelCount(), config.getSpread(), config.getLevelNotional());
        return validate(config);
    }

    /**
     * Центральная проверка. Возвращает тот же объект, чтобы можно было писать {@code return validate(cfg)}.
     */
    public GridConfig validate(GridConfig c) {
        if (c.getSymbols() == null || c.getSymbols().isEmpty()) {
            throw new GridConfigException("Список символов пуст");
        }
        Set<String> unique = new LinkedHashSet<>(c.getSymbols());
        if (unique.size() != c.getSymbols().size()) {
            throw new GridConfigException("Символы повторяются: " + c.getSymbols());
        }
        for (String s : c.getSymbols()) {
            if (!s.endsWith(c.getQuoteCurrency()) || s.length() == c.getQuoteCurrency().length()) {
                throw new GridConfigException("Символ " + s + " не котируется в " + c.getQuoteCurrency());
            }
        }
        if (c.getLevelCount() <= 0) {
            throw new GridConfigException("levelCount должен быть > 0, получено: " + c.getLevelCount());
        }
        if (c.getSpread() == null || c.getSpread().signum() <= 0) {
            throw new GridConfigException("spread должен быть > 0, получено: " + c.getSpread());
        }
        if (c.getLevelNotional() == null || c.getLevelNotional().signum() <= 0) {
            throw new GridConfigException("levelNotional должен быть > 0, получено: " + c.getLevelNotional());
        }
        if (c.getLogMultiplier() == null || c.getLogMultiplier().compareTo(BigDecimal.ONE) < 0) {
            throw new GridConfigException("logMultiplier должен быть >= 1, получено: " + c.getLogMultiplier());
        }
        if (c.getPriceDecimals() < 0 || c.getAmountDecimals() < 0) {
            throw new GridConfigException("Количество знаков не может быть отрицательным");
        }
        // дальний BUY уровень должен остаться выше нуля
        BigDecimal farthest = c.distance(c.getLevelCount() - 1);
        if (farthest.compareTo(BigDecimal.ONE) >= 0) {
            throw new GridConfigException("Дальний уровень уходит на " + farthest.multiply(HUNDRED).toPlainString()
                                          + "% от цены: уменьшите spread, logMultiplier или levelCount");
        }
        return c;
    }

    private static GridConfig.GridConfigBuilder baseBuilder(GridBotProperties props, List<String> symbols) {
        return GridConfig.builder()
                .symbols(symbols)
                .quoteCurrency(props.getQuoteCurrency().trim().toUpperCase(Locale.ROOT))
                .logMultiplier(props.getLogMultiplier())
                .priceDecimals(props.getPriceDecimals())
                .amountDecimals(props.getAmountDecimals());
    }

    /** "doge/usdt" → "DOGEUSDT" */
    private static List<String> normalizeSymbols(List<String> raw, String quote) {
        if (raw == null || raw.isEmpty()) {
            throw new GridConfigException("Список символов пуст (grid.symbols)");
        }
        if (quote == null || quote.isBlank()) {
            throw new GridConfigException("Не задана валюта котировки (grid.quote-currency)");
        }
        List<String> out = new ArrayList<>(raw.size());
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            out.add(s.replace("/", "").trim().toUpperCase(Locale.ROOT));
        }
        if (out.isEmpty()) {
            throw new GridConfigException("Список символов пуст (grid.symbols): " + raw);
        }
        return out;
    }
}
