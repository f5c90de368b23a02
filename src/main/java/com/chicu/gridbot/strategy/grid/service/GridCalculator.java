package com.chicu.gridbot.strategy.grid.service;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.strategy.grid.exception.GridConfigException;
import com.chicu.gridbot.strategy.grid.model.GridConfig;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.strategy.grid.model.LevelStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Логарифмическая лестница уровней вокруг опорной цены.
 * <p>
 * Уровень i отстоит от цены на spread * logMultiplier^i: у цены уровни плотные,
 * к краям редеют.
 */
@Component
public class GridCalculator {

    /**
     * Строит 2 * levelCount уровней в порядке (levelIndex, BUY, SELL), все PENDING без ордера.
     *
     * @throws GridConfigException если после округления цены не строго монотонны
     *                             или BUY уровень ушёл в ноль
     */
    public List<GridLevel> buildGrid(String symbol, BigDecimal referencePrice, GridConfig config) {
        if (referencePrice == null || referencePrice.signum() <= 0) {
            throw new IllegalArgumentException("Опорная цена должна быть > 0: " + referencePrice);
        }
        if (config.getLogMultiplier().compareTo(BigDecimal.ONE) < 0) {
            throw new GridConfigException("logMultiplier < 1 ломает монотонность сетки: " + config.getLogMultiplier());
        }

        BigDecimal baseAmount = baseAmount(referencePrice, config);
        List<GridLevel> levels = new ArrayList<>(config.getLevelCount() * 2);

        BigDecimal prevBuy = referencePrice;
        BigDecimal prevSell = referencePrice;
        for (int i = 0; i < config.getLevelCount(); i++) {
            BigDecimal buy = levelPrice(OrderSide.BUY, i, referencePrice, config);
            BigDecimal sell = levelPrice(OrderSide.SELL, i, referencePrice, config);

            if (buy.signum() <= 0) {
                throw new GridConfigException("BUY уровень " + i + " " + symbol + " ушёл в " + buy.toPlainString());
            }
            if (buy.compareTo(prevBuy) >= 0 || sell.compareTo(prevSell) <= 0) {
                throw new GridConfigException("Уровни " + symbol + " не монотонны на индексе " + i
                                              + " (buy=" + buy.toPlainString() + ", sell=" + sell.toPlainString()
                                              + "): не хватает точности priceDecimals=" + config.getPriceDecimals());
            }
            prevBuy = buy;
            prevSell = sell;

            levels.add(pending(symbol, i, OrderSide.BUY, buy, baseAmount));
            levels.add(pending(symbol, i, OrderSide.SELL, sell, baseAmount));
        }
        return levels;
    }

    /**
     * Цена уровня от произвольной опорной цены. Та же формула используется
     * при перестройке слота и для зеркального ордера.
     */
    public BigDecimal levelPrice(OrderSide side, int levelIndex, BigDecimal referencePrice, GridConfig config) {
        BigDecimal d = config.distance(levelIndex);
        BigDecimal factor = side == OrderSide.BUY ? BigDecimal.ONE.subtract(d) : BigDecimal.ONE.add(d);
        return referencePrice.multiply(factor).setScale(config.getPriceDecimals(), RoundingMode.HALF_UP);
    }

    /** levelNotional / цена, вниз до amountDecimals: лучше недобрать, чем упереться в баланс. */
    public BigDecimal baseAmount(BigDecimal referencePrice, GridConfig config) {
        return config.getLevelNotional()
                .divide(referencePrice, MathContext.DECIMAL64)
                .setScale(config.getAmountDecimals(), RoundingMode.DOWN);
    }

    private static GridLevel pending(String symbol, int idx, OrderSide side, BigDecimal price, BigDecimal amount) {
        return GridLevel.builder()
                .symbol(symbol)
                .levelIndex(idx)
                .side(side)
                .price(price)
                .baseAmount(amount)
                .status(LevelStatus.PENDING)
                .build();
    }
}
