package com.chicu.gridbot.strategy.grid.service.impl;

import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.model.OrderInfo;
import com.chicu.gridbot.strategy.grid.model.GridConfig;
import com.chicu.gridbot.strategy.grid.service.BalanceGuard;
import com.chicu.gridbot.strategy.grid.service.BalanceVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * BUY: нужно q*p в QUOTE; доступно = свободный QUOTE − Σ(qty*price) всех открытых BUY
 * по парам с той же валютой котировки.
 * <br>
 * SELL: нужно q в BASE; доступно = свободный BASE − Σ qty открытых SELL по этой паре.
 * <p>
 * Резервы пересчитываются всегда, даже если биржа уже вычла их из «free».
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExchangeBalanceGuard implements BalanceGuard {

    private final ExchangeClient exchange;
    private final GridConfig config;

    @Override
    public BalanceVerdict check(String symbol, OrderSide side, BigDecimal quantity, BigDecimal price) {
        BalanceVerdict verdict = side == OrderSide.BUY
                ? checkBuy(quantity.multiply(price))
                : checkSell(symbol, quantity);

        if (!verdict.isSufficient()) {
            log.debug("💰 {} {} {}@{}: нужно {}, доступно {}, не хватает {}",
                    symbol, side, quantity.toPlainString(), price.toPlainString(),
                    verdict.getRequired().toPlainString(), verdict.getAvailable().toPlainString(),
                    verdict.getShortfall().toPlainString());
        }
        return verdict;
    }

    private BalanceVerdict checkBuy(BigDecimal required) {
        String quote = config.getQuoteCurrency();
        BigDecimal free = exchange.getFreeBalance(quote);

        // все открытые ордера аккаунта: BUY на любой паре в той же валюте котировки занимает QUOTE
        List<OrderInfo> open = exchange.getOpenOrders(null);
        BigDecimal reserved = open.stream()
                .filter(o -> o.getSide() == OrderSide.BUY)
                .filter(o -> o.getSymbol() != null && o.getSymbol().endsWith(quote))
                .map(OrderInfo::getNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return BalanceVerdict.of(required, free.subtract(reserved));
    }

    private BalanceVerdict checkSell(String symbol, BigDecimal required) {
        BigDecimal free = exchange.getFreeBalance(config.baseCurrency(symbol));

        BigDecimal reserved = exchange.getOpenOrders(symbol).stream()
                .filter(o -> o.getSide() == OrderSide.SELL)
                .filter(o -> symbol.equals(o.getSymbol()))
                .map(OrderInfo::getQty)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return BalanceVerdict.of(required, free.subtract(reserved));
    }
}
