package com.chicu.gridbot.strategy.grid.service;

import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.exception.ExchangeException;
import com.chicu.gridbot.exchange.exception.OrderNotFoundException;
import com.chicu.gridbot.exchange.model.OrderRequest;
import com.chicu.gridbot.notify.GridNotifier;
import com.chicu.gridbot.strategy.grid.model.GridConfig;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.strategy.grid.model.LevelStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Зеркальный ордер после исполнения уровня: противоположная сторона, тот же индекс,
 * цена = цена исполнения * (1 ± distance(levelIndex)), тот же объём.
 * <p>
 * Если денег нет или биржа отказала, слот остаётся PENDING по зеркальной цене
 * (entryPrice = цена исполнения) и добирается следующими тиками.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MirrorOrderGenerator {

    private final GridCalculator calculator;
    private final BalanceGuard balanceGuard;
    private final ExchangeClient exchange;
    private final LevelLedger ledger;
    private final GridNotifier notifier;
    private final GridConfig config;

    /**
     * @param filled   исполнившийся уровень (цена уровня = цена исполнения лимитки)
     * @param opposite текущее состояние слота (symbol, levelIndex, side'), может быть null
     * @return новое состояние противоположного слота, уже записанное в журнал;
     *         сам {@code opposite}, если его ордер снять не удалось (вызывающий повторит позже)
     */
    public GridLevel onFill(GridLevel filled, GridLevel opposite) {
        OrderSide mirrorSide = filled.getSide().opposite();
        BigDecimal filledPrice = filled.getPrice();
        BigDecimal mirrorPrice = calculator.levelPrice(mirrorSide, filled.getLevelIndex(), filledPrice, config);

        GridLevel mirror = GridLevel.builder()
                .symbol(filled.getSymbol())
                .levelIndex(filled.getLevelIndex())
                .side(mirrorSide)
                .price(mirrorPrice)
                .baseAmount(filled.getBaseAmount())
                .entryPrice(filledPrice)
                .status(LevelStatus.PENDING)
                .build();

        // слот занят живым ордером — сначала снимаем его
        if (opposite != null && opposite.isLive() && !cancelReplaced(opposite)) {
            notifier.send("⚠️ " + mirror.key() + ": зеркало отложено до следующего тика, не удалось снять ордер " + opposite.getOrderRef());
            return opposite;
        }

        BalanceVerdict verdict;
        try {
            verdict = balanceGuard.check(mirror.getSymbol(), mirrorSide, mirror.getBaseAmount(), mirrorPrice);
        } catch (ExchangeException e) {
            log.warn("⏸ Зеркало {} отложено: баланс недоступен ({})", mirror.key(), e.getMessage());
            return defer(mirror);
        }
        if (!verdict.isSufficient()) {
            log.info("⏸ Зеркало {} @{} отложено: не хватает {}", mirror.key(),
                    mirrorPrice.toPlainString(), verdict.getShortfall().toPlainString());
            return defer(mirror);
        }

        String orderId;
        try {
            orderId = exchange.placeLimitOrder(OrderRequest.builder()
                    .symbol(mirror.getSymbol())
                    .side(mirrorSide)
                    .quantity(mirror.getBaseAmount())
                    .price(mirrorPrice)
                    .clientOrderId(mirror.key().toClientOrderId(System.currentTimeMillis()))
                    .build());
        } catch (ExchangeException e) {
            log.warn("⏸ Зеркало {} @{} отклонено биржей: {}", mirror.key(), mirrorPrice.toPlainString(), e.getMessage());
            return defer(mirror);
        }

        GridLevel placed = ledger.upsertLevel(mirror.toBuilder()
                .orderRef(orderId)
                .status(LevelStatus.ACTIVE)
                .build());
        log.info("🪞 Зеркало {} @{} (исполнено @{}) → ордер {}", placed.key(),
                mirrorPrice.toPlainString(), filledPrice.toPlainString(), orderId);
        notifier.send("🪞 " + placed.key() + " @" + mirrorPrice.toPlainString() + " после исполнения @" + filledPrice.toPlainString());
        return placed;
    }

    private boolean cancelReplaced(GridLevel opposite) {
        try {
            exchange.cancelOrder(opposite.getOrderRef(), opposite.getSymbol());
            log.info("✖ Снят ордер {} слота {} под зеркало", opposite.getOrderRef(), opposite.key());
            return true;
        } catch (OrderNotFoundException e) {
            log.warn("⚠️ Ордер {} слота {} уже не существует на бирже, ставлю зеркало", opposite.getOrderRef(), opposite.key());
            return true;
        } catch (ExchangeException e) {
            log.warn("⚠️ Не удалось снять ордер {} слота {}: {}", opposite.getOrderRef(), opposite.key(), e.getMessage());
            return false;
        }
    }

    private GridLevel defer(GridLevel mirror) {
        return ledger.upsertLevel(mirror);
    }
}
