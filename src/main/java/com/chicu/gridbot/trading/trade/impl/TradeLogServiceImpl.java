package com.chicu.gridbot.trading.trade.impl;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.strategy.grid.exception.LedgerPersistenceException;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.trading.trade.TradeLogEntity;
import com.chicu.gridbot.trading.trade.TradeLogRepository;
import com.chicu.gridbot.trading.trade.TradeLogService;
import com.chicu.gridbot.trading.trade.model.TradeLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TradeLogServiceImpl implements TradeLogService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradeLogRepository repo;
    private final Clock clock;

    @Override
    @Transactional
    public TradeLogEntry logFill(GridLevel filled) {
        BigDecimal entry = filled.getEntryPrice();
        BigDecimal price = filled.getPrice();
        BigDecimal volume = filled.getBaseAmount();

        BigDecimal pnl = null;
        BigDecimal pnlPct = null;
        if (entry != null && entry.signum() > 0) {
            // SELL закрывает покупку по entry, BUY — откупает проданное по entry
            BigDecimal perUnit = filled.getSide() == OrderSide.SELL ? price.subtract(entry) : entry.subtract(price);
            pnl = perUnit.multiply(volume);
            pnlPct = perUnit.divide(entry, MathContext.DECIMAL64).multiply(HUNDRED);
        }

        TradeLogEntity entity = TradeLogEntity.builder()
                .symbol(filled.getSymbol())
                .levelIndex(filled.getLevelIndex())
                .side(filled.getSide().name())
                .orderRef(filled.getOrderRef())
                .entryPrice(entry)
                .price(price)
                .volume(volume)
                .pnl(pnl)
                .pnlPct(pnlPct)
                .filledAt(Instant.now(clock))
                .build();

        try {
            repo.save(entity);
        } catch (DataAccessException e) {
            throw new LedgerPersistenceException("Не удалось записать сделку " + filled.key() + ": " + e.getMessage(), e);
        }
        log.info("💾 Записана сделка: symbol={} level={} side={} entry={} price={} volume={} pnl={}",
                entity.getSymbol(), entity.getLevelIndex(), entity.getSide(),
                entity.getEntryPrice(), entity.getPrice(), entity.getVolume(), entity.getPnl());
        return toEntry(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BigDecimal> getTotalPnl(String symbol) {
        return Optional.ofNullable(repo.sumPnlBySymbol(symbol));
    }

    private static TradeLogEntry toEntry(TradeLogEntity e) {
        return TradeLogEntry.builder()
                .symbol(e.getSymbol())
                .levelIndex(e.getLevelIndex())
                .side(e.getSide())
                .orderRef(e.getOrderRef())
                .entryPrice(e.getEntryPrice())
                .price(e.getPrice())
                .volume(e.getVolume())
                .pnl(e.getPnl())
                .pnlPct(e.getPnlPct())
                .filledAt(e.getFilledAt())
                .build();
    }
}
