package com.chicu.gridbot.strategy.grid.service.impl;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.strategy.grid.exception.LedgerPersistenceException;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.strategy.grid.model.LevelStatus;
import com.chicu.gridbot.strategy.grid.repository.GridLevelRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaLevelLedger.class)
class JpaLevelLedgerTest {

    @Autowired
    private JpaLevelLedger ledger;

    @Autowired
    private GridLevelRepository repo;

    private static GridLevel level(String symbol, int idx, OrderSide side, String price) {
        return GridLevel.builder()
                .symbol(symbol)
                .levelIndex(idx)
                .side(side)
                .price(new BigDecimal(price))
                .baseAmount(new BigDecimal("0.5"))
                .status(LevelStatus.PENDING)
                .build();
    }

    @Test
    void upsertingSameLevelTwiceKeepsOneRow() {
        GridLevel l = level("DOGEUSDT", 0, OrderSide.BUY, "0.099");

        ledger.upsertLevel(l);
        ledger.upsertLevel(l);

        assertThat(repo.count()).isEqualTo(1);
    }

    @Test
    void plainUpsertResetsOrderState() {
        ledger.upsertLevel(level("DOGEUSDT", 1, OrderSide.SELL, "0.101"));
        ledger.updateOrder("DOGEUSDT", 1, OrderSide.SELL, new BigDecimal("0.101"), "ord-1", LevelStatus.ACTIVE);

        GridLevel rebuilt = ledger.upsertLevel(level("DOGEUSDT", 1, OrderSide.SELL, "0.102"));

        assertThat(rebuilt.getStatus()).isEqualTo(LevelStatus.PENDING);
        assertThat(rebuilt.getOrderRef()).isNull();
        assertThat(rebuilt.getPrice()).isEqualByComparingTo("0.102");
    }

    @Test
    void preservingUpsertOnlyTouchesPriceAndAmount() {
        ledger.upsertLevel(level("DOGEUSDT", 1, OrderSide.SELL, "0.101"));
        ledger.updateOrder("DOGEUSDT", 1, OrderSide.SELL, new BigDecimal("0.101"), "ord-1", LevelStatus.ACTIVE);

        GridLevel refreshed = ledger.upsertLevel(level("DOGEUSDT", 1, OrderSide.SELL, "0.105")
                .toBuilder().baseAmount(new BigDecimal("0.7")).build(), true);

        assertThat(refreshed.getStatus()).isEqualTo(LevelStatus.ACTIVE);
        assertThat(refreshed.getOrderRef()).isEqualTo("ord-1");
        assertThat(refreshed.getPrice()).isEqualByComparingTo("0.105");
        assertThat(refreshed.getBaseAmount()).isEqualByComparingTo("0.7");
    }

    @Test
    void loadGridsReturnsLatestStateSortedBySlot() {
        // пишем вразнобой
        ledger.upsertLevel(level("XRPUSDT", 1, OrderSide.SELL, "0.61"));
        ledger.upsertLevel(level("DOGEUSDT", 1, OrderSide.BUY, "0.098"));
        ledger.upsertLevel(level("DOGEUSDT", 0, OrderSide.SELL, "0.101"));
        ledger.upsertLevel(level("DOGEUSDT", 0, OrderSide.BUY, "0.099"));
        ledger.upsertLevel(level("XRPUSDT", 0, OrderSide.BUY, "0.59"));
        ledger.updateOrder("DOGEUSDT", 0, OrderSide.BUY, new BigDecimal("0.0991"), "ord-7", LevelStatus.ACTIVE);
        ledger.updateStatus("XRPUSDT", 1, OrderSide.SELL, LevelStatus.CANCELLED);

        Map<String, List<GridLevel>> grids = ledger.loadGrids();

        assertThat(grids).containsOnlyKeys("DOGEUSDT", "XRPUSDT");
        List<GridLevel> doge = grids.get("DOGEUSDT");
        assertThat(doge).extracting(GridLevel::getLevelIndex).containsExactly(0, 0, 1);
        assertThat(doge).extracting(GridLevel::getSide).containsExactly(OrderSide.BUY, OrderSide.SELL, OrderSide.BUY);
        assertThat(doge.get(0).getOrderRef()).isEqualTo("ord-7");
        assertThat(doge.get(0).getStatus()).isEqualTo(LevelStatus.ACTIVE);
        assertThat(doge.get(0).getPrice()).isEqualByComparingTo("0.0991");

        List<GridLevel> xrp = grids.get("XRPUSDT");
        assertThat(xrp).extracting(GridLevel::getStatus).containsExactly(LevelStatus.PENDING, LevelStatus.CANCELLED);
    }

    @Test
    void entryPriceSurvivesRoundTrip() {
        ledger.upsertLevel(level("DOGEUSDT", 2, OrderSide.SELL, "100.225").toBuilder()
                .entryPrice(new BigDecimal("100")).build());

        GridLevel loaded = ledger.loadGrids().get("DOGEUSDT").get(0);

        assertThat(loaded.getEntryPrice()).isEqualByComparingTo("100");
        assertThat(loaded.isDeferredMirror()).isTrue();
        assertThat(loaded.getUpdatedAt()).isNotNull();
    }

    @Test
    void updatingUnknownLevelFails() {
        assertThatThrownBy(() -> ledger.updateStatus("DOGEUSDT", 9, OrderSide.BUY, LevelStatus.CANCELLED))
                .isInstanceOf(LedgerPersistenceException.class)
                .hasMessageContaining("DOGEUSDT#9");
    }

    @Test
    void compactOnCleanLedgerRemovesNothing() {
        ledger.upsertLevel(level("DOGEUSDT", 0, OrderSide.BUY, "0.099"));

        assertThat(ledger.compact()).isZero();
        assertThat(repo.count()).isEqualTo(1);
    }
}
