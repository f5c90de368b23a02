package com.chicu.gridbot.trading.trade;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;

public interface TradeLogRepository extends JpaRepository<TradeLogEntity, Long> {

    @Query("SELECT SUM(t.pnl) FROM TradeLogEntity t WHERE t.symbol = :symbol")
    BigDecimal sumPnlBySymbol(@Param("symbol") String symbol);
}
