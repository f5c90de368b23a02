package com.chicu.gridbot.strategy.grid.repository;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.strategy.grid.model.GridLevelEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GridLevelRepository extends JpaRepository<GridLevelEntity, Long> {

    // самая свежая строка по ключу: устойчиво к старым дублям до компактизации
    Optional<GridLevelEntity> findTopBySymbolAndLevelIndexAndSideOrderByUpdatedAtDescIdDesc(
            String symbol, Integer levelIndex, OrderSide side
    );

    List<GridLevelEntity> findAllByOrderBySymbolAscLevelIndexAscSideAscUpdatedAtAscIdAsc();
}
