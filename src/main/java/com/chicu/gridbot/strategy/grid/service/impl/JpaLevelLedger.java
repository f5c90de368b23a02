package com.chicu.gridbot.strategy.grid.service.impl;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.strategy.grid.exception.LedgerPersistenceException;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.strategy.grid.model.GridLevelEntity;
import com.chicu.gridbot.strategy.grid.model.LevelKey;
import com.chicu.gridbot.strategy.grid.model.LevelStatus;
import com.chicu.gridbot.strategy.grid.repository.GridLevelRepository;
import com.chicu.gridbot.strategy.grid.service.LevelLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaLevelLedger implements LevelLedger {

    /** Свежесть строки: updatedAt, при равенстве — больший id. */
    private static final Comparator<GridLevelEntity> RECENCY = Comparator
            .comparing(GridLevelEntity::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(GridLevelEntity::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

    /** Колонки уникального ключа {@code uk_grid_level_identity} */
    private static final Set<String> IDENTITY_COLUMNS = Set.of("symbol", "level_index", "side");

    private final GridLevelRepository repo;
    private final JdbcTemplate jdbc;

    @Override
    @Transactional
    public GridLevel upsertLevel(GridLevel level, boolean preserveOrderState) {
        try {
            GridLevelEntity e = find(level.getSymbol(), level.getLevelIndex(), level.getSide())
                    .orElseGet(GridLevelEntity::new);
            boolean created = e.getId() == null;

            e.setSymbol(level.getSymbol());
            e.setLevelIndex(level.getLevelIndex());
            e.setSide(level.getSide());
            e.setAmount(level.getBaseAmount());
            e.setPrice(level.getPrice());
            if (created || !preserveOrderState) {
                e.setOrderRef(level.getOrderRef());
                e.setStatus(level.getStatus() == null ? LevelStatus.PENDING : level.getStatus());
                e.setEntryPrice(level.getEntryPrice());
            }
            e.setUpdatedAt(Instant.now());
            return toLevel(repo.saveAndFlush(e));
        } catch (DataAccessException ex) {
            throw new LedgerPersistenceException("Не удалось сохранить уровень " + level.key() + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, List<GridLevel>> loadGrids() {
        List<GridLevelEntity> rows;
        try {
            rows = repo.findAllByOrderBySymbolAscLevelIndexAscSideAscUpdatedAtAscIdAsc();
        } catch (DataAccessException ex) {
            throw new LedgerPersistenceException("Не удалось загрузить сетки: " + ex.getMessage(), ex);
        }

        // строки уже отсортированы, LinkedHashMap сохраняет порядок (symbol, levelIndex, side)
        Map<LevelKey, GridLevelEntity> latest = new LinkedHashMap<>();
        for (GridLevelEntity row : rows) {
            LevelKey key = new LevelKey(row.getSymbol(), row.getLevelIndex(), row.getSide());
            latest.merge(key, row, (a, b) -> RECENCY.compare(a, b) >= 0 ? a : b);
        }

        Map<String, List<GridLevel>> grids = new LinkedHashMap<>();
        for (GridLevelEntity row : latest.values()) {
            grids.computeIfAbsent(row.getSymbol(), s -> new ArrayList<>()).add(toLevel(row));
        }
        return grids;
    }

    @Override
    @Transactional
    public GridLevel updateStatus(String symbol, int levelIndex, OrderSide side, LevelStatus status) {
        return update(symbol, levelIndex, side, e -> e.setStatus(status));
    }

    @Override
    @Transactional
    public GridLevel updateOrder(String symbol, int levelIndex, OrderSide side,
                                 BigDecimal price, String orderRef, LevelStatus status) {
        return update(symbol, levelIndex, side, e -> {
            e.setPrice(price);
            e.setOrderRef(orderRef);
            e.setStatus(status);
        });
    }

    @Override
    @Transactional
    public int compact() {
        try {
            Map<LevelKey, List<GridLevelEntity>> byKey = new LinkedHashMap<>();
            for (GridLevelEntity row : repo.findAll()) {
                byKey.computeIfAbsent(new LevelKey(row.getSymbol(), row.getLevelIndex(), row.getSide()),
                        k -> new ArrayList<>()).add(row);
            }

            List<GridLevelEntity> stale = new ArrayList<>();
            byKey.forEach((key, list) -> {
                if (list.size() <= 1) return;
                list.sort(RECENCY);
                // последний — самый свежий, остальные в утиль
                stale.addAll(list.subList(0, list.size() - 1));
                log.warn("🧹 Дубли уровня {}: {} строк, оставляю id={}", key, list.size(), list.get(list.size() - 1).getId());
            });

            if (!stale.isEmpty()) {
                repo.deleteAllInBatch(stale);
                repo.flush();
            }
            ensureIdentityKey();
            return stale.size();
        } catch (DataAccessException ex) {
            throw new LedgerPersistenceException("Компактизация журнала уровней не удалась: " + ex.getMessage(), ex);
        }
    }

    // ===================== helpers =====================

    /**
     * ddl-auto=update не может создать уникальный ключ на таблице, где уже лежат дубли
     * (Hibernate только пишет предупреждение). После чистки добавляем его сами.
     */
    private void ensureIdentityKey() {
        Boolean present = jdbc.execute((ConnectionCallback<Boolean>) this::hasIdentityIndex);
        if (Boolean.TRUE.equals(present)) return;
        jdbc.execute("ALTER TABLE grid_levels ADD CONSTRAINT uk_grid_level_identity UNIQUE (symbol, level_index, side)");
        log.warn("🔑 Уникальный ключ uk_grid_level_identity восстановлен после компактизации");
    }

    private Boolean hasIdentityIndex(Connection con) throws SQLException {
        DatabaseMetaData md = con.getMetaData();
        String table = md.storesUpperCaseIdentifiers() ? "GRID_LEVELS" : "grid_levels";
        Map<String, Set<String>> columnsByIndex = new HashMap<>();
        try (ResultSet rs = md.getIndexInfo(con.getCatalog(), null, table, true, false)) {
            while (rs.next()) {
                String index = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (index == null || column == null) continue;
                columnsByIndex.computeIfAbsent(index, k -> new HashSet<>()).add(column.toLowerCase(Locale.ROOT));
            }
        }
        return columnsByIndex.values().stream().anyMatch(IDENTITY_COLUMNS::equals);
    }

    private Optional<GridLevelEntity> find(String symbol, int levelIndex, OrderSide side) {
        return repo.findTopBySymbolAndLevelIndexAndSideOrderByUpdatedAtDescIdDesc(symbol, levelIndex, side);
    }

    private GridLevel update(String symbol, int levelIndex, OrderSide side,
                             Consumer<GridLevelEntity> change) {
        try {
            GridLevelEntity e = find(symbol, levelIndex, side)
                    .orElseThrow(() -> new LedgerPersistenceException(
                            "В журнале нет уровня " + symbol + "#" + levelIndex + "/" + side));
            change.accept(e);
            e.setUpdatedAt(Instant.now());
            return toLevel(repo.saveAndFlush(e));
        } catch (DataAccessException ex) {
            throw new LedgerPersistenceException("Не удалось обновить уровень " + symbol + "#" + levelIndex
                                                 + "/" + side + ": " + ex.getMessage(), ex);
        }
    }

    private static GridLevel toLevel(GridLevelEntity e) {
        return GridLevel.builder()
                .symbol(e.getSymbol())
                .levelIndex(e.getLevelIndex())
                .side(e.getSide())
                .price(e.getPrice())
                .baseAmount(e.getAmount())
                .orderRef(e.getOrderRef())
                .status(e.getStatus())
                .entryPrice(e.getEntryPrice())
                .updatedAt(e.getUpdatedAt())
                .build();
    }
}
