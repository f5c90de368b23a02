package com.chicu.gridbot.strategy.grid;

import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderStatus;
import com.chicu.gridbot.exchange.exception.ExchangeException;
import com.chicu.gridbot.exchange.exception.MarketDataException;
import com.chicu.gridbot.exchange.exception.OrderNotFoundException;
import com.chicu.gridbot.exchange.exception.OrderRejectedException;
import com.chicu.gridbot.exchange.model.OrderInfo;
import com.chicu.gridbot.exchange.model.OrderRequest;
import com.chicu.gridbot.exchange.model.TickerInfo;
import com.chicu.gridbot.notify.GridNotifier;
import com.chicu.gridbot.strategy.grid.exception.GridConfigException;
import com.chicu.gridbot.strategy.grid.model.GridConfig;
import com.chicu.gridbot.strategy.grid.model.GridLevel;
import com.chicu.gridbot.strategy.grid.model.LevelKey;
import com.chicu.gridbot.strategy.grid.model.LevelStatus;
import com.chicu.gridbot.strategy.grid.model.TickSummary;
import com.chicu.gridbot.strategy.grid.service.BalanceGuard;
import com.chicu.gridbot.strategy.grid.service.BalanceVerdict;
import com.chicu.gridbot.strategy.grid.service.GridCalculator;
import com.chicu.gridbot.strategy.grid.service.LevelLedger;
import com.chicu.gridbot.strategy.grid.service.MirrorOrderGenerator;
import com.chicu.gridbot.trading.scheduler.SymbolCircuitBreaker;
import com.chicu.gridbot.trading.trade.TradeLogService;
import com.chicu.gridbot.trading.trade.model.TradeLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Управляющий цикл сетки.
 * <p>
 * Уровень живёт так: PENDING → ACTIVE → FILLED | CANCELLED, после чего слот снова
 * становится PENDING по свежей цене. Журнал уровней — единственный источник правды:
 * рабочая копия в памяти меняется только значением, которое вернул журнал после записи.
 * <p>
 * Ошибки биржи по одному уровню не трогают остальные уровни, ошибки по символу
 * (тикер) не трогают остальные символы. Ошибки журнала не ловятся и останавливают процесс.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GridSupervisor {

    private static final Comparator<GridLevel> BY_SLOT = Comparator
            .comparingInt(GridLevel::getLevelIndex)
            .thenComparing(GridLevel::getSide);

    private final GridConfig config;
    private final ExchangeClient exchange;
    private final LevelLedger ledger;
    private final GridCalculator calculator;
    private final BalanceGuard balanceGuard;
    private final MirrorOrderGenerator mirrorGenerator;
    private final TradeLogService tradeLogService;
    private final SymbolCircuitBreaker circuitBreaker;
    private final GridNotifier notifier;

    /** symbol → (ключ слота → уровень), порядок символов как в конфиге */
    private final Map<String, Map<LevelKey, GridLevel>> grids = new LinkedHashMap<>();

    /** Чужие ордера, о которых уже сообщили */
    private final Set<String> reportedOrphans = new HashSet<>();

    private boolean started;

    // ===================== старт =====================

    /**
     * Компактизация журнала, загрузка сеток, постройка недостающих и сверка с открытыми ордерами биржи.
     * Символ, для которого сетку построить не удалось, достраивается в тиках.
     */
    public synchronized void start() {
        int removed = ledger.compact();
        if (removed > 0) {
            log.warn("🧹 Из журнала уровней удалено дублей: {}", removed);
        }

        Map<String, List<GridLevel>> stored = ledger.loadGrids();
        stored.keySet().stream()
                .filter(s -> !config.getSymbols().contains(s))
                .forEach(s -> log.warn("⚠️ В журнале есть сетка {}, но символа нет в настройках: пропускаю", s));

        grids.clear();
        for (String symbol : config.getSymbols()) {
            List<GridLevel> levels = stored.get(symbol);
            if (levels != null && !levels.isEmpty()) {
                grids.put(symbol, index(dropOutOfRange(symbol, levels)));
                log.info("📂 {}: загружено уровней {} (активных {})", symbol, levels.size(),
                        levels.stream().filter(GridLevel::isLive).count());
            }
            try {
                ensureGrid(symbol, null);
            } catch (ExchangeException e) {
                log.warn("⚠️ {}: сетку построить не удалось, попробую в следующем тике: {}", symbol, e.getMessage());
            }
        }

        try {
            reconcileOpenOrders(null);
        } catch (ExchangeException e) {
            log.warn("⚠️ Сверка открытых ордеров при старте не удалась: {}", e.getMessage());
        }

        started = true;
        log.info("🚀 Сеточный движок запущен: символы={}, уровней на сторону={}, spread={}, множитель={}",
                config.getSymbols(), config.getLevelCount(), config.getSpread(), config.getLogMultiplier());
    }

    // ===================== тик =====================

    public TickSummary tick() {
        return tick(() -> false);
    }

    /**
     * Один проход по всем символам в порядке настроек.
     *
     * @param stopRequested проверяется перед каждым символом
     */
    public synchronized TickSummary tick(BooleanSupplier stopRequested) {
        if (!started) {
            throw new IllegalStateException("tick() до start()");
        }
        TickSummary summary = new TickSummary();

        for (String symbol : config.getSymbols()) {
            if (stopRequested.getAsBoolean()) {
                summary.setInterrupted(true);
                log.info("⏹ Тик прерван по запросу остановки перед {}", symbol);
                break;
            }
            if (!circuitBreaker.allowAttempt(symbol)) {
                summary.incSuspendedSymbols();
                log.debug("⏸ {}: на паузе у предохранителя", symbol);
                continue;
            }
            try {
                processSymbol(symbol, summary);
                circuitBreaker.recordSuccess(symbol);
            } catch (ExchangeException | GridConfigException e) {
                // сетка, не построенная на старте, строится в тике: её ошибка касается только этого символа
                summary.incFailedSymbols();
                log.warn("⚠️ {}: символ пропущен в этом тике: {}", symbol, e.getMessage());
                Duration pause = circuitBreaker.recordFailure(symbol);
                if (circuitBreaker.isSuspended(symbol)) {
                    notifier.send("⛔ " + symbol + " отключён на " + pause + " после серии ошибок: " + e.getMessage());
                }
            }
        }

        log.info("🔁 Тик: выставлено={}, отложено={}, исполнено={}, отменено={}, ошибок уровней={}, символов пропущено={}, на паузе={}",
                summary.getPlaced(), summary.getSkipped(), summary.getFilled(), summary.getCancelled(),
                summary.getFailedLevels(), summary.getFailedSymbols(), summary.getSuspendedSymbols());
        return summary;
    }

    /** Копия рабочего состояния сетки, уровни по (levelIndex, side). */
    public synchronized List<GridLevel> snapshot(String symbol) {
        Map<LevelKey, GridLevel> grid = grids.get(symbol);
        if (grid == null) return List.of();
        return grid.values().stream().sorted(BY_SLOT).collect(Collectors.toList());
    }

    private void processSymbol(String symbol, TickSummary summary) {
        BigDecimal ref = referencePrice(symbol, exchange.getTicker(symbol));
        Map<LevelKey, GridLevel> grid = ensureGrid(symbol, ref);

        try {
            reconcileOpenOrders(symbol);
        } catch (ExchangeException e) {
            log.debug("{}: сверка открытых ордеров пропущена: {}", symbol, e.getMessage());
        }

        Set<LevelKey> awaitingMirror = syncActive(symbol, grid, summary);
        regenerate(grid, ref, awaitingMirror);
        placePending(symbol, grid, ref, summary);
    }

    // ===================== сверка =====================

    /**
     * ACTIVE уровни: спрашиваем статус их ордеров. Сначала все отмены, потом все исполнения
     * (FILLED пишется в журнал до зеркала), и только затем зеркала.
     */
    private Set<LevelKey> syncActive(String symbol, Map<LevelKey, GridLevel> grid, TickSummary summary) {
        List<GridLevel> filled = new ArrayList<>();
        List<GridLevel> cancelled = new ArrayList<>();

        for (GridLevel level : live(grid)) {
            OrderStatus status;
            try {
                status = exchange.getOrderStatus(level.getOrderRef(), symbol);
            } catch (OrderNotFoundException e) {
                log.warn("❓ {}: ордер {} бирже неизвестен, уровень не трогаю", level.key(), level.getOrderRef());
                continue;
            } catch (ExchangeException e) {
                summary.incFailedLevels();
                log.warn("⚠️ {}: статус ордера {} не получен: {}", level.key(), level.getOrderRef(), e.getMessage());
                continue;
            }

            if (status == OrderStatus.FILLED) {
                filled.add(level);
            } else if (status.isCancelledLike()) {
                cancelled.add(level);
            } else if (status == OrderStatus.UNKNOWN) {
                log.warn("❓ {}: неизвестный статус ордера {}, уровень не трогаю", level.key(), level.getOrderRef());
            }
        }

        for (GridLevel level : cancelled) {
            GridLevel saved = ledger.updateStatus(symbol, level.getLevelIndex(), level.getSide(), LevelStatus.CANCELLED);
            put(grid, saved);
            summary.incCancelled();
            log.info("✖ {}: ордер {} снят на бирже → CANCELLED", level.key(), level.getOrderRef());
        }

        for (GridLevel level : filled) {
            GridLevel saved = ledger.upsertLevel(level.toBuilder()
                    .status(LevelStatus.FILLED)
                    .entryPrice(null)
                    .build());
            put(grid, saved);
            summary.incFilled();

            // в журнал сделок — с entryPrice, пока он ещё есть
            TradeLogEntry trade = tradeLogService.logFill(level.toBuilder().status(LevelStatus.FILLED).build());
            log.info("✅ {}: ордер {} исполнен @{} объём {}", level.key(), level.getOrderRef(),
                    level.getPrice().toPlainString(), level.getBaseAmount().toPlainString());
            notifier.send("✅ Исполнен " + level.key() + " @" + level.getPrice().toPlainString()
                          + " объём " + level.getBaseAmount().toPlainString() + pnlSuffix(symbol, trade));
        }

        // FILLED слоты, включая оставшиеся с прошлых тиков: зеркало ещё не выставлено
        Set<LevelKey> awaitingMirror = new HashSet<>();
        for (GridLevel level : sorted(grid)) {
            if (level.getStatus() != LevelStatus.FILLED) continue;
            LevelKey oppositeKey = new LevelKey(symbol, level.getLevelIndex(), level.getSide().opposite());
            GridLevel opposite = grid.get(oppositeKey);
            GridLevel mirror = mirrorGenerator.onFill(level, opposite);
            if (mirror == opposite) {
                // старый ордер на слоте снять не удалось: повторим в следующем тике
                awaitingMirror.add(level.key());
                log.warn("⏳ {}: зеркало ждёт снятия ордера {}", level.key(), opposite.getOrderRef());
                continue;
            }
            put(grid, mirror);
        }
        return awaitingMirror;
    }

    /**
     * Открытые ордера, которых нет в журнале. Если clientOrderId указывает на наш слот, а слот
     * не ACTIVE (упали между размещением и записью), ордер подхватывается. Остальные — сироты,
     * о них сообщаем один раз.
     */
    private void reconcileOpenOrders(String symbol) {
        List<OrderInfo> open = exchange.getOpenOrders(symbol);

        Set<String> known = new HashSet<>();
        grids.values().forEach(g -> g.values().stream()
                .filter(GridLevel::isLive)
                .forEach(l -> known.add(l.getOrderRef())));

        for (OrderInfo order : open) {
            if (known.contains(order.getOrderId())) continue;

            Optional<LevelKey> key = LevelKey.fromClientOrderId(order.getClientOrderId());
            Map<LevelKey, GridLevel> grid = key.map(k -> grids.get(k.getSymbol())).orElse(null);
            GridLevel slot = grid == null ? null : grid.get(key.get());

            if (slot != null && !slot.isLive()) {
                GridLevel saved = ledger.updateOrder(slot.getSymbol(), slot.getLevelIndex(), slot.getSide(),
                        order.getPrice(), order.getOrderId(), LevelStatus.ACTIVE);
                put(grid, saved);
                known.add(order.getOrderId());
                log.warn("🔗 {}: подхвачен ордер {} @{}, которого не было в журнале", saved.key(),
                        order.getOrderId(), order.getPrice().toPlainString());
            } else if (reportedOrphans.add(order.getOrderId())) {
                log.warn("👻 Ордер-сирота {} {} {} {}@{} (clientOrderId={}): в журнале его нет",
                        order.getOrderId(), order.getSymbol(), order.getSide(),
                        order.getQty().toPlainString(), order.getPrice().toPlainString(), order.getClientOrderId());
                notifier.send("👻 Ордер-сирота " + order.getOrderId() + " " + order.getSymbol() + " "
                              + order.getSide() + " @" + order.getPrice().toPlainString());
            }
        }
    }

    // ===================== перестройка и размещение =====================

    /**
     * Все слоты без живого ордера переезжают на цену от текущего рынка, кроме отложенных зеркал
     * (у них своя цена от исполнения) и исполненных слотов, чьё зеркало ещё не выставлено.
     * В журнал пишем только изменившиеся слоты.
     */
    private void regenerate(Map<LevelKey, GridLevel> grid, BigDecimal ref, Set<LevelKey> awaitingMirror) {
        BigDecimal amount = calculator.baseAmount(ref, config);

        for (GridLevel level : sorted(grid)) {
            if (level.isLive() || level.isDeferredMirror() || awaitingMirror.contains(level.key())) continue;

            BigDecimal price = calculator.levelPrice(level.getSide(), level.getLevelIndex(), ref, config);
            GridLevel fresh = level.toBuilder()
                    .price(price)
                    .baseAmount(amount)
                    .orderRef(null)
                    .status(LevelStatus.PENDING)
                    .entryPrice(null)
                    .build();
            if (sameState(level, fresh)) continue;

            if (level.getStatus() != LevelStatus.PENDING) {
                log.info("♻️ {}: {} → PENDING @{}", level.key(), level.getStatus(), price.toPlainString());
            }
            put(grid, ledger.upsertLevel(fresh));
        }
    }

    /** PENDING слоты от ближнего к цене к дальнему. Кончились деньги — дальние просто ждут. */
    private void placePending(String symbol, Map<LevelKey, GridLevel> grid, BigDecimal ref, TickSummary summary) {
        List<GridLevel> candidates = grid.values().stream()
                .filter(l -> l.getStatus() == LevelStatus.PENDING)
                .sorted(Comparator.<GridLevel, BigDecimal>comparing(l -> l.getPrice().subtract(ref).abs())
                        .thenComparing(BY_SLOT))
                .collect(Collectors.toList());

        for (GridLevel level : candidates) {
            BalanceVerdict verdict;
            try {
                verdict = balanceGuard.check(symbol, level.getSide(), level.getBaseAmount(), level.getPrice());
            } catch (ExchangeException e) {
                summary.incFailedLevels();
                log.warn("⚠️ {}: баланс не проверен: {}", level.key(), e.getMessage());
                continue;
            }
            if (!verdict.isSufficient()) {
                summary.incSkipped();
                log.info("⏸ {} @{}: пропуск, не хватает {} (нужно {}, доступно {})", level.key(),
                        level.getPrice().toPlainString(), verdict.getShortfall().toPlainString(),
                        verdict.getRequired().toPlainString(), verdict.getAvailable().toPlainString());
                continue;
            }

            String orderId;
            try {
                orderId = exchange.placeLimitOrder(OrderRequest.builder()
                        .symbol(symbol)
                        .side(level.getSide())
                        .quantity(level.getBaseAmount())
                        .price(level.getPrice())
                        .clientOrderId(level.key().toClientOrderId(System.currentTimeMillis()))
                        .build());
            } catch (OrderRejectedException e) {
                summary.incFailedLevels();
                log.warn("🚫 {} @{}: биржа отклонила ордер: {}", level.key(), level.getPrice().toPlainString(), e.getReason());
                continue;
            } catch (ExchangeException e) {
                summary.incFailedLevels();
                log.warn("⚠️ {} @{}: ордер не выставлен: {}", level.key(), level.getPrice().toPlainString(), e.getMessage());
                continue;
            }

            GridLevel saved = ledger.updateOrder(symbol, level.getLevelIndex(), level.getSide(),
                    level.getPrice(), orderId, LevelStatus.ACTIVE);
            put(grid, saved);
            summary.incPlaced();
            log.info("📌 {} @{} объём {} → ордер {}", level.key(), level.getPrice().toPlainString(),
                    level.getBaseAmount().toPlainString(), orderId);
        }
    }

    // ===================== сетки =====================

    /**
     * Сетка символа в памяти и в журнале. Недостающие слоты (новый символ или выросший levelCount)
     * строятся от опорной цены; существующие строки не трогаются.
     *
     * @param ref опорная цена, null — спросить тикер
     */
    private Map<LevelKey, GridLevel> ensureGrid(String symbol, BigDecimal ref) {
        Map<LevelKey, GridLevel> grid = grids.get(symbol);
        if (grid != null && hasAllSlots(symbol, grid)) {
            return grid;
        }

        BigDecimal price = ref != null ? ref : referencePrice(symbol, exchange.getTicker(symbol));
        List<GridLevel> built = calculator.buildGrid(symbol, price, config);

        Map<LevelKey, GridLevel> target = grid != null ? grid : new LinkedHashMap<>();
        int created = 0;
        for (GridLevel level : built) {
            if (target.containsKey(level.key())) continue;
            put(target, ledger.upsertLevel(level));
            created++;
        }
        grids.put(symbol, target);
        log.info("🧱 {}: сетка построена от {}, новых слотов {}", symbol, price.toPlainString(), created);
        return target;
    }

    /**
     * Слоты с индексом за пределами текущего levelCount (сетка прошлого запуска была шире)
     * в работу не берутся. Их живые ордера снимаются, а не снятые остаются сиротами.
     */
    private List<GridLevel> dropOutOfRange(String symbol, List<GridLevel> levels) {
        List<GridLevel> kept = new ArrayList<>(levels.size());
        for (GridLevel level : levels) {
            if (level.getLevelIndex() < config.getLevelCount()) {
                kept.add(level);
                continue;
            }
            if (!level.isLive()) {
                log.info("🗑 {}: слот вне сетки (levelCount={}), пропускаю", level.key(), config.getLevelCount());
                continue;
            }
            try {
                exchange.cancelOrder(level.getOrderRef(), symbol);
                log.warn("✖ {}: слот вне сетки (levelCount={}), ордер {} снят", level.key(),
                        config.getLevelCount(), level.getOrderRef());
            } catch (OrderNotFoundException e) {
                log.info("🗑 {}: слот вне сетки, ордера {} на бирже уже нет", level.key(), level.getOrderRef());
            } catch (ExchangeException e) {
                reportedOrphans.add(level.getOrderRef());
                log.warn("👻 {}: слот вне сетки, ордер {} снять не удалось: {}", level.key(),
                        level.getOrderRef(), e.getMessage());
                notifier.send("👻 Ордер-сирота " + level.getOrderRef() + " " + level.key()
                              + ": слота нет в текущей сетке, снять не удалось");
            }
        }
        return kept;
    }

    private boolean hasAllSlots(String symbol, Map<LevelKey, GridLevel> grid) {
        for (int i = 0; i < config.getLevelCount(); i++) {
            for (OrderSide side : OrderSide.values()) {
                if (!grid.containsKey(new LevelKey(symbol, i, side))) return false;
            }
        }
        return true;
    }

    /** last, а если его нет — середина стакана. */
    private static BigDecimal referencePrice(String symbol, TickerInfo ticker) {
        if (ticker.getLast() != null && ticker.getLast().signum() > 0) {
            return ticker.getLast();
        }
        if (ticker.getBid() != null && ticker.getAsk() != null
            && ticker.getBid().signum() > 0 && ticker.getAsk().signum() > 0) {
            return ticker.getBid().add(ticker.getAsk()).divide(BigDecimal.valueOf(2), 18, RoundingMode.HALF_UP).stripTrailingZeros();
        }
        throw new MarketDataException("Тикер " + symbol + " без цены: " + ticker);
    }

    /** PnL закрытой пары и итог по символу; у первичного уровня сетки PnL нет. */
    private String pnlSuffix(String symbol, TradeLogEntry trade) {
        if (trade == null || trade.getPnl() == null) return "";
        String total = tradeLogService.getTotalPnl(symbol).map(BigDecimal::toPlainString).orElse("—");
        return ", PnL " + trade.getPnl().toPlainString() + " " + config.getQuoteCurrency()
               + " (всего по " + symbol + ": " + total + ")";
    }

    private static Map<LevelKey, GridLevel> index(List<GridLevel> levels) {
        Map<LevelKey, GridLevel> map = new LinkedHashMap<>();
        levels.stream().sorted(BY_SLOT).forEach(l -> map.put(l.key(), l));
        return map;
    }

    private static void put(Map<LevelKey, GridLevel> grid, GridLevel level) {
        grid.put(level.key(), level);
    }

    private static List<GridLevel> live(Map<LevelKey, GridLevel> grid) {
        return grid.values().stream().filter(GridLevel::isLive).sorted(BY_SLOT).collect(Collectors.toList());
    }

    private static List<GridLevel> sorted(Map<LevelKey, GridLevel> grid) {
        return grid.values().stream().sorted(BY_SLOT).collect(Collectors.toList());
    }

    private static boolean sameState(GridLevel a, GridLevel b) {
        return a.getStatus() == b.getStatus()
               && Objects.equals(a.getOrderRef(), b.getOrderRef())
               && sameNumber(a.getEntryPrice(), b.getEntryPrice())
               && sameNumber(a.getPrice(), b.getPrice())
               && sameNumber(a.getBaseAmount(), b.getBaseAmount());
    }

    private static boolean sameNumber(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return a == b;
        return a.compareTo(b) == 0;
    }
}
