package com.chicu.gridbot.trading.scheduler;

import com.chicu.gridbot.config.GridBotProperties;
import com.chicu.gridbot.strategy.grid.GridSupervisor;
import com.chicu.gridbot.strategy.grid.exception.GridConfigException;
import com.chicu.gridbot.strategy.grid.exception.LedgerPersistenceException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Один поток, фиксированная пауза между тиками. Первый запуск делает start() движка,
 * дальше только tick(). Остановка кооперативная: флаг проверяется в начале тика и перед каждым символом.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GridTickScheduler {

    private static final long SHUTDOWN_WAIT_SEC = 30;
    private static final int FATAL_EXIT_CODE = 2;

    private final GridSupervisor supervisor;
    private final GridBotProperties props;
    private final ConfigurableApplicationContext context;

    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private ScheduledThreadPoolExecutor scheduler;
    private ScheduledFuture<?> loop;
    private boolean engineStarted;

    @PostConstruct
    private void init() {
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("grid-tick");
            t.setDaemon(true);
            return t;
        });
        this.scheduler.setRemoveOnCancelPolicy(true);

        if (!props.isAutostart()) {
            log.info("Автозапуск сетки отключён (grid.autostart=false)");
            return;
        }
        startLoop();
    }

    @PreDestroy
    private void shutdown() {
        log.info("Останавливаю планировщик сетки…");
        stopRequested.set(true);
        scheduler.shutdown();
        try {
            // дожидаемся текущего тика, чтобы не оборвать запись в журнал
            if (!scheduler.awaitTermination(SHUTDOWN_WAIT_SEC, TimeUnit.SECONDS)) {
                log.warn("Тик не завершился за {}s, прерываю", SHUTDOWN_WAIT_SEC);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public synchronized void startLoop() {
        if (isRunning()) {
            log.info("Цикл сетки уже запущен");
            return;
        }
        stopRequested.set(false);
        long intervalMs = Math.max(1000, props.getTickInterval().toMillis());
        loop = scheduler.scheduleWithFixedDelay(this::runTick, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("▶️ Цикл сетки запущен (интервал={} мс)", intervalMs);
    }

    public synchronized void stopLoop() {
        stopRequested.set(true);
        if (loop != null) {
            loop.cancel(false);
        }
        log.info("⏹ Цикл сетки остановлен");
    }

    public synchronized boolean isRunning() {
        return loop != null && !loop.isCancelled() && !loop.isDone();
    }

    void runTick() {
        if (stopRequested.get()) return;
        try {
            if (!engineStarted) {
                supervisor.start();
                engineStarted = true;
            }
            supervisor.tick(stopRequested::get);
        } catch (GridConfigException | LedgerPersistenceException | DataAccessException e) {
            log.error("💥 Фатальная ошибка, торговый цикл остановлен: {}", e.getMessage(), e);
            stopLoop();
            onFatal();
        } catch (RuntimeException e) {
            // исключение из задачи отменило бы scheduleWithFixedDelay
            log.error("Ошибка тика: {}", e.getMessage(), e);
        }
    }

    /** Закрываем контекст из отдельного потока: этот поток сам ждёт в shutdown(). */
    protected void onFatal() {
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> FATAL_EXIT_CODE)),
                "grid-fatal-exit");
        exit.setDaemon(false);
        exit.start();
    }
}
