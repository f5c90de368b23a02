package com.chicu.gridbot.trading.scheduler;

import com.chicu.gridbot.config.GridBotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Пауза и отключение одного символа после ошибок биржи, остальные символы работают дальше.
 * <p>
 * После n-й ошибки подряд символ пропускает тики в течение initial * 2^(n-1), но не дольше max.
 * После failureThreshold ошибок подряд символ отключается на suspendFor; после паузы даётся
 * одна пробная попытка, и новая ошибка снова отключает символ.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SymbolCircuitBreaker {

    private final GridBotProperties props;
    private final Clock clock;

    private final Map<String, State> states = new ConcurrentHashMap<>();

    private static final class State {
        int failures;
        Instant retryAt = Instant.MIN;
        boolean suspended;
    }

    /** Можно ли трогать символ в этом тике. */
    public boolean allowAttempt(String symbol) {
        State s = states.get(symbol);
        if (s == null) return true;
        Instant now = clock.instant();
        if (now.isBefore(s.retryAt)) return false;
        if (s.suspended) {
            s.suspended = false;
            // пробная попытка: одна ошибка вернёт символ в отключку
            s.failures = Math.max(0, props.getBackoff().getFailureThreshold() - 1);
            log.info("🔌 {}: пауза закончилась, пробная попытка", symbol);
        }
        return true;
    }

    /**
     * @return через сколько символ снова будет допущен к работе
     */
    public Duration recordFailure(String symbol) {
        State s = states.computeIfAbsent(symbol, k -> new State());
        s.failures++;
        GridBotProperties.Backoff cfg = props.getBackoff();

        Duration delay;
        if (s.failures >= cfg.getFailureThreshold()) {
            s.suspended = true;
            delay = cfg.getSuspendFor();
            log.warn("⛔ {}: {} ошибок подряд, символ отключён на {}", symbol, s.failures, delay);
        } else {
            delay = backoff(s.failures);
            log.warn("⏳ {}: ошибка #{}, следующая попытка через {}", symbol, s.failures, delay);
        }
        s.retryAt = clock.instant().plus(delay);
        return delay;
    }

    public void recordSuccess(String symbol) {
        State s = states.remove(symbol);
        if (s != null && s.failures > 0) {
            log.info("✅ {}: снова в строю после {} ошибок", symbol, s.failures);
        }
    }

    public boolean isSuspended(String symbol) {
        State s = states.get(symbol);
        return s != null && s.suspended;
    }

    public int failures(String symbol) {
        State s = states.get(symbol);
        return s == null ? 0 : s.failures;
    }

    Duration backoff(int failures) {
        GridBotProperties.Backoff cfg = props.getBackoff();
        Duration max = cfg.getMax();
        Duration d = cfg.getInitial();
        for (int i = 1; i < failures; i++) {
            d = d.multipliedBy(2);
            if (d.compareTo(max) >= 0) return max;
        }
        return d.compareTo(max) > 0 ? max : d;
    }
}
