package com.chicu.gridbot.strategy.grid.model;

import lombok.Data;

/**
 * Итог одного прохода по символам, для лога и тестов.
 */
@Data
public class TickSummary {
    private int placed;           // выставлено новых ордеров
    private int skipped;          // отложено: не хватило средств
    private int filled;           // замечено исполнений
    private int cancelled;        // замечено отмен
    private int failedLevels;     // ошибки биржи по отдельным уровням
    private int failedSymbols;    // символ пропущен целиком (тикер/постройка)
    private int suspendedSymbols; // символ на паузе у предохранителя
    private boolean interrupted;  // остановлен по флагу до конца прохода

    public void incPlaced() { placed++; }
    public void incSkipped() { skipped++; }
    public void incFilled() { filled++; }
    public void incCancelled() { cancelled++; }
    public void incFailedLevels() { failedLevels++; }
    public void incFailedSymbols() { failedSymbols++; }
    public void incSuspendedSymbols() { suspendedSymbols++; }
}
