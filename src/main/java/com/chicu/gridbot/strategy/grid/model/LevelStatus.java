package com.chicu.gridbot.strategy.grid.model;

/**
 * PENDING → ACTIVE → {FILLED, CANCELLED}.
 * FILLED и CANCELLED конечны для конкретного ордера, но слот сразу снова идёт в PENDING.
 */
public enum LevelStatus {
    PENDING,
    ACTIVE,
    FILLED,
    CANCELLED
}
