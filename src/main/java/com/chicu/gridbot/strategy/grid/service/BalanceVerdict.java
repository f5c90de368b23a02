package com.chicu.gridbot.strategy.grid.service;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Вердикт проверки баланса. Нехватка средств — не ошибка, а повод отложить уровень.
 */
@Value
public class BalanceVerdict {

    boolean sufficient;
    BigDecimal required;
    BigDecimal available;
    /** 0, если средств хватает */
    BigDecimal shortfall;

    /** Равенство required == available считается достаточным. */
    public static BalanceVerdict of(BigDecimal required, BigDecimal available) {
        BigDecimal gap = required.subtract(available);
        boolean ok = gap.signum() <= 0;
        return new BalanceVerdict(ok, required, available, ok ? BigDecimal.ZERO : gap);
    }
}
