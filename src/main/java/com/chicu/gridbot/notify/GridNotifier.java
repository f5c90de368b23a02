package com.chicu.gridbot.notify;

/**
 * Короткие уведомления оператору: исполнения, зеркала, сироты, отключение символа.
 * Реализация не должна бросать исключения в торговый цикл.
 */
public interface GridNotifier {

    void send(String text);
}
