package com.chicu.gridbot.notify.impl;

import com.chicu.gridbot.notify.GridNotifier;
import com.chicu.gridbot.notify.TelegramBotProperties;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.bots.DefaultAbsSender;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Только отправка: бот не принимает апдейты, поэтому без long polling.
 */
@Slf4j
public class TelegramGridNotifier extends DefaultAbsSender implements GridNotifier {

    // 4096 — жёсткий лимит Telegram на одно сообщение
    private static final int SAFE_SEND = 4000;

    private final String chatId;

    public TelegramGridNotifier(TelegramBotProperties props) {
        super(new DefaultBotOptions(), props.getToken());
        this.chatId = props.getChatId();
    }

    @Override
    public void send(String text) {
        log.info("📣 {}", text);
        String body = text.length() > SAFE_SEND ? text.substring(0, SAFE_SEND) + "…" : text;
        try {
            execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(body)
                    .disableWebPagePreview(true)
                    .build());
        } catch (TelegramApiException e) {
            // торговый цикл важнее уведомления
            log.warn("⚠️ Не удалось отправить уведомление в Telegram: {}", e.getMessage());
        }
    }
}
