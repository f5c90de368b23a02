package com.chicu.gridbot.config;

import com.chicu.gridbot.notify.GridNotifier;
import com.chicu.gridbot.notify.TelegramBotProperties;
import com.chicu.gridbot.notify.impl.LogGridNotifier;
import com.chicu.gridbot.notify.impl.TelegramGridNotifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration(proxyBeanMethods = false)
public class NotifierConfig {

    /** Telegram, если заданы токен и чат, иначе только лог. */
    @Bean
    public GridNotifier gridNotifier(TelegramBotProperties telegram) {
        if (telegram.isConfigured()) {
            log.info("📨 Уведомления: Telegram, чат {}", telegram.getChatId());
            return new TelegramGridNotifier(telegram);
        }
        log.info("📨 Уведомления: только лог (telegram.bot.token / chat-id не заданы)");
        return new LogGridNotifier();
    }
}
