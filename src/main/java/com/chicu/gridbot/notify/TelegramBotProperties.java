package com.chicu.gridbot.notify;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Свойства уведомлений в Telegram: токен и чат.
 * Если token или chatId пусты, уведомления идут только в лог.
 */
@ConfigurationProperties(prefix = "telegram.bot")
@Data
public class TelegramBotProperties {
    /**
     * username бота без "@"
     */
    private String username;
    /**
     * Токен, полученный от BotFather
     */
    private String token;
    /**
     * Куда слать уведомления
     */
    private String chatId;

    public boolean isConfigured() {
        return token != null && !token.isBlank() && chatId != null && !chatId.isBlank();
    }
}
