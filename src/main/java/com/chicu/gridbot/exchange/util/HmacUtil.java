package com.chicu.gridbot.exchange.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

public class HmacUtil {

    /**
     * HMAC с заданным алгоритмом, результат — hex-строка в нижнем регистре.
     *
     * @param secret    секретный ключ
     * @param message   строка для подписи
     * @param algorithm например HmacSHA256
     */
    public static String hmacHex(String secret, String message, String algorithm) {
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm));
            byte[] hmacBytes = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));

            StringBuilder hex = new StringBuilder(hmacBytes.length * 2);
            for (byte b : hmacBytes) {
                hex.append(String.format("%02x", b & 0xff));
            }
            return hex.toString();
        } catch (Exception e) {
            throw new IllegalStateException("❌ Ошибка HMAC-HEX (" + algorithm + "): " + e.getMessage(), e);
        }
    }

    // Bybit v5 подписывает запросы HMAC-SHA256
    public static String sha256Hex(String secret, String message) {
        return hmacHex(secret, message, "HmacSHA256");
    }
}
