package com.chicu.gridbot.exchange.bybit;

import com.chicu.gridbot.exchange.enums.NetworkType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Доступ к Bybit: ключи, сеть и адреса API.
 * Читаются из application.properties (prefix = bybit).
 */
@Data
@ConfigurationProperties(prefix = "bybit")
public class BybitProperties {

    private String apiKey;

    private String apiSecret;

    private NetworkType network = NetworkType.MAINNET;

    private String mainnetBaseUrl = "https://api.bybit.com";

    private String testnetBaseUrl = "https://api-testnet.bybit.com";

    private String recvWindow = "5000";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    public String baseUrl() {
        String b = network == NetworkType.TESTNET ? testnetBaseUrl : mainnetBaseUrl;
        return b.replaceAll("/+$", "");
    }
}
