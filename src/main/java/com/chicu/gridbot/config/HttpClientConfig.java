package com.chicu.gridbot.config;

import com.chicu.gridbot.exchange.bybit.BybitProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP-клиент для REST API биржи. Таймауты — единственная защита цикла от зависшего вызова.
 */
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, BybitProperties bybit) {
        return builder
                .setConnectTimeout(bybit.getConnectTimeout())
                .setReadTimeout(bybit.getReadTimeout())
                .build();
    }
}
