// src/main/java/com/chicu/gridbot/exchange/model/OrderRequest.java
package com.chicu.gridbot.exchange.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderType;
import lombok.*;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderRequest {
    private String symbol;
    private OrderSide side;
    @Builder.Default
    private OrderType type = OrderType.LIMIT;
    private BigDecimal quantity;
    private BigDecimal price;
    /** Клиентский идентификатор (Bybit orderLinkId), кодирует слот сетки */
    private String clientOrderId;
}
