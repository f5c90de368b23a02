package com.chicu.gridbot.exchange.model;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Унифицированная информация об открытом ордере, полученная от биржи.
 * Ядро сетки не владеет этими объектами, а только ссылается на них через orderRef уровня.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderInfo {

    private String orderId;          // ID ордера на бирже
    private String clientOrderId;    // orderLinkId, если ставили мы сами
    private String symbol;           // тикер, например DOGEUSDT
    private OrderSide side;          // BUY / SELL
    private BigDecimal qty;          // объём в BASE
    private BigDecimal price;        // лимитная цена
    private OrderStatus status;

    /** Сколько QUOTE заблокировано этим ордером (qty * price). */
    public BigDecimal getNotional() {
        return qty.multiply(price);
    }
}
