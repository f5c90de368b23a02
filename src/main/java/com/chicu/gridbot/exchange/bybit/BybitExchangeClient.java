package com.chicu.gridbot.exchange.bybit;

import com.chicu.gridbot.exchange.client.ExchangeClient;
import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderStatus;
import com.chicu.gridbot.exchange.exception.ExchangeException;
import com.chicu.gridbot.exchange.exception.MarketDataException;
import com.chicu.gridbot.exchange.exception.OrderNotFoundException;
import com.chicu.gridbot.exchange.exception.OrderRejectedException;
import com.chicu.gridbot.exchange.model.OrderInfo;
import com.chicu.gridbot.exchange.model.OrderRequest;
import com.chicu.gridbot.exchange.model.TickerInfo;
import com.chicu.gridbot.exchange.util.HmacUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Клиент Bybit v5 (спот, единый аккаунт).
 * Ответы разбираются строго: отсутствие обязательного поля — {@link MarketDataException}, а не ноль по умолчанию.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BybitExchangeClient implements ExchangeClient {

    /** retCode Bybit: ордер не существует или уже закрыт */
    private static final int ORDER_NOT_EXISTS = 170213;
    private static final int PAGE_LIMIT = 50;
    private static final int MAX_PAGES = 20;

    private final RestTemplate rest;
    private final ObjectMapper objectMapper;
    private final BybitProperties props;

    /* ====================== helpers ====================== */

    private static String enc(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            throw new MarketDataException("Пустой ответ Bybit");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("JSON parse error: " + e.getOriginalMessage(), e);
        }
    }

    /** Заголовки подписанного запроса (payload = queryString для GET или JSON-тело для POST). */
    private HttpHeaders signedHeaders(long ts, String payload) {
        String apiKey = props.getApiKey();
        String preSign = ts + apiKey + props.getRecvWindow() + (payload == null ? "" : payload);
        String sign = HmacUtil.sha256Hex(props.getApiSecret(), preSign);

        HttpHeaders h = new HttpHeaders();
        h.set("X-BAPI-API-KEY", apiKey);
        h.set("X-BAPI-TIMESTAMP", String.valueOf(ts));
        h.set("X-BAPI-RECV-WINDOW", props.getRecvWindow());
        h.set("X-BAPI-SIGN", sign);
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }

    private JsonNode publicGet(String pathAndQuery) {
        try {
            ResponseEntity<String> r = rest.exchange(URI.create(props.baseUrl() + pathAndQuery),
                    HttpMethod.GET, new HttpEntity<>(new HttpHeaders()), String.class);
            return parseJson(r.getBody());
        } catch (RestClientException e) {
            throw new MarketDataException("Bybit недоступен: " + e.getMessage(), e);
        }
    }

    private JsonNode signedGet(String path, String query) {
        try {
            HttpHeaders headers = signedHeaders(System.currentTimeMillis(), query);
            ResponseEntity<String> r = rest.exchange(URI.create(props.baseUrl() + path + "?" + query),
                    HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return parseJson(r.getBody());
        } catch (RestClientException e) {
            throw new ExchangeException("Bybit signed GET " + path + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode signedPost(String path, Map<String, Object> body) {
        String bodyJson;
        try {
            bodyJson = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Не удалось сериализовать тело запроса: " + e.getMessage(), e);
        }
        try {
            HttpHeaders headers = signedHeaders(System.currentTimeMillis(), bodyJson);
            ResponseEntity<String> r = rest.exchange(URI.create(props.baseUrl() + path),
                    HttpMethod.POST, new HttpEntity<>(bodyJson, headers), String.class);
            return parseJson(r.getBody());
        } catch (RestClientException e) {
            throw new ExchangeException("Bybit signed POST " + path + " failed: " + e.getMessage(), e);
        }
    }

    /** Для запросов чтения: retCode != 0 означает, что данных нет. */
    private static void ensureOk(JsonNode root, String ctx) {
        int retCode = root.path("retCode").asInt(-1);
        if (retCode != 0) {
            throw new MarketDataException(ctx + ": retCode=" + retCode + ", retMsg=" + root.path("retMsg").asText());
        }
    }

    private static String requireText(JsonNode n, String field, String ctx) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull() || v.asText().isBlank()) {
            throw new MarketDataException(ctx + ": нет обязательного поля '" + field + "'");
        }
        return v.asText();
    }

    private static BigDecimal requireDecimal(JsonNode n, String field, String ctx) {
        String raw = requireText(n, field, ctx);
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new MarketDataException(ctx + ": поле '" + field + "' не число: " + raw, e);
        }
    }

    /* ====================== instruments cache ====================== */

    private record Instrument(
            BigDecimal tickSize,
            BigDecimal qtyStep,
            BigDecimal minOrderQty,
            BigDecimal minOrderAmt
    ) {}

    private final ConcurrentMap<String, Instrument> instruments = new ConcurrentHashMap<>();

    private Instrument getInstrument(String symbol) {
        // исключение из fetchInstrument не кэшируется — повторим на следующем тике
        return instruments.computeIfAbsent(props.getNetwork().name() + ":" + symbol, k -> fetchInstrument(symbol));
    }

    private Instrument fetchInstrument(String symbol) {
        String ctx = "instruments-info " + symbol;
        JsonNode root = publicGet("/v5/market/instruments-info?category=spot&symbol=" + enc(symbol));
        ensureOk(root, ctx);
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new MarketDataException("Неизвестный символ " + symbol);
        }
        JsonNode info = list.get(0);
        JsonNode lot = info.path("lotSizeFilter");
        // у спота шаг объёма называется basePrecision, у деривативов — qtyStep
        String stepField = lot.hasNonNull("basePrecision") ? "basePrecision" : "qtyStep";
        return new Instrument(
                requireDecimal(info.path("priceFilter"), "tickSize", ctx),
                requireDecimal(lot, stepField, ctx),
                requireDecimal(lot, "minOrderQty", ctx),
                lot.hasNonNull("minOrderAmt") ? requireDecimal(lot, "minOrderAmt", ctx) : BigDecimal.ZERO
        );
    }

    /** Квантизация вниз к ближайшему кратному шагу. */
    static BigDecimal quantizeDown(BigDecimal value, BigDecimal step) {
        if (value == null || step == null || step.signum() == 0) return value;
        BigDecimal[] div = value.divideAndRemainder(step);
        BigDecimal floored = div[0].multiply(step);
        int scale = Math.max(0, step.stripTrailingZeros().scale());
        return floored.setScale(scale, RoundingMode.DOWN).stripTrailingZeros();
    }

    /* ====================== ExchangeClient ====================== */

    @Override
    public TickerInfo getTicker(String symbol) {
        String ctx = "ticker " + symbol;
        JsonNode root = publicGet("/v5/market/tickers?category=spot&symbol=" + enc(symbol));
        ensureOk(root, ctx);
        JsonNode list = root.path("result").path("list");
        if (!list.isArray() || list.isEmpty()) {
            throw new MarketDataException("Неизвестный символ " + symbol);
        }
        JsonNode t = list.get(0);
        return TickerInfo.builder()
                .bid(requireDecimal(t, "bid1Price", ctx))
                .ask(requireDecimal(t, "ask1Price", ctx))
                .last(requireDecimal(t, "lastPrice", ctx))
                .volume(requireDecimal(t, "volume24h", ctx))
                .build();
    }

    /**
     * Свободный баланс = walletBalance - locked.
     * Резервы открытых ордеров BalanceGuard всё равно пересчитывает сам.
     */
    @Override
    public BigDecimal getFreeBalance(String currency) {
        String ctx = "wallet-balance " + currency;
        JsonNode root = signedGet("/v5/account/wallet-balance", "accountType=UNIFIED&coin=" + enc(currency));
        ensureOk(root, ctx);
        for (JsonNode acc : root.path("result").path("list")) {
            for (JsonNode c : acc.path("coin")) {
                if (currency.equalsIgnoreCase(c.path("coin").asText())) {
                    BigDecimal wallet = requireDecimal(c, "walletBalance", ctx);
                    BigDecimal locked = requireDecimal(c, "locked", ctx);
                    return wallet.subtract(locked).max(BigDecimal.ZERO);
                }
            }
        }
        return BigDecimal.ZERO;
    }

    @Override
    public List<OrderInfo> getOpenOrders(String symbol) {
        List<OrderInfo> out = new ArrayList<>();
        String cursor = "";
        int pages = 0;
        do {
            StringBuilder q = new StringBuilder("category=spot&limit=").append(PAGE_LIMIT);
            if (symbol != null && !symbol.isBlank()) q.append("&symbol=").append(enc(symbol));
            if (!cursor.isBlank()) q.append("&cursor=").append(enc(cursor));

            JsonNode root = signedGet("/v5/order/realtime", q.toString());
            ensureOk(root, "open orders " + (symbol == null ? "*" : symbol));
            JsonNode result = root.path("result");
            for (JsonNode n : result.path("list")) {
                OrderInfo info = toOrderInfo(n);
                if (info.getStatus().isOpen()) out.add(info);
            }
            cursor = result.path("nextPageCursor").asText("");
            pages++;
        } while (!cursor.isBlank() && pages < MAX_PAGES);
        return out;
    }

    @Override
    public String placeLimitOrder(OrderRequest req) {
        String symbol = req.getSymbol();
        Instrument f = getInstrument(symbol);

        BigDecimal qty = quantizeDown(req.getQuantity(), f.qtyStep());
        BigDecimal price = quantizeDown(req.getPrice(), f.tickSize());
        if (price == null || price.signum() <= 0) {
            throw new OrderRejectedException("цена " + req.getPrice() + " обнуляется шагом " + f.tickSize());
        }
        if (qty == null || qty.signum() <= 0 || qty.compareTo(f.minOrderQty()) < 0) {
            throw new OrderRejectedException("объём " + req.getQuantity() + " меньше минимального " + f.minOrderQty());
        }
        if (qty.multiply(price).compareTo(f.minOrderAmt()) < 0) {
            throw new OrderRejectedException("сумма " + qty.multiply(price) + " меньше minOrderAmt " + f.minOrderAmt());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", "spot");
        body.put("symbol", symbol);
        body.put("side", req.getSide() == OrderSide.BUY ? "Buy" : "Sell");
        body.put("orderType", "Limit");
        body.put("qty", qty.toPlainString());
        body.put("price", price.toPlainString());
        body.put("timeInForce", "GTC");
        if (req.getClientOrderId() != null && !req.getClientOrderId().isBlank()) {
            body.put("orderLinkId", req.getClientOrderId());
        }

        JsonNode root = signedPost("/v5/order/create", body);
        int retCode = root.path("retCode").asInt(-1);
        if (retCode != 0) {
            throw new OrderRejectedException(root.path("retMsg").asText() + " (retCode=" + retCode + ")");
        }
        String orderId = root.path("result").path("orderId").asText("");
        if (orderId.isBlank()) {
            // ордер мог встать — его подхватит сверка по orderLinkId
            throw new ExchangeException("Bybit не вернул orderId для " + symbol + " linkId=" + req.getClientOrderId());
        }
        log.debug("Bybit order created: {} {} {} @ {} -> {}", symbol, req.getSide(), qty, price, orderId);
        return orderId;
    }

    /** Сначала realtime (открытые и недавно закрытые), потом история. */
    @Override
    public OrderStatus getOrderStatus(String orderId, String symbol) {
        String q = "category=spot&symbol=" + enc(symbol) + "&orderId=" + enc(orderId);
        for (String path : List.of("/v5/order/realtime", "/v5/order/history")) {
            JsonNode root = signedGet(path, q);
            ensureOk(root, "order " + orderId);
            JsonNode list = root.path("result").path("list");
            if (list.isArray() && !list.isEmpty()) {
                return OrderStatus.fromExchange(requireText(list.get(0), "orderStatus", "order " + orderId));
            }
        }
        throw new OrderNotFoundException(orderId, symbol);
    }

    @Override
    public void cancelOrder(String orderId, String symbol) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", "spot");
        body.put("symbol", symbol);
        body.put("orderId", orderId);

        JsonNode root = signedPost("/v5/order/cancel", body);
        int retCode = root.path("retCode").asInt(-1);
        if (retCode == ORDER_NOT_EXISTS) {
            throw new OrderNotFoundException(orderId, symbol);
        }
        if (retCode != 0) {
            throw new OrderRejectedException("отмена " + orderId + ": " + root.path("retMsg").asText()
                                             + " (retCode=" + retCode + ")");
        }
    }

    private OrderInfo toOrderInfo(JsonNode n) {
        String ctx = "order";
        String sideStr = requireText(n, "side", ctx);
        String linkId = n.path("orderLinkId").asText("");
        return OrderInfo.builder()
                .orderId(requireText(n, "orderId", ctx))
                .clientOrderId(linkId.isBlank() ? null : linkId)
                .symbol(requireText(n, "symbol", ctx))
                .side("Buy".equalsIgnoreCase(sideStr) ? OrderSide.BUY : OrderSide.SELL)
                .qty(requireDecimal(n, "qty", ctx))
                .price(requireDecimal(n, "price", ctx))
                .status(OrderStatus.fromExchange(requireText(n, "orderStatus", ctx)))
                .build();
    }
}
