package com.chicu.gridbot.exchange.bybit;

import com.chicu.gridbot.exchange.enums.OrderSide;
import com.chicu.gridbot.exchange.enums.OrderStatus;
import com.chicu.gridbot.exchange.exception.MarketDataException;
import com.chicu.gridbot.exchange.exception.OrderNotFoundException;
import com.chicu.gridbot.exchange.exception.OrderRejectedException;
import com.chicu.gridbot.exchange.model.OrderInfo;
import com.chicu.gridbot.exchange.model.OrderRequest;
import com.chicu.gridbot.exchange.model.TickerInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class BybitExchangeClientTest {

    private static final String BASE = "https://api.bybit.com";

    private MockRestServiceServer server;
    private BybitExchangeClient client;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        BybitProperties props = new BybitProperties();
        props.setApiKey("key");
        props.setApiSecret("secret");
        client = new BybitExchangeClient(rest, new ObjectMapper(), props);
    }

    private void respond(String url, HttpMethod method, String json) {
        server.expect(requestTo(url))
                .andExpect(method(method))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
    }

    @Test
    void tickerIsParsedFromFirstListEntry() {
        respond(BASE + "/v5/market/tickers?category=spot&symbol=DOGEUSDT", HttpMethod.GET, """
                {"retCode":0,"retMsg":"OK","result":{"list":[
                  {"symbol":"DOGEUSDT","bid1Price":"0.1001","ask1Price":"0.1002","lastPrice":"0.10015","volume24h":"12345.6"}
                ]}}""");

        TickerInfo t = client.getTicker("DOGEUSDT");

        assertThat(t.getBid()).isEqualByComparingTo("0.1001");
        assertThat(t.getAsk()).isEqualByComparingTo("0.1002");
        assertThat(t.getLast()).isEqualByComparingTo("0.10015");
        assertThat(t.getVolume()).isEqualByComparingTo("12345.6");
        server.verify();
    }

    @Test
    void tickerWithoutRequiredFieldIsMarketDataError() {
        respond(BASE + "/v5/market/tickers?category=spot&symbol=DOGEUSDT", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[{"symbol":"DOGEUSDT","bid1Price":"0.1","ask1Price":"0.2","volume24h":"1"}]}}""");

        assertThatThrownBy(() -> client.getTicker("DOGEUSDT"))
                .isInstanceOf(MarketDataException.class)
                .hasMessageContaining("lastPrice");
    }

    @Test
    void unknownSymbolAndOutageAreMarketDataErrors() {
        respond(BASE + "/v5/market/tickers?category=spot&symbol=NOPEUSDT", HttpMethod.GET, """
                {"retCode":10001,"retMsg":"Not supported symbols","result":{}}""");
        assertThatThrownBy(() -> client.getTicker("NOPEUSDT")).isInstanceOf(MarketDataException.class);

        server.reset();
        server.expect(requestTo(BASE + "/v5/market/tickers?category=spot&symbol=DOGEUSDT")).andRespond(withServerError());
        assertThatThrownBy(() -> client.getTicker("DOGEUSDT")).isInstanceOf(MarketDataException.class);
    }

    @Test
    void freeBalanceIsWalletMinusLockedAndRequestIsSigned() {
        server.expect(requestTo(BASE + "/v5/account/wallet-balance?accountType=UNIFIED&coin=USDT"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-BAPI-API-KEY", "key"))
                .andExpect(header("X-BAPI-RECV-WINDOW", "5000"))
                .andRespond(withSuccess("""
                        {"retCode":0,"result":{"list":[{"coin":[
                          {"coin":"USDT","walletBalance":"100","locked":"30"}
                        ]}]}}""", MediaType.APPLICATION_JSON));

        assertThat(client.getFreeBalance("USDT")).isEqualByComparingTo("70");
        server.verify();
    }

    @Test
    void missingCoinMeansZeroBalance() {
        respond(BASE + "/v5/account/wallet-balance?accountType=UNIFIED&coin=DOGE", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[{"coin":[]}]}}""");

        assertThat(client.getFreeBalance("DOGE")).isZero();
    }

    @Test
    void openOrdersFollowCursorAndDropClosedOnes() {
        respond(BASE + "/v5/order/realtime?category=spot&limit=50&symbol=DOGEUSDT", HttpMethod.GET, """
                {"retCode":0,"result":{"nextPageCursor":"p2","list":[
                  {"orderId":"1","orderLinkId":"g-DOGEUSDT-0-B-abc","symbol":"DOGEUSDT","side":"Buy","qty":"100","price":"0.099","orderStatus":"New"},
                  {"orderId":"2","orderLinkId":"","symbol":"DOGEUSDT","side":"Sell","qty":"100","price":"0.101","orderStatus":"Filled"}
                ]}}""");
        respond(BASE + "/v5/order/realtime?category=spot&limit=50&symbol=DOGEUSDT&cursor=p2", HttpMethod.GET, """
                {"retCode":0,"result":{"nextPageCursor":"","list":[
                  {"orderId":"3","symbol":"DOGEUSDT","side":"Sell","qty":"50","price":"0.102","orderStatus":"PartiallyFilled"}
                ]}}""");

        List<OrderInfo> open = client.getOpenOrders("DOGEUSDT");

        assertThat(open).extracting(OrderInfo::getOrderId).containsExactly("1", "3");
        assertThat(open.get(0).getClientOrderId()).isEqualTo("g-DOGEUSDT-0-B-abc");
        assertThat(open.get(0).getSide()).isEqualTo(OrderSide.BUY);
        assertThat(open.get(1).getClientOrderId()).isNull();
        assertThat(open.get(1).getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        server.verify();
    }

    @Test
    void limitOrderIsQuantizedToInstrumentSteps() {
        respond(BASE + "/v5/market/instruments-info?category=spot&symbol=DOGEUSDT", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[{"symbol":"DOGEUSDT",
                  "priceFilter":{"tickSize":"0.0001"},
                  "lotSizeFilter":{"basePrecision":"0.1","minOrderQty":"1","minOrderAmt":"1"}}]}}""");
        server.expect(requestTo(BASE + "/v5/order/create"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-BAPI-API-KEY", "key"))
                .andExpect(jsonPath("$.category").value("spot"))
                .andExpect(jsonPath("$.side").value("Buy"))
                .andExpect(jsonPath("$.orderType").value("Limit"))
                .andExpect(jsonPath("$.qty").value("12.3"))
                .andExpect(jsonPath("$.price").value("0.1234"))
                .andExpect(jsonPath("$.orderLinkId").value("g-DOGEUSDT-1-B-xyz"))
                .andRespond(withSuccess("""
                        {"retCode":0,"retMsg":"OK","result":{"orderId":"1500","orderLinkId":"g-DOGEUSDT-1-B-xyz"}}""",
                        MediaType.APPLICATION_JSON));

        String id = client.placeLimitOrder(OrderRequest.builder()
                .symbol("DOGEUSDT")
                .side(OrderSide.BUY)
                .quantity(new BigDecimal("12.38"))
                .price(new BigDecimal("0.12345"))
                .clientOrderId("g-DOGEUSDT-1-B-xyz")
                .build());

        assertThat(id).isEqualTo("1500");
        server.verify();
    }

    @Test
    void tooSmallOrderIsRejectedBeforeSending() {
        respond(BASE + "/v5/market/instruments-info?category=spot&symbol=DOGEUSDT", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[{"symbol":"DOGEUSDT",
                  "priceFilter":{"tickSize":"0.0001"},
                  "lotSizeFilter":{"basePrecision":"0.1","minOrderQty":"10","minOrderAmt":"1"}}]}}""");

        assertThatThrownBy(() -> client.placeLimitOrder(OrderRequest.builder()
                .symbol("DOGEUSDT").side(OrderSide.SELL)
                .quantity(new BigDecimal("5")).price(new BigDecimal("0.1"))
                .build()))
                .isInstanceOf(OrderRejectedException.class)
                .hasMessageContaining("меньше минимального");
        server.verify();
    }

    @Test
    void venueRejectionCarriesReason() {
        respond(BASE + "/v5/market/instruments-info?category=spot&symbol=DOGEUSDT", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[{"symbol":"DOGEUSDT",
                  "priceFilter":{"tickSize":"0.0001"},
                  "lotSizeFilter":{"basePrecision":"0.1","minOrderQty":"1"}}]}}""");
        respond(BASE + "/v5/order/create", HttpMethod.POST, """
                {"retCode":170131,"retMsg":"Insufficient balance.","result":{}}""");

        assertThatThrownBy(() -> client.placeLimitOrder(OrderRequest.builder()
                .symbol("DOGEUSDT").side(OrderSide.BUY)
                .quantity(new BigDecimal("100")).price(new BigDecimal("0.1"))
                .build()))
                .isInstanceOf(OrderRejectedException.class)
                .satisfies(e -> assertThat(((OrderRejectedException) e).getReason()).contains("Insufficient balance"));
    }

    @Test
    void orderStatusFallsBackToHistory() {
        respond(BASE + "/v5/order/realtime?category=spot&symbol=DOGEUSDT&orderId=77", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[]}}""");
        respond(BASE + "/v5/order/history?category=spot&symbol=DOGEUSDT&orderId=77", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[{"orderId":"77","orderStatus":"Filled"}]}}""");

        assertThat(client.getOrderStatus("77", "DOGEUSDT")).isEqualTo(OrderStatus.FILLED);
    }

    @Test
    void orderUnknownEverywhereIsNotFound() {
        respond(BASE + "/v5/order/realtime?category=spot&symbol=DOGEUSDT&orderId=78", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[]}}""");
        respond(BASE + "/v5/order/history?category=spot&symbol=DOGEUSDT&orderId=78", HttpMethod.GET, """
                {"retCode":0,"result":{"list":[]}}""");

        assertThatThrownBy(() -> client.getOrderStatus("78", "DOGEUSDT")).isInstanceOf(OrderNotFoundException.class);
    }

    @Test
    void cancellingMissingOrderIsNotFound() {
        server.expect(requestTo(BASE + "/v5/order/cancel"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.orderId").value("79"))
                .andRespond(withSuccess("""
                        {"retCode":170213,"retMsg":"Order does not exist.","result":{}}""", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.cancelOrder("79", "DOGEUSDT")).isInstanceOf(OrderNotFoundException.class);
    }

    @Test
    void quantizeDownFloorsToStep() {
        assertThat(BybitExchangeClient.quantizeDown(new BigDecimal("1.2399"), new BigDecimal("0.01")))
                .isEqualByComparingTo("1.23");
        assertThat(BybitExchangeClient.quantizeDown(new BigDecimal("17"), new BigDecimal("5")))
                .isEqualByComparingTo("15");
    }
}
