package com.pairninja.infra;

import com.pairninja.engine.execution.OrderExecutionException;
import com.pairninja.model.FundingRate;
import com.pairninja.model.Instrument;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderSide;
import com.pairninja.model.PriceBar;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FuturesBinanceServiceTest {

    @Test
    public void testKlineInterval() {
        assertEquals("15m", FuturesBinanceService.klineInterval(900));
        assertEquals("1h", FuturesBinanceService.klineInterval(3600));
        assertEquals("4h", FuturesBinanceService.klineInterval(14_400));
        assertThrows(IllegalArgumentException.class, () -> FuturesBinanceService.klineInterval(90 * 61 + 1));
    }

    @Test
    public void testQueryStringKeepsInsertionOrder() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", "ETHUSDT");
        params.put("side", "BUY");
        params.put("quantity", "1.25");
        assertEquals("symbol=ETHUSDT&side=BUY&quantity=1.25", FuturesBinanceService.buildQueryString(params));
    }

    @Test
    public void testSignatureMatchesPublishedExample() throws GeneralSecurityException {
        // Example request from the Binance API documentation
        String secret = "NhqPtmdSJYdKjVHjA7PZj4Mge3R5YNiP1e3UZjInClVN65XAbvqqM6A7H5fATj0j";
        String query = "symbol=LTCBTC&side=BUY&type=LIMIT&timeInForce=GTC&quantity=1&price=0.1"
                + "&recvWindow=5000&timestamp=1499827319559";
        assertEquals("c8db56825ae71d6d79447849e617115f4a920fa2acdcab2b053c4b2838bd6b71",
                FuturesBinanceService.hmacSha256Hex(secret, query));
    }

    @Test
    public void testParseKlinesStampsBarClose() throws MarketDataException {
        String body = "[[1709251200000,\"3000.0\",\"3010.0\",\"2995.0\",\"3005.5\",\"100\",1709252099999],"
                + "[1709252100000,\"3005.5\",\"3008.0\",\"3001.0\",\"3002.0\",\"80\",1709252999999]]";

        List<PriceBar> bars = FuturesBinanceService.parseKlines(Instrument.ETH_PERP, body, 900);

        assertEquals(2, bars.size());
        assertEquals(Instant.parse("2024-03-01T00:15:00Z"), bars.get(0).getTimestamp());
        assertEquals(3005.5, bars.get(0).getClose());
    }

    @Test
    public void testMalformedKlinesRaiseMarketDataException() {
        assertThrows(MarketDataException.class,
                () -> FuturesBinanceService.parseKlines(Instrument.BTC_PERP, "{\"code\":-1121}", 900));
    }

    @Test
    public void testParseFunding() throws MarketDataException {
        Instant at = Instant.parse("2024-03-01T00:15:00Z");
        FundingRate current = FuturesBinanceService.parsePremiumIndex(Instrument.BTC_PERP,
                "{\"symbol\":\"BTCUSDT\",\"markPrice\":\"60000.1\",\"lastFundingRate\":\"0.00010000\"}", at, 8);
        assertEquals(0.0001, current.getRate(), 1e-12);
        assertEquals(8, current.getIntervalHours());

        List<FundingRate> history = FuturesBinanceService.parseFundingHistory(Instrument.ETH_PERP,
                "[{\"symbol\":\"ETHUSDT\",\"fundingTime\":1709251200000,\"fundingRate\":\"-0.00005\"}]", 8);
        assertEquals(1, history.size());
        assertEquals(Instant.parse("2024-03-01T00:00:00Z"), history.get(0).getTimestamp());
        assertEquals(-0.00005, history.get(0).getRate(), 1e-12);
    }

    @Test
    public void testParseOrderAndAccount() {
        assertEquals(0.416, FuturesBinanceService.parseExecutedQty(
                "{\"orderId\":1,\"status\":\"FILLED\",\"executedQty\":\"0.416\"}"));
        assertEquals(101_234.5, FuturesBinanceService.parseEquity("{\"totalMarginBalance\":\"101234.5\"}"));
    }

    @Test
    public void testTimedOutOrderIsLookedUpBeforeResend() throws OrderExecutionException {
        ScriptedExchange exchange = new ScriptedExchange();
        exchange.timeout();
        exchange.respond(200, "{\"orderId\":7,\"status\":\"FILLED\",\"executedQty\":\"8\"}");
        FuturesBinanceService service = serviceWith(exchange);
        OrderRequest request = OrderRequest.market(Instrument.ETH_PERP, OrderSide.BUY, 8.0, 3000.0);

        OrderExecutionException e = assertThrows(OrderExecutionException.class, () -> service.submit(request));
        assertEquals(OrderExecutionException.Kind.TRANSIENT, e.getKind());

        assertEquals(8.0, service.submit(request));
        assertEquals(2, exchange.requests.size());
        assertEquals("POST", exchange.requests.get(0).method());
        assertEquals(request.getClientOrderId(), exchange.requests.get(0).url().queryParameter("newClientOrderId"));
        assertEquals("GET", exchange.requests.get(1).method());
        assertEquals(request.getClientOrderId(), exchange.requests.get(1).url().queryParameter("origClientOrderId"));
    }

    @Test
    public void testUnknownOrderIsResentWithSameClientId() throws OrderExecutionException {
        ScriptedExchange exchange = new ScriptedExchange();
        exchange.timeout();
        exchange.respond(400, "{\"code\":-2013,\"msg\":\"Order does not exist.\"}");
        exchange.respond(200, "{\"orderId\":8,\"status\":\"FILLED\",\"executedQty\":\"0.4\"}");
        FuturesBinanceService service = serviceWith(exchange);
        OrderRequest request = OrderRequest.market(Instrument.BTC_PERP, OrderSide.SELL, 0.4, 60_000.0);

        assertThrows(OrderExecutionException.class, () -> service.submit(request));
        assertEquals(0.4, service.submit(request));

        assertEquals(3, exchange.requests.size());
        assertEquals("POST", exchange.requests.get(2).method());
        assertEquals(request.getClientOrderId(), exchange.requests.get(2).url().queryParameter("newClientOrderId"));
    }

    @Test
    public void testAnsweredOrderIsNotLookedUp() throws OrderExecutionException {
        ScriptedExchange exchange = new ScriptedExchange();
        exchange.respond(200, "{\"orderId\":9,\"status\":\"FILLED\",\"executedQty\":\"8\"}");
        FuturesBinanceService service = serviceWith(exchange);

        service.close(OrderRequest.market(Instrument.ETH_PERP, OrderSide.SELL, 8.0, 3000.0));

        assertEquals(1, exchange.requests.size());
        assertEquals("true", exchange.requests.get(0).url().queryParameter("reduceOnly"));
    }

    @Test
    public void testErrorCode() {
        assertEquals(-2013, FuturesBinanceService.errorCode("{\"code\":-2013,\"msg\":\"Order does not exist.\"}"));
        assertEquals(0, FuturesBinanceService.errorCode("<html>bad gateway</html>"));
    }

    private static FuturesBinanceService serviceWith(ScriptedExchange exchange) {
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(exchange).build();
        return new FuturesBinanceService("https://fapi.test", "key", "secret", client,
                new ExchangeRateLimiter("binance-test", 100), 900, 8);
    }

    /**
     * Answers calls from a queue of canned responses and records each request.
     */
    static class ScriptedExchange implements Interceptor {
        final List<Request> requests = new ArrayList<>();
        private final Deque<Object[]> script = new ArrayDeque<>();

        void respond(int code, String body) {
            script.add(new Object[]{code, body});
        }

        void timeout() {
            script.add(new Object[]{null, null});
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            requests.add(chain.request());
            Object[] next = script.poll();
            if (next == null) {
                throw new IllegalStateException("Unexpected call " + chain.request().url());
            }
            if (next[0] == null) {
                throw new IOException("timeout");
            }
            return new Response.Builder()
                    .request(chain.request())
                    .protocol(Protocol.HTTP_1_1)
                    .code((Integer) next[0])
                    .message("scripted")
                    .body(ResponseBody.create((String) next[1], MediaType.get("application/json")))
                    .build();
        }
    }
}
