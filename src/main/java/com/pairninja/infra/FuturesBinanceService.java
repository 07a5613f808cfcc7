package com.pairninja.infra;

import com.pairninja.config.Config;
import com.pairninja.engine.execution.OrderExecutionException;
import com.pairninja.model.FundingRate;
import com.pairninja.model.Instrument;
import com.pairninja.model.OrderRequest;
import com.pairninja.model.OrderType;
import com.pairninja.model.PriceBar;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Binance USDT-M Futures adapter.
 *
 * Direct REST calls over OkHttp with HMAC-SHA256 signing:
 * - prices: /fapi/v1/klines (close) and /fapi/v1/markPriceKlines (mark)
 * - funding: /fapi/v1/premiumIndex (current) and /fapi/v1/fundingRate (history)
 * - orders: /fapi/v1/order, closes sent reduce-only, each with a newClientOrderId
 * - equity: /fapi/v2/account
 *
 * Every call waits on the shared {@link ExchangeRateLimiter}. Reads retry
 * transient failures (HTTP 429, 5xx, IO) with exponential backoff; order calls
 * are not retried here because the execution coordinator owns order retries.
 *
 * An order POST that fails without an HTTP response may still have reached the
 * exchange. Its client order id is remembered, and the next attempt for the
 * same request looks the order up before sending it again.
 */
public class FuturesBinanceService implements PriceSource, FundingSource, OrderTransport, AccountBalanceSource {
    private static final Logger logger = LoggerFactory.getLogger(FuturesBinanceService.class);
    private static final String FUTURES_BASE_URL = "https://fapi.binance.com";
    private static final int MAX_KLINES_PER_REQUEST = 1500;
    private static final int MAX_FUNDING_PER_REQUEST = 1000;
    private static final int ORDER_DOES_NOT_EXIST = -2013;

    private final String baseUrl;
    private final String apiKey;
    private final String secretKey;
    private final OkHttpClient httpClient;
    private final ExchangeRateLimiter rateLimiter;
    private final int barIntervalSeconds;
    private final int fundingIntervalHours;

    // Mac is not thread-safe; one initialized instance per thread
    private final ThreadLocal<Mac> macThreadLocal;
    private final Retry readRetry;
    private final Set<String> unconfirmedOrders = ConcurrentHashMap.newKeySet();

    public FuturesBinanceService(Config config, ExchangeRateLimiter rateLimiter, int barIntervalSeconds,
            int fundingIntervalHours) {
        this(FUTURES_BASE_URL, config.get(Config.BINANCE_API_KEY), config.get(Config.BINANCE_SECRET_KEY),
                new OkHttpClient.Builder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .readTimeout(Duration.ofSeconds(30))
                        .writeTimeout(Duration.ofSeconds(30))
                        .build(),
                rateLimiter, barIntervalSeconds, fundingIntervalHours);
    }

    public FuturesBinanceService(String baseUrl, String apiKey, String secretKey, OkHttpClient httpClient,
            ExchangeRateLimiter rateLimiter, int barIntervalSeconds, int fundingIntervalHours) {
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.secretKey = secretKey;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.barIntervalSeconds = barIntervalSeconds;
        this.fundingIntervalHours = fundingIntervalHours;

        this.macThreadLocal = ThreadLocal.withInitial(() -> {
            try {
                Mac mac = Mac.getInstance("HmacSHA256");
                mac.init(new SecretKeySpec(this.secretKey.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
                return mac;
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Failed to initialize HMAC SHA256", e);
            }
        });

        if (apiKey == null || secretKey == null) {
            logger.warn("⚠️ Binance API keys not found. Signed requests (orders, account) will fail.");
        }

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(4)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(500), 2.0))
                .retryOnException(e -> e instanceof IOException
                        && (!(e instanceof ExchangeHttpException) || ((ExchangeHttpException) e).isTransient()))
                .build();
        this.readRetry = Retry.of("binanceRead", retryConfig);
        readRetry.getEventPublisher()
                .onRetry(event -> logger.warn("🔄 API Retry {}/{}: {}",
                        event.getNumberOfRetryAttempts(), retryConfig.getMaxAttempts(),
                        event.getLastThrowable().getMessage()));

        logger.info("✅ Binance Futures service initialized ({} bars, funding every {}h)",
                klineInterval(barIntervalSeconds), fundingIntervalHours);
    }

    // ==================== PriceSource ====================

    @Override
    public PriceBar fetchBar(Instrument symbol, Instant barClose) throws MarketDataException {
        Instant open = barClose.minusSeconds(barIntervalSeconds);
        List<PriceBar> bars = fetchHistory(symbol, barClose, barClose);
        for (PriceBar bar : bars) {
            if (bar.getTimestamp().equals(barClose)) {
                return bar;
            }
        }
        throw new MarketDataException("No " + symbol + " bar opening at " + open + " (close " + barClose + ")");
    }

    @Override
    public List<PriceBar> fetchHistory(Instrument symbol, Instant start, Instant end) throws MarketDataException {
        List<PriceBar> result = new ArrayList<>();
        long intervalMs = barIntervalSeconds * 1000L;
        long cursor = start.toEpochMilli() - intervalMs;
        long lastOpen = end.toEpochMilli() - intervalMs;

        while (cursor <= lastOpen) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("symbol", symbol.getExchangeSymbol());
            params.put("interval", klineInterval(barIntervalSeconds));
            params.put("startTime", cursor);
            params.put("endTime", lastOpen);
            params.put("limit", MAX_KLINES_PER_REQUEST);

            List<PriceBar> closes = parseKlines(symbol, readGet("/fapi/v1/klines", params), barIntervalSeconds);
            List<PriceBar> marks = parseKlines(symbol, readGet("/fapi/v1/markPriceKlines", params),
                    barIntervalSeconds);
            if (closes.isEmpty()) {
                break;
            }
            result.addAll(mergeMarks(symbol, closes, marks));
            cursor = closes.get(closes.size() - 1).getTimestamp().toEpochMilli();
            if (closes.size() < MAX_KLINES_PER_REQUEST) {
                break;
            }
        }
        logger.debug("Loaded {} {} bars between {} and {}", result.size(), symbol, start, end);
        return result;
    }

    // ==================== FundingSource ====================

    /**
     * Funding rate currently in effect. Binance only publishes the live
     * estimate, so {@code at} is used as the snapshot timestamp.
     */
    @Override
    public FundingRate fetchRate(Instrument symbol, Instant at) throws MarketDataException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", symbol.getExchangeSymbol());
        return parsePremiumIndex(symbol, readGet("/fapi/v1/premiumIndex", params), at, fundingIntervalHours);
    }

    @Override
    public List<FundingRate> fetchFundingHistory(Instrument symbol, Instant start, Instant end) throws MarketDataException {
        List<FundingRate> result = new ArrayList<>();
        long cursor = start.toEpochMilli();
        while (cursor <= end.toEpochMilli()) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("symbol", symbol.getExchangeSymbol());
            params.put("startTime", cursor);
            params.put("endTime", end.toEpochMilli());
            params.put("limit", MAX_FUNDING_PER_REQUEST);

            List<FundingRate> page = parseFundingHistory(symbol, readGet("/fapi/v1/fundingRate", params),
                    fundingIntervalHours);
            if (page.isEmpty()) {
                break;
            }
            result.addAll(page);
            cursor = page.get(page.size() - 1).getTimestamp().toEpochMilli() + 1;
            if (page.size() < MAX_FUNDING_PER_REQUEST) {
                break;
            }
        }
        return result;
    }

    // ==================== OrderTransport ====================

    @Override
    public double submit(OrderRequest request) throws OrderExecutionException {
        return placeOrder(request, false);
    }

    @Override
    public double close(OrderRequest request) throws OrderExecutionException {
        return placeOrder(request, true);
    }

    private double placeOrder(OrderRequest request, boolean reduceOnly) throws OrderExecutionException {
        String clientOrderId = request.getClientOrderId();
        if (unconfirmedOrders.contains(clientOrderId)) {
            Double filled = lookupOrder(request);
            if (filled != null) {
                unconfirmedOrders.remove(clientOrderId);
                logger.warn("⚠️ Order {} reached the exchange before the failure, filled {}", clientOrderId, filled);
                return filled;
            }
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", request.getSymbol().getExchangeSymbol());
        params.put("side", request.getSide().name());
        params.put("type", request.getType().name());
        params.put("quantity", plain(request.getQuantity()));
        if (request.getType() == OrderType.LIMIT) {
            params.put("price", plain(request.getPrice()));
            params.put("timeInForce", "IOC");
        }
        if (reduceOnly) {
            params.put("reduceOnly", true);
        }
        params.put("newClientOrderId", clientOrderId);
        params.put("newOrderRespType", "RESULT");

        logger.info("Placing {} order {}: {}", reduceOnly ? "reduce-only" : "opening", clientOrderId, request);
        String body;
        try {
            body = signedRequest("POST", "/fapi/v1/order", params);
        } catch (ExchangeHttpException e) {
            if (e.isTransient()) {
                throw OrderExecutionException.transientError("Order " + request + " failed: " + e.getMessage(), e);
            }
            throw new OrderExecutionException(OrderExecutionException.Kind.REJECTED,
                    "Order " + request + " rejected: " + e.getMessage(), e);
        } catch (IOException e) {
            // No response: the order may have been accepted
            unconfirmedOrders.add(clientOrderId);
            throw OrderExecutionException.transientError("Order " + request + " failed: " + e.getMessage(), e);
        }
        unconfirmedOrders.remove(clientOrderId);
        try {
            return parseExecutedQty(body);
        } catch (JSONException e) {
            throw new OrderExecutionException(OrderExecutionException.Kind.REJECTED,
                    "Unreadable order response for " + request + ": " + body, e);
        }
    }

    /**
     * Filled quantity of an earlier attempt of this request, or null if the
     * exchange never saw it or it ended without a fill.
     */
    private Double lookupOrder(OrderRequest request) throws OrderExecutionException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", request.getSymbol().getExchangeSymbol());
        params.put("origClientOrderId", request.getClientOrderId());
        String body;
        try {
            body = signedRequest("GET", "/fapi/v1/order", params);
        } catch (ExchangeHttpException e) {
            if (errorCode(e.getBody()) == ORDER_DOES_NOT_EXIST) {
                logger.info("Order {} never reached the exchange, sending it again", request.getClientOrderId());
                return null;
            }
            throw OrderExecutionException.transientError("Status of order " + request.getClientOrderId()
                    + " unknown: " + e.getMessage(), e);
        } catch (IOException e) {
            throw OrderExecutionException.transientError("Status of order " + request.getClientOrderId()
                    + " unknown: " + e.getMessage(), e);
        }
        try {
            double filled = parseExecutedQty(body);
            return filled > 0 ? filled : null;
        } catch (JSONException e) {
            throw OrderExecutionException.transientError("Unreadable order status for "
                    + request.getClientOrderId() + ": " + body, e);
        }
    }

    static int errorCode(String body) {
        try {
            return new JSONObject(body).optInt("code", 0);
        } catch (JSONException e) {
            return 0;
        }
    }

    // ==================== AccountBalanceSource ====================

    @Override
    public double fetchEquity() throws MarketDataException {
        String body;
        try {
            body = readRetry.executeCheckedSupplier(() -> signedRequest("GET", "/fapi/v2/account",
                    new LinkedHashMap<>()));
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new MarketDataException("Account info unavailable: " + t.getMessage(), t);
        }
        try {
            return parseEquity(body);
        } catch (JSONException e) {
            throw new MarketDataException("Unreadable account response: " + e.getMessage(), e);
        }
    }

    // ==================== HTTP ====================

    private String readGet(String endpoint, Map<String, Object> params) throws MarketDataException {
        CheckedSupplier<String> call = () -> publicGet(endpoint, params);
        try {
            return readRetry.executeCheckedSupplier(call);
        } catch (Error e) {
            throw e;
        } catch (Throwable t) {
            throw new MarketDataException("GET " + endpoint + " failed: " + t.getMessage(), t);
        }
    }

    private String publicGet(String endpoint, Map<String, Object> params) throws IOException {
        rateLimiter.acquire();
        String url = baseUrl + endpoint + "?" + buildQueryString(params);
        Request request = new Request.Builder().url(url).get().build();
        return execute(request);
    }

    /**
     * Make a signed request to Binance Futures API
     */
    private String signedRequest(String method, String endpoint, Map<String, Object> params) throws IOException {
        rateLimiter.acquire();
        Map<String, Object> signed = new LinkedHashMap<>(params);
        signed.put("recvWindow", 5000);
        signed.put("timestamp", System.currentTimeMillis());

        String queryString = buildQueryString(signed);
        queryString += "&signature=" + sign(queryString);
        String url = baseUrl + endpoint + "?" + queryString;

        Request.Builder requestBuilder = new Request.Builder()
                .url(url)
                .addHeader("X-MBX-APIKEY", apiKey == null ? "" : apiKey);
        if ("POST".equals(method)) {
            requestBuilder.post(RequestBody.create("", MediaType.parse("application/x-www-form-urlencoded")));
        } else {
            requestBuilder.get();
        }
        return execute(requestBuilder.build());
    }

    private String execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new ExchangeHttpException(response.code(), body);
            }
            return body;
        }
    }

    static String buildQueryString(Map<String, Object> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append("&");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
        }
        return sb.toString();
    }

    private String sign(String data) {
        if (secretKey == null) {
            throw new IllegalStateException("Binance secret key is not configured");
        }
        return hex(macThreadLocal.get().doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    static String hmacSha256Hex(String secret, String data) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return hex(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
    }

    private static String hex(byte[] hash) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    // ==================== Parsing ====================

    static String klineInterval(int seconds) {
        if (seconds % 3600 == 0) {
            return (seconds / 3600) + "h";
        }
        if (seconds % 60 == 0) {
            return (seconds / 60) + "m";
        }
        throw new IllegalArgumentException("Unsupported bar interval: " + seconds + "s");
    }

    /**
     * Kline rows are [openTime, open, high, low, close, ...]; the bar is
     * stamped with its close (open + interval).
     */
    static List<PriceBar> parseKlines(Instrument symbol, String body, int intervalSeconds)
            throws MarketDataException {
        try {
            JSONArray rows = new JSONArray(body);
            List<PriceBar> bars = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONArray row = rows.getJSONArray(i);
                Instant close = Instant.ofEpochMilli(row.getLong(0)).plusSeconds(intervalSeconds);
                bars.add(PriceBar.ofClose(symbol, close, Double.parseDouble(row.getString(4))));
            }
            return bars;
        } catch (JSONException | IllegalArgumentException e) {
            throw new MarketDataException("Malformed kline response for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private static List<PriceBar> mergeMarks(Instrument symbol, List<PriceBar> closes, List<PriceBar> marks) {
        Map<Instant, Double> markByTime = new TreeMap<>();
        for (PriceBar mark : marks) {
            markByTime.put(mark.getTimestamp(), mark.getClose());
        }
        List<PriceBar> merged = new ArrayList<>(closes.size());
        for (PriceBar bar : closes) {
            merged.add(new PriceBar(symbol, bar.getTimestamp(), null, markByTime.get(bar.getTimestamp()),
                    bar.getClose()));
        }
        return merged;
    }

    static FundingRate parsePremiumIndex(Instrument symbol, String body, Instant at, int intervalHours)
            throws MarketDataException {
        try {
            JSONObject json = new JSONObject(body);
            return new FundingRate(symbol, Double.parseDouble(json.getString("lastFundingRate")), at, intervalHours);
        } catch (JSONException | IllegalArgumentException e) {
            throw new MarketDataException("Malformed premium index for " + symbol + ": " + e.getMessage(), e);
        }
    }

    static List<FundingRate> parseFundingHistory(Instrument symbol, String body, int intervalHours)
            throws MarketDataException {
        try {
            JSONArray rows = new JSONArray(body);
            List<FundingRate> rates = new ArrayList<>(rows.length());
            for (int i = 0; i < rows.length(); i++) {
                JSONObject row = rows.getJSONObject(i);
                rates.add(new FundingRate(symbol, Double.parseDouble(row.getString("fundingRate")),
                        Instant.ofEpochMilli(row.getLong("fundingTime")), intervalHours));
            }
            return rates;
        } catch (JSONException | IllegalArgumentException e) {
            throw new MarketDataException("Malformed funding history for " + symbol + ": " + e.getMessage(), e);
        }
    }

    static double parseExecutedQty(String body) {
        JSONObject json = new JSONObject(body);
        return Double.parseDouble(json.getString("executedQty"));
    }

    static double parseEquity(String body) {
        JSONObject json = new JSONObject(body);
        return Double.parseDouble(json.getString("totalMarginBalance"));
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Non-2xx response. 429 and 5xx are worth retrying.
     */
    static class ExchangeHttpException extends IOException {
        private final int code;
        private final String body;

        ExchangeHttpException(int code, String body) {
            super("HTTP " + code + " - " + body);
            this.code = code;
            this.body = body;
        }

        String getBody() {
            return body;
        }

        boolean isTransient() {
            return code == 429 || code >= 500;
        }
    }
}
