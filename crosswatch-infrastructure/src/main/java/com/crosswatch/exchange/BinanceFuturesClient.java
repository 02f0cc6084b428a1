package com.crosswatch.exchange;

import com.crosswatch.application.config.ConfigKey;
import com.crosswatch.application.ports.ConfigPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Binance USDT-M futures REST client (fapi):
 *  - klines()            public
 *  - spotKlines()        public, spot market (/api/v3) for monitor-only symbols
 *  - serverTime()        public, used for time sync
 *  - marketOrder()       signed
 *  - changeLeverage()    signed
 *
 * Signed requests carry recvWindow + a server-corrected timestamp. A -1021 answer
 * resyncs the clock before the error is rethrown, so the caller's retry goes out with a fresh offset.
 */
public class BinanceFuturesClient {

    private static final Logger log = LoggerFactory.getLogger(BinanceFuturesClient.class);

    public static final String DEFAULT_BASE_URL = "https://fapi.binance.com";
    public static final String DEFAULT_SPOT_BASE_URL = "https://api.binance.com";

    private final String baseUrl;
    private final String spotBaseUrl;
    private final String apiKey;
    private final String apiSecret;
    private final long recvWindow;
    private final OkHttpClient http;
    private final BinanceServerTime time;
    private final ObjectMapper om = new ObjectMapper();

    public BinanceFuturesClient(ConfigPort cfg) {
        this(
                cfg.get(ConfigKey.BINANCE_BASE_URL.key(), DEFAULT_BASE_URL),
                cfg.get(ConfigKey.BINANCE_SPOT_BASE_URL.key(), DEFAULT_SPOT_BASE_URL),
                cfg.getSecret(ConfigKey.BINANCE_API_KEY.key()),
                cfg.getSecret(ConfigKey.BINANCE_API_SECRET.key()),
                cfg.getLong(ConfigKey.BINANCE_RECV_WINDOW.key(), 5_000),
                defaultHttp(),
                new BinanceServerTime()
        );
    }

    public BinanceFuturesClient(String baseUrl, String apiKey, String apiSecret, long recvWindow,
                                OkHttpClient http, BinanceServerTime time) {
        this(baseUrl, DEFAULT_SPOT_BASE_URL, apiKey, apiSecret, recvWindow, http, time);
    }

    public BinanceFuturesClient(String baseUrl, String spotBaseUrl, String apiKey, String apiSecret, long recvWindow,
                                OkHttpClient http, BinanceServerTime time) {
        this.baseUrl = normalize(baseUrl, DEFAULT_BASE_URL);
        this.spotBaseUrl = normalize(spotBaseUrl, DEFAULT_SPOT_BASE_URL);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.apiSecret = apiSecret == null ? "" : apiSecret.trim();
        this.recvWindow = recvWindow;
        this.http = http;
        this.time = time;
    }

    public static OkHttpClient defaultHttp() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    public boolean hasCredentials() {
        return !apiKey.isBlank() && !apiSecret.isBlank();
    }

    // --------------------------------------------------------------------
    //                              PUBLIC
    // --------------------------------------------------------------------

    /** Most recent futures klines, oldest first. The last row is the kline still forming. */
    public List<Kline> klines(String symbol, String interval, int limit) throws IOException {
        return fetchKlines(baseUrl + "/fapi/v1/klines", symbol, interval, limit);
    }

    /** Same as {@link #klines} on the spot market. */
    public List<Kline> spotKlines(String symbol, String interval, int limit) throws IOException {
        return fetchKlines(spotBaseUrl + "/api/v3/klines", symbol, interval, limit);
    }

    private List<Kline> fetchKlines(String endpoint, String symbol, String interval, int limit) throws IOException {
        String query = "symbol=" + enc(symbol) + "&interval=" + enc(interval) + "&limit=" + limit;
        JsonNode arr = execute(new Request.Builder().url(endpoint + "?" + query).get().build());

        List<Kline> list = new ArrayList<>();
        for (JsonNode node : arr) {
            list.add(new Kline(
                    node.get(0).asLong(),
                    node.get(1).asDouble(),
                    node.get(2).asDouble(),
                    node.get(3).asDouble(),
                    node.get(4).asDouble(),
                    node.get(5).asDouble(),
                    node.get(6).asLong()
            ));
        }
        return list;
    }

    public long serverTime() throws IOException {
        JsonNode n = execute(new Request.Builder().url(baseUrl + "/fapi/v1/time").get().build());
        JsonNode t = n.get("serverTime");
        if (t == null) throw new IOException("serverTime missing in response: " + n);
        return t.asLong();
    }

    /** Measures the offset to server time and applies it to signed timestamps. */
    public long syncTime() throws IOException {
        long sent = time.localNow();
        long server = serverTime();
        long received = time.localNow();
        long offset = time.update(server, sent, received);
        log.info("Binance time synced, offset={} ms", offset);
        return offset;
    }

    // --------------------------------------------------------------------
    //                              SIGNED
    // --------------------------------------------------------------------

    /** MARKET order; {@code quantity} must already be formatted for the venue. */
    public JsonNode marketOrder(String symbol, String side, String quantity) throws IOException {
        String query = "symbol=" + enc(symbol) + "&side=" + enc(side) + "&type=MARKET&quantity=" + enc(quantity);
        return signedPost("/fapi/v1/order", query);
    }

    public JsonNode changeLeverage(String symbol, int leverage) throws IOException {
        return signedPost("/fapi/v1/leverage", "symbol=" + enc(symbol) + "&leverage=" + leverage);
    }

    private JsonNode signedPost(String path, String query) throws IOException {
        if (!hasCredentials()) {
            throw new IllegalStateException("Missing BINANCE_API_KEY / BINANCE_API_SECRET");
        }

        String q = query + "&recvWindow=" + recvWindow + "&timestamp=" + time.now();
        String sig = Signer.hmacSha256(apiSecret, q);

        Request req = new Request.Builder()
                .url(baseUrl + path + "?" + q + "&signature=" + sig)
                .post(RequestBody.create(new byte[0], null))
                .addHeader("X-MBX-APIKEY", apiKey)
                .build();

        try {
            return execute(req);
        } catch (BinanceApiException e) {
            if (e.isTimestampError()) resyncAfterTimestampError();
            throw e;
        }
    }

    private void resyncAfterTimestampError() {
        try {
            syncTime();
        } catch (IOException e) {
            log.warn("Binance time resync failed: {}", e.getMessage());
        }
    }

    private JsonNode execute(Request req) throws IOException {
        try (Response resp = http.newCall(req).execute()) {
            String body = resp.body() != null ? resp.body().string() : "";
            if (!resp.isSuccessful()) {
                throw error(resp.code(), body);
            }
            if (body.isBlank()) return om.createObjectNode();
            return om.readTree(body);
        }
    }

    private BinanceApiException error(int status, String body) {
        int code = 0;
        String msg = body;
        try {
            JsonNode n = om.readTree(body);
            if (n != null && n.has("code")) {
                code = n.get("code").asInt();
                msg = n.path("msg").asText(body);
            }
        } catch (JsonProcessingException e) {
            log.debug("Non-JSON error body from Binance (HTTP {}): {}", status, body);
        }
        return new BinanceApiException(status, code, msg);
    }

    private static String normalize(String url, String def) {
        String u = url == null || url.isBlank() ? def : url.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }

    private static String enc(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
