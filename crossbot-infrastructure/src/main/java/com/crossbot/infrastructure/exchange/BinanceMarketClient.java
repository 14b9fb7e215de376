package com.crossbot.infrastructure.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Public Binance market-data endpoints. No API key is needed for klines.
 */
public class BinanceMarketClient {

    public static final String DEFAULT_BASE_URL = "https://api.binance.com";

    private static final int CLOSE_INDEX = 4;

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final HttpUrl baseUrl;

    public BinanceMarketClient(String baseUrl) {
        this(new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .build(), baseUrl);
    }

    public BinanceMarketClient(OkHttpClient http, String baseUrl) {
        this.http = Objects.requireNonNull(http, "http");
        HttpUrl parsed = HttpUrl.parse(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid market data base url: " + baseUrl);
        }
        this.baseUrl = parsed;
    }

    /**
     * Close prices of the last {@code limit} klines, oldest first.
     *
     * @throws IOException on transport errors, non-2xx responses or an unexpected payload
     */
    public List<Double> closes(String symbol, String interval, int limit) throws IOException {
        HttpUrl url = baseUrl.newBuilder()
                .addPathSegments("api/v3/klines")
                .addQueryParameter("symbol", symbol)
                .addQueryParameter("interval", interval)
                .addQueryParameter("limit", Integer.toString(limit))
                .build();

        Request req = new Request.Builder().url(url).get().build();

        try (Response resp = http.newCall(req).execute()) {
            ResponseBody body = resp.body();
            String text = body != null ? body.string() : "";
            if (!resp.isSuccessful()) {
                throw new IOException("klines HTTP " + resp.code() + ": " + text);
            }

            JsonNode arr = om.readTree(text);
            if (arr == null || !arr.isArray()) {
                throw new IOException("klines: expected a JSON array");
            }

            List<Double> closes = new ArrayList<>(arr.size());
            for (JsonNode kline : arr) {
                JsonNode close = kline.get(CLOSE_INDEX);
                if (close == null) {
                    throw new IOException("klines: entry without close price: " + kline);
                }
                double v = close.asDouble(Double.NaN);
                if (!(v > 0)) {
                    throw new IOException("klines: invalid close price: " + close);
                }
                closes.add(v);
            }
            return closes;
        }
    }
}
