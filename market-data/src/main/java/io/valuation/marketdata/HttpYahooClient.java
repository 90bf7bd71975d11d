package io.valuation.marketdata;

import io.valuation.error.NoDataException;
import io.valuation.retry.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Plain HTTP GET against the chart endpoint. Transport failures and non-404 error statuses are retried
 * per the {@link RetryPolicy}; a 404 means the symbol is unknown and is answered with
 * {@link NoDataException} straight away.
 */
final class HttpYahooClient implements YahooClient {
    private static final Logger log = LogManager.getLogger(HttpYahooClient.class);
    static final String DEFAULT_BASE_URL = "https://query1.finance.yahoo.com";

    private final HttpClient http;
    private final String baseUrl;
    private final RetryPolicy retryPolicy;

    HttpYahooClient(RetryPolicy retryPolicy) {
        this(DEFAULT_BASE_URL, retryPolicy);
    }

    HttpYahooClient(String baseUrl, RetryPolicy retryPolicy) {
        this.http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
        this.baseUrl = baseUrl;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String fetch(String symbol, long period1, long period2, String interval) throws Exception {
        String url = String.format(
                "%s/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d&events=div%%2Csplits&includeAdjustedClose=true",
                baseUrl,
                URLEncoder.encode(symbol, StandardCharsets.UTF_8),
                URLEncoder.encode(interval, StandardCharsets.UTF_8),
                period1, period2);
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("User-Agent", "Mozilla/5.0")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                if (resp.statusCode() == 200) return resp.body();
                if (resp.statusCode() == 404) throw new NoDataException("No data found for " + symbol + " (HTTP 404)");
                throw new IOException("Yahoo fetch failed for " + symbol + ": HTTP " + resp.statusCode());
            } catch (IOException e) {
                if (!retryPolicy.shouldRetry(attempt, e)) throw e;
                long backoff = retryPolicy.backoffMillis(attempt);
                log.debug("retrying {} after attempt {} in {} ms: {}", symbol, attempt, backoff, e.getMessage());
                Thread.sleep(backoff);
            }
        }
    }
}
