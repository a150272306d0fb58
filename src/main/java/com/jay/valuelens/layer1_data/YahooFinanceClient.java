package com.jay.valuelens.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.valuelens.config.AnalysisConfig;
import com.jay.valuelens.model.RawFinancials;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Cookie;
import okhttp3.CookieJar;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1 — Yahoo Finance statement source.
 * Fetches annual statements plus profile/price/ratio modules for one ticker
 * through the quoteSummary API, authenticated with a session cookie and crumb.
 *
 * Endpoint: https://query2.finance.yahoo.com/v10/finance/quoteSummary/{symbol}
 */
@Slf4j
@Component
public class YahooFinanceClient implements FinancialDataSource {

    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
        + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String QUOTE_SUMMARY_URL = "https://query2.finance.yahoo.com/v10/finance/quoteSummary/";

    private final AnalysisConfig.Fetch fetchConfig;
    // In-memory CookieJar — stores all cookies and matches them by URL.
    private final List<Cookie> cookieStore = new CopyOnWriteArrayList<>();
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    // Caps concurrent Yahoo Finance calls to avoid rate-limiting on large batches
    private final Semaphore rateLimiter;

    private volatile String crumb = null;

    @Autowired
    public YahooFinanceClient(AnalysisConfig config) {
        this(config, new OkHttpClient.Builder());
    }

    YahooFinanceClient(AnalysisConfig config, OkHttpClient.Builder clientBuilder) {
        this.fetchConfig = config.fetch();
        this.rateLimiter = new Semaphore(Math.max(1, fetchConfig.getMaxConcurrentRequests()));
        this.httpClient = clientBuilder
            .connectTimeout(fetchConfig.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(fetchConfig.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .cookieJar(new CookieJar() {
                @Override public void saveFromResponse(HttpUrl url, List<Cookie> cookies) {
                    cookieStore.addAll(cookies);
                }
                @Override public List<Cookie> loadForRequest(HttpUrl url) {
                    List<Cookie> matched = new ArrayList<>();
                    for (Cookie c : cookieStore) { if (c.matches(url)) matched.add(c); }
                    return matched;
                }
            })
            .build();
    }

    @Override
    public RawFinancials fetch(String ticker) {
        if (crumb == null) initCredentials();
        if (crumb == null) {
            throw new DataFetchException(ticker, "Yahoo Finance session could not be established");
        }
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataFetchException(ticker, "Interrupted while waiting for Yahoo Finance", e);
        }
        try {
            try {
                return doFetch(ticker, false);
            } finally {
                rateLimiter.release();
            }
        } finally {
            pause();
        }
    }

    private RawFinancials doFetch(String ticker, boolean isRetry) {
        HttpUrl url = HttpUrl.get(QUOTE_SUMMARY_URL).newBuilder()
            .addPathSegment(ticker)
            .addQueryParameter("modules", String.join(",", modules()))
            .addQueryParameter("crumb", crumb)
            .build();
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", USER_AGENT)
            .addHeader("Accept", "application/json")
            .get().build();

        try (Response response = httpClient.newCall(request).execute()) {
            if ((response.code() == 401 || response.code() == 403) && !isRetry) {
                log.warn("Yahoo Finance returned {} for {} — refreshing crumb and retrying", response.code(), ticker);
                resetCredentials();
                initCredentials();
                if (crumb == null) throw new DataFetchException(ticker, "Yahoo Finance session expired");
                return doFetch(ticker, true);
            }
            if (response.body() == null) {
                throw new DataFetchException(ticker, "Empty response from Yahoo Finance (HTTP " + response.code() + ")");
            }
            JsonNode root = mapper.readTree(response.body().string());
            if (!response.isSuccessful() && root.path("quoteSummary").path("error").isMissingNode()) {
                throw new DataFetchException(ticker, "Yahoo Finance returned HTTP " + response.code());
            }
            return QuoteSummaryParser.parse(ticker, root);
        } catch (IOException e) {
            throw new DataFetchException(ticker, "Yahoo Finance request failed: " + e.getMessage(), e);
        }
    }

    static List<String> modules() {
        List<String> modules = new ArrayList<>(QuoteSummaryParser.INFO_MODULES);
        modules.addAll(QuoteSummaryParser.STATEMENT_MODULES);
        return modules;
    }

    /**
     * Obtains a session cookie (from fc.yahoo.com) and crumb (from
     * query2.finance.yahoo.com/v1/test/getcrumb). Both are cached and reused.
     */
    private synchronized void initCredentials() {
        if (crumb != null) return; // another thread already refreshed
        try {
            // Step 1 — visit fc.yahoo.com; the CookieJar keeps every Set-Cookie header
            Request fcReq = new Request.Builder()
                .url("https://fc.yahoo.com")
                .addHeader("User-Agent", USER_AGENT)
                .addHeader("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .get().build();
            try (Response fcResp = httpClient.newCall(fcReq).execute()) {
                log.debug("fc.yahoo.com responded with HTTP {}", fcResp.code());
            }

            // Step 2 — get crumb; cookies are sent automatically by the CookieJar
            Request crumbReq = new Request.Builder()
                .url("https://query2.finance.yahoo.com/v1/test/getcrumb")
                .addHeader("User-Agent", USER_AGENT)
                .addHeader("Accept", "text/plain")
                .get().build();
            try (Response crumbResp = httpClient.newCall(crumbReq).execute()) {
                if (!crumbResp.isSuccessful() || crumbResp.body() == null) {
                    log.warn("Yahoo Finance: crumb request returned {}", crumbResp.code());
                    return;
                }
                String value = crumbResp.body().string().trim();
                if (value.isEmpty() || value.startsWith("{")) {
                    log.warn("Yahoo Finance: invalid crumb received: {}", value);
                    return;
                }
                crumb = value;
                log.info("Yahoo Finance credentials initialised (crumb length={})", value.length());
            }
        } catch (IOException e) {
            log.error("Yahoo Finance credential init failed: {}", e.getMessage());
        }
    }

    private synchronized void resetCredentials() {
        crumb = null;
        cookieStore.clear();
    }

    // Spacing between calls; an interrupt cuts it short and is left set for the caller.
    private void pause() {
        long delay = fetchConfig.getRequestDelayMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
