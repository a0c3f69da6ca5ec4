package io.peerbench.bank.fdic;

import io.peerbench.bank.error.TransientFetchException;
import io.peerbench.budget.Budget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * BankFind REST client. Every request first takes an external-op permit from the budget so requests are
 * spaced no closer than the configured delay, whichever worker issues them.
 */
public class HttpFdicClient implements FdicApi {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpFdicClient.class);

    public static final String DEFAULT_BASE = "https://banks.data.fdic.gov/api";

    private final HttpClient http;
    private final String base;
    private final String apiKey;
    private final Duration timeout;
    private final Budget budget;

    public HttpFdicClient(URI base, String apiKey, Duration timeout, Budget budget) {
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
        String b = base.toString();
        this.base = b.endsWith("/") ? b.substring(0, b.length() - 1) : b;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.budget = budget;
    }

    @Override
    public String financials(int cert, List<String> fields, int limit) throws TransientFetchException, InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filters", "CERT:" + cert);
        params.put("fields", String.join(",", fields));
        params.put("sort_by", "REPDTE");
        params.put("sort_order", "DESC");
        params.put("limit", Integer.toString(limit));
        params.put("format", "json");
        return get("/financials", params);
    }

    @Override
    public String institution(int cert) throws TransientFetchException, InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filters", "CERT:" + cert);
        params.put("fields", "NAME,STALP");
        params.put("format", "json");
        return get("/institutions", params);
    }

    @Override
    public String locations(int cert) throws TransientFetchException, InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filters", "CERT:" + cert);
        params.put("fields", "STALP");
        params.put("limit", "10000");
        params.put("format", "json");
        return get("/locations", params);
    }

    private String get(String path, Map<String, String> params) throws TransientFetchException, InterruptedException {
        if (apiKey != null && !apiKey.isBlank()) params.put("api_key", apiKey);
        String query = params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        URI uri = URI.create(base + path + "?" + query);
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0")
                .header("Accept", "application/json")
                .GET()
                .build();
        budget.acquireExternalOp();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientFetchException("GET " + path + " failed: " + e.getMessage(), e);
        }
        if (resp.statusCode() != 200) {
            throw new TransientFetchException("GET " + path + " returned HTTP " + resp.statusCode(), resp.statusCode(), null);
        }
        LOGGER.debug("GET {} ok ({} bytes)", path, resp.body().length());
        return resp.body();
    }
}
