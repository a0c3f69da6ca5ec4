package io.peerbench.bank.ffiec;

import io.peerbench.bank.error.ProtocolStateException;
import io.peerbench.bank.error.TransientFetchException;
import io.peerbench.retry.ExponentialBackoffRetryPolicy;
import io.peerbench.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Drives {@link BulkDownloadProtocol} over HTTP. Each attempt starts from INIT with a new client and its own
 * cookie jar, so no state leaks between attempts or between periods downloaded in parallel.
 */
public class BulkDownloadSession implements BulkDownloader {
    private static final Logger LOGGER = LoggerFactory.getLogger(BulkDownloadSession.class);

    public static final String DEFAULT_URL = "https://cdr.ffiec.gov/public/pws/downloadbulkdata.aspx";
    private static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final DateTimeFormatter DEBUG_TIME = DateTimeFormatter.ofPattern("HHmmss");

    private final URI formUrl;
    private final Path debugDir;
    private final RetryPolicy retry;
    private final int maxAttempts;
    private final Duration pageTimeout;
    private final Duration archiveTimeout;
    private final Clock clock;

    public BulkDownloadSession(URI formUrl, Path debugDir) {
        this(formUrl, debugDir, 3, 2_000, Duration.ofSeconds(30), Duration.ofSeconds(120), Clock.systemDefaultZone());
    }

    public BulkDownloadSession(URI formUrl, Path debugDir, int maxAttempts, long backoffMillis,
                               Duration pageTimeout, Duration archiveTimeout, Clock clock) {
        this.formUrl = formUrl;
        this.debugDir = debugDir;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retry = new ExponentialBackoffRetryPolicy(this.maxAttempts, backoffMillis, backoffMillis * 8);
        this.pageTimeout = pageTimeout;
        this.archiveTimeout = archiveTimeout;
        this.clock = clock;
    }

    @Override
    public BulkSessionState download(LocalDate period) throws InterruptedException {
        BulkSessionState state = BulkSessionState.init(period);
        for (int attempt = 1; ; attempt++) {
            try {
                return attempt(period);
            } catch (ProtocolStateException | TransientFetchException e) {
                if (retry.shouldRetry(attempt, e)) {
                    LOGGER.warn("Bulk download {} attempt {}/{} failed: {}", period, attempt, maxAttempts, e.getMessage());
                    Thread.sleep(retry.backoffMillis(attempt));
                    continue;
                }
                LOGGER.error("Bulk download {} failed after {} attempt(s): {}", period, attempt, e.getMessage());
                return BulkDownloadProtocol.failed(state, e.getMessage());
            }
        }
    }

    private BulkSessionState attempt(LocalDate period) throws TransientFetchException, InterruptedException {
        HttpClient http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(pageTimeout)
                .build();

        BulkSessionState state = BulkSessionState.init(period);
        state = BulkDownloadProtocol.onFormPage(state, send(http, get(), "form page"));
        state = BulkDownloadProtocol.onDateSelected(state,
                send(http, post(BulkDownloadProtocol.dateSelectionPayload(state), pageTimeout), "date selection"));
        PageResponse download = send(http, post(BulkDownloadProtocol.downloadPayload(state), archiveTimeout), "download");
        try {
            state = BulkDownloadProtocol.onDownload(state, download);
        } catch (ProtocolStateException e) {
            Path saved = saveDebugPage(period, download.body());
            if (saved != null) LOGGER.warn("Download for {} returned a page instead of an archive; saved to {}", period, saved);
            throw e;
        }
        LOGGER.info("Downloaded bulk archive for {} ({} bytes)", period, state.archive().length);
        return state;
    }

    private HttpRequest get() {
        return base(pageTimeout).GET().build();
    }

    private HttpRequest post(Map<String, String> form, Duration timeout) {
        String body = form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return base(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
    }

    private HttpRequest.Builder base(Duration timeout) {
        return HttpRequest.newBuilder(formUrl)
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Referer", formUrl.toString());
    }

    private static PageResponse send(HttpClient http, HttpRequest req, String step)
            throws TransientFetchException, InterruptedException {
        try {
            HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            String type = resp.headers().firstValue("Content-Type").orElse("");
            return new PageResponse(resp.statusCode(), type, resp.body());
        } catch (IOException e) {
            throw new TransientFetchException(step + " failed: " + e.getMessage(), e);
        }
    }

    private Path saveDebugPage(LocalDate period, byte[] body) {
        String name = "ffiec_fail_" + DateTimeFormatter.BASIC_ISO_DATE.format(period)
                + "_" + DEBUG_TIME.format(LocalDateTime.now(clock)) + ".html";
        try {
            Files.createDirectories(debugDir);
            Path file = debugDir.resolve(name);
            Files.write(file, body);
            return file;
        } catch (IOException e) {
            LOGGER.warn("Could not save debug page {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
