package com.jobsearchops.pipeline.http;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * GET-only client for feed documents. Never throws for network trouble: every failure comes back
 * as an {@link HttpFetchResult} with an error code. The request timeout bounds the whole exchange,
 * body included. Requests are not retried; the next scheduled poll is the retry.
 */
@Service
public class FeedHttpClient {
    private static final Logger log = LoggerFactory.getLogger(FeedHttpClient.class);
    private static final String FEED_ACCEPT =
        "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.9, */*;q=0.5";

    private final PipelineProperties.Feed properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public FeedHttpClient(PipelineProperties properties) {
        this.properties = properties.getFeed();
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(this.properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public HttpFetchResult get(String url) {
        Instant startedAt = Instant.now();
        URI uri = parseFeedUri(url);
        if (uri == null) {
            return errorResult(url, startedAt, "invalid_url", "Feed URL must be an absolute http(s) URL with a host");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            enforcePerHostDelay(host);
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", PipelineProperties.Feed.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", FEED_ACCEPT)
                .GET()
                .build();

            long timeoutMillis = Duration.ofSeconds(properties.getRequestTimeoutSeconds()).toMillis();
            AtomicReference<InputStream> openBody = new AtomicReference<>();
            CompletableFuture<HttpResponse<InputStream>> pending =
                client.sendAsync(request, HttpResponse.BodyHandlers.ofInputStream());
            CompletableFuture<BoundedBody> download = pending.thenApply(response -> {
                openBody.set(response.body());
                return readBounded(response);
            });
            BoundedBody body;
            try {
                body = download.get(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                pending.cancel(true);
                closeQuietly(url, openBody.get());
                return errorResult(url, startedAt, "timeout", "Feed not received within " + timeoutMillis + "ms");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof UncheckedIOException ? e.getCause().getCause() : e.getCause();
                if (cause instanceof HttpTimeoutException) {
                    return errorResult(url, startedAt, "timeout", cause.getMessage());
                }
                if (cause instanceof IOException) {
                    return errorResult(url, startedAt, "io_error", cause.getMessage());
                }
                return errorResult(url, startedAt, "http_error", cause == null ? e.getMessage() : cause.getMessage());
            }
            if (body.tooLargeMessage() != null) {
                return errorResult(url, startedAt, "body_too_large", body.tooLargeMessage());
            }
            HttpResponse<InputStream> response = body.response();
            HttpFetchResult result = new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                new String(body.bytes(), StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
            log.debug("Fetched {} status={} bytes={} in {}ms", url, result.statusCode(), body.bytes().length, result.duration().toMillis());
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (RuntimeException e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private BoundedBody readBounded(HttpResponse<InputStream> response) {
        int maxBytes = properties.getMaxFeedBytes();
        long declaredLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
        try (InputStream in = response.body()) {
            if (declaredLength > maxBytes) {
                return new BoundedBody(response, null, "Content-Length " + declaredLength + " exceeds " + maxBytes);
            }
            byte[] bytes = in.readNBytes(maxBytes + 1);
            if (bytes.length > maxBytes) {
                return new BoundedBody(response, null, "Feed body exceeds " + maxBytes + " bytes");
            }
            return new BoundedBody(response, bytes, null);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void closeQuietly(String url, InputStream in) {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Closing timed out body of {} failed: {}", url, e.getMessage());
        }
    }

    /**
     * @return the parsed URI, or {@code null} unless {@code input} is an absolute http/https URL
     *     with a host
     */
    public static URI parseFeedUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(input.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
            if (!normalizedScheme.equals("http") && !normalizedScheme.equals("https")) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(Math.max(1, properties.getPerHostDelayMs())));
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private record BoundedBody(HttpResponse<InputStream> response, byte[] bytes, String tooLargeMessage) {
    }
}
