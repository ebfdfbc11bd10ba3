package com.jobsearchops.pipeline.http;

import static org.assertj.core.api.Assertions.assertThat;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.model.HttpFetchResult;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class FeedHttpClientTest {
  private MockWebServer server;

  @AfterEach
  void tearDown() throws Exception {
    if (server != null) {
      server.shutdown();
    }
  }

  @Test
  void sendsIdentifyingUserAgentAndReturnsBody() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "application/rss+xml")
        .setBody("<rss><channel></channel></rss>"));
    server.start();

    FeedHttpClient client = new FeedHttpClient(properties(5, 5_000_000, "custom-agent/2.0"));
    HttpFetchResult result = client.get(server.url("/feed").toString());

    assertThat(result.isSuccessful()).isTrue();
    assertThat(result.body()).isEqualTo("<rss><channel></channel></rss>");
    assertThat(result.contentType()).isEqualTo("application/rss+xml");
    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    assertThat(request.getMethod()).isEqualTo("GET");
    assertThat(request.getHeader("User-Agent")).isEqualTo("custom-agent/2.0");
    assertThat(request.getHeader("Accept")).contains("application/rss+xml");
  }

  @Test
  void blankUserAgentFallsBackToDefault() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(200).setBody("<feed/>"));
    server.start();

    FeedHttpClient client = new FeedHttpClient(properties(5, 5_000_000, "  "));
    client.get(server.url("/feed").toString());

    RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
    assertThat(request.getHeader("User-Agent")).startsWith("job-search-ops/");
  }

  @Test
  void returnsBodyTooLargeWhenFeedExceedsMaxBytes() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(200).setBody("a".repeat(5000)));
    server.start();

    FeedHttpClient client = new FeedHttpClient(properties(5, 1024, null));
    HttpFetchResult result = client.get(server.url("/big").toString());

    assertThat(result.errorCode()).isEqualTo("body_too_large");
    assertThat(result.body()).isNull();
    assertThat(result.isSuccessful()).isFalse();
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  @Test
  void slowServerYieldsTimeout() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeadersDelay(3, TimeUnit.SECONDS)
        .setBody("<rss/>"));
    server.start();

    FeedHttpClient client = new FeedHttpClient(properties(1, 5_000_000, null));
    HttpFetchResult result = client.get(server.url("/slow").toString());

    assertThat(result.errorCode()).isEqualTo("timeout");
    assertThat(result.isSuccessful()).isFalse();
  }

  @Test
  void trickleBodyIsCutOffAtRequestTimeout() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "application/rss+xml")
        .setBody("<rss><channel>" + "<item><title>x</title></item>".repeat(40) + "</channel></rss>")
        .throttleBody(64, 1, TimeUnit.SECONDS));
    server.start();

    FeedHttpClient client = new FeedHttpClient(properties(1, 5_000_000, null));
    long startedAt = System.nanoTime();
    HttpFetchResult result = client.get(server.url("/trickle").toString());
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

    assertThat(result.errorCode()).isEqualTo("timeout");
    assertThat(result.isSuccessful()).isFalse();
    assertThat(elapsedMs).isLessThan(5_000);
  }

  @Test
  void serverErrorIsReportedByStatus() throws Exception {
    server = new MockWebServer();
    server.enqueue(new MockResponse().setResponseCode(503).setBody("down"));
    server.start();

    FeedHttpClient client = new FeedHttpClient(properties(5, 5_000_000, null));
    HttpFetchResult result = client.get(server.url("/feed").toString());

    assertThat(result.isSuccessful()).isFalse();
    assertThat(result.errorCode()).isNull();
    assertThat(result.errorKey()).isEqualTo("http_503");
  }

  @Test
  void rejectsNonHttpUrlsWithoutRequesting() {
    FeedHttpClient client = new FeedHttpClient(properties(5, 5_000_000, null));

    assertThat(client.get("ftp://example.com/feed.xml").errorCode()).isEqualTo("invalid_url");
    assertThat(client.get("/relative/feed").errorCode()).isEqualTo("invalid_url");
    assertThat(client.get("not a url").errorCode()).isEqualTo("invalid_url");
    assertThat(FeedHttpClient.parseFeedUri("https://jobs.example.com/rss")).isNotNull();
  }

  private PipelineProperties properties(int timeoutSeconds, int maxBytes, String userAgent) {
    PipelineProperties properties = new PipelineProperties();
    properties.getFeed().setRequestTimeoutSeconds(timeoutSeconds);
    properties.getFeed().setPerHostDelayMs(1);
    properties.getFeed().setMaxFeedBytes(maxBytes);
    properties.getFeed().setUserAgent(userAgent);
    return properties;
  }
}
