package com.jobsearchops.pipeline.feed;

import com.jobsearchops.pipeline.model.ActivityLogEntry;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.FeedPollResult;
import com.jobsearchops.pipeline.model.FeedSourceError;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.OpportunitySource;
import com.jobsearchops.pipeline.model.Stage;
import com.jobsearchops.pipeline.service.ActivityLedger;
import com.jobsearchops.pipeline.service.OpportunityService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class FeedIngestionServiceTest {

    @Autowired
    private FeedIngestionService feedIngestionService;
    @Autowired
    private ActivityLedger ledger;
    @Autowired
    private OpportunityService opportunityService;
    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private MockWebServer server;
    private String suffix;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        suffix = UUID.randomUUID().toString().substring(0, 8);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void keywordFilterKeepsOnlyMatchingTitles() {
        server.enqueue(rss(item("Senior Data Manager", "a"), item("Barista", "b"), item("BI Lead", "c")));

        FeedPollResult result = feedIngestionService.poll(List.of(feedUrl()), List.of("data", "bi"));

        assertThat(result.created()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.errors()).isEmpty();
        assertThat(result.createdTitles()).containsExactly("Senior Data Manager", "BI Lead");
        assertThat(countByUrl(postingUrl("b"))).isZero();
    }

    @Test
    void secondPollOfUnchangedFeedCreatesNothing() {
        String body = rssBody(item("Analytics Manager at Initech", "x"), item("Data Manager | Globex", "y"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(body));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(body));

        FeedPollResult first = feedIngestionService.poll(List.of(feedUrl()), List.of());
        FeedPollResult second = feedIngestionService.poll(List.of(feedUrl()), List.of());

        assertThat(first.created()).isEqualTo(2);
        assertThat(second.created()).isZero();
        assertThat(second.skipped()).isEqualTo(2);
        assertThat(countByUrl(postingUrl("x"))).isEqualTo(1);
        assertThat(countByUrl(postingUrl("y"))).isEqualTo(1);
    }

    @Test
    void urlsDifferingOnlyByQueryAreDistinctPostings() {
        server.enqueue(rss(item("Data Manager at Acme", "q"), item("Data Manager at Acme", "q?utm_source=feed")));

        FeedPollResult result = feedIngestionService.poll(List.of(feedUrl()), List.of());

        assertThat(result.created()).isEqualTo(2);
    }

    @Test
    void failingSourcesDoNotStopTheOthers() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html><body>not a feed</body></html>"));
        server.enqueue(rss(item("BI Manager - Hooli", "ok")));

        FeedPollResult result = feedIngestionService.poll(
            List.of("not a url", server.url("/broken").toString(), server.url("/html").toString(), feedUrl()),
            List.of()
        );

        assertThat(result.created()).isEqualTo(1);
        assertThat(result.errors()).extracting(FeedSourceError::source)
            .containsExactly("not a url", server.url("/broken").toString(), server.url("/html").toString());
        assertThat(result.errors().get(0).error()).startsWith("invalid_url");
        assertThat(result.errors().get(1).error()).startsWith("http_500");
        assertThat(result.errors().get(2).error()).startsWith("parse_error");
    }

    @Test
    void createdOpportunityIsAProspectWithLedgerEntry() {
        server.enqueue(rss(item("Decision Science Lead at Pied Piper", "p")));

        feedIngestionService.poll(List.of(feedUrl()), List.of());

        Long id = jdbc.queryForObject(
            "SELECT id FROM opportunities WHERE jd_url = :url",
            new MapSqlParameterSource("url", postingUrl("p")),
            Long.class
        );
        List<ActivityLogEntry> entries = ledger.recent(id, 10);
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).activityType()).isEqualTo(ActivityType.NOTE_ADDED);
        assertThat(entries.get(0).metadata()).contains(postingUrl("p")).contains(feedUrl());

        Opportunity opportunity = opportunityService.get(id);
        assertThat(opportunity.company()).isEqualTo("Pied Piper");
        assertThat(opportunity.roleTitle()).isEqualTo("Decision Science Lead");
        assertThat(opportunity.stage()).isEqualTo(Stage.PROSPECT);
        assertThat(opportunity.source()).isEqualTo(OpportunitySource.OTHER);
        assertThat(opportunity.jdRaw()).isEqualTo("Role p");
        assertThat(opportunity.nextActionDate()).isNotNull();
    }

    private String feedUrl() {
        return server.url("/feed-" + suffix).toString();
    }

    private String postingUrl(String id) {
        return "https://jobs.example.com/" + suffix + "/" + id;
    }

    private String item(String title, String id) {
        return "<item><title>" + title + "</title><link>" + postingUrl(id).replace("&", "&amp;")
            + "</link><description>&lt;p&gt;Role " + id + "&lt;/p&gt;</description></item>";
    }

    private MockResponse rss(String... items) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/rss+xml")
            .setBody(rssBody(items));
    }

    private String rssBody(String... items) {
        return "<?xml version=\"1.0\"?><rss version=\"2.0\"><channel><title>Test</title>"
            + String.join("", items)
            + "</channel></rss>";
    }

    private int countByUrl(String url) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM opportunities WHERE jd_url = :url",
            new MapSqlParameterSource("url", url),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
