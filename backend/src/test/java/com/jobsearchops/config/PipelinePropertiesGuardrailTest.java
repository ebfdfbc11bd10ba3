package com.jobsearchops.config;

import com.jobsearchops.pipeline.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.getFeed().setUserAgent("   ");
        assertTrue(properties.getFeed().getUserAgent().startsWith("job-search-ops/1.0"));
    }

    @Test
    void numericSettingsAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getScheduler().setPollIntervalSeconds(0);
        properties.getScheduler().setShutdownGraceSeconds(-5);
        properties.getFeed().setPerHostDelayMs(-10);
        properties.getFeed().setRequestTimeoutSeconds(0);
        properties.getFollowUp().setWaitingOnDays(0);
        properties.getDigest().setTimeoutSeconds(0);

        assertEquals(1, properties.getScheduler().getPollIntervalSeconds());
        assertEquals(1, properties.getScheduler().getShutdownGraceSeconds());
        assertEquals(1, properties.getFeed().getPerHostDelayMs());
        assertEquals(1, properties.getFeed().getRequestTimeoutSeconds());
        assertEquals(1, properties.getFollowUp().getWaitingOnDays());
        assertEquals(1, properties.getDigest().getTimeoutSeconds());
    }

    @Test
    void runTimeParsesAsLocalTime() {
        PipelineProperties properties = new PipelineProperties();
        properties.getScheduler().setRunTime(" 07:30 ");
        assertEquals(LocalTime.of(7, 30), properties.getScheduler().resolveRunTime());
    }

    @Test
    void malformedRunTimeIsRejected() {
        PipelineProperties properties = new PipelineProperties();
        properties.getScheduler().setRunTime("25:99");
        assertThrows(ValidationException.class, () -> properties.getScheduler().resolveRunTime());

        properties.getScheduler().setRunTime("");
        assertThrows(ValidationException.class, () -> properties.getScheduler().resolveRunTime());
    }

    @Test
    void feedListsDropBlankEntries() {
        PipelineProperties properties = new PipelineProperties();
        properties.getFeed().setUrls(Arrays.asList(" https://jobs.example.com/rss ", "", null, "  "));
        properties.getFeed().setKeywords(Arrays.asList("data", " ", " BI "));

        assertEquals(1, properties.getFeed().getUrls().size());
        assertEquals("https://jobs.example.com/rss", properties.getFeed().getUrls().get(0));
        assertEquals(2, properties.getFeed().getKeywords().size());
        assertEquals("BI", properties.getFeed().getKeywords().get(1));
    }
}
