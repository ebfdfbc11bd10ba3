package com.jobsearchops.config;

import com.jobsearchops.pipeline.exception.ValidationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {
    private Scheduler scheduler = new Scheduler();
    private Feed feed = new Feed();
    private FollowUp followUp = new FollowUp();
    private Digest digest = new Digest();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public FollowUp getFollowUp() {
        return followUp;
    }

    public void setFollowUp(FollowUp followUp) {
        this.followUp = followUp;
    }

    public Digest getDigest() {
        return digest;
    }

    public void setDigest(Digest digest) {
        this.digest = digest;
    }

    private static List<String> cleanList(List<String> values) {
        List<String> cleaned = new ArrayList<>();
        if (values == null) {
            return cleaned;
        }
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                cleaned.add(value.trim());
            }
        }
        return cleaned;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private String runTime = "08:00";
        private int pollIntervalSeconds = 60;
        private int shutdownGraceSeconds = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getRunTime() {
            return runTime;
        }

        public void setRunTime(String runTime) {
            this.runTime = runTime;
        }

        /**
         * Parses the configured local run time ({@code HH:mm}).
         *
         * @throws ValidationException when the value is missing or not a valid time of day
         */
        public LocalTime resolveRunTime() {
            if (runTime == null || runTime.isBlank()) {
                throw new ValidationException("pipeline.scheduler.run-time is required");
            }
            try {
                return LocalTime.parse(runTime.trim());
            } catch (DateTimeParseException e) {
                throw new ValidationException("Invalid pipeline.scheduler.run-time: " + runTime);
            }
        }

        public int getPollIntervalSeconds() {
            return Math.max(1, pollIntervalSeconds);
        }

        public void setPollIntervalSeconds(int pollIntervalSeconds) {
            this.pollIntervalSeconds = Math.max(1, pollIntervalSeconds);
        }

        public int getShutdownGraceSeconds() {
            return Math.max(1, shutdownGraceSeconds);
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = Math.max(1, shutdownGraceSeconds);
        }
    }

    public static class Feed {
        private static final String DEFAULT_USER_AGENT = "job-search-ops/1.0 (personal-use job search tool)";

        private List<String> urls = new ArrayList<>();
        private List<String> keywords = new ArrayList<>();
        private int requestTimeoutSeconds = 15;
        private int perHostDelayMs = 1000;
        private int maxFeedBytes = 5_000_000;
        private String userAgent;

        public List<String> getUrls() {
            return urls;
        }

        public void setUrls(List<String> urls) {
            this.urls = cleanList(urls);
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = cleanList(keywords);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }

        public int getMaxFeedBytes() {
            return Math.max(1024, maxFeedBytes);
        }

        public void setMaxFeedBytes(int maxFeedBytes) {
            this.maxFeedBytes = Math.max(1024, maxFeedBytes);
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public static String normalizeUserAgent(String candidate) {
            if (candidate == null || candidate.isBlank()) {
                return DEFAULT_USER_AGENT;
            }
            return candidate.trim();
        }
    }

    public static class FollowUp {
        private int waitingOnDays = 2;
        private int staleOpportunityDays = 7;

        public int getWaitingOnDays() {
            return Math.max(1, waitingOnDays);
        }

        public void setWaitingOnDays(int waitingOnDays) {
            this.waitingOnDays = Math.max(1, waitingOnDays);
        }

        public int getStaleOpportunityDays() {
            return Math.max(1, staleOpportunityDays);
        }

        public void setStaleOpportunityDays(int staleOpportunityDays) {
            this.staleOpportunityDays = Math.max(1, staleOpportunityDays);
        }
    }

    public static class Digest {
        private int timeoutSeconds = 60;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }
}
