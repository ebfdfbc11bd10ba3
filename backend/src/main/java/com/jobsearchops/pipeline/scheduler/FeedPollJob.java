package com.jobsearchops.pipeline.scheduler;

import com.jobsearchops.pipeline.feed.FeedIngestionService;
import com.jobsearchops.pipeline.model.FeedPollResult;
import com.jobsearchops.pipeline.model.FeedSourceError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Component
@Order(3)
public class FeedPollJob implements DailyJob {
    private static final Logger log = LoggerFactory.getLogger(FeedPollJob.class);

    private final FeedIngestionService feedIngestionService;

    public FeedPollJob(FeedIngestionService feedIngestionService) {
        this.feedIngestionService = feedIngestionService;
    }

    @Override
    public String name() {
        return "feed-poll";
    }

    @Override
    public void run(LocalDate runDate) {
        FeedPollResult result = feedIngestionService.pollConfigured();
        for (FeedSourceError error : result.errors()) {
            log.warn("Feed poll {} source={} error={}", runDate, error.source(), error.error());
        }
        log.info("Feed poll {} created={} skipped={} errors={}",
            runDate, result.created(), result.skipped(), result.errors().size());
    }
}
