package com.jobsearchops.pipeline.scheduler;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.exception.TransientIoException;
import com.jobsearchops.pipeline.external.DigestSummarizer;
import com.jobsearchops.pipeline.external.PipelineNotifier;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.DigestContext;
import com.jobsearchops.pipeline.persistence.PipelineViewRepository;
import com.jobsearchops.pipeline.service.ActivityLedger;
import com.jobsearchops.pipeline.service.FollowUpService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
@Order(2)
public class DigestJob implements DailyJob {
    private static final Logger log = LoggerFactory.getLogger(DigestJob.class);

    private final PipelineViewRepository views;
    private final FollowUpService followUpService;
    private final DigestSummarizer summarizer;
    private final PipelineNotifier notifier;
    private final ActivityLedger ledger;
    private final ExecutorService digestExecutor;
    private final PipelineProperties properties;

    public DigestJob(
        PipelineViewRepository views,
        FollowUpService followUpService,
        DigestSummarizer summarizer,
        PipelineNotifier notifier,
        ActivityLedger ledger,
        @Qualifier("digestExecutor") ExecutorService digestExecutor,
        PipelineProperties properties
    ) {
        this.views = views;
        this.followUpService = followUpService;
        this.summarizer = summarizer;
        this.notifier = notifier;
        this.ledger = ledger;
        this.digestExecutor = digestExecutor;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "digest";
    }

    @Override
    public void run(LocalDate runDate) {
        DigestContext context = new DigestContext(
            runDate,
            views.todayQueue(runDate),
            followUpService.dueFollowUps(),
            views.pipelineSummary()
        );
        if (context.isEmpty()) {
            log.info("Digest {} skipped: pipeline is empty", runDate);
            return;
        }

        String digest = summarizeWithTimeout(context);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("date", runDate.toString());
        metadata.put("queue_items", context.todayQueue().size());
        metadata.put("due_follow_ups", context.dueFollowUps().size());
        metadata.put("digest", digest);
        ledger.append(null, null, ActivityType.AI_ACTION, "Daily digest generated for " + runDate, metadata);
        notifier.digestReady(runDate, digest);
    }

    private String summarizeWithTimeout(DigestContext context) {
        int timeoutSeconds = properties.getDigest().getTimeoutSeconds();
        Future<String> future = digestExecutor.submit(() -> summarizer.summarize(context));
        try {
            String digest = future.get(timeoutSeconds, TimeUnit.SECONDS);
            if (digest == null || digest.isBlank()) {
                throw new TransientIoException("digest_empty", "Summarizer returned no text");
            }
            return digest;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientIoException("digest_timeout", "Summarizer did not answer within " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TransientIoException("digest_failed", "Summarizer failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientIoException("interrupted", "Interrupted while waiting for the summarizer", e);
        }
    }
}
