package com.jobsearchops.pipeline.scheduler;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.model.DailyRunSummary;
import com.jobsearchops.pipeline.model.JobOutcome;
import com.jobsearchops.pipeline.model.SchedulerStatus;
import com.jobsearchops.pipeline.model.TickOutcome;
import com.jobsearchops.pipeline.persistence.SchedulerStateRepository;
import com.jobsearchops.pipeline.service.ActivityLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the daily job sequence at most once per calendar day. A tick that finds the run time
 * reached first claims the day in {@code scheduler_state}; only the claimant runs the jobs, so a
 * restart later the same day does not repeat them.
 */
@Service
public class DailyJobScheduler {
    private static final Logger log = LoggerFactory.getLogger(DailyJobScheduler.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final SchedulerStateRepository stateRepository;
    private final ActivityLedger ledger;
    private final TransactionTemplate transactionTemplate;
    private final List<DailyJob> jobs;
    private final PipelineProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final Object wakeLock = new Object();

    private ExecutorService executor;
    private volatile DailyRunSummary lastRun;

    public DailyJobScheduler(
        SchedulerStateRepository stateRepository,
        ActivityLedger ledger,
        TransactionTemplate transactionTemplate,
        List<DailyJob> jobs,
        PipelineProperties properties,
        Clock clock
    ) {
        this.stateRepository = stateRepository;
        this.ledger = ledger;
        this.transactionTemplate = transactionTemplate;
        this.jobs = List.copyOf(jobs);
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            LocalTime runTime = properties.getScheduler().resolveRunTime();
            int pollIntervalSeconds = properties.getScheduler().getPollIntervalSeconds();
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("daily-job-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.submit(() -> loop(pollIntervalSeconds));
            log.info("Daily scheduler started runTime={} pollIntervalSeconds={} jobs={}",
                runTime, pollIntervalSeconds, jobs.stream().map(DailyJob::name).toList());
        }
    }

    /**
     * Stops the loop. A job sequence already in progress gets the configured grace period to
     * finish before its thread is interrupted.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            synchronized (wakeLock) {
                wakeLock.notifyAll();
            }
            if (executor != null) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(properties.getScheduler().getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                        log.warn("Daily scheduler did not finish within the grace period; interrupting");
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Daily scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus getStatus() {
        LocalTime runTime = null;
        try {
            runTime = properties.getScheduler().resolveRunTime();
        } catch (RuntimeException e) {
            log.warn("Configured run time is invalid: {}", e.getMessage());
        }
        return new SchedulerStatus(running.get(), runTime, stateRepository.findLastRunDate(), lastRun);
    }

    public TickOutcome tickNow() {
        return tick(LocalDateTime.now(clock));
    }

    /**
     * One evaluation of the run condition at {@code now}: runs the job sequence when the run time
     * has passed and today has not been claimed yet.
     */
    public TickOutcome tick(LocalDateTime now) {
        LocalTime runTime = properties.getScheduler().resolveRunTime();
        if (now.toLocalTime().isBefore(runTime)) {
            return TickOutcome.NOT_YET_DUE;
        }
        LocalDate today = now.toLocalDate();
        if (!claim(today)) {
            return TickOutcome.ALREADY_RAN;
        }
        lastRun = runJobs(today);
        return TickOutcome.RAN;
    }

    public DailyRunSummary getLastRun() {
        return lastRun;
    }

    private boolean claim(LocalDate today) {
        Boolean claimed = transactionTemplate.execute(status -> {
            if (!stateRepository.claimRunDate(today, clock.instant())) {
                return false;
            }
            ledger.append(
                null,
                null,
                ActivityType.NOTE_ADDED,
                "Daily scheduler run started for " + today,
                Map.of("run_date", today.toString(), "jobs", jobs.stream().map(DailyJob::name).toList())
            );
            return true;
        });
        return Boolean.TRUE.equals(claimed);
    }

    private DailyRunSummary runJobs(LocalDate runDate) {
        Instant startedAt = Instant.now();
        log.info("Daily run {} starting", runDate);
        List<JobOutcome> outcomes = new ArrayList<>();
        for (DailyJob job : jobs) {
            Instant jobStartedAt = Instant.now();
            try {
                job.run(runDate);
                outcomes.add(new JobOutcome(job.name(), true, null, Duration.between(jobStartedAt, Instant.now())));
            } catch (Exception e) {
                log.warn("Daily job {} failed for {}", job.name(), runDate, e);
                outcomes.add(new JobOutcome(
                    job.name(),
                    false,
                    describe(e),
                    Duration.between(jobStartedAt, Instant.now())
                ));
            }
        }
        DailyRunSummary summary = new DailyRunSummary(runDate, startedAt, Instant.now(), List.copyOf(outcomes));
        log.info("Daily run {} finished jobs={} failed={}", runDate, outcomes.size(), summary.failedCount());
        return summary;
    }

    private void loop(int pollIntervalSeconds) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                TickOutcome outcome = tickNow();
                log.debug("Scheduler tick outcome={}", outcome);
            } catch (Exception e) {
                log.warn("Scheduler tick failed", e);
            }
            sleep(pollIntervalSeconds * 1000L);
        }
    }

    private void sleep(long millis) {
        synchronized (wakeLock) {
            if (!running.get()) {
                return;
            }
            try {
                wakeLock.wait(Math.max(1L, millis));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private String describe(Exception e) {
        String message = e.getClass().getSimpleName() + ": " + e.getMessage();
        if (message.length() > MAX_ERROR_LENGTH) {
            return message.substring(0, MAX_ERROR_LENGTH);
        }
        return message;
    }
}
