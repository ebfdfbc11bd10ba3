package com.jobsearchops.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobsearchops.pipeline.external.DigestSummarizer;
import com.jobsearchops.pipeline.external.DisabledEmailSender;
import com.jobsearchops.pipeline.external.EmailSender;
import com.jobsearchops.pipeline.external.LoggingPipelineNotifier;
import com.jobsearchops.pipeline.external.PipelineNotifier;
import com.jobsearchops.pipeline.external.TemplateDigestSummarizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    /**
     * Summarizer calls run here. A call that outlives its timeout keeps its thread, so the pool
     * grows a fresh thread for the next call instead of queueing behind it.
     */
    @Bean(name = "digestExecutor", destroyMethod = "shutdownNow")
    public ExecutorService digestExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("digest-summarizer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(DigestSummarizer.class)
    public DigestSummarizer digestSummarizer() {
        return new TemplateDigestSummarizer();
    }

    @Bean
    @ConditionalOnMissingBean(EmailSender.class)
    public EmailSender emailSender() {
        return new DisabledEmailSender();
    }

    @Bean
    @ConditionalOnMissingBean(PipelineNotifier.class)
    public PipelineNotifier pipelineNotifier() {
        return new LoggingPipelineNotifier();
    }
}
