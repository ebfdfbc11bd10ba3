package com.jobsearchops.pipeline.feed;

import com.jobsearchops.config.PipelineProperties;
import com.jobsearchops.pipeline.http.FeedHttpClient;
import com.jobsearchops.pipeline.model.FeedPollResult;
import com.jobsearchops.pipeline.model.FeedPosting;
import com.jobsearchops.pipeline.model.FeedSourceError;
import com.jobsearchops.pipeline.model.HttpFetchResult;
import com.jobsearchops.pipeline.model.NewOpportunity;
import com.jobsearchops.pipeline.model.Opportunity;
import com.jobsearchops.pipeline.model.OpportunitySource;
import com.jobsearchops.pipeline.persistence.OpportunityRepository;
import com.jobsearchops.pipeline.service.OpportunityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls RSS/Atom sources and creates a Prospect opportunity for every posting URL not seen
 * before. Sources are fetched one after another and polls never overlap, so the dedup check and
 * the insert for a URL cannot interleave with another poll.
 */
@Service
public class FeedIngestionService {
    private static final Logger log = LoggerFactory.getLogger(FeedIngestionService.class);
    private static final String UNTITLED = "Untitled posting";

    private final FeedHttpClient httpClient;
    private final FeedParser parser;
    private final OpportunityRepository opportunities;
    private final OpportunityService opportunityService;
    private final TransactionTemplate transactionTemplate;
    private final PipelineProperties properties;
    private final ReentrantLock pollLock = new ReentrantLock();

    public FeedIngestionService(
        FeedHttpClient httpClient,
        FeedParser parser,
        OpportunityRepository opportunities,
        OpportunityService opportunityService,
        TransactionTemplate transactionTemplate,
        PipelineProperties properties
    ) {
        this.httpClient = httpClient;
        this.parser = parser;
        this.opportunities = opportunities;
        this.opportunityService = opportunityService;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    public FeedPollResult pollConfigured() {
        return poll(properties.getFeed().getUrls(), properties.getFeed().getKeywords());
    }

    /**
     * Polls every source. Per-source failures are collected in the result and never thrown.
     *
     * @param keywords case-insensitive title substrings; empty accepts every posting
     */
    public FeedPollResult poll(List<String> sources, List<String> keywords) {
        List<String> keywordFilter = normalizeKeywords(keywords);
        pollLock.lock();
        try {
            int created = 0;
            int skipped = 0;
            List<FeedSourceError> errors = new ArrayList<>();
            List<String> createdTitles = new ArrayList<>();
            for (String source : sources == null ? List.<String>of() : sources) {
                if (source == null || source.isBlank()) {
                    continue;
                }
                String feedUrl = source.trim();
                List<FeedPosting> postings;
                try {
                    postings = fetchPostings(feedUrl);
                } catch (FeedSourceFailure e) {
                    log.warn("Feed {} failed: {}", feedUrl, e.getMessage());
                    errors.add(new FeedSourceError(feedUrl, e.getMessage()));
                    continue;
                }

                for (FeedPosting posting : postings) {
                    if (!matchesKeywords(posting.title(), keywordFilter)) {
                        log.debug("Skipping '{}' from {}: no keyword match", posting.title(), feedUrl);
                        skipped++;
                        continue;
                    }
                    try {
                        Opportunity opportunity = createIfNew(feedUrl, posting);
                        if (opportunity == null) {
                            log.debug("Skipping {} from {}: already ingested", posting.link(), feedUrl);
                            skipped++;
                        } else {
                            created++;
                            createdTitles.add(posting.title());
                        }
                    } catch (RuntimeException e) {
                        log.warn("Failed to create opportunity for {} from {}", posting.link(), feedUrl, e);
                        errors.add(new FeedSourceError(feedUrl, "create_failed: " + posting.link() + ": " + e.getMessage()));
                    }
                }
            }
            log.info("Feed poll finished sources={} created={} skipped={} errors={}",
                sources == null ? 0 : sources.size(), created, skipped, errors.size());
            return new FeedPollResult(created, skipped, List.copyOf(errors), List.copyOf(createdTitles));
        } finally {
            pollLock.unlock();
        }
    }

    private List<FeedPosting> fetchPostings(String feedUrl) {
        if (FeedHttpClient.parseFeedUri(feedUrl) == null) {
            throw new FeedSourceFailure("invalid_url: " + feedUrl);
        }
        HttpFetchResult fetch = httpClient.get(feedUrl);
        if (!fetch.isSuccessful()) {
            String detail = fetch.errorMessage() == null ? "" : ": " + fetch.errorMessage();
            throw new FeedSourceFailure(fetch.errorKey() + detail);
        }
        try {
            return parser.parse(fetch.body());
        } catch (FeedFormatException e) {
            throw new FeedSourceFailure("parse_error: " + e.getMessage());
        }
    }

    private Opportunity createIfNew(String feedUrl, FeedPosting posting) {
        return transactionTemplate.execute(status -> {
            if (opportunities.existsByJdUrl(posting.link())) {
                return null;
            }
            String title = posting.title() == null || posting.title().isBlank() ? UNTITLED : posting.title();
            PostingTitleSplitter.RoleAndCompany split = PostingTitleSplitter.split(title);
            String jdRaw = FeedParser.stripHtml(posting.description());
            NewOpportunity request = new NewOpportunity(
                split.company(),
                split.roleTitle(),
                null,
                null,
                OpportunitySource.OTHER,
                null,
                null,
                posting.link(),
                jdRaw.isEmpty() ? title : jdRaw,
                "[]",
                null
            );
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("feed_url", feedUrl);
            metadata.put("posting_url", posting.link());
            return opportunityService.create(request, "Auto-added from job feed: " + title, metadata);
        });
    }

    static boolean matchesKeywords(String title, List<String> keywords) {
        if (keywords.isEmpty()) {
            return true;
        }
        String lowerTitle = title == null ? "" : title.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lowerTitle.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalizeKeywords(List<String> keywords) {
        List<String> normalized = new ArrayList<>();
        if (keywords == null) {
            return normalized;
        }
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                normalized.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        return normalized;
    }

    private static class FeedSourceFailure extends RuntimeException {
        FeedSourceFailure(String message) {
            super(message);
        }
    }
}
