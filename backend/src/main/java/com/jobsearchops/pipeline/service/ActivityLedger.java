package com.jobsearchops.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobsearchops.pipeline.model.ActivityLogEntry;
import com.jobsearchops.pipeline.model.ActivityType;
import com.jobsearchops.pipeline.persistence.ActivityLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends entries to the activity log. Runs inside the caller's transaction, so a failed append
 * rolls back the mutation it describes.
 */
@Service
public class ActivityLedger {
    private static final Logger log = LoggerFactory.getLogger(ActivityLedger.class);
    private static final int MAX_PAGE = 500;

    private final ActivityLogRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ActivityLedger(ActivityLogRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public long append(Long opportunityId, Long contactId, ActivityType type, String description) {
        return append(opportunityId, contactId, type, description, null);
    }

    public long append(
        Long opportunityId,
        Long contactId,
        ActivityType type,
        String description,
        Map<String, ?> metadata
    ) {
        long id = repository.insert(
            opportunityId,
            contactId,
            type,
            description,
            toJson(metadata),
            clock.instant()
        );
        log.debug("Ledger entry {} type={} opportunity={} contact={}", id, type.label(), opportunityId, contactId);
        return id;
    }

    public List<ActivityLogEntry> recent(Long opportunityId, int limit) {
        return repository.findRecent(opportunityId, Math.min(Math.max(1, limit), MAX_PAGE));
    }

    private String toJson(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("Ledger metadata keys={} is not serializable; storing its string form", metadata.keySet(), e);
            Map<String, String> fallback = new LinkedHashMap<>();
            fallback.put("serialization_error", e.getOriginalMessage());
            fallback.put("raw", String.valueOf(metadata));
            try {
                return objectMapper.writeValueAsString(fallback);
            } catch (JsonProcessingException nested) {
                throw new IllegalStateException("Ledger metadata could not be written", nested);
            }
        }
    }
}
