package com.example.agentdeployer.service;

import com.example.agentdeployer.domain.ActivityLog;
import com.example.agentdeployer.repository.ActivityLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Activity trail for agents, clients and deployments.
 * Writes are asynchronous and never fail the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivityLogService {

    public static final String AGENT = "agent";
    public static final String CLIENT = "client";
    public static final String DEPLOYMENT = "deployment";

    private final ActivityLogRepository activityLogRepository;
    private final ObjectMapper objectMapper;

    @Async("notificationExecutor")
    public void record(String entityType, String entityId, String action, String description) {
        record(entityType, entityId, action, description, null);
    }

    @Async("notificationExecutor")
    public void record(String entityType, String entityId, String action, String description,
                       Map<String, Object> metadata) {
        try {
            ActivityLog entry = ActivityLog.builder()
                    .entityType(entityType)
                    .entityId(entityId)
                    .action(action)
                    .description(description)
                    .metadata(metadata != null ? objectMapper.writeValueAsString(metadata) : null)
                    .timestamp(Instant.now())
                    .build();
            activityLogRepository.save(entry);
            log.debug("Activity: [{} {}] {} - {}", entityType, entityId, action, description);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize activity metadata for {} {}: {}", entityType, entityId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to write activity log: {}", e.getMessage());
        }
    }

    public List<ActivityLog> getRecent(int limit) {
        return activityLogRepository.findAllByOrderByTimestampDesc(PageRequest.of(0, limit));
    }

    public List<ActivityLog> getForEntity(String entityType, String entityId) {
        return activityLogRepository.findByEntityTypeAndEntityIdOrderByTimestampDesc(entityType, entityId);
    }
}
