package com.example.ledger.service;

import com.example.ledger.domain.AuditEvent;
import com.example.ledger.repository.AuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail for every GL-affecting transition. Events are written inside the
 * caller's transaction so a rolled-back posting leaves no audit row behind.
 */
@Service
@Transactional
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    public AuditService(AuditEventRepository auditEventRepository) {
        this.auditEventRepository = auditEventRepository;
        this.objectMapper = new ObjectMapper();
    }

    public AuditEvent logEvent(Long orgId, Long userId, String eventType, String entityType,
                               Long entityId, String summary) {
        return logEvent(orgId, userId, eventType, entityType, entityId, summary, null);
    }

    public AuditEvent logEvent(Long orgId, Long userId, String eventType, String entityType,
                               Long entityId, String summary, Map<String, Object> details) {
        AuditEvent event = new AuditEvent(orgId, userId, eventType, entityType, entityId, summary);
        if (details != null && !details.isEmpty()) {
            try {
                event.setDetailsJson(objectMapper.writeValueAsString(details));
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize audit details for {} {}", entityType, entityId, e);
            }
        }
        return auditEventRepository.save(event);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> findByOrg(Long orgId) {
        return auditEventRepository.findByOrgIdOrderByCreatedAtDesc(orgId);
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> findByEntity(Long orgId, String entityType, Long entityId) {
        return auditEventRepository.findByOrgIdAndEntityTypeAndEntityIdOrderByCreatedAtAsc(
            orgId, entityType, entityId);
    }
}
