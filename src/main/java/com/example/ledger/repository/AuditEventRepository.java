package com.example.ledger.repository;

import com.example.ledger.domain.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, Long> {

    List<AuditEvent> findByOrgIdOrderByCreatedAtDesc(Long orgId);

    List<AuditEvent> findByOrgIdAndEntityTypeAndEntityIdOrderByCreatedAtAsc(Long orgId, String entityType,
                                                                           Long entityId);
}
