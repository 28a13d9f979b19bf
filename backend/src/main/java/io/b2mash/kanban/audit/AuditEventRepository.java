package io.b2mash.kanban.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  @Query(
      """
      SELECT e FROM AuditEvent e
      WHERE e.projectId = :projectId
        AND (CAST(:entityType AS string) IS NULL OR e.entityType = :entityType)
        AND (:entityId IS NULL OR e.entityId = :entityId)
      ORDER BY e.occurredAt DESC, e.id
      """)
  Page<AuditEvent> findTrail(
      @Param("projectId") UUID projectId,
      @Param("entityType") String entityType,
      @Param("entityId") UUID entityId,
      Pageable pageable);
}
