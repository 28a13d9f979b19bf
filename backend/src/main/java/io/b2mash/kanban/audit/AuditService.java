package io.b2mash.kanban.audit;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface AuditService {

  /** Writes in the caller's transaction, so a rolled-back change leaves no trace. */
  void log(AuditEventRecord record);

  /**
   * A project's trail, newest first.
   *
   * @param entity optional filter on the kind of entity
   * @param entityId optional filter on a single entity
   */
  Page<AuditEvent> findTrail(
      UUID projectId, AuditedEntity entity, UUID entityId, Pageable pageable);
}
