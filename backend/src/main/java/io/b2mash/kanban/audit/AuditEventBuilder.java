package io.b2mash.kanban.audit;

import io.b2mash.kanban.request.RequestScopes;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Assembles an {@link AuditEventRecord}. The actor defaults to the member bound to the current
 * request.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "paused")
 *         .project(item.getProjectId())
 *         .entity(item.getId())
 *         .detail("status", item.getStatus().name())
 *         .build());
 * }</pre>
 */
public final class AuditEventBuilder {

  private final AuditedEntity entity;
  private final String action;
  private final Map<String, Object> details = new LinkedHashMap<>();
  private UUID projectId;
  private UUID entityId;

  private AuditEventBuilder(AuditedEntity entity, String action) {
    this.entity = entity;
    this.action = action;
  }

  public static AuditEventBuilder of(AuditedEntity entity, String action) {
    return new AuditEventBuilder(entity, action);
  }

  public AuditEventBuilder project(UUID projectId) {
    this.projectId = projectId;
    return this;
  }

  public AuditEventBuilder entity(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  /** Adds one entry; null values are kept so that cleared fields show up in the trail. */
  public AuditEventBuilder detail(String key, Object value) {
    details.put(key, value);
    return this;
  }

  public AuditEventBuilder details(Map<String, ?> entries) {
    details.putAll(entries);
    return this;
  }

  public AuditEventRecord build() {
    if (entity == null || action == null || projectId == null || entityId == null) {
      throw new IllegalStateException("entity, action, project and entity id are required");
    }
    return new AuditEventRecord(
        projectId,
        entity,
        action,
        entityId,
        RequestScopes.currentMemberId().orElse(null),
        Collections.unmodifiableMap(new LinkedHashMap<>(details)));
  }
}
