package io.b2mash.kanban.audit;

import java.util.Map;
import java.util.UUID;

/**
 * One change to be written to the project's audit trail.
 *
 * @param action past-tense verb; the stored event type is {@code <entity key>.<action>}
 * @param actorId calling member, null when nobody was bound to the request
 */
public record AuditEventRecord(
    UUID projectId,
    AuditedEntity entity,
    String action,
    UUID entityId,
    UUID actorId,
    Map<String, Object> details) {

  public String eventType() {
    return entity.key() + "." + action;
  }
}
