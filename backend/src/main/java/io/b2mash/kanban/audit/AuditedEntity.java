package io.b2mash.kanban.audit;

/** Kinds of entity whose changes land in the audit trail. */
public enum AuditedEntity {
  PROJECT("project"),
  BACKLOG_ITEM("backlog_item"),
  WIP_LIMIT("wip_limit"),
  WORKFLOW_POLICY("workflow_policy");

  private final String key;

  AuditedEntity(String key) {
    this.key = key;
  }

  /** Stored value of {@code entity_type}, and the prefix of every event type. */
  public String key() {
    return key;
  }
}
