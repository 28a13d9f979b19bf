package io.b2mash.kanban.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One committed status transition of a backlog item. Append-only. */
@Entity
@Table(name = "item_status_changes")
public class StatusChange {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "item_id", nullable = false, updatable = false)
  private UUID itemId;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  /** Null for the entry recorded when the item was created. */
  @Enumerated(EnumType.STRING)
  @Column(name = "from_status", length = 20, updatable = false)
  private ItemStatus fromStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "to_status", nullable = false, length = 20, updatable = false)
  private ItemStatus toStatus;

  @Column(name = "actor_id", updatable = false)
  private UUID actorId;

  @Column(name = "changed_at", nullable = false, updatable = false)
  private Instant changedAt;

  protected StatusChange() {}

  public StatusChange(
      UUID itemId, UUID projectId, ItemStatus fromStatus, ItemStatus toStatus, UUID actorId) {
    this.itemId = itemId;
    this.projectId = projectId;
    this.fromStatus = fromStatus;
    this.toStatus = toStatus;
    this.actorId = actorId;
    this.changedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getItemId() {
    return itemId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public ItemStatus getFromStatus() {
    return fromStatus;
  }

  public ItemStatus getToStatus() {
    return toStatus;
  }

  public UUID getActorId() {
    return actorId;
  }

  public Instant getChangedAt() {
    return changedAt;
  }
}
