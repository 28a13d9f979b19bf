package io.b2mash.kanban.backlog;

import io.b2mash.kanban.exception.IllegalTransitionException;
import io.b2mash.kanban.exception.ResourceConflictException;
import io.b2mash.kanban.workflow.ItemStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * A unit of work on the board. The hierarchy is held as a plain {@code parentId} reference, never
 * as a mapped association, so acyclicity is checked explicitly on every reparent rather than
 * assumed from the object graph.
 *
 * <p>{@code status} has no setter: it only changes through {@link #moveTo}, which rejects any move
 * that is not an edge of the workflow graph.
 */
@Entity
@Table(name = "backlog_items")
public class BacklogItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "acceptance_criteria", columnDefinition = "TEXT")
  private String acceptanceCriteria;

  @Column(name = "type", length = 50)
  private String type;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ItemStatus status;

  @Column(name = "rank_value", nullable = false)
  private long rankValue;

  @Column(name = "reviewer_id")
  private UUID reviewerId;

  @Column(name = "assignee_id")
  private UUID assigneeId;

  @Column(name = "estimate_value", precision = 10, scale = 2)
  private BigDecimal estimateValue;

  @Column(name = "story_point")
  private Integer storyPoint;

  @Column(name = "paused", nullable = false)
  private boolean paused;

  @Column(name = "deadline")
  private Instant deadline;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BacklogItem() {}

  public BacklogItem(UUID projectId, UUID parentId, String title, long rank) {
    this.projectId = projectId;
    this.parentId = parentId;
    this.title = title;
    this.status = ItemStatus.initial();
    this.rankValue = rank;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /**
   * Applies a partial update. Null arguments leave the field unchanged; use the dedicated methods
   * for status, rank, parent and pause.
   */
  public void applyDetails(ItemDetails details) {
    applyDetails(details, Set.of());
  }

  /**
   * As {@link #applyDetails(ItemDetails)}, first emptying every field named in {@code cleared}.
   * The caller rejects a field that is both cleared and given a value.
   */
  public void applyDetails(ItemDetails details, Set<ItemField> cleared) {
    for (var field : cleared) {
      clear(field);
    }
    if (details.title() != null) {
      this.title = details.title();
    }
    if (details.description() != null) {
      this.description = details.description();
    }
    if (details.acceptanceCriteria() != null) {
      this.acceptanceCriteria = details.acceptanceCriteria();
    }
    if (details.type() != null) {
      this.type = details.type();
    }
    if (details.reviewerId() != null) {
      this.reviewerId = details.reviewerId();
    }
    if (details.assigneeId() != null) {
      this.assigneeId = details.assigneeId();
    }
    if (details.estimateValue() != null) {
      this.estimateValue = details.estimateValue();
    }
    if (details.storyPoint() != null) {
      this.storyPoint = details.storyPoint();
    }
    if (details.deadline() != null) {
      this.deadline = details.deadline();
    }
    touch();
  }

  private void clear(ItemField field) {
    switch (field) {
      case DESCRIPTION -> this.description = null;
      case ACCEPTANCE_CRITERIA -> this.acceptanceCriteria = null;
      case TYPE -> this.type = null;
      case REVIEWER_ID -> this.reviewerId = null;
      case ASSIGNEE_ID -> this.assigneeId = null;
      case ESTIMATE_VALUE -> this.estimateValue = null;
      case STORY_POINT -> this.storyPoint = null;
      case DEADLINE -> this.deadline = null;
    }
  }

  // --- Workflow ---

  /**
   * Moves the item into {@code target} at {@code rank}. Maintains the lifecycle timestamps:
   * {@code startedAt} is stamped on the first entry into Doing and kept afterwards, {@code
   * completedAt} is stamped on entering Done and cleared on leaving it.
   *
   * @throws IllegalTransitionException if {@code target} is not reachable in one step
   */
  public void moveTo(ItemStatus target, long rank) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalTransitionException(id, status, target);
    }
    var now = Instant.now();
    if (target == ItemStatus.DOING && startedAt == null) {
      this.startedAt = now;
    }
    if (target == ItemStatus.DONE) {
      this.completedAt = now;
    } else if (status == ItemStatus.DONE) {
      this.completedAt = null;
    }
    this.status = target;
    this.rankValue = rank;
    touch();
  }

  /** Changes the position within the current column. */
  public void changeRank(long rank) {
    this.rankValue = rank;
    touch();
  }

  /**
   * Rank rewrite during a column rebalance. Relative order is unchanged, but the row is written, so
   * {@code updatedAt} moves with it like any other persisted change.
   */
  public void rebalanceRank(long rank) {
    this.rankValue = rank;
    touch();
  }

  // --- Hierarchy ---

  /** Sets the parent reference. Acyclicity and project scoping are checked by the caller. */
  public void reparent(UUID newParentId) {
    this.parentId = newParentId;
    touch();
  }

  // --- Pause ---

  public void pause() {
    this.paused = true;
    touch();
  }

  public void resume() {
    this.paused = false;
    touch();
  }

  /**
   * Rejects a write based on a stale read.
   *
   * @throws ResourceConflictException if {@code expectedVersion} is given and differs
   */
  public void requireVersion(Integer expectedVersion) {
    if (expectedVersion != null && expectedVersion != version) {
      throw ResourceConflictException.staleVersion("BacklogItem", id, expectedVersion, version);
    }
  }

  private void touch() {
    var now = Instant.now();
    this.updatedAt = updatedAt == null || now.isAfter(updatedAt) ? now : updatedAt;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getParentId() {
    return parentId;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getAcceptanceCriteria() {
    return acceptanceCriteria;
  }

  public String getType() {
    return type;
  }

  public ItemStatus getStatus() {
    return status;
  }

  public long getRank() {
    return rankValue;
  }

  public UUID getReviewerId() {
    return reviewerId;
  }

  public UUID getAssigneeId() {
    return assigneeId;
  }

  public BigDecimal getEstimateValue() {
    return estimateValue;
  }

  public Integer getStoryPoint() {
    return storyPoint;
  }

  public boolean isPaused() {
    return paused;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
