package io.b2mash.kanban.wip;

import io.b2mash.kanban.exception.ValidationException;
import io.b2mash.kanban.workflow.ItemStatus;
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

/**
 * Capacity of one column of one project. A null limit means unlimited. Every column has a row,
 * including Backlog and Done which can never be limited: the row is what admission and rank
 * assignment lock for that column.
 */
@Entity
@Table(name = "wip_limits")
public class WipLimit {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "board_column", nullable = false, length = 20, updatable = false)
  private ItemStatus boardColumn;

  @Column(name = "wip_limit")
  private Integer limitValue;

  @Enumerated(EnumType.STRING)
  @Column(name = "limit_type", nullable = false, length = 10)
  private WipLimitType limitType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WipLimit() {}

  /** Creates the default, unlimited row for a column. */
  public WipLimit(UUID projectId, ItemStatus column) {
    this.projectId = projectId;
    this.boardColumn = column;
    this.limitValue = null;
    this.limitType = WipLimitType.HARD;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /**
   * Changes the limit. Only Todo and Doing may be limited, and a limit must be positive; null
   * removes it.
   */
  public void changeLimit(Integer newLimit, WipLimitType newType) {
    if (newLimit != null && !boardColumn.isCapacityConstrained()) {
      throw new ValidationException(
          "Column cannot be limited",
          boardColumn + " is unbounded; only TODO and DOING take a limit");
    }
    if (newLimit != null && newLimit <= 0) {
      throw new ValidationException("Invalid WIP limit", "limit must be a positive integer");
    }
    this.limitValue = newLimit;
    this.limitType = newType != null ? newType : WipLimitType.HARD;
    this.updatedAt = Instant.now();
  }

  public boolean isUnlimited() {
    return limitValue == null;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public ItemStatus getColumn() {
    return boardColumn;
  }

  public Integer getLimit() {
    return limitValue;
  }

  public WipLimitType getLimitType() {
    return limitType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
