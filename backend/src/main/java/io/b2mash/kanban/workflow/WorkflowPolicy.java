package io.b2mash.kanban.workflow;

import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Entry criteria for one edge of a project's workflow. An inactive policy is kept but not
 * enforced. Policies only exist for legal edges.
 */
@Entity
@Table(name = "workflow_policies")
public class WorkflowPolicy {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "from_status", nullable = false, length = 20, updatable = false)
  private ItemStatus fromStatus;

  @Enumerated(EnumType.STRING)
  @Column(name = "to_status", nullable = false, length = 20, updatable = false)
  private ItemStatus toStatus;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "criteria", columnDefinition = "jsonb", nullable = false)
  private List<String> criteria;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected WorkflowPolicy() {}

  /**
   * @throws ValidationException if {@code from -> to} is not an edge of the workflow graph
   */
  public WorkflowPolicy(
      UUID projectId, ItemStatus from, ItemStatus to, Collection<PolicyCriterion> criteria) {
    if (!from.canTransitionTo(to)) {
      throw new ValidationException(
          "Invalid policy edge", "No transition from " + from + " to " + to + " to guard");
    }
    this.projectId = projectId;
    this.fromStatus = from;
    this.toStatus = to;
    this.criteria = names(criteria);
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  /** Null arguments leave the current value. */
  public void update(Collection<PolicyCriterion> newCriteria, Boolean newActive) {
    if (newCriteria != null) {
      this.criteria = names(newCriteria);
    }
    if (newActive != null) {
      this.active = newActive;
    }
    this.updatedAt = Instant.now();
  }

  /** Every unmet criterion, in declaration order. */
  public List<PolicyViolation> violationsOf(BacklogItem item) {
    return getCriteria().stream()
        .filter(criterion -> !criterion.isMetBy(item))
        .map(PolicyViolation::of)
        .toList();
  }

  private static List<String> names(Collection<PolicyCriterion> criteria) {
    var sorted = EnumSet.noneOf(PolicyCriterion.class);
    sorted.addAll(criteria);
    return new ArrayList<>(sorted.stream().map(Enum::name).toList());
  }

  public UUID getId() {
    return id;
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

  public Set<PolicyCriterion> getCriteria() {
    var set = EnumSet.noneOf(PolicyCriterion.class);
    criteria.forEach(name -> set.add(PolicyCriterion.valueOf(name)));
    return set;
  }

  public boolean isActive() {
    return active;
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
