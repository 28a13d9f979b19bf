package io.b2mash.kanban.project;

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
import java.util.UUID;

/**
 * The board owner. Everything else is scoped to a project: hierarchy edges never cross projects
 * and WIP limits are per project and column. The row doubles as the project's hierarchy lock.
 */
@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "wip_policy", nullable = false, length = 20)
  private WipPolicy wipPolicy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(String name, WipPolicy wipPolicy) {
    this.name = name;
    this.wipPolicy = wipPolicy != null ? wipPolicy : WipPolicy.ITEM_COUNT;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void update(String name, WipPolicy wipPolicy) {
    this.name = name;
    this.wipPolicy = wipPolicy;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public WipPolicy getWipPolicy() {
    return wipPolicy;
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
