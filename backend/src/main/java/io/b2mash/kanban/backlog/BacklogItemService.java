package io.b2mash.kanban.backlog;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.exception.HasChildrenException;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.exception.ValidationException;
import io.b2mash.kanban.hierarchy.DeletionPolicy;
import io.b2mash.kanban.hierarchy.HierarchyService;
import io.b2mash.kanban.project.Project;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.project.ProjectService;
import io.b2mash.kanban.rank.PositionHint;
import io.b2mash.kanban.rank.RankSequencer;
import io.b2mash.kanban.request.RequestScopes;
import io.b2mash.kanban.wip.WipAdmissionService;
import io.b2mash.kanban.workflow.ItemStatus;
import io.b2mash.kanban.workflow.StatusChange;
import io.b2mash.kanban.workflow.StatusChangeRepository;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BacklogItemService {

  private static final Logger log = LoggerFactory.getLogger(BacklogItemService.class);

  private final BacklogItemRepository backlogItemRepository;
  private final ProjectRepository projectRepository;
  private final ProjectService projectService;
  private final HierarchyService hierarchyService;
  private final WipAdmissionService wipAdmissionService;
  private final RankSequencer rankSequencer;
  private final StatusChangeRepository statusChangeRepository;
  private final AuditService auditService;

  public BacklogItemService(
      BacklogItemRepository backlogItemRepository,
      ProjectRepository projectRepository,
      ProjectService projectService,
      HierarchyService hierarchyService,
      WipAdmissionService wipAdmissionService,
      RankSequencer rankSequencer,
      StatusChangeRepository statusChangeRepository,
      AuditService auditService) {
    this.backlogItemRepository = backlogItemRepository;
    this.projectRepository = projectRepository;
    this.projectService = projectService;
    this.hierarchyService = hierarchyService;
    this.wipAdmissionService = wipAdmissionService;
    this.rankSequencer = rankSequencer;
    this.statusChangeRepository = statusChangeRepository;
    this.auditService = auditService;
  }

  /**
   * Creates an item at the bottom of the project's Backlog column. Items are never created
   * directly into another column. Creation runs under the project's hierarchy lock.
   */
  @Transactional
  public BacklogItem create(UUID projectId, UUID parentId, ItemDetails details) {
    if (details.title() == null || details.title().isBlank()) {
      throw new ValidationException("Missing title", "title is required");
    }
    validateSizing(details);
    // Project before column: the insert's foreign key check share-locks the project row.
    var project = projectService.lockHierarchy(projectId);
    if (parentId != null) {
      hierarchyService.requireParent(projectId, parentId);
    }

    var column = ItemStatus.initial();
    wipAdmissionService.lockColumn(projectId, column);
    long rank = rankSequencer.assignRank(projectId, column, PositionHint.bottom(), null);

    var item = new BacklogItem(project.getId(), parentId, details.title(), rank);
    item.applyDetails(details);
    item = backlogItemRepository.save(item);
    statusChangeRepository.save(
        new StatusChange(
            item.getId(), projectId, null, column, RequestScopes.currentMemberId().orElse(null)));
    log.info("Created backlog item {} in project {}", item.getId(), projectId);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "created")
            .project(projectId)
            .entity(item.getId())
            .detail("title", item.getTitle())
            .detail("parent_id", parentId)
            .build());
    return item;
  }

  @Transactional(readOnly = true)
  public BacklogItem get(UUID itemId) {
    return backlogItemRepository
        .findById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
  }

  @Transactional(readOnly = true)
  public Page<BacklogItem> listByProject(
      UUID projectId, ItemStatus status, UUID assigneeId, String type, Pageable pageable) {
    requireProject(projectId);
    return backlogItemRepository.findByFilter(projectId, status, assigneeId, type, pageable);
  }

  /**
   * Applies a partial update. Fields named in {@code clear} are emptied; other fields change only
   * when the patch gives them a value. When the item is active in a capacity-constrained column
   * and the change makes it heavier, the new weight has to pass admission first. Clearing a size
   * can make an item heavier too: an unsized item weighs one.
   */
  @Transactional
  public BacklogItem update(
      UUID itemId, ItemDetails patch, Set<ItemField> clear, Integer expectedVersion) {
    if (patch.title() != null && patch.title().isBlank()) {
      throw new ValidationException("Invalid title", "title must not be blank");
    }
    validateSizing(patch);
    var cleared = clear != null ? clear : Set.<ItemField>of();
    requireNoClearedValue(patch, cleared);
    var item = get(itemId);
    item.requireVersion(expectedVersion);

    var project = requireProject(item.getProjectId());
    var policy = project.getWipPolicy();
    BigDecimal weightBefore = policy.weightOf(item);
    var changes = describeChanges(item, patch, cleared);

    item.applyDetails(patch, cleared);
    if (item.getStatus().isCapacityConstrained()
        && !item.isPaused()
        && policy.weightOf(item).compareTo(weightBefore) > 0) {
      wipAdmissionService.admit(project, item.getStatus(), item);
    }
    item = backlogItemRepository.save(item);
    log.info("Updated backlog item {}", itemId);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "updated")
            .project(item.getProjectId())
            .entity(itemId)
            .details(changes)
            .build());
    return item;
  }

  /**
   * Pauses or resumes an item. Pausing takes it out of its column's load at once; resuming puts
   * it back and must pass admission like any other entry.
   */
  @Transactional
  public BacklogItem setPaused(UUID itemId, boolean paused, Integer expectedVersion) {
    var item = get(itemId);
    item.requireVersion(expectedVersion);
    if (item.isPaused() == paused) {
      return item;
    }

    if (paused) {
      item.pause();
    } else {
      if (item.getStatus().isCapacityConstrained()) {
        var project = requireProject(item.getProjectId());
        wipAdmissionService.admitWeight(
            project, item.getStatus(), project.getWipPolicy().weightOf(item), itemId);
      }
      item.resume();
    }
    item = backlogItemRepository.save(item);
    log.info("{} backlog item {}", paused ? "Paused" : "Resumed", itemId);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, paused ? "paused" : "resumed")
            .project(item.getProjectId())
            .entity(itemId)
            .detail("status", item.getStatus().name())
            .build());
    return item;
  }

  /**
   * Deletes an item. An item with children needs a {@link DeletionPolicy}; without one the
   * deletion is refused and nothing changes.
   *
   * @return the ids of all deleted items, leaves first
   */
  @Transactional
  public List<UUID> delete(UUID itemId, DeletionPolicy policy, Integer expectedVersion) {
    var item = get(itemId);
    item.requireVersion(expectedVersion);
    projectService.lockHierarchy(item.getProjectId());

    var children = backlogItemRepository.findChildren(itemId);
    if (!children.isEmpty() && policy == null) {
      throw new HasChildrenException(itemId, children.size());
    }

    List<BacklogItem> doomed;
    if (children.isEmpty() || policy == DeletionPolicy.DETACH_CHILDREN) {
      for (var child : children) {
        child.reparent(null);
      }
      backlogItemRepository.saveAll(children);
      doomed = List.of(item);
    } else {
      doomed = hierarchyService.collectSubtreeLeavesFirst(item);
    }

    for (var victim : doomed) {
      statusChangeRepository.deleteByItemId(victim.getId());
      backlogItemRepository.delete(victim);
      backlogItemRepository.flush();
      auditService.log(
          AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "deleted")
              .project(victim.getProjectId())
              .entity(victim.getId())
              .detail("title", victim.getTitle())
              .detail("root_id", itemId)
              .build());
    }
    log.info(
        "Deleted backlog item {} ({} item(s), {} child(ren) detached)",
        itemId,
        doomed.size(),
        policy == DeletionPolicy.DETACH_CHILDREN ? children.size() : 0);
    return doomed.stream().map(BacklogItem::getId).toList();
  }

  private Project requireProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  private static void validateSizing(ItemDetails details) {
    if (details.storyPoint() != null && details.storyPoint() < 0) {
      throw new ValidationException("Invalid story points", "story points must not be negative");
    }
    if (details.estimateValue() != null && details.estimateValue().signum() < 0) {
      throw new ValidationException("Invalid estimate", "estimate must not be negative");
    }
  }

  private static void requireNoClearedValue(ItemDetails patch, Set<ItemField> cleared) {
    for (var field : cleared) {
      if (valueOf(patch, field) != null) {
        throw new ValidationException(
            "Conflicting update", field.name() + " cannot be both set and cleared");
      }
    }
  }

  private static Object valueOf(ItemDetails details, ItemField field) {
    return switch (field) {
      case DESCRIPTION -> details.description();
      case ACCEPTANCE_CRITERIA -> details.acceptanceCriteria();
      case TYPE -> details.type();
      case REVIEWER_ID -> details.reviewerId();
      case ASSIGNEE_ID -> details.assigneeId();
      case ESTIMATE_VALUE -> details.estimateValue();
      case STORY_POINT -> details.storyPoint();
      case DEADLINE -> details.deadline();
    };
  }

  private static Object valueOf(BacklogItem item, ItemField field) {
    return switch (field) {
      case DESCRIPTION -> item.getDescription();
      case ACCEPTANCE_CRITERIA -> item.getAcceptanceCriteria();
      case TYPE -> item.getType();
      case REVIEWER_ID -> item.getReviewerId();
      case ASSIGNEE_ID -> item.getAssigneeId();
      case ESTIMATE_VALUE -> item.getEstimateValue();
      case STORY_POINT -> item.getStoryPoint();
      case DEADLINE -> item.getDeadline();
    };
  }

  private static Map<String, Object> describeChanges(
      BacklogItem item, ItemDetails patch, Set<ItemField> cleared) {
    var changes = new LinkedHashMap<String, Object>();
    putChange(changes, "title", item.getTitle(), patch.title());
    for (var field : ItemField.values()) {
      var key = field.name().toLowerCase(Locale.ROOT);
      var before = valueOf(item, field);
      if (cleared.contains(field)) {
        if (before != null) {
          var change = new LinkedHashMap<String, Object>();
          change.put("from", before.toString());
          change.put("to", null);
          changes.put(key, change);
        }
      } else {
        putChange(changes, key, before, valueOf(patch, field));
      }
    }
    return changes;
  }

  private static void putChange(
      Map<String, Object> changes, String field, Object before, Object after) {
    if (after != null && !Objects.equals(before, after)) {
      var change = new LinkedHashMap<String, Object>();
      change.put("from", before != null ? before.toString() : null);
      change.put("to", after.toString());
      changes.put(field, change);
    }
  }
}
