package io.b2mash.kanban.hierarchy;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.CrossProjectReferenceException;
import io.b2mash.kanban.exception.HierarchyCycleException;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.project.ProjectService;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Parent/child relations between backlog items. Edges are plain id references; every mutation
 * walks the ancestor chain explicitly instead of trusting the stored forest to be acyclic, and
 * runs under the project's hierarchy lock so two concurrent reparents cannot each pass the walk
 * and together close a cycle.
 */
@Service
public class HierarchyService {

  private static final Logger log = LoggerFactory.getLogger(HierarchyService.class);

  private final BacklogItemRepository backlogItemRepository;
  private final ProjectService projectService;
  private final AuditService auditService;

  public HierarchyService(
      BacklogItemRepository backlogItemRepository,
      ProjectService projectService,
      AuditService auditService) {
    this.backlogItemRepository = backlogItemRepository;
    this.projectService = projectService;
    this.auditService = auditService;
  }

  /**
   * Moves an item under {@code newParentId}, or makes it a root when that is null. Fails before
   * any write if the new parent is the item itself or one of its descendants, or lives in another
   * project.
   */
  @Transactional
  public BacklogItem reparent(UUID itemId, UUID newParentId, Integer expectedVersion) {
    var item = findItem(itemId);
    item.requireVersion(expectedVersion);
    projectService.lockHierarchy(item.getProjectId());

    UUID oldParentId = item.getParentId();
    if (newParentId != null) {
      requireParent(item.getProjectId(), newParentId);
      requireNotAncestor(itemId, newParentId);
    }
    if (Objects.equals(oldParentId, newParentId)) {
      return item;
    }

    item.reparent(newParentId);
    var saved = backlogItemRepository.save(item);
    log.info("Reparented backlog item {} from {} to {}", itemId, oldParentId, newParentId);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "reparented")
            .project(item.getProjectId())
            .entity(itemId)
            .detail("from", oldParentId)
            .detail("to", newParentId)
            .build());
    return saved;
  }

  /**
   * Loads a prospective parent and checks it belongs to {@code projectId}.
   *
   * @throws CrossProjectReferenceException if it belongs to another project
   */
  @Transactional(readOnly = true)
  public BacklogItem requireParent(UUID projectId, UUID parentId) {
    var parent =
        backlogItemRepository
            .findById(parentId)
            .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", parentId));
    if (!parent.getProjectId().equals(projectId)) {
      throw new CrossProjectReferenceException(projectId, parentId, parent.getProjectId());
    }
    return parent;
  }

  /** Direct children, oldest first. */
  @Transactional(readOnly = true)
  public List<BacklogItem> getChildren(UUID itemId) {
    requireExists(itemId);
    return backlogItemRepository.findChildren(itemId);
  }

  /**
   * All descendants in depth-first pre-order. The returned iterable is lazy: each level is
   * fetched as the iteration reaches it. Every call to {@code iterator()} starts a fresh walk from
   * the store, so results are never cached and the sequence can be restarted.
   */
  @Transactional(readOnly = true)
  public Iterable<BacklogItem> getDescendants(UUID itemId) {
    requireExists(itemId);
    return () -> new DescendantIterator(itemId);
  }

  /** The item and its whole subtree in post-order: every item comes after all its descendants. */
  @Transactional(readOnly = true)
  public List<BacklogItem> collectSubtreeLeavesFirst(BacklogItem root) {
    var visited = new HashSet<UUID>();
    Deque<BacklogItem> stack = new ArrayDeque<>();
    Deque<BacklogItem> output = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      var current = stack.pop();
      if (!visited.add(current.getId())) {
        continue;
      }
      output.push(current);
      backlogItemRepository.findChildren(current.getId()).forEach(stack::push);
    }
    // Reversed pre-order puts every item after its descendants.
    return new ArrayList<>(output);
  }

  private void requireNotAncestor(UUID itemId, UUID newParentId) {
    Set<UUID> seen = new HashSet<>();
    UUID current = newParentId;
    while (current != null) {
      if (current.equals(itemId)) {
        log.warn("Refused reparent of {} under its own descendant {}", itemId, newParentId);
        throw new HierarchyCycleException(itemId, newParentId);
      }
      if (!seen.add(current)) {
        throw new IllegalStateException("Stored hierarchy contains a cycle through " + current);
      }
      current = backlogItemRepository.findParentIdById(current).orElse(null);
    }
  }

  private void requireExists(UUID itemId) {
    if (!backlogItemRepository.existsById(itemId)) {
      throw new ResourceNotFoundException("BacklogItem", itemId);
    }
  }

  private BacklogItem findItem(UUID itemId) {
    return backlogItemRepository
        .findById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
  }

  private final class DescendantIterator implements Iterator<BacklogItem> {

    private final Deque<BacklogItem> stack = new ArrayDeque<>();
    private final Set<UUID> visited = new HashSet<>();

    DescendantIterator(UUID rootId) {
      visited.add(rootId);
      pushChildren(rootId);
    }

    @Override
    public boolean hasNext() {
      return !stack.isEmpty();
    }

    @Override
    public BacklogItem next() {
      if (stack.isEmpty()) {
        throw new NoSuchElementException();
      }
      var next = stack.pop();
      pushChildren(next.getId());
      return next;
    }

    private void pushChildren(UUID parentId) {
      var children = new ArrayList<>(backlogItemRepository.findChildren(parentId));
      Collections.reverse(children);
      for (var child : children) {
        if (visited.add(child.getId())) {
          stack.push(child);
        }
      }
    }
  }
}
