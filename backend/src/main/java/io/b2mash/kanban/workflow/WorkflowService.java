package io.b2mash.kanban.workflow;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.IllegalTransitionException;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.exception.WorkflowPolicyViolationException;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.rank.PositionHint;
import io.b2mash.kanban.rank.RankSequencer;
import io.b2mash.kanban.request.RequestScopes;
import io.b2mash.kanban.wip.WipAdmissionService;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only code path that changes an item's status. A transition validates the edge, checks the
 * edge's workflow policy, passes admission for the target column, takes a rank there and writes
 * the item, all in one transaction that holds the target column's lock from admission to commit.
 * Children are never moved along with their parent.
 */
@Service
public class WorkflowService {

  private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

  private final BacklogItemRepository backlogItemRepository;
  private final ProjectRepository projectRepository;
  private final WorkflowPolicyService workflowPolicyService;
  private final WipAdmissionService wipAdmissionService;
  private final RankSequencer rankSequencer;
  private final StatusChangeRepository statusChangeRepository;
  private final AuditService auditService;

  public WorkflowService(
      BacklogItemRepository backlogItemRepository,
      ProjectRepository projectRepository,
      WorkflowPolicyService workflowPolicyService,
      WipAdmissionService wipAdmissionService,
      RankSequencer rankSequencer,
      StatusChangeRepository statusChangeRepository,
      AuditService auditService) {
    this.backlogItemRepository = backlogItemRepository;
    this.projectRepository = projectRepository;
    this.workflowPolicyService = workflowPolicyService;
    this.wipAdmissionService = wipAdmissionService;
    this.rankSequencer = rankSequencer;
    this.statusChangeRepository = statusChangeRepository;
    this.auditService = auditService;
  }

  /**
   * Moves an item to {@code target}. A move to the item's current status changes nothing.
   *
   * @param hint position in the target column; null places the item at the bottom
   * @param expectedVersion optional; when given it must match the stored version
   * @throws WorkflowPolicyViolationException if the edge's active policy is not met; checked
   *     before admission, so a refused move takes no column lock
   */
  @Transactional
  public TransitionResult transition(
      UUID itemId, ItemStatus target, PositionHint hint, Integer expectedVersion) {
    var item = findItem(itemId);
    item.requireVersion(expectedVersion);

    ItemStatus from = item.getStatus();
    if (from == target) {
      return new TransitionResult(item, null);
    }
    if (!from.canTransitionTo(target)) {
      throw new IllegalTransitionException(itemId, from, target);
    }
    workflowPolicyService.requireSatisfied(item, from, target);

    var project =
        projectRepository
            .findById(item.getProjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Project", item.getProjectId()));
    var admission = wipAdmissionService.admit(project, target, item);
    long rank =
        rankSequencer.assignRank(
            project.getId(), target, hint != null ? hint : PositionHint.bottom(), itemId);

    item.moveTo(target, rank);
    var saved = backlogItemRepository.save(item);
    statusChangeRepository.save(
        new StatusChange(
            itemId,
            project.getId(),
            from,
            target,
            RequestScopes.currentMemberId().orElse(null)));
    log.info("Moved backlog item {} from {} to {}", itemId, from, target);

    var event =
        AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "transitioned")
            .project(project.getId())
            .entity(itemId)
            .detail("from", from.name())
            .detail("to", target.name())
            .detail("rank", rank);
    if (admission.overLimit()) {
      event.detail("soft_limit_exceeded", true);
    }
    auditService.log(event.build());
    return new TransitionResult(saved, admission);
  }

  /** Committed transitions of an item, oldest first, starting with its creation. */
  @Transactional(readOnly = true)
  public List<StatusChange> getStatusHistory(UUID itemId) {
    if (!backlogItemRepository.existsById(itemId)) {
      throw new ResourceNotFoundException("BacklogItem", itemId);
    }
    return statusChangeRepository.findByItemIdOrderByChangedAtAscIdAsc(itemId);
  }

  private BacklogItem findItem(UUID itemId) {
    return backlogItemRepository
        .findById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
  }
}
