package io.b2mash.kanban.rank;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.wip.WipAdmissionService;
import io.b2mash.kanban.workflow.ItemStatus;
import io.b2mash.kanban.workflow.TransitionResult;
import io.b2mash.kanban.workflow.WorkflowService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drag-and-drop style moves: place an item right after another one, or at the top of a column.
 * A move into another column is a status change and goes through {@link WorkflowService}.
 */
@Service
public class ReorderService {

  private static final Logger log = LoggerFactory.getLogger(ReorderService.class);

  private final BacklogItemRepository backlogItemRepository;
  private final WipAdmissionService wipAdmissionService;
  private final RankSequencer rankSequencer;
  private final WorkflowService workflowService;
  private final AuditService auditService;

  public ReorderService(
      BacklogItemRepository backlogItemRepository,
      WipAdmissionService wipAdmissionService,
      RankSequencer rankSequencer,
      WorkflowService workflowService,
      AuditService auditService) {
    this.backlogItemRepository = backlogItemRepository;
    this.wipAdmissionService = wipAdmissionService;
    this.rankSequencer = rankSequencer;
    this.workflowService = workflowService;
    this.auditService = auditService;
  }

  /**
   * Moves an item to {@code targetColumn}, right after {@code afterItemId} or at the top of the
   * column when that is null.
   */
  @Transactional
  public TransitionResult reorder(
      UUID itemId, ItemStatus targetColumn, UUID afterItemId, Integer expectedVersion) {
    var item = findItem(itemId);
    if (item.getStatus() != targetColumn) {
      return workflowService.transition(
          itemId, targetColumn, PositionHint.afterOrTop(afterItemId), expectedVersion);
    }

    item.requireVersion(expectedVersion);
    wipAdmissionService.lockColumn(item.getProjectId(), targetColumn);
    long before = item.getRank();
    long rank =
        rankSequencer.assignRank(
            item.getProjectId(), targetColumn, PositionHint.afterOrTop(afterItemId), itemId);
    item.changeRank(rank);
    var saved = backlogItemRepository.save(item);
    log.info("Reordered backlog item {} within {}", itemId, targetColumn);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.BACKLOG_ITEM, "reordered")
            .project(item.getProjectId())
            .entity(itemId)
            .detail("column", targetColumn.name())
            .detail("after_item_id", afterItemId)
            .detail("from_rank", before)
            .detail("to_rank", rank)
            .build());
    return new TransitionResult(saved, null);
  }

  private BacklogItem findItem(UUID itemId) {
    return backlogItemRepository
        .findById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
  }
}
