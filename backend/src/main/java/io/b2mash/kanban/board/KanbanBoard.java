package io.b2mash.kanban.board;

import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.wip.WipLimitType;
import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only projection of a project's board: the four columns in workflow order, each listing the
 * items currently in it by ascending rank. Every item appears in exactly one column; the cards'
 * {@code children} repeat items that also appear in their own column.
 */
public record KanbanBoard(UUID projectId, String projectName, List<Column> columns) {

  public record Column(
      ItemStatus status,
      Integer wipLimit,
      WipLimitType limitType,
      BigDecimal currentLoad,
      List<Card> items) {}

  public record Card(
      UUID id,
      UUID parentId,
      String title,
      String type,
      ItemStatus status,
      long rank,
      UUID assigneeId,
      UUID reviewerId,
      Integer storyPoint,
      BigDecimal estimateValue,
      boolean paused,
      Instant deadline,
      int version,
      List<Card> children) {

    static Card of(BacklogItem item, List<Card> children) {
      return new Card(
          item.getId(),
          item.getParentId(),
          item.getTitle(),
          item.getType(),
          item.getStatus(),
          item.getRank(),
          item.getAssigneeId(),
          item.getReviewerId(),
          item.getStoryPoint(),
          item.getEstimateValue(),
          item.isPaused(),
          item.getDeadline(),
          item.getVersion(),
          children);
    }
  }
}
