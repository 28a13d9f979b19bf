package io.b2mash.kanban.rank;

import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.exception.ValidationException;
import io.b2mash.kanban.workflow.ItemStatus;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Computes ranks within a column. Every method expects the caller to hold the column's lock (see
 * {@code WipAdmissionService#lockColumn}); that lock is what makes rebalancing exclusive with
 * concurrent inserts into the same column.
 */
@Service
public class RankSequencer {

  private static final Logger log = LoggerFactory.getLogger(RankSequencer.class);

  private static final PageRequest FIRST = PageRequest.of(0, 1);

  private final BacklogItemRepository backlogItemRepository;

  public RankSequencer(BacklogItemRepository backlogItemRepository) {
    this.backlogItemRepository = backlogItemRepository;
  }

  /**
   * Returns a free rank in {@code column} at the hinted position.
   *
   * @param movingItemId the item being placed, left out of the neighbour search; null for a new
   *     item
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public long assignRank(UUID projectId, ItemStatus column, PositionHint hint, UUID movingItemId) {
    OptionalLong rank = tryAssign(projectId, column, hint, movingItemId);
    if (rank.isPresent()) {
      return rank.getAsLong();
    }
    rebalance(projectId, column, movingItemId);
    return tryAssign(projectId, column, hint, movingItemId)
        .orElseThrow(
            () -> new IllegalStateException("No free rank in " + column + " after rebalancing"));
  }

  /**
   * Renumbers the column to evenly spaced ranks, keeping its order. The moving item, if it is in
   * the column, is left out; the caller gives it a new rank in the same transaction and the
   * deferred unique constraint is only checked at commit.
   *
   * <p>A transition out of this column holds only its target column's lock, so it can commit a
   * row this rebalance is rewriting. The rebalance then fails on that row's version and the
   * whole transaction rolls back as a conflict; the caller retries.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public void rebalance(UUID projectId, ItemStatus column, UUID movingItemId) {
    List<BacklogItem> items = backlogItemRepository.findColumn(projectId, column, movingItemId);
    for (int i = 0; i < items.size(); i++) {
      items.get(i).rebalanceRank(RankSpace.evenlySpaced(i));
    }
    backlogItemRepository.flush();
    log.debug("Rebalanced {} items in column {} of project {}", items.size(), column, projectId);
  }

  private OptionalLong tryAssign(
      UUID projectId, ItemStatus column, PositionHint hint, UUID movingItemId) {
    return switch (hint.placement()) {
      case TOP ->
          first(projectId, column, movingItemId)
              .map(head -> RankSpace.before(head.getRank()))
              .orElse(OptionalLong.of(RankSpace.initial()));
      case BOTTOM ->
          last(projectId, column, movingItemId)
              .map(tail -> RankSpace.after(tail.getRank()))
              .orElse(OptionalLong.of(RankSpace.initial()));
      case AFTER ->
          afterAnchor(
              projectId, column, anchor(projectId, column, hint, movingItemId), movingItemId);
      case AT_RANK -> atRank(projectId, column, hint.rank(), movingItemId);
    };
  }

  private OptionalLong afterAnchor(
      UUID projectId, ItemStatus column, BacklogItem anchor, UUID movingItemId) {
    var successors =
        backlogItemRepository.findSuccessors(
            projectId, column, anchor.getRank(), movingItemId, FIRST);
    return successors.isEmpty()
        ? RankSpace.after(anchor.getRank())
        : RankSpace.between(anchor.getRank(), successors.get(0).getRank());
  }

  private OptionalLong atRank(UUID projectId, ItemStatus column, Long rank, UUID movingItemId) {
    if (rank == null || !RankSpace.inBounds(rank)) {
      throw new ValidationException(
          "Invalid rank", "Requested rank must be between -2^62 and 2^62");
    }
    var occupant = backlogItemRepository.findOccupant(projectId, column, rank, movingItemId);
    if (occupant.isEmpty()) {
      return OptionalLong.of(rank);
    }
    var successors =
        backlogItemRepository.findSuccessors(projectId, column, rank, movingItemId, FIRST);
    return successors.isEmpty()
        ? RankSpace.after(rank)
        : RankSpace.between(rank, successors.get(0).getRank());
  }

  private BacklogItem anchor(
      UUID projectId, ItemStatus column, PositionHint hint, UUID movingItemId) {
    UUID anchorId = hint.afterItemId();
    if (anchorId == null) {
      throw new ValidationException("Invalid position", "AFTER placement needs an anchor item");
    }
    if (anchorId.equals(movingItemId)) {
      throw new ValidationException("Invalid position", "An item cannot be placed after itself");
    }
    var anchor =
        backlogItemRepository
            .findById(anchorId)
            .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", anchorId));
    if (!anchor.getProjectId().equals(projectId) || anchor.getStatus() != column) {
      throw new ValidationException(
          "Invalid position", "Anchor item " + anchorId + " is not in column " + column);
    }
    return anchor;
  }

  private Optional<BacklogItem> first(
      UUID projectId, ItemStatus column, UUID movingItemId) {
    return backlogItemRepository.findHead(projectId, column, movingItemId, FIRST).stream()
        .findFirst();
  }

  private Optional<BacklogItem> last(
      UUID projectId, ItemStatus column, UUID movingItemId) {
    return backlogItemRepository.findTail(projectId, column, movingItemId, FIRST).stream()
        .findFirst();
  }
}
