package io.b2mash.kanban.board;

import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.project.WipPolicy;
import io.b2mash.kanban.wip.WipLimit;
import io.b2mash.kanban.wip.WipLimitRepository;
import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Assembles the board from one snapshot. Items are read in a single statement inside a {@code
 * REPEATABLE READ} transaction, so a concurrent transition is either entirely visible or not at
 * all and no item can show up in two columns or in none.
 */
@Service
public class BoardService {

  private static final Logger log = LoggerFactory.getLogger(BoardService.class);

  private final ProjectRepository projectRepository;
  private final BacklogItemRepository backlogItemRepository;
  private final WipLimitRepository wipLimitRepository;
  private final BoardProperties boardProperties;

  public BoardService(
      ProjectRepository projectRepository,
      BacklogItemRepository backlogItemRepository,
      WipLimitRepository wipLimitRepository,
      BoardProperties boardProperties) {
    this.projectRepository = projectRepository;
    this.backlogItemRepository = backlogItemRepository;
    this.wipLimitRepository = wipLimitRepository;
    this.boardProperties = boardProperties;
  }

  /**
   * @param childrenMode overrides the configured hierarchy attachment; null uses the default
   */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public KanbanBoard getBoard(UUID projectId, ChildrenMode childrenMode) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    List<BacklogItem> items = backlogItemRepository.findByProjectId(projectId);
    Map<ItemStatus, WipLimit> limits =
        wipLimitRepository.findByProjectId(projectId).stream()
            .collect(Collectors.toMap(WipLimit::getColumn, Function.identity()));

    var mode = childrenMode != null ? childrenMode : boardProperties.children();
    int depth = boardProperties.depthFor(mode);
    var index = HierarchyIndex.of(items);

    Map<ItemStatus, List<BacklogItem>> byStatus = new EnumMap<>(ItemStatus.class);
    for (var status : ItemStatus.values()) {
      byStatus.put(status, new ArrayList<>());
    }
    items.forEach(item -> byStatus.get(item.getStatus()).add(item));

    var columns = new ArrayList<KanbanBoard.Column>();
    for (var entry : byStatus.entrySet()) {
      var columnItems = entry.getValue();
      columnItems.sort(Comparator.comparingLong(BacklogItem::getRank));
      var wipLimit = limits.get(entry.getKey());
      columns.add(
          new KanbanBoard.Column(
              entry.getKey(),
              wipLimit != null ? wipLimit.getLimit() : null,
              wipLimit != null ? wipLimit.getLimitType() : null,
              load(columnItems, project.getWipPolicy()),
              columnItems.stream()
                  .map(item -> toCard(item, index, depth, new HashSet<>()))
                  .toList()));
    }
    log.debug("Assembled board for project {} with {} items", projectId, items.size());
    return new KanbanBoard(project.getId(), project.getName(), columns);
  }

  private KanbanBoard.Card toCard(
      BacklogItem item, HierarchyIndex index, int depth, Set<UUID> path) {
    if (depth == 0 || !path.add(item.getId())) {
      return KanbanBoard.Card.of(item, List.of());
    }
    var children =
        index.childrenOf(item.getId()).stream()
            .map(child -> toCard(child, index, depth - 1, path))
            .toList();
    path.remove(item.getId());
    return KanbanBoard.Card.of(item, children);
  }

  private static BigDecimal load(List<BacklogItem> columnItems, WipPolicy policy) {
    return columnItems.stream()
        .filter(item -> !item.isPaused())
        .map(policy::weightOf)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }
}
