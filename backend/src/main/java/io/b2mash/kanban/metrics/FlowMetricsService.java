package io.b2mash.kanban.metrics;

import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.workflow.ItemStatus;
import io.b2mash.kanban.workflow.StatusChange;
import io.b2mash.kanban.workflow.StatusChangeRepository;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Lean flow metrics derived from lifecycle timestamps and the status history. */
@Service
public class FlowMetricsService {

  static final Duration THROUGHPUT_WINDOW = Duration.ofDays(7);

  private static final double SECONDS_PER_HOUR = 3600.0;

  private final ProjectRepository projectRepository;
  private final BacklogItemRepository backlogItemRepository;
  private final StatusChangeRepository statusChangeRepository;

  public FlowMetricsService(
      ProjectRepository projectRepository,
      BacklogItemRepository backlogItemRepository,
      StatusChangeRepository statusChangeRepository) {
    this.projectRepository = projectRepository;
    this.backlogItemRepository = backlogItemRepository;
    this.statusChangeRepository = statusChangeRepository;
  }

  @Transactional(readOnly = true)
  public ProjectFlowMetrics getProjectMetrics(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("Project", projectId);
    }
    List<BacklogItem> completed = backlogItemRepository.findCompleted(projectId);
    OptionalDouble cycle =
        completed.stream()
            .filter(item -> item.getStartedAt() != null)
            .mapToDouble(item -> hoursBetween(item.getStartedAt(), item.getCompletedAt()))
            .average();
    OptionalDouble lead =
        completed.stream()
            .mapToDouble(item -> hoursBetween(item.getCreatedAt(), item.getCompletedAt()))
            .average();
    long throughput =
        backlogItemRepository.countCompletedSince(
            projectId, Instant.now().minus(THROUGHPUT_WINDOW));
    return new ProjectFlowMetrics(
        projectId,
        cycle.isPresent() ? cycle.getAsDouble() : null,
        lead.isPresent() ? lead.getAsDouble() : null,
        throughput,
        completed.size(),
        backlogItemRepository.countWorkInProgress(projectId));
  }

  @Transactional(readOnly = true)
  public ItemFlowMetrics getItemMetrics(UUID itemId) {
    var item =
        backlogItemRepository
            .findById(itemId)
            .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
    var history = statusChangeRepository.findByItemIdOrderByChangedAtAscIdAsc(itemId);
    Instant completedAt = item.getCompletedAt();
    return new ItemFlowMetrics(
        itemId,
        item.getStatus(),
        item.getStartedAt() != null && completedAt != null
            ? hoursBetween(item.getStartedAt(), completedAt)
            : null,
        completedAt != null ? hoursBetween(item.getCreatedAt(), completedAt) : null,
        hoursPerColumn(history, Instant.now()));
  }

  /**
   * Time spent in each column. Every history entry opens a stay in its target column that lasts
   * until the next entry; the last one is still open and runs until {@code now}.
   */
  static Map<ItemStatus, Double> hoursPerColumn(List<StatusChange> history, Instant now) {
    Map<ItemStatus, Double> hours = new EnumMap<>(ItemStatus.class);
    for (int i = 0; i < history.size(); i++) {
      var change = history.get(i);
      Instant until = i + 1 < history.size() ? history.get(i + 1).getChangedAt() : now;
      hours.merge(change.getToStatus(), hoursBetween(change.getChangedAt(), until), Double::sum);
    }
    return hours;
  }

  private static double hoursBetween(Instant from, Instant to) {
    return Duration.between(from, to).toMillis() / 1000.0 / SECONDS_PER_HOUR;
  }

  public record ProjectFlowMetrics(
      UUID projectId,
      Double avgCycleTimeHours,
      Double avgLeadTimeHours,
      long throughputLast7Days,
      long totalCompleted,
      long workInProgress) {}

  public record ItemFlowMetrics(
      UUID itemId,
      ItemStatus status,
      Double cycleTimeHours,
      Double leadTimeHours,
      Map<ItemStatus, Double> hoursInColumn) {}
}
