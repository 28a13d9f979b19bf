package io.b2mash.kanban.wip;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.exception.ValidationException;
import io.b2mash.kanban.exception.WipLimitExceededException;
import io.b2mash.kanban.project.Project;
import io.b2mash.kanban.project.ProjectRepository;
import io.b2mash.kanban.project.WipPolicy;
import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Gates entry into capacity-constrained columns. Admission and the write that follows it form one
 * unit: {@link #admit} takes the column's row lock and the caller's transaction keeps it until
 * commit, so two concurrent moves into the same column are decided one after the other against
 * the load the first one left behind.
 */
@Service
public class WipAdmissionService {

  private static final Logger log = LoggerFactory.getLogger(WipAdmissionService.class);

  private final WipLimitRepository wipLimitRepository;
  private final BacklogItemRepository backlogItemRepository;
  private final ProjectRepository projectRepository;
  private final AuditService auditService;

  public WipAdmissionService(
      WipLimitRepository wipLimitRepository,
      BacklogItemRepository backlogItemRepository,
      ProjectRepository projectRepository,
      AuditService auditService) {
    this.wipLimitRepository = wipLimitRepository;
    this.backlogItemRepository = backlogItemRepository;
    this.projectRepository = projectRepository;
    this.auditService = auditService;
  }

  /** Enters the (project, column) critical section for the rest of the current transaction. */
  @Transactional(propagation = Propagation.MANDATORY)
  public WipLimit lockColumn(UUID projectId, ItemStatus column) {
    return wipLimitRepository
        .findForUpdate(projectId, column)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  /**
   * Admits {@code item} into {@code column}, leaving the column locked. The item's own weight is
   * never counted twice: it is excluded from the current load wherever it is. A paused item enters
   * with no weight.
   *
   * @throws WipLimitExceededException if a hard limit would be exceeded
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public AdmissionResult admit(Project project, ItemStatus column, BacklogItem item) {
    var wipLimit = lockColumn(project.getId(), column);
    var policy = policyUnderLock(project);
    var weight = item.isPaused() ? BigDecimal.ZERO : policy.weightOf(item);
    return decide(project, wipLimit, policy, weight, item.getId());
  }

  /** As {@link #admit}, for an explicit weight; {@code excludeItemId} may be null. */
  @Transactional(propagation = Propagation.MANDATORY)
  public AdmissionResult admitWeight(
      Project project, ItemStatus column, BigDecimal weight, UUID excludeItemId) {
    var wipLimit = lockColumn(project.getId(), column);
    return decide(project, wipLimit, policyUnderLock(project), weight, excludeItemId);
  }

  // A policy change commits while holding the column locks, so the value read here is the one
  // the load has to be measured with.
  private WipPolicy policyUnderLock(Project project) {
    return projectRepository.findWipPolicy(project.getId()).orElse(project.getWipPolicy());
  }

  private AdmissionResult decide(
      Project project, WipLimit wipLimit, WipPolicy policy, BigDecimal weight, UUID excludeId) {
    var column = wipLimit.getColumn();
    var load = sumWeights(project.getId(), column, policy, excludeId);
    var result = AdmissionResult.evaluate(wipLimit, load, weight);
    if (!result.admitted()) {
      log.warn(
          "Refused admission of weight {} into {} of project {}: load {} of limit {}",
          weight,
          column,
          project.getId(),
          load,
          wipLimit.getLimit());
      throw new WipLimitExceededException(
          project.getId(), column, load, weight, wipLimit.getLimit());
    }
    if (result.overLimit()) {
      log.warn(
          "Soft WIP limit {} of {} in project {} exceeded",
          wipLimit.getLimit(),
          column,
          project.getId());
    }
    return result;
  }

  /**
   * Standalone admission check: would {@code incomingWeight} fit into the column right now? Runs
   * under the column lock but writes nothing.
   *
   * @throws WipLimitExceededException if a hard limit would be exceeded
   */
  @Transactional
  public AdmissionResult checkAdmission(UUID projectId, ItemStatus column, BigDecimal weight) {
    if (weight == null || weight.signum() < 0) {
      throw new ValidationException("Invalid weight", "incoming weight must be zero or positive");
    }
    return admitWeight(requireProject(projectId), column, weight, null);
  }

  /**
   * Dry run of the admission an item would face moving to {@code target}. Takes no lock and never
   * throws for a refused admission; the result says whether it would be admitted.
   */
  @Transactional(readOnly = true)
  public AdmissionResult previewAdmission(UUID itemId, ItemStatus target) {
    var item =
        backlogItemRepository
            .findById(itemId)
            .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
    if (item.getStatus() == target) {
      return AdmissionResult.unchecked(target);
    }
    var project = requireProject(item.getProjectId());
    var wipLimit = getWipLimit(project.getId(), target);
    return AdmissionResult.evaluate(
        wipLimit,
        currentLoad(project, target, item.getId()),
        item.isPaused() ? BigDecimal.ZERO : project.getWipPolicy().weightOf(item));
  }

  /** Sum of the weights of the column's non-paused items, optionally leaving one out. */
  @Transactional(readOnly = true)
  public BigDecimal currentLoad(Project project, ItemStatus column, UUID excludeItemId) {
    return sumWeights(project.getId(), column, project.getWipPolicy(), excludeItemId);
  }

  private BigDecimal sumWeights(
      UUID projectId, ItemStatus column, WipPolicy policy, UUID excludeItemId) {
    return backlogItemRepository.findActiveInColumn(projectId, column, excludeItemId).stream()
        .map(policy::weightOf)
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  @Transactional(readOnly = true)
  public WipLimit getWipLimit(UUID projectId, ItemStatus column) {
    return wipLimitRepository
        .findByProjectIdAndBoardColumn(projectId, column)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  /** All four column rows of a project, in board order. */
  @Transactional(readOnly = true)
  public List<WipLimit> getWipLimits(UUID projectId) {
    requireProject(projectId);
    return wipLimitRepository.findByProjectId(projectId).stream()
        .sorted(Comparator.comparing(WipLimit::getColumn))
        .toList();
  }

  /**
   * Sets or removes ({@code null}) a column's limit. Lowering it below the current load is allowed;
   * it only gates later entries.
   */
  @Transactional
  public WipLimit setWipLimit(
      UUID projectId, ItemStatus column, Integer limit, WipLimitType limitType) {
    requireProject(projectId);
    var wipLimit = lockColumn(projectId, column);
    Integer previous = wipLimit.getLimit();
    wipLimit.changeLimit(limit, limitType);
    wipLimit = wipLimitRepository.save(wipLimit);
    log.info(
        "Set WIP limit of {} in project {} to {} ({})",
        column,
        projectId,
        limit,
        wipLimit.getLimitType());

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.WIP_LIMIT, "updated")
            .project(projectId)
            .entity(wipLimit.getId())
            .detail("column", column.name())
            .detail("from", previous)
            .detail("to", limit)
            .detail("limit_type", wipLimit.getLimitType().name())
            .build());
    return wipLimit;
  }

  @Transactional(readOnly = true)
  public List<ColumnUsage> getColumnUsage(UUID projectId) {
    var project = requireProject(projectId);
    return getWipLimits(projectId).stream()
        .map(w -> ColumnUsage.of(w, currentLoad(project, w.getColumn(), null)))
        .toList();
  }

  private Project requireProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }
}
