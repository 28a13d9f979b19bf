package io.b2mash.kanban.project;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceConflictException;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.exception.WipLimitExceededException;
import io.b2mash.kanban.wip.WipLimit;
import io.b2mash.kanban.wip.WipLimitRepository;
import io.b2mash.kanban.wip.WipLimitType;
import io.b2mash.kanban.workflow.ItemStatus;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final WipLimitRepository wipLimitRepository;
  private final BacklogItemRepository backlogItemRepository;
  private final AuditService auditService;

  public ProjectService(
      ProjectRepository projectRepository,
      WipLimitRepository wipLimitRepository,
      BacklogItemRepository backlogItemRepository,
      AuditService auditService) {
    this.projectRepository = projectRepository;
    this.wipLimitRepository = wipLimitRepository;
    this.backlogItemRepository = backlogItemRepository;
    this.auditService = auditService;
  }

  /** Registers a project and gives each of its four columns an unlimited WIP row. */
  @Transactional
  public Project createProject(String name, WipPolicy wipPolicy) {
    var project = projectRepository.save(new Project(name, wipPolicy));
    wipLimitRepository.saveAll(
        Arrays.stream(ItemStatus.values())
            .map(column -> new WipLimit(project.getId(), column))
            .toList());
    log.info("Created project {} with WIP policy {}", project.getId(), project.getWipPolicy());

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.PROJECT, "created")
            .project(project.getId())
            .entity(project.getId())
            .detail("name", name)
            .detail("wip_policy", project.getWipPolicy().name())
            .build());
    return project;
  }

  @Transactional(readOnly = true)
  public Project getProject(UUID projectId) {
    return projectRepository
        .findById(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }

  /**
   * Renames the project or changes how WIP load is weighed. A policy change re-weighs every
   * capacity-constrained column under its lock and is refused when a column with a hard limit
   * would end up over it; soft limits only log.
   *
   * @throws WipLimitExceededException if the new policy overfills a hard-limited column
   */
  @Transactional
  public Project updateProject(
      UUID projectId, String name, WipPolicy wipPolicy, Integer expectedVersion) {
    var project = lockHierarchy(projectId);
    if (expectedVersion != null && expectedVersion != project.getVersion()) {
      throw ResourceConflictException.staleVersion(
          "Project", projectId, expectedVersion, project.getVersion());
    }

    var details = new LinkedHashMap<String, Object>();
    if (!project.getName().equals(name)) {
      details.put("name", Map.of("from", project.getName(), "to", name));
    }
    WipPolicy newPolicy = wipPolicy != null ? wipPolicy : project.getWipPolicy();
    if (project.getWipPolicy() != newPolicy) {
      details.put(
          "wip_policy", Map.of("from", project.getWipPolicy().name(), "to", newPolicy.name()));
    }

    if (project.getWipPolicy() != newPolicy) {
      requireCapacityUnder(projectId, newPolicy);
    }

    project.update(name, newPolicy);
    project = projectRepository.save(project);
    log.info("Updated project {}", projectId);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.PROJECT, "updated")
            .project(projectId)
            .entity(projectId)
            .details(details)
            .build());
    return project;
  }

  // Columns are locked in board order, after the project row, and held until commit.
  private void requireCapacityUnder(UUID projectId, WipPolicy policy) {
    for (var column : ItemStatus.values()) {
      if (!column.isCapacityConstrained()) {
        continue;
      }
      var wipLimit =
          wipLimitRepository
              .findForUpdate(projectId, column)
              .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
      if (wipLimit.isUnlimited()) {
        continue;
      }
      var load =
          backlogItemRepository.findActiveInColumn(projectId, column, null).stream()
              .map(policy::weightOf)
              .reduce(BigDecimal.ZERO, BigDecimal::add);
      if (load.compareTo(BigDecimal.valueOf(wipLimit.getLimit())) <= 0) {
        continue;
      }
      if (wipLimit.getLimitType() == WipLimitType.HARD) {
        log.warn(
            "Refused WIP policy {} for project {}: {} would weigh {} against limit {}",
            policy,
            projectId,
            column,
            load,
            wipLimit.getLimit());
        throw new WipLimitExceededException(
            projectId, column, load, BigDecimal.ZERO, wipLimit.getLimit());
      }
      log.warn(
          "WIP policy {} puts {} of project {} over its soft limit {}",
          policy,
          column,
          projectId,
          wipLimit.getLimit());
    }
  }

  /**
   * Takes the project's hierarchy lock for the rest of the current transaction. Callers must lock
   * the project before any column.
   */
  @Transactional
  public Project lockHierarchy(UUID projectId) {
    return projectRepository
        .findOneForUpdate(projectId)
        .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
  }
}
