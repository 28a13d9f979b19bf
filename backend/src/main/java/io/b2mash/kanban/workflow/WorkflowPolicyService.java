package io.b2mash.kanban.workflow;

import io.b2mash.kanban.audit.AuditEventBuilder;
import io.b2mash.kanban.audit.AuditService;
import io.b2mash.kanban.audit.AuditedEntity;
import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.backlog.BacklogItemRepository;
import io.b2mash.kanban.exception.ResourceNotFoundException;
import io.b2mash.kanban.exception.WorkflowPolicyViolationException;
import io.b2mash.kanban.project.ProjectService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-project entry criteria on workflow edges. A transition across an edge with an active policy
 * is refused until the item meets every criterion; edges without one are unrestricted.
 */
@Service
public class WorkflowPolicyService {

  private static final Logger log = LoggerFactory.getLogger(WorkflowPolicyService.class);

  /** Ready to start: someone owns it and it is sized. */
  static final Set<PolicyCriterion> DEFAULT_START_CRITERIA =
      Set.of(PolicyCriterion.ASSIGNEE_REQUIRED, PolicyCriterion.STORY_POINTS_ESTIMATED);

  /** Ready to finish: reviewed against its acceptance criteria and not on hold. */
  static final Set<PolicyCriterion> DEFAULT_FINISH_CRITERIA =
      Set.of(
          PolicyCriterion.REVIEWER_REQUIRED,
          PolicyCriterion.ACCEPTANCE_CRITERIA_DEFINED,
          PolicyCriterion.NO_BLOCKERS);

  private final WorkflowPolicyRepository workflowPolicyRepository;
  private final BacklogItemRepository backlogItemRepository;
  private final ProjectService projectService;
  private final AuditService auditService;

  public WorkflowPolicyService(
      WorkflowPolicyRepository workflowPolicyRepository,
      BacklogItemRepository backlogItemRepository,
      ProjectService projectService,
      AuditService auditService) {
    this.workflowPolicyRepository = workflowPolicyRepository;
    this.backlogItemRepository = backlogItemRepository;
    this.projectService = projectService;
    this.auditService = auditService;
  }

  /**
   * Creates the default policies for Todo to Doing and Doing to Done. An edge that already has a
   * policy keeps it untouched.
   *
   * @return the policies created by this call
   */
  @Transactional
  public List<WorkflowPolicy> initializeDefaults(UUID projectId) {
    projectService.lockHierarchy(projectId);
    var created = new ArrayList<WorkflowPolicy>();
    createIfAbsent(projectId, ItemStatus.TODO, ItemStatus.DOING, DEFAULT_START_CRITERIA, created);
    createIfAbsent(projectId, ItemStatus.DOING, ItemStatus.DONE, DEFAULT_FINISH_CRITERIA, created);
    log.info(
        "Initialized {} default workflow policy(ies) for project {}", created.size(), projectId);
    return created;
  }

  /** A project's policies, in board order of their edges. */
  @Transactional(readOnly = true)
  public List<WorkflowPolicy> listPolicies(UUID projectId) {
    projectService.getProject(projectId);
    return workflowPolicyRepository.findByProjectId(projectId).stream()
        .sorted(
            Comparator.comparing(WorkflowPolicy::getFromStatus)
                .thenComparing(WorkflowPolicy::getToStatus))
        .toList();
  }

  /**
   * Creates or changes the policy of one edge. A null {@code criteria} or {@code active} leaves
   * the current value; a new policy starts active with no criteria unless given.
   */
  @Transactional
  public WorkflowPolicy upsertPolicy(
      UUID projectId,
      ItemStatus from,
      ItemStatus to,
      Set<PolicyCriterion> criteria,
      Boolean active) {
    projectService.lockHierarchy(projectId);
    var existing =
        workflowPolicyRepository.findByProjectIdAndFromStatusAndToStatus(projectId, from, to);
    if (existing.isEmpty()) {
      var policy = new WorkflowPolicy(projectId, from, to, criteria != null ? criteria : Set.of());
      if (active != null) {
        policy.update(null, active);
      }
      policy = workflowPolicyRepository.save(policy);
      log.info("Created workflow policy {} -> {} for project {}", from, to, projectId);
      auditCreated(policy);
      return policy;
    }

    var policy = existing.get();
    var previousCriteria = policy.getCriteria();
    var wasActive = policy.isActive();
    policy.update(criteria, active);
    policy = workflowPolicyRepository.save(policy);
    log.info("Updated workflow policy {} -> {} for project {}", from, to, projectId);

    auditService.log(
        AuditEventBuilder.of(AuditedEntity.WORKFLOW_POLICY, "updated")
            .project(projectId)
            .entity(policy.getId())
            .detail("from_status", from.name())
            .detail("to_status", to.name())
            .detail("criteria_before", names(previousCriteria))
            .detail("criteria", names(policy.getCriteria()))
            .detail("active_before", wasActive)
            .detail("active", policy.isActive())
            .build());
    return policy;
  }

  /**
   * Dry run of the policy an item would face moving to {@code target} from where it is now.
   * Never throws for unmet criteria; the result lists them.
   */
  @Transactional(readOnly = true)
  public PolicyCheck checkPolicy(UUID itemId, ItemStatus target) {
    var item =
        backlogItemRepository
            .findById(itemId)
            .orElseThrow(() -> new ResourceNotFoundException("BacklogItem", itemId));
    return evaluate(item, item.getStatus(), target);
  }

  /** Evaluates the active policy of {@code from -> to}, if any, against {@code item}. */
  @Transactional(readOnly = true)
  public PolicyCheck evaluate(BacklogItem item, ItemStatus from, ItemStatus to) {
    var policy =
        workflowPolicyRepository
            .findByProjectIdAndFromStatusAndToStatus(item.getProjectId(), from, to)
            .filter(WorkflowPolicy::isActive);
    if (policy.isEmpty()) {
      return PolicyCheck.passed(from, to);
    }
    var violations = policy.get().violationsOf(item);
    return new PolicyCheck(from, to, violations.isEmpty(), violations);
  }

  /**
   * Refuses the move when the edge's active policy is not met.
   *
   * @throws WorkflowPolicyViolationException listing every unmet criterion
   */
  @Transactional(readOnly = true)
  public void requireSatisfied(BacklogItem item, ItemStatus from, ItemStatus to) {
    var check = evaluate(item, from, to);
    if (!check.allowed()) {
      log.info(
          "Workflow policy refused backlog item {} from {} to {}: {} violation(s)",
          item.getId(),
          from,
          to,
          check.violations().size());
      throw new WorkflowPolicyViolationException(item.getId(), check);
    }
  }

  private void createIfAbsent(
      UUID projectId,
      ItemStatus from,
      ItemStatus to,
      Set<PolicyCriterion> criteria,
      List<WorkflowPolicy> created) {
    if (workflowPolicyRepository
        .findByProjectIdAndFromStatusAndToStatus(projectId, from, to)
        .isPresent()) {
      return;
    }
    var policy = workflowPolicyRepository.save(new WorkflowPolicy(projectId, from, to, criteria));
    auditCreated(policy);
    created.add(policy);
  }

  private void auditCreated(WorkflowPolicy policy) {
    auditService.log(
        AuditEventBuilder.of(AuditedEntity.WORKFLOW_POLICY, "created")
            .project(policy.getProjectId())
            .entity(policy.getId())
            .detail("from_status", policy.getFromStatus().name())
            .detail("to_status", policy.getToStatus().name())
            .detail("criteria", names(policy.getCriteria()))
            .detail("active", policy.isActive())
            .build());
  }

  private static List<String> names(Set<PolicyCriterion> criteria) {
    return criteria.stream().map(Enum::name).toList();
  }
}
