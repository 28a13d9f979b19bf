package io.b2mash.kanban.workflow;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkflowPolicyController {

  private final WorkflowPolicyService workflowPolicyService;

  public WorkflowPolicyController(WorkflowPolicyService workflowPolicyService) {
    this.workflowPolicyService = workflowPolicyService;
  }

  @GetMapping("/api/projects/{projectId}/workflow-policies")
  public ResponseEntity<List<WorkflowPolicyResponse>> listPolicies(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        workflowPolicyService.listPolicies(projectId).stream()
            .map(WorkflowPolicyResponse::from)
            .toList());
  }

  @PostMapping("/api/projects/{projectId}/workflow-policies/defaults")
  public ResponseEntity<DefaultsResponse> initializeDefaults(@PathVariable UUID projectId) {
    var created = workflowPolicyService.initializeDefaults(projectId);
    return ResponseEntity.ok(
        new DefaultsResponse(
            created.size(), created.stream().map(WorkflowPolicyResponse::from).toList()));
  }

  @PutMapping("/api/projects/{projectId}/workflow-policies/{fromStatus}/{toStatus}")
  public ResponseEntity<WorkflowPolicyResponse> upsertPolicy(
      @PathVariable UUID projectId,
      @PathVariable ItemStatus fromStatus,
      @PathVariable ItemStatus toStatus,
      @RequestBody UpsertPolicyRequest request) {
    var policy =
        workflowPolicyService.upsertPolicy(
            projectId, fromStatus, toStatus, request.criteria(), request.active());
    return ResponseEntity.ok(WorkflowPolicyResponse.from(policy));
  }

  @GetMapping("/api/items/{itemId}/policy-check")
  public ResponseEntity<PolicyCheck> checkPolicy(
      @PathVariable UUID itemId, @RequestParam ItemStatus target) {
    return ResponseEntity.ok(workflowPolicyService.checkPolicy(itemId, target));
  }

  // --- DTOs ---

  public record UpsertPolicyRequest(Set<PolicyCriterion> criteria, Boolean active) {}

  public record DefaultsResponse(int created, List<WorkflowPolicyResponse> policies) {}

  public record WorkflowPolicyResponse(
      UUID id,
      UUID projectId,
      ItemStatus fromStatus,
      ItemStatus toStatus,
      Set<PolicyCriterion> criteria,
      boolean active,
      int version,
      Instant updatedAt) {

    public static WorkflowPolicyResponse from(WorkflowPolicy policy) {
      return new WorkflowPolicyResponse(
          policy.getId(),
          policy.getProjectId(),
          policy.getFromStatus(),
          policy.getToStatus(),
          policy.getCriteria(),
          policy.isActive(),
          policy.getVersion(),
          policy.getUpdatedAt());
    }
  }
}
