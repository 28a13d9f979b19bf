package io.b2mash.kanban.workflow;

import io.b2mash.kanban.backlog.BacklogItemController.BacklogItemResponse;
import io.b2mash.kanban.rank.PositionHint;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkflowController {

  private final WorkflowService workflowService;

  public WorkflowController(WorkflowService workflowService) {
    this.workflowService = workflowService;
  }

  @PostMapping("/api/items/{itemId}/transition")
  public ResponseEntity<TransitionResponse> transition(
      @PathVariable UUID itemId, @Valid @RequestBody TransitionRequest request) {
    var result =
        workflowService.transition(
            itemId,
            request.targetStatus(),
            request.requestedRank() != null ? PositionHint.atRank(request.requestedRank()) : null,
            request.expectedVersion());
    return ResponseEntity.ok(
        new TransitionResponse(BacklogItemResponse.from(result.item()), result.warning()));
  }

  @GetMapping("/api/items/{itemId}/status-history")
  public ResponseEntity<List<StatusChangeResponse>> getStatusHistory(@PathVariable UUID itemId) {
    return ResponseEntity.ok(
        workflowService.getStatusHistory(itemId).stream().map(StatusChangeResponse::from).toList());
  }

  // --- DTOs ---

  public record TransitionRequest(
      @NotNull(message = "targetStatus is required") ItemStatus targetStatus,
      Long requestedRank,
      Integer expectedVersion) {}

  public record TransitionResponse(BacklogItemResponse item, String warning) {}

  public record StatusChangeResponse(
      ItemStatus fromStatus, ItemStatus toStatus, UUID actorId, Instant changedAt) {

    public static StatusChangeResponse from(StatusChange change) {
      return new StatusChangeResponse(
          change.getFromStatus(), change.getToStatus(), change.getActorId(), change.getChangedAt());
    }
  }
}
