package io.b2mash.kanban.rank;

import io.b2mash.kanban.backlog.BacklogItemController.BacklogItemResponse;
import io.b2mash.kanban.workflow.ItemStatus;
import io.b2mash.kanban.workflow.WorkflowController.TransitionResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReorderController {

  private final ReorderService reorderService;

  public ReorderController(ReorderService reorderService) {
    this.reorderService = reorderService;
  }

  @PostMapping("/api/items/{itemId}/reorder")
  public ResponseEntity<TransitionResponse> reorder(
      @PathVariable UUID itemId, @Valid @RequestBody ReorderRequest request) {
    var result =
        reorderService.reorder(
            itemId, request.targetColumn(), request.afterItemId(), request.expectedVersion());
    return ResponseEntity.ok(
        new TransitionResponse(BacklogItemResponse.from(result.item()), result.warning()));
  }

  // --- DTOs ---

  public record ReorderRequest(
      @NotNull(message = "targetColumn is required") ItemStatus targetColumn,
      UUID afterItemId,
      Integer expectedVersion) {}
}
