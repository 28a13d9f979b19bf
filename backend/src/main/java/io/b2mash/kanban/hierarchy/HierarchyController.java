package io.b2mash.kanban.hierarchy;

import io.b2mash.kanban.backlog.BacklogItemController.BacklogItemResponse;
import java.util.List;
import java.util.UUID;
import java.util.stream.StreamSupport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HierarchyController {

  private final HierarchyService hierarchyService;

  public HierarchyController(HierarchyService hierarchyService) {
    this.hierarchyService = hierarchyService;
  }

  /** A null {@code parentId} makes the item a root. */
  @PutMapping("/api/items/{itemId}/parent")
  public ResponseEntity<BacklogItemResponse> reparent(
      @PathVariable UUID itemId, @RequestBody ReparentRequest request) {
    var item = hierarchyService.reparent(itemId, request.parentId(), request.expectedVersion());
    return ResponseEntity.ok(BacklogItemResponse.from(item));
  }

  @GetMapping("/api/items/{itemId}/children")
  public ResponseEntity<List<BacklogItemResponse>> getChildren(@PathVariable UUID itemId) {
    return ResponseEntity.ok(
        hierarchyService.getChildren(itemId).stream().map(BacklogItemResponse::from).toList());
  }

  @GetMapping("/api/items/{itemId}/descendants")
  public ResponseEntity<List<BacklogItemResponse>> getDescendants(@PathVariable UUID itemId) {
    var descendants = hierarchyService.getDescendants(itemId);
    return ResponseEntity.ok(
        StreamSupport.stream(descendants.spliterator(), false)
            .map(BacklogItemResponse::from)
            .toList());
  }

  // --- DTOs ---

  public record ReparentRequest(UUID parentId, Integer expectedVersion) {}
}
