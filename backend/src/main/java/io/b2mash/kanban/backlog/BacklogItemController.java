package io.b2mash.kanban.backlog;

import io.b2mash.kanban.hierarchy.DeletionPolicy;
import io.b2mash.kanban.workflow.ItemStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BacklogItemController {

  private static final int MAX_PAGE_SIZE = 200;

  private final BacklogItemService backlogItemService;

  public BacklogItemController(BacklogItemService backlogItemService) {
    this.backlogItemService = backlogItemService;
  }

  @PostMapping("/api/projects/{projectId}/items")
  public ResponseEntity<BacklogItemResponse> createItem(
      @PathVariable UUID projectId, @Valid @RequestBody CreateItemRequest request) {
    var item =
        backlogItemService.create(
            projectId,
            request.parentId(),
            new ItemDetails(
                request.title(),
                request.description(),
                request.type(),
                request.reviewerId(),
                request.assigneeId(),
                request.estimateValue(),
                request.storyPoint(),
                request.deadline(),
                request.acceptanceCriteria()));
    return ResponseEntity.created(URI.create("/api/items/" + item.getId()))
        .body(BacklogItemResponse.from(item));
  }

  @GetMapping("/api/projects/{projectId}/items")
  public ResponseEntity<ItemPageResponse> listItems(
      @PathVariable UUID projectId,
      @RequestParam(required = false) ItemStatus status,
      @RequestParam(required = false) UUID assigneeId,
      @RequestParam(required = false) String type,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    var result = backlogItemService.listByProject(projectId, status, assigneeId, type, pageable);
    return ResponseEntity.ok(
        new ItemPageResponse(
            result.getContent().stream().map(BacklogItemResponse::from).toList(),
            result.getNumber(),
            result.getSize(),
            result.getTotalElements(),
            result.getTotalPages()));
  }

  @GetMapping("/api/items/{itemId}")
  public ResponseEntity<BacklogItemResponse> getItem(@PathVariable UUID itemId) {
    return ResponseEntity.ok(BacklogItemResponse.from(backlogItemService.get(itemId)));
  }

  @PatchMapping("/api/items/{itemId}")
  public ResponseEntity<BacklogItemResponse> updateItem(
      @PathVariable UUID itemId, @Valid @RequestBody UpdateItemRequest request) {
    var item =
        backlogItemService.update(
            itemId,
            new ItemDetails(
                request.title(),
                request.description(),
                request.type(),
                request.reviewerId(),
                request.assigneeId(),
                request.estimateValue(),
                request.storyPoint(),
                request.deadline(),
                request.acceptanceCriteria()),
            request.clear(),
            request.expectedVersion());
    return ResponseEntity.ok(BacklogItemResponse.from(item));
  }

  @PutMapping("/api/items/{itemId}/pause")
  public ResponseEntity<BacklogItemResponse> setPaused(
      @PathVariable UUID itemId, @Valid @RequestBody PauseRequest request) {
    var item = backlogItemService.setPaused(itemId, request.paused(), request.expectedVersion());
    return ResponseEntity.ok(BacklogItemResponse.from(item));
  }

  @DeleteMapping("/api/items/{itemId}")
  public ResponseEntity<Void> deleteItem(
      @PathVariable UUID itemId,
      @RequestParam(required = false) DeletionPolicy policy,
      @RequestParam(required = false) Integer expectedVersion) {
    backlogItemService.delete(itemId, policy, expectedVersion);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateItemRequest(
      @NotBlank(message = "title is required")
          @Size(max = 500, message = "title must be at most 500 characters")
          String title,
      String description,
      @Size(max = 50, message = "type must be at most 50 characters") String type,
      UUID parentId,
      UUID reviewerId,
      UUID assigneeId,
      @PositiveOrZero(message = "estimateValue must not be negative") BigDecimal estimateValue,
      @PositiveOrZero(message = "storyPoint must not be negative") Integer storyPoint,
      Instant deadline,
      String acceptanceCriteria) {}

  public record UpdateItemRequest(
      @Size(min = 1, max = 500, message = "title must be between 1 and 500 characters")
          String title,
      String description,
      @Size(max = 50, message = "type must be at most 50 characters") String type,
      UUID reviewerId,
      UUID assigneeId,
      @PositiveOrZero(message = "estimateValue must not be negative") BigDecimal estimateValue,
      @PositiveOrZero(message = "storyPoint must not be negative") Integer storyPoint,
      Instant deadline,
      String acceptanceCriteria,
      Set<ItemField> clear,
      Integer expectedVersion) {}

  public record PauseRequest(
      @NotNull(message = "paused is required") Boolean paused, Integer expectedVersion) {}

  public record ItemPageResponse(
      List<BacklogItemResponse> content,
      int page,
      int size,
      long totalElements,
      int totalPages) {}

  public record BacklogItemResponse(
      UUID id,
      UUID projectId,
      UUID parentId,
      String title,
      String description,
      String acceptanceCriteria,
      String type,
      ItemStatus status,
      long rank,
      UUID reviewerId,
      UUID assigneeId,
      BigDecimal estimateValue,
      Integer storyPoint,
      boolean paused,
      Instant deadline,
      Instant startedAt,
      Instant completedAt,
      int version,
      Instant createdAt,
      Instant updatedAt) {

    public static BacklogItemResponse from(BacklogItem item) {
      return new BacklogItemResponse(
          item.getId(),
          item.getProjectId(),
          item.getParentId(),
          item.getTitle(),
          item.getDescription(),
          item.getAcceptanceCriteria(),
          item.getType(),
          item.getStatus(),
          item.getRank(),
          item.getReviewerId(),
          item.getAssigneeId(),
          item.getEstimateValue(),
          item.getStoryPoint(),
          item.isPaused(),
          item.getDeadline(),
          item.getStartedAt(),
          item.getCompletedAt(),
          item.getVersion(),
          item.getCreatedAt(),
          item.getUpdatedAt());
    }
  }
}
