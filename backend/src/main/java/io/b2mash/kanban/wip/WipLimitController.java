package io.b2mash.kanban.wip;

import io.b2mash.kanban.workflow.ItemStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
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
public class WipLimitController {

  private final WipAdmissionService wipAdmissionService;

  public WipLimitController(WipAdmissionService wipAdmissionService) {
    this.wipAdmissionService = wipAdmissionService;
  }

  @GetMapping("/api/projects/{projectId}/wip-limits")
  public ResponseEntity<List<WipLimitResponse>> getWipLimits(@PathVariable UUID projectId) {
    return ResponseEntity.ok(
        wipAdmissionService.getWipLimits(projectId).stream().map(WipLimitResponse::from).toList());
  }

  @GetMapping("/api/projects/{projectId}/wip-limits/{column}")
  public ResponseEntity<WipLimitResponse> getWipLimit(
      @PathVariable UUID projectId, @PathVariable ItemStatus column) {
    return ResponseEntity.ok(
        WipLimitResponse.from(wipAdmissionService.getWipLimit(projectId, column)));
  }

  @PutMapping("/api/projects/{projectId}/wip-limits/{column}")
  public ResponseEntity<WipLimitResponse> setWipLimit(
      @PathVariable UUID projectId,
      @PathVariable ItemStatus column,
      @Valid @RequestBody SetWipLimitRequest request) {
    var wipLimit =
        wipAdmissionService.setWipLimit(projectId, column, request.limit(), request.limitType());
    return ResponseEntity.ok(WipLimitResponse.from(wipLimit));
  }

  @GetMapping("/api/projects/{projectId}/wip-usage")
  public ResponseEntity<List<ColumnUsage>> getColumnUsage(@PathVariable UUID projectId) {
    return ResponseEntity.ok(wipAdmissionService.getColumnUsage(projectId));
  }

  @PostMapping("/api/projects/{projectId}/wip-limits/{column}/admission-check")
  public ResponseEntity<AdmissionResponse> checkAdmission(
      @PathVariable UUID projectId,
      @PathVariable ItemStatus column,
      @Valid @RequestBody AdmissionCheckRequest request) {
    return ResponseEntity.ok(
        AdmissionResponse.from(
            wipAdmissionService.checkAdmission(projectId, column, request.weight())));
  }

  @GetMapping("/api/items/{itemId}/admission-preview")
  public ResponseEntity<AdmissionResponse> previewAdmission(
      @PathVariable UUID itemId, @RequestParam ItemStatus target) {
    return ResponseEntity.ok(
        AdmissionResponse.from(wipAdmissionService.previewAdmission(itemId, target)));
  }

  // --- DTOs ---

  public record SetWipLimitRequest(
      @Positive(message = "limit must be a positive integer") Integer limit,
      WipLimitType limitType) {}

  public record AdmissionCheckRequest(
      @NotNull(message = "weight is required")
          @PositiveOrZero(message = "weight must be zero or positive")
          BigDecimal weight) {}

  public record WipLimitResponse(
      UUID id,
      UUID projectId,
      ItemStatus column,
      Integer limit,
      WipLimitType limitType,
      Instant updatedAt) {

    public static WipLimitResponse from(WipLimit wipLimit) {
      return new WipLimitResponse(
          wipLimit.getId(),
          wipLimit.getProjectId(),
          wipLimit.getColumn(),
          wipLimit.getLimit(),
          wipLimit.getLimitType(),
          wipLimit.getUpdatedAt());
    }
  }

  public record AdmissionResponse(
      ItemStatus column,
      boolean admitted,
      boolean overLimit,
      BigDecimal currentLoad,
      BigDecimal incomingWeight,
      Integer limit,
      WipLimitType limitType,
      String warning) {

    public static AdmissionResponse from(AdmissionResult result) {
      return new AdmissionResponse(
          result.column(),
          result.admitted(),
          result.overLimit(),
          result.currentLoad(),
          result.incomingWeight(),
          result.limit(),
          result.limitType(),
          result.warning());
    }
  }
}
