package io.b2mash.kanban.audit;

import io.b2mash.kanban.project.ProjectService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private static final int MAX_PAGE_SIZE = 200;

  private final AuditService auditService;
  private final ProjectService projectService;

  public AuditEventController(AuditService auditService, ProjectService projectService) {
    this.auditService = auditService;
    this.projectService = projectService;
  }

  @GetMapping("/api/projects/{projectId}/audit-events")
  public ResponseEntity<AuditTrailResponse> getTrail(
      @PathVariable UUID projectId,
      @RequestParam(required = false) AuditedEntity entity,
      @RequestParam(required = false) UUID entityId,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    projectService.getProject(projectId);
    var pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    var trail = auditService.findTrail(projectId, entity, entityId, pageable);
    return ResponseEntity.ok(
        new AuditTrailResponse(
            trail.getContent().stream().map(AuditEventResponse::from).toList(),
            trail.getNumber(),
            trail.getSize(),
            trail.getTotalElements()));
  }

  // --- DTOs ---

  public record AuditTrailResponse(
      List<AuditEventResponse> content, int page, int size, long totalElements) {}

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID actorId,
      Map<String, Object> details,
      Instant occurredAt) {

    static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorId(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
