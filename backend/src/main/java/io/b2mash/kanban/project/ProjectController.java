package io.b2mash.kanban.project;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @PostMapping("/api/projects")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    var project = projectService.createProject(request.name(), request.wipPolicy());
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @GetMapping("/api/projects/{projectId}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID projectId) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(projectId)));
  }

  @PutMapping("/api/projects/{projectId}")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID projectId, @Valid @RequestBody UpdateProjectRequest request) {
    var project =
        projectService.updateProject(
            projectId, request.name(), request.wipPolicy(), request.expectedVersion());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  // --- DTOs ---

  public record CreateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      WipPolicy wipPolicy) {}

  public record UpdateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      WipPolicy wipPolicy,
      Integer expectedVersion) {}

  public record ProjectResponse(
      UUID id,
      String name,
      WipPolicy wipPolicy,
      int version,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getWipPolicy(),
          project.getVersion(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
