package io.b2mash.kanban.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A project, backlog item or WIP limit that does not exist. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;

  public ResourceNotFoundException(String resourceType, Object id) {
    super(HttpStatus.NOT_FOUND, problemFor(resourceType, id), null);
    this.resourceType = resourceType;
  }

  public String getResourceType() {
    return resourceType;
  }

  private static ProblemDetail problemFor(String resourceType, Object id) {
    var problem =
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, resourceType + " " + id + " does not exist");
    problem.setTitle(resourceType + " not found");
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("id", String.valueOf(id));
    return problem;
  }
}
