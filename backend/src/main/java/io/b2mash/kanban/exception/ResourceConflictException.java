package io.b2mash.kanban.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Stale write: the caller's view of the resource is behind the stored version. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  /** Builds the conflict raised when an {@code expectedVersion} does not match the stored one. */
  public static ResourceConflictException staleVersion(
      String resourceType, Object id, int expected, int actual) {
    var ex =
        new ResourceConflictException(
            "Concurrent modification",
            resourceType
                + " "
                + id
                + " is at version "
                + actual
                + " but the request was based on version "
                + expected
                + ". Refetch and retry.");
    ex.getBody().setProperty("expectedVersion", expected);
    ex.getBody().setProperty("currentVersion", actual);
    return ex;
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
