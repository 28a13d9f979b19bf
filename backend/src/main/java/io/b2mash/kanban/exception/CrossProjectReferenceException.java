package io.b2mash.kanban.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class CrossProjectReferenceException extends ErrorResponseException {

  public CrossProjectReferenceException(UUID itemProjectId, UUID parentId, UUID parentProjectId) {
    super(HttpStatus.BAD_REQUEST, createProblem(itemProjectId, parentId, parentProjectId), null);
  }

  private static ProblemDetail createProblem(
      UUID itemProjectId, UUID parentId, UUID parentProjectId) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Cross-project parent");
    problem.setDetail(
        "Parent "
            + parentId
            + " belongs to project "
            + parentProjectId
            + ", not "
            + itemProjectId);
    return problem;
  }
}
