package io.b2mash.kanban.exception;

import io.b2mash.kanban.workflow.PolicyCheck;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The item does not meet the entry criteria the project set for the requested edge. */
public class WorkflowPolicyViolationException extends ErrorResponseException {

  private final PolicyCheck policyCheck;

  public WorkflowPolicyViolationException(UUID itemId, PolicyCheck check) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(itemId, check), null);
    this.policyCheck = check;
  }

  public PolicyCheck getPolicyCheck() {
    return policyCheck;
  }

  private static ProblemDetail createProblem(UUID itemId, PolicyCheck check) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Workflow policy not satisfied");
    problem.setDetail(
        check.violations().size()
            + " criterion(s) unmet for moving backlog item "
            + itemId
            + " from "
            + check.fromStatus()
            + " to "
            + check.toStatus());
    problem.setProperty("fromStatus", check.fromStatus().name());
    problem.setProperty("toStatus", check.toStatus().name());
    problem.setProperty("violations", check.violations());
    return problem;
  }
}
