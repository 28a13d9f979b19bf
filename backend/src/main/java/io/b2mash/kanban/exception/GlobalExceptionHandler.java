package io.b2mash.kanban.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(WipLimitExceededException.class)
  public ResponseEntity<ProblemDetail> handleWipLimitExceeded(WipLimitExceededException ex) {
    log.info(
        "Admission refused: column={}, load={}, incoming={}, limit={}",
        ex.getColumn(),
        ex.getCurrentLoad(),
        ex.getIncomingWeight(),
        ex.getLimit());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(ex.getBody());
  }

  /** Another writer committed a newer version of the same row first. */
  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleStaleWrite(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Stale write to {} {}", ex.getPersistentClassName(), ex.getIdentifier());
    return conflict("Stale write", "The resource changed since it was read; reload and retry");
  }

  /** Lock wait timeout or deadlock victim; nothing was written. */
  @ExceptionHandler(PessimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleLockFailure(PessimisticLockingFailureException ex) {
    log.warn("Board lock not acquired: {}", ex.getMostSpecificCause().getMessage());
    return conflict("Board busy", "A concurrent change held the lock; retry the operation");
  }

  private static ResponseEntity<ProblemDetail> conflict(String title, String detail) {
    var problem = ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, detail);
    problem.setTitle(title);
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
