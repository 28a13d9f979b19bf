package io.b2mash.kanban.workflow;

import io.b2mash.kanban.backlog.BacklogItem;
import io.b2mash.kanban.wip.AdmissionResult;

/** The moved item and the admission it passed; {@code admission} is null for a no-op. */
public record TransitionResult(BacklogItem item, AdmissionResult admission) {

  public String warning() {
    return admission != null ? admission.warning() : null;
  }
}
