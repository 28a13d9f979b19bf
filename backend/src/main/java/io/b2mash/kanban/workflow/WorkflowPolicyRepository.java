package io.b2mash.kanban.workflow;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkflowPolicyRepository extends JpaRepository<WorkflowPolicy, UUID> {

  Optional<WorkflowPolicy> findByProjectIdAndFromStatusAndToStatus(
      UUID projectId, ItemStatus fromStatus, ItemStatus toStatus);

  List<WorkflowPolicy> findByProjectId(UUID projectId);
}
