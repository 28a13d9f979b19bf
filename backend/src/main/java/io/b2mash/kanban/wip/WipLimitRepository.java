package io.b2mash.kanban.wip;

import io.b2mash.kanban.workflow.ItemStatus;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WipLimitRepository extends JpaRepository<WipLimit, UUID> {

  Optional<WipLimit> findByProjectIdAndBoardColumn(UUID projectId, ItemStatus column);

  List<WipLimit> findByProjectId(UUID projectId);

  /**
   * {@code SELECT ... FOR UPDATE} on the column's row. Holding it is the per-(project, column)
   * critical section: admission checks, rank assignment and rebalancing for that column all run
   * under it until the transaction commits.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT w FROM WipLimit w WHERE w.projectId = :projectId AND w.boardColumn = :column")
  Optional<WipLimit> findForUpdate(
      @Param("projectId") UUID projectId, @Param("column") ItemStatus column);
}
