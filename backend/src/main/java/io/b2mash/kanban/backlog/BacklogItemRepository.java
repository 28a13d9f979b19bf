package io.b2mash.kanban.backlog;

import io.b2mash.kanban.workflow.ItemStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BacklogItemRepository extends JpaRepository<BacklogItem, UUID> {

  /** Filtered listing, ordered by board column (Backlog first) and then by rank. */
  @Query(
      value =
          """
          SELECT i FROM BacklogItem i WHERE i.projectId = :projectId
            AND (:status IS NULL OR i.status = :status)
            AND (:assigneeId IS NULL OR i.assigneeId = :assigneeId)
            AND (CAST(:type AS string) IS NULL OR i.type = :type)
          ORDER BY
            CASE i.status
              WHEN io.b2mash.kanban.workflow.ItemStatus.BACKLOG THEN 0
              WHEN io.b2mash.kanban.workflow.ItemStatus.TODO THEN 1
              WHEN io.b2mash.kanban.workflow.ItemStatus.DOING THEN 2
              ELSE 3
            END,
            i.rankValue ASC
          """,
      countQuery =
          """
          SELECT COUNT(i) FROM BacklogItem i WHERE i.projectId = :projectId
            AND (:status IS NULL OR i.status = :status)
            AND (:assigneeId IS NULL OR i.assigneeId = :assigneeId)
            AND (CAST(:type AS string) IS NULL OR i.type = :type)
          """)
  Page<BacklogItem> findByFilter(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("assigneeId") UUID assigneeId,
      @Param("type") String type,
      Pageable pageable);

  /** Every item of the project in one statement; the board is assembled from this snapshot. */
  List<BacklogItem> findByProjectId(UUID projectId);

  /** Items of one column in display order, optionally leaving out one item. */
  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = :status
        AND (:excludeId IS NULL OR i.id <> :excludeId)
      ORDER BY i.rankValue ASC
      """)
  List<BacklogItem> findColumn(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("excludeId") UUID excludeId);

  /** First item of a column; page the result to one row. */
  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = :status
        AND (:excludeId IS NULL OR i.id <> :excludeId)
      ORDER BY i.rankValue ASC
      """)
  List<BacklogItem> findHead(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("excludeId") UUID excludeId,
      Pageable pageable);

  /** Last item of a column; page the result to one row. */
  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = :status
        AND (:excludeId IS NULL OR i.id <> :excludeId)
      ORDER BY i.rankValue DESC
      """)
  List<BacklogItem> findTail(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("excludeId") UUID excludeId,
      Pageable pageable);

  /** Successor of a rank within a column; page the result to one row. */
  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = :status
        AND i.rankValue > :rank
        AND (:excludeId IS NULL OR i.id <> :excludeId)
      ORDER BY i.rankValue ASC
      """)
  List<BacklogItem> findSuccessors(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("rank") long rank,
      @Param("excludeId") UUID excludeId,
      Pageable pageable);

  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = :status AND i.rankValue = :rank
        AND (:excludeId IS NULL OR i.id <> :excludeId)
      """)
  Optional<BacklogItem> findOccupant(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("rank") long rank,
      @Param("excludeId") UUID excludeId);

  /** Items that count towards a column's load: everything in it that is not paused. */
  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = :status AND i.paused = false
        AND (:excludeId IS NULL OR i.id <> :excludeId)
      """)
  List<BacklogItem> findActiveInColumn(
      @Param("projectId") UUID projectId,
      @Param("status") ItemStatus status,
      @Param("excludeId") UUID excludeId);

  @Query("SELECT i FROM BacklogItem i WHERE i.parentId = :parentId ORDER BY i.createdAt, i.id")
  List<BacklogItem> findChildren(@Param("parentId") UUID parentId);

  long countByParentId(UUID parentId);

  /** One step of an ancestor walk. Empty when the item is a root or does not exist. */
  @Query("SELECT i.parentId FROM BacklogItem i WHERE i.id = :id")
  Optional<UUID> findParentIdById(@Param("id") UUID id);

  @Query(
      """
      SELECT i FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = io.b2mash.kanban.workflow.ItemStatus.DONE
        AND i.completedAt IS NOT NULL
      """)
  List<BacklogItem> findCompleted(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT COUNT(i) FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.paused = false
        AND i.status IN (io.b2mash.kanban.workflow.ItemStatus.TODO,
                         io.b2mash.kanban.workflow.ItemStatus.DOING)
      """)
  long countWorkInProgress(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT COUNT(i) FROM BacklogItem i
      WHERE i.projectId = :projectId AND i.status = io.b2mash.kanban.workflow.ItemStatus.DONE
        AND i.completedAt >= :since
      """)
  long countCompletedSince(@Param("projectId") UUID projectId, @Param("since") Instant since);
}
