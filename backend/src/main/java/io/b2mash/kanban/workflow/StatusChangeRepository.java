package io.b2mash.kanban.workflow;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StatusChangeRepository extends JpaRepository<StatusChange, UUID> {

  List<StatusChange> findByItemIdOrderByChangedAtAscIdAsc(UUID itemId);

  @Modifying
  @Query("DELETE FROM StatusChange s WHERE s.itemId = :itemId")
  void deleteByItemId(@Param("itemId") UUID itemId);
}
