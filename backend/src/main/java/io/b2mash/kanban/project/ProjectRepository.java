package io.b2mash.kanban.project;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  /**
   * Locks the project row until the current transaction ends. Serializes hierarchy mutations
   * (reparent, create under a parent, delete) within one project.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Project p WHERE p.id = :id")
  Optional<Project> findOneForUpdate(@Param("id") UUID id);

  /** Reads the committed policy, bypassing any copy already held in the persistence context. */
  @Query("SELECT p.wipPolicy FROM Project p WHERE p.id = :id")
  Optional<WipPolicy> findWipPolicy(@Param("id") UUID id);
}
