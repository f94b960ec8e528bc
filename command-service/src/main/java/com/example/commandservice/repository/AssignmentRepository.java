package com.example.commandservice.repository;

import com.example.commandservice.entity.Assignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AssignmentRepository extends JpaRepository<Assignment, UUID> {

    Optional<Assignment> findByIdAndOwnerId(UUID id, UUID ownerId);

    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    long countByOwnerId(UUID ownerId);

    @Query("SELECT a FROM Assignment a WHERE a.ownerId = :ownerId " +
           "AND (:courseId IS NULL OR a.courseId = :courseId) " +
           "AND (:isCompleted IS NULL OR a.isCompleted = :isCompleted) " +
           "AND (:dueFrom IS NULL OR a.dueDate >= :dueFrom) " +
           "AND (:dueTo IS NULL OR a.dueDate <= :dueTo) " +
           "ORDER BY a.dueDate ASC")
    List<Assignment> search(@Param("ownerId") UUID ownerId,
                            @Param("courseId") UUID courseId,
                            @Param("isCompleted") Boolean isCompleted,
                            @Param("dueFrom") Instant dueFrom,
                            @Param("dueTo") Instant dueTo);
}
