package com.example.commandservice.repository;

import com.example.commandservice.entity.Exam;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExamRepository extends JpaRepository<Exam, UUID> {

    Optional<Exam> findByIdAndOwnerId(UUID id, UUID ownerId);

    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    @Query("SELECT e FROM Exam e WHERE e.ownerId = :ownerId " +
           "AND (:courseId IS NULL OR e.courseId = :courseId) " +
           "AND (:dateFrom IS NULL OR e.examDate >= :dateFrom) " +
           "AND (:dateTo IS NULL OR e.examDate <= :dateTo) " +
           "ORDER BY e.examDate ASC")
    List<Exam> search(@Param("ownerId") UUID ownerId,
                      @Param("courseId") UUID courseId,
                      @Param("dateFrom") Instant dateFrom,
                      @Param("dateTo") Instant dateTo);
}
