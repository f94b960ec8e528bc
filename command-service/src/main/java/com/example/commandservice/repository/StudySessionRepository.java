package com.example.commandservice.repository;

import com.example.commandservice.entity.StudySession;
import com.example.commandservice.entity.StudySessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudySessionRepository extends JpaRepository<StudySession, UUID> {

    Optional<StudySession> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Query("SELECT s FROM StudySession s WHERE s.ownerId = :ownerId " +
           "AND (:courseId IS NULL OR s.courseId = :courseId) " +
           "AND (:status IS NULL OR s.status = :status) " +
           "AND (:startFrom IS NULL OR s.scheduledStart >= :startFrom) " +
           "AND (:startTo IS NULL OR s.scheduledStart <= :startTo) " +
           "ORDER BY s.scheduledStart ASC")
    List<StudySession> search(@Param("ownerId") UUID ownerId,
                              @Param("courseId") UUID courseId,
                              @Param("status") StudySessionStatus status,
                              @Param("startFrom") Instant startFrom,
                              @Param("startTo") Instant startTo);
}
