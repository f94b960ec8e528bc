package com.example.commandservice.repository;

import com.example.commandservice.entity.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EventRepository extends JpaRepository<Event, UUID> {

    /**
     * Owner-scoped lookup. Inactive (logically deleted) events are returned too.
     */
    Optional<Event> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Query("SELECT e FROM Event e WHERE e.ownerId = :ownerId " +
           "AND (:includeInactive = true OR e.isActive = true) " +
           "AND (:courseId IS NULL OR e.courseId = :courseId) " +
           "AND (:fromDate IS NULL OR e.specificDate >= :fromDate) " +
           "AND (:toDate IS NULL OR e.specificDate <= :toDate) " +
           "ORDER BY e.specificDate ASC, e.startTime ASC")
    List<Event> search(@Param("ownerId") UUID ownerId,
                       @Param("courseId") UUID courseId,
                       @Param("fromDate") LocalDate fromDate,
                       @Param("toDate") LocalDate toDate,
                       @Param("includeInactive") boolean includeInactive);
}
