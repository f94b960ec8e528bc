package com.example.commandservice.repository;

import com.example.commandservice.entity.Course;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CourseRepository extends JpaRepository<Course, UUID> {

    Optional<Course> findByIdAndOwnerId(UUID id, UUID ownerId);

    /**
     * Reference check. Deactivated courses still count as owned.
     */
    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    @Query("SELECT c FROM Course c WHERE c.ownerId = :ownerId " +
           "AND (:includeInactive = true OR c.isActive = true) " +
           "AND (:semesterId IS NULL OR c.semesterId = :semesterId) " +
           "ORDER BY c.name ASC")
    List<Course> search(@Param("ownerId") UUID ownerId,
                        @Param("semesterId") UUID semesterId,
                        @Param("includeInactive") boolean includeInactive);
}
