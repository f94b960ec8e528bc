package com.example.commandservice.repository;

import com.example.commandservice.entity.Semester;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SemesterRepository extends JpaRepository<Semester, UUID> {

    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    Optional<Semester> findFirstByOwnerIdAndIsActiveTrueOrderByStartDateDesc(UUID ownerId);

    List<Semester> findAllByOwnerId(UUID ownerId);
}
