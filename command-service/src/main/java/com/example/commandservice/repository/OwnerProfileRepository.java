package com.example.commandservice.repository;

import com.example.commandservice.entity.OwnerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface OwnerProfileRepository extends JpaRepository<OwnerProfile, UUID> {
}
