package com.example.commandservice.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Owner profile row. Only the timezone is read here; id equals the owner id.
 */
@Entity
@Table(name = "profiles")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OwnerProfile {

    @Id
    @Column(name = "id", nullable = false)
    private UUID id;

    @Column(name = "timezone", nullable = false, length = 64)
    private String timezone = "UTC";
}
