package com.example.commandservice.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Course entity. Always attached to a semester of the same owner.
 */
@Entity
@Table(name = "courses", indexes = {
    @Index(name = "idx_courses_owner_semester", columnList = "owner_id, semester_id")
})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Course implements OwnedEntity, SoftDeletable {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "semester_id", nullable = false)
    private UUID semesterId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "code", length = 50)
    private String code;

    @Builder.Default
    @Column(name = "credits", nullable = false)
    private Integer credits = 3;

    @Column(name = "instructor")
    private String instructor;

    @Builder.Default
    @Column(name = "color", length = 30)
    private String color = "blue";

    @Column(name = "target_grade", length = 10)
    private String targetGrade;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @Override
    public void deactivate() {
        this.isActive = false;
    }
}
