package com.example.commandservice.handler;

import com.example.commandservice.entity.Assignment;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.exception.VersionConflictException;
import com.example.commandservice.repository.AssignmentRepository;
import com.example.commandservice.service.OwnerTimezoneResolver;
import com.example.commandservice.service.OwnershipVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Assignments. Physical delete, optimistic locking via {@code version}.
 */
@Component
public class AssignmentHandler extends AbstractOwnedEntityHandler<Assignment> {

    private final AssignmentRepository assignmentRepository;
    private final OwnerTimezoneResolver timezoneResolver;
    private final OwnershipVerifier ownershipVerifier;

    public AssignmentHandler(ObjectMapper objectMapper,
                             AssignmentRepository assignmentRepository,
                             OwnerTimezoneResolver timezoneResolver,
                             OwnershipVerifier ownershipVerifier) {
        super(objectMapper);
        this.assignmentRepository = assignmentRepository;
        this.timezoneResolver = timezoneResolver;
        this.ownershipVerifier = ownershipVerifier;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ASSIGNMENT;
    }

    @Override
    protected JpaRepository<Assignment, UUID> repository() {
        return assignmentRepository;
    }

    @Override
    protected Optional<Assignment> findOwned(UUID ownerId, UUID id) {
        return assignmentRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    protected Assignment newEntity(UUID ownerId, Payload payload) {
        UUID courseId = payload.requiredUuid("course_id");
        String title = payload.requiredText("title");
        ZoneId zone = timezoneResolver.resolve(ownerId);
        ownershipVerifier.requireCourse(ownerId, courseId);

        Integer priority = payload.integerInRange("priority", Assignment.MIN_PRIORITY, Assignment.MAX_PRIORITY);
        Integer percentage = payload.integerInRange("completion_percentage", 0, Assignment.COMPLETE);

        Assignment assignment = Assignment.builder()
                .ownerId(ownerId)
                .courseId(courseId)
                .title(title)
                .description(payload.text("description"))
                .assignmentType(payload.text("assignment_type", "homework"))
                .dueDate(payload.requiredInstant("due_date", zone))
                .estimatedHours(payload.decimal("estimated_hours"))
                .priority(priority != null ? priority : 2)
                .completionPercentage(percentage != null ? percentage : 0)
                .notes(payload.text("notes"))
                .build();
        assignment.markCompleted(payload.bool("is_completed", false));
        return assignment;
    }

    @Override
    protected void applyUpdate(UUID ownerId, Assignment assignment, Payload payload) {
        if (payload.has("expected_version")) {
            Integer expected = payload.integer("expected_version");
            if (!Objects.equals(expected, assignment.getVersion())) {
                throw VersionConflictException.staleVersion(assignment.getId(), expected, assignment.getVersion());
            }
        }
        if (payload.has("course_id")) {
            UUID courseId = payload.nonNull("course_id", payload.uuid("course_id"));
            ownershipVerifier.requireCourse(ownerId, courseId);
            assignment.setCourseId(courseId);
        }
        if (payload.has("title")) {
            assignment.setTitle(payload.nonNullText("title"));
        }
        if (payload.has("description")) {
            assignment.setDescription(payload.text("description"));
        }
        if (payload.has("assignment_type")) {
            assignment.setAssignmentType(payload.nonNullText("assignment_type"));
        }
        if (payload.has("due_date")) {
            ZoneId zone = timezoneResolver.resolve(ownerId);
            assignment.setDueDate(payload.nonNull("due_date", payload.instant("due_date", zone)));
        }
        if (payload.has("estimated_hours")) {
            assignment.setEstimatedHours(payload.decimal("estimated_hours"));
        }
        if (payload.has("priority")) {
            assignment.setPriority(payload.nonNull("priority",
                    payload.integerInRange("priority", Assignment.MIN_PRIORITY, Assignment.MAX_PRIORITY)));
        }
        if (payload.has("notes")) {
            assignment.setNotes(payload.text("notes"));
        }
        if (payload.has("completion_percentage")) {
            assignment.setCompletionPercentage(payload.nonNull("completion_percentage",
                    payload.integerInRange("completion_percentage", 0, Assignment.COMPLETE)));
        }
        // applied after the percentage so completing always wins
        if (payload.has("is_completed")) {
            assignment.markCompleted(payload.nonNull("is_completed", payload.bool("is_completed")));
        }
    }

    @Override
    protected List<Assignment> list(UUID ownerId, Payload filter) {
        ZoneId zone = timezoneResolver.resolve(ownerId);
        return assignmentRepository.search(
                ownerId,
                filter.uuid("course_id"),
                filter.bool("is_completed"),
                filter.instant("from", zone),
                filter.instant("to", zone));
    }
}
