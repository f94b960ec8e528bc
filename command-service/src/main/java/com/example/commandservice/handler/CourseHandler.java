package com.example.commandservice.handler;

import com.example.commandservice.entity.Course;
import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.repository.CourseRepository;
import com.example.commandservice.service.OwnershipVerifier;
import com.example.commandservice.service.SemesterService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Courses. Logical delete. A create without {@code semester_id} attaches the course to the
 * owner's active semester, creating one first when the owner has none.
 */
@Component
public class CourseHandler extends AbstractOwnedEntityHandler<Course> {

    private final CourseRepository courseRepository;
    private final SemesterService semesterService;
    private final OwnershipVerifier ownershipVerifier;

    public CourseHandler(ObjectMapper objectMapper,
                         CourseRepository courseRepository,
                         SemesterService semesterService,
                         OwnershipVerifier ownershipVerifier) {
        super(objectMapper);
        this.courseRepository = courseRepository;
        this.semesterService = semesterService;
        this.ownershipVerifier = ownershipVerifier;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.COURSE;
    }

    @Override
    protected JpaRepository<Course, UUID> repository() {
        return courseRepository;
    }

    @Override
    protected Optional<Course> findOwned(UUID ownerId, UUID id) {
        return courseRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    protected Course newEntity(UUID ownerId, Payload payload) {
        String name = payload.requiredText("name");
        UUID semesterId = payload.uuid("semester_id");
        if (semesterId != null) {
            ownershipVerifier.requireSemester(ownerId, semesterId);
        } else {
            semesterId = semesterService.resolveActiveSemester(ownerId).getId();
        }

        Integer credits = payload.integer("credits");
        return Course.builder()
                .ownerId(ownerId)
                .semesterId(semesterId)
                .name(name)
                .code(payload.text("code"))
                .credits(credits != null ? credits : 3)
                .instructor(payload.text("instructor"))
                .color(payload.text("color", "blue"))
                .targetGrade(payload.text("target_grade"))
                .isActive(true)
                .build();
    }

    @Override
    protected void applyUpdate(UUID ownerId, Course course, Payload payload) {
        if (payload.has("name")) {
            course.setName(payload.nonNullText("name"));
        }
        if (payload.has("semester_id")) {
            UUID semesterId = payload.nonNull("semester_id", payload.uuid("semester_id"));
            ownershipVerifier.requireSemester(ownerId, semesterId);
            course.setSemesterId(semesterId);
        }
        if (payload.has("code")) {
            course.setCode(payload.text("code"));
        }
        if (payload.has("credits")) {
            course.setCredits(payload.nonNull("credits", payload.integer("credits")));
        }
        if (payload.has("instructor")) {
            course.setInstructor(payload.text("instructor"));
        }
        if (payload.has("color")) {
            course.setColor(payload.text("color"));
        }
        if (payload.has("target_grade")) {
            course.setTargetGrade(payload.text("target_grade"));
        }
        if (payload.has("is_active")) {
            course.setIsActive(payload.nonNull("is_active", payload.bool("is_active")));
        }
    }

    @Override
    protected List<Course> list(UUID ownerId, Payload filter) {
        return courseRepository.search(
                ownerId,
                filter.uuid("semester_id"),
                filter.bool("include_inactive", false));
    }
}
