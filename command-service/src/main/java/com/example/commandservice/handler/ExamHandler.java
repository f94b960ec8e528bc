package com.example.commandservice.handler;

import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.entity.Exam;
import com.example.commandservice.repository.ExamRepository;
import com.example.commandservice.service.OwnerTimezoneResolver;
import com.example.commandservice.service.OwnershipVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class ExamHandler extends AbstractOwnedEntityHandler<Exam> {

    private final ExamRepository examRepository;
    private final OwnerTimezoneResolver timezoneResolver;
    private final OwnershipVerifier ownershipVerifier;

    public ExamHandler(ObjectMapper objectMapper,
                       ExamRepository examRepository,
                       OwnerTimezoneResolver timezoneResolver,
                       OwnershipVerifier ownershipVerifier) {
        super(objectMapper);
        this.examRepository = examRepository;
        this.timezoneResolver = timezoneResolver;
        this.ownershipVerifier = ownershipVerifier;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.EXAM;
    }

    @Override
    protected JpaRepository<Exam, UUID> repository() {
        return examRepository;
    }

    @Override
    protected Optional<Exam> findOwned(UUID ownerId, UUID id) {
        return examRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    protected Exam newEntity(UUID ownerId, Payload payload) {
        UUID courseId = payload.requiredUuid("course_id");
        String title = payload.requiredText("title");
        ZoneId zone = timezoneResolver.resolve(ownerId);
        ownershipVerifier.requireCourse(ownerId, courseId);

        Integer duration = payload.integer("duration_minutes");
        BigDecimal plannedHours = payload.decimal("study_hours_planned");
        return Exam.builder()
                .ownerId(ownerId)
                .courseId(courseId)
                .title(title)
                .examType(payload.text("exam_type", "midterm"))
                .examDate(payload.requiredInstant("exam_date", zone))
                .durationMinutes(duration != null ? duration : 60)
                .location(payload.text("location"))
                .notes(payload.text("notes"))
                .studyHoursPlanned(plannedHours != null ? plannedHours : BigDecimal.TEN)
                .build();
    }

    @Override
    protected void applyUpdate(UUID ownerId, Exam exam, Payload payload) {
        if (payload.has("course_id")) {
            UUID courseId = payload.nonNull("course_id", payload.uuid("course_id"));
            ownershipVerifier.requireCourse(ownerId, courseId);
            exam.setCourseId(courseId);
        }
        if (payload.has("title")) {
            exam.setTitle(payload.nonNullText("title"));
        }
        if (payload.has("exam_type")) {
            exam.setExamType(payload.nonNullText("exam_type"));
        }
        if (payload.has("exam_date")) {
            ZoneId zone = timezoneResolver.resolve(ownerId);
            exam.setExamDate(payload.nonNull("exam_date", payload.instant("exam_date", zone)));
        }
        if (payload.has("duration_minutes")) {
            exam.setDurationMinutes(payload.nonNull("duration_minutes", payload.integer("duration_minutes")));
        }
        if (payload.has("location")) {
            exam.setLocation(payload.text("location"));
        }
        if (payload.has("notes")) {
            exam.setNotes(payload.text("notes"));
        }
        if (payload.has("study_hours_planned")) {
            exam.setStudyHoursPlanned(payload.decimal("study_hours_planned"));
        }
        if (payload.has("study_hours_completed")) {
            exam.setStudyHoursCompleted(payload.decimal("study_hours_completed"));
        }
    }

    @Override
    protected List<Exam> list(UUID ownerId, Payload filter) {
        ZoneId zone = timezoneResolver.resolve(ownerId);
        return examRepository.search(
                ownerId,
                filter.uuid("course_id"),
                filter.instant("from", zone),
                filter.instant("to", zone));
    }
}
