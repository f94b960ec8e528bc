package com.example.commandservice.handler;

import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.entity.StudySession;
import com.example.commandservice.entity.StudySessionStatus;
import com.example.commandservice.exception.InvalidPayloadException;
import com.example.commandservice.repository.StudySessionRepository;
import com.example.commandservice.service.OwnerTimezoneResolver;
import com.example.commandservice.service.OwnershipVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class StudySessionHandler extends AbstractOwnedEntityHandler<StudySession> {

    private final StudySessionRepository studySessionRepository;
    private final OwnerTimezoneResolver timezoneResolver;
    private final OwnershipVerifier ownershipVerifier;

    public StudySessionHandler(ObjectMapper objectMapper,
                               StudySessionRepository studySessionRepository,
                               OwnerTimezoneResolver timezoneResolver,
                               OwnershipVerifier ownershipVerifier) {
        super(objectMapper);
        this.studySessionRepository = studySessionRepository;
        this.timezoneResolver = timezoneResolver;
        this.ownershipVerifier = ownershipVerifier;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.STUDY_SESSION;
    }

    @Override
    protected JpaRepository<StudySession, UUID> repository() {
        return studySessionRepository;
    }

    @Override
    protected Optional<StudySession> findOwned(UUID ownerId, UUID id) {
        return studySessionRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    protected StudySession newEntity(UUID ownerId, Payload payload) {
        String title = payload.requiredText("title");
        ZoneId zone = timezoneResolver.resolve(ownerId);
        Instant start = payload.requiredInstant("scheduled_start", zone);
        Instant end = payload.requiredInstant("scheduled_end", zone);
        requireOrdered(start, end);

        UUID courseId = payload.uuid("course_id");
        UUID assignmentId = payload.uuid("assignment_id");
        UUID examId = payload.uuid("exam_id");
        ownershipVerifier.requireCourse(ownerId, courseId);
        ownershipVerifier.requireAssignment(ownerId, assignmentId);
        ownershipVerifier.requireExam(ownerId, examId);

        StudySessionStatus status = parseStatus(payload);
        return StudySession.builder()
                .ownerId(ownerId)
                .title(title)
                .scheduledStart(start)
                .scheduledEnd(end)
                .courseId(courseId)
                .assignmentId(assignmentId)
                .examId(examId)
                .status(status != null ? status : StudySessionStatus.SCHEDULED)
                .focusScore(payload.integerInRange("focus_score", 1, 10))
                .notes(payload.text("notes"))
                .build();
    }

    @Override
    protected void applyUpdate(UUID ownerId, StudySession session, Payload payload) {
        if (payload.has("title")) {
            session.setTitle(payload.nonNullText("title"));
        }
        if (payload.has("scheduled_start") || payload.has("scheduled_end")) {
            ZoneId zone = timezoneResolver.resolve(ownerId);
            Instant start = payload.has("scheduled_start")
                    ? payload.nonNull("scheduled_start", payload.instant("scheduled_start", zone))
                    : session.getScheduledStart();
            Instant end = payload.has("scheduled_end")
                    ? payload.nonNull("scheduled_end", payload.instant("scheduled_end", zone))
                    : session.getScheduledEnd();
            requireOrdered(start, end);
            session.setScheduledStart(start);
            session.setScheduledEnd(end);
        }
        if (payload.has("course_id")) {
            UUID courseId = payload.uuid("course_id");
            ownershipVerifier.requireCourse(ownerId, courseId);
            session.setCourseId(courseId);
        }
        if (payload.has("assignment_id")) {
            UUID assignmentId = payload.uuid("assignment_id");
            ownershipVerifier.requireAssignment(ownerId, assignmentId);
            session.setAssignmentId(assignmentId);
        }
        if (payload.has("exam_id")) {
            UUID examId = payload.uuid("exam_id");
            ownershipVerifier.requireExam(ownerId, examId);
            session.setExamId(examId);
        }
        if (payload.has("status")) {
            session.setStatus(payload.nonNull("status", parseStatus(payload)));
        }
        if (payload.has("focus_score")) {
            session.setFocusScore(payload.integerInRange("focus_score", 1, 10));
        }
        if (payload.has("notes")) {
            session.setNotes(payload.text("notes"));
        }
    }

    @Override
    protected List<StudySession> list(UUID ownerId, Payload filter) {
        ZoneId zone = timezoneResolver.resolve(ownerId);
        return studySessionRepository.search(
                ownerId,
                filter.uuid("course_id"),
                parseStatus(filter),
                filter.instant("from", zone),
                filter.instant("to", zone));
    }

    private static StudySessionStatus parseStatus(Payload payload) {
        String value = payload.text("status");
        if (value == null || value.isBlank()) {
            return null;
        }
        return StudySessionStatus.fromWire(value)
                .orElseThrow(() -> InvalidPayloadException.invalidValue("status", value));
    }

    private static void requireOrdered(Instant start, Instant end) {
        if (end.isBefore(start)) {
            throw new InvalidPayloadException("scheduled_end must not be before scheduled_start");
        }
    }
}
