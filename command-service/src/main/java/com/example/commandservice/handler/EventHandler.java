package com.example.commandservice.handler;

import com.example.commandservice.entity.EntityKind;
import com.example.commandservice.entity.Event;
import com.example.commandservice.repository.EventRepository;
import com.example.commandservice.service.OwnerTimezoneResolver;
import com.example.commandservice.service.OwnershipVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Calendar events ("schedule blocks"). Logical delete.
 *
 * <p>Accepts {@code start_iso}/{@code start} and {@code end_iso}/{@code end};
 * {@code notes} is accepted as an alias of {@code description}.
 */
@Component
public class EventHandler extends AbstractOwnedEntityHandler<Event> {

    private static final String[] START_FIELDS = {"start_iso", "start"};
    private static final String[] END_FIELDS = {"end_iso", "end"};
    private static final String DEFAULT_SOURCE = "manual";

    private final EventRepository eventRepository;
    private final OwnerTimezoneResolver timezoneResolver;
    private final OwnershipVerifier ownershipVerifier;

    public EventHandler(ObjectMapper objectMapper,
                        EventRepository eventRepository,
                        OwnerTimezoneResolver timezoneResolver,
                        OwnershipVerifier ownershipVerifier) {
        super(objectMapper);
        this.eventRepository = eventRepository;
        this.timezoneResolver = timezoneResolver;
        this.ownershipVerifier = ownershipVerifier;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.EVENT;
    }

    @Override
    protected JpaRepository<Event, UUID> repository() {
        return eventRepository;
    }

    @Override
    protected Optional<Event> findOwned(UUID ownerId, UUID id) {
        return eventRepository.findByIdAndOwnerId(id, ownerId);
    }

    @Override
    protected Event newEntity(UUID ownerId, Payload payload) {
        String title = payload.requiredText("title");
        ZoneId zone = timezoneResolver.resolve(ownerId);
        Instant start = payload.requiredInstant(fieldOrDefault(payload, START_FIELDS), zone);
        Instant end = payload.requiredInstant(fieldOrDefault(payload, END_FIELDS), zone);
        DerivedSchedule schedule = ScheduleTimeDeriver.derive(start, end, zone);

        UUID courseId = payload.uuid("course_id");
        ownershipVerifier.requireCourse(ownerId, courseId);

        return Event.builder()
                .ownerId(ownerId)
                .title(title)
                .description(payload.has("description") ? payload.text("description") : payload.text("notes"))
                .location(payload.text("location"))
                .courseId(courseId)
                .specificDate(schedule.getDate())
                .startTime(schedule.getStartTime())
                .endTime(schedule.getEndTime())
                .dayOfWeek(schedule.getWeekday())
                .isRecurring(payload.bool("is_recurring", false))
                .isActive(true)
                .source(payload.text("source", DEFAULT_SOURCE))
                .build();
    }

    @Override
    protected void applyUpdate(UUID ownerId, Event event, Payload payload) {
        if (payload.has("title")) {
            event.setTitle(payload.nonNullText("title"));
        }
        String descriptionField = payload.firstPresent("description", "notes");
        if (descriptionField != null) {
            event.setDescription(payload.text(descriptionField));
        }
        if (payload.has("location")) {
            event.setLocation(payload.text("location"));
        }
        if (payload.has("course_id")) {
            UUID courseId = payload.uuid("course_id");
            ownershipVerifier.requireCourse(ownerId, courseId);
            event.setCourseId(courseId);
        }
        if (payload.has("is_recurring")) {
            event.setIsRecurring(payload.nonNull("is_recurring", payload.bool("is_recurring")));
        }
        if (payload.has("is_active")) {
            event.setIsActive(payload.nonNull("is_active", payload.bool("is_active")));
        }
        applyTimeChange(ownerId, event, payload);
    }

    /**
     * Recompute date, start time and weekday when a start is given, end time when an end is given.
     * A start-only move keeps the stored end time unchecked, as an event may cross midnight.
     * An end-only change is checked against the stored start.
     */
    private void applyTimeChange(UUID ownerId, Event event, Payload payload) {
        String startField = payload.firstPresent(START_FIELDS);
        String endField = payload.firstPresent(END_FIELDS);
        if (startField == null && endField == null) {
            return;
        }
        ZoneId zone = timezoneResolver.resolve(ownerId);
        if (endField == null) {
            Instant start = payload.nonNull(startField, payload.instant(startField, zone));
            applyStart(event, ScheduleTimeDeriver.deriveStart(start, zone));
            return;
        }

        Instant start = startField != null
                ? payload.nonNull(startField, payload.instant(startField, zone))
                : event.getSpecificDate().atTime(event.getStartTime()).atZone(zone).toInstant();
        Instant end = payload.nonNull(endField, payload.instant(endField, zone));
        DerivedSchedule schedule = ScheduleTimeDeriver.derive(start, end, zone);
        if (startField != null) {
            applyStart(event, schedule);
        }
        event.setEndTime(schedule.getEndTime());
    }

    private static void applyStart(Event event, DerivedSchedule schedule) {
        event.setSpecificDate(schedule.getDate());
        event.setStartTime(schedule.getStartTime());
        event.setDayOfWeek(schedule.getWeekday());
    }

    @Override
    protected List<Event> list(UUID ownerId, Payload filter) {
        LocalDate date = filter.date("date");
        LocalDate from = date != null ? date : filter.date("from");
        LocalDate to = date != null ? date : filter.date("to");
        return eventRepository.search(
                ownerId,
                filter.uuid("course_id"),
                from,
                to,
                filter.bool("include_inactive", false));
    }

    private static String fieldOrDefault(Payload payload, String[] fields) {
        String present = payload.firstPresent(fields);
        return present != null ? present : fields[0];
    }
}
