package com.example.commandservice.handler;

import com.example.commandservice.exception.InvalidPayloadException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Derives the stored calendar fields of an event from its start and end instants.
 *
 * <p>Date, start time and weekday come from the start instant; end time from the end instant,
 * all in the owner's zone. An event crossing midnight keeps the start date and an end time
 * earlier than its start time.
 */
public final class ScheduleTimeDeriver {

    private ScheduleTimeDeriver() {
    }

    public static DerivedSchedule derive(Instant start, Instant end, ZoneId zone) {
        if (start == null || end == null || zone == null) {
            throw new IllegalArgumentException("start, end and zone are required");
        }
        if (end.isBefore(start)) {
            throw new InvalidPayloadException("Event end must not be before its start");
        }
        ZonedDateTime localStart = start.atZone(zone);
        ZonedDateTime localEnd = end.atZone(zone);
        return new DerivedSchedule(
                localStart.toLocalDate(),
                localStart.toLocalTime(),
                localEnd.toLocalTime(),
                localStart.getDayOfWeek().getValue() % 7);
    }

    /**
     * Date, start time and weekday of a moved start. The end time is left to the caller.
     */
    public static DerivedSchedule deriveStart(Instant start, ZoneId zone) {
        if (start == null || zone == null) {
            throw new IllegalArgumentException("start and zone are required");
        }
        ZonedDateTime localStart = start.atZone(zone);
        return new DerivedSchedule(
                localStart.toLocalDate(),
                localStart.toLocalTime(),
                null,
                localStart.getDayOfWeek().getValue() % 7);
    }
}
