package com.example.commandservice.handler;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalTime;

@Value
public class DerivedSchedule {
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    /** 0 = Sunday .. 6 = Saturday. */
    int weekday;
}
