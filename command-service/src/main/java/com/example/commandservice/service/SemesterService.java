package com.example.commandservice.service;

import com.example.commandservice.entity.Semester;
import com.example.commandservice.repository.SemesterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Default semester for course creation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemesterService {

    static final String DEFAULT_SEMESTER_NAME = "Current Semester";

    private final SemesterRepository semesterRepository;
    private final OwnerTimezoneResolver timezoneResolver;
    private final Clock clock;

    @Value("${planner.semester.default-length-days:120}")
    private int defaultLengthDays = 120;

    /**
     * The owner's active semester, created on first use ("Current Semester", today plus
     * the configured length, today taken in the owner's zone). Joins the caller's transaction
     * so a failed course create also discards the semester.
     */
    @Transactional
    public Semester resolveActiveSemester(UUID ownerId) {
        return semesterRepository.findFirstByOwnerIdAndIsActiveTrueOrderByStartDateDesc(ownerId)
                .orElseGet(() -> createDefaultSemester(ownerId));
    }

    private Semester createDefaultSemester(UUID ownerId) {
        LocalDate today = LocalDate.now(clock.withZone(timezoneResolver.resolve(ownerId)));
        Semester semester = Semester.builder()
                .ownerId(ownerId)
                .name(DEFAULT_SEMESTER_NAME)
                .startDate(today)
                .endDate(today.plusDays(defaultLengthDays))
                .isActive(true)
                .build();
        Semester saved = semesterRepository.saveAndFlush(semester);
        log.info("Default semester created: ownerId={}, semesterId={}, {}..{}",
                ownerId, saved.getId(), saved.getStartDate(), saved.getEndDate());
        return saved;
    }
}
