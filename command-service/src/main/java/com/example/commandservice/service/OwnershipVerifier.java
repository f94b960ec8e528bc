package com.example.commandservice.service;

import com.example.commandservice.exception.ResourceNotFoundException;
import com.example.commandservice.repository.AssignmentRepository;
import com.example.commandservice.repository.CourseRepository;
import com.example.commandservice.repository.ExamRepository;
import com.example.commandservice.repository.SemesterRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Checks that ids referenced from a payload point at records of the same owner.
 * A foreign or missing reference is reported as NOT_FOUND.
 */
@Service
@RequiredArgsConstructor
public class OwnershipVerifier {

    private final CourseRepository courseRepository;
    private final SemesterRepository semesterRepository;
    private final AssignmentRepository assignmentRepository;
    private final ExamRepository examRepository;

    public void requireCourse(UUID ownerId, UUID courseId) {
        if (courseId != null && !courseRepository.existsByIdAndOwnerId(courseId, ownerId)) {
            throw ResourceNotFoundException.referenceNotFound("course", courseId);
        }
    }

    public void requireSemester(UUID ownerId, UUID semesterId) {
        if (semesterId != null && !semesterRepository.existsByIdAndOwnerId(semesterId, ownerId)) {
            throw ResourceNotFoundException.referenceNotFound("semester", semesterId);
        }
    }

    public void requireAssignment(UUID ownerId, UUID assignmentId) {
        if (assignmentId != null && !assignmentRepository.existsByIdAndOwnerId(assignmentId, ownerId)) {
            throw ResourceNotFoundException.referenceNotFound("assignment", assignmentId);
        }
    }

    public void requireExam(UUID ownerId, UUID examId) {
        if (examId != null && !examRepository.existsByIdAndOwnerId(examId, ownerId)) {
            throw ResourceNotFoundException.referenceNotFound("exam", examId);
        }
    }
}
