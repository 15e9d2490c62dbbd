package com.sugang.api.enrollment.dtos;

import com.sugang.api.course.dtos.CourseDtos;
import com.sugang.domain.enrollment.Enrollment;
import com.sugang.service.enrollment.WithdrawalResult;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDateTime;
import java.util.List;

public class EnrollmentDtos {

    public record Request(
            @NotNull Long studentId,
            @NotNull Long courseId
    ) {
    }

    public record Response(
            Long id,
            Long studentId,
            Long courseId,
            String courseName,
            String courseCode,
            Integer credits,
            List<CourseDtos.TimeSlot> timeSlots,
            LocalDateTime enrolledAt
    ) {
        public static Response from(Enrollment enrollment) {
            return new Response(
                    enrollment.getId(),
                    enrollment.getStudent().getId(),
                    enrollment.getCourse().getId(),
                    enrollment.getCourse().getName(),
                    enrollment.getCourse().getCode(),
                    enrollment.getCourse().getCredits(),
                    CourseDtos.TimeSlot.listOf(enrollment.getCourse()),
                    enrollment.getEnrolledAt()
            );
        }
    }

    public record WithdrawResponse(
            String message,
            String courseName,
            long remainingEnrollments
    ) {
        public static WithdrawResponse from(WithdrawalResult result) {
            return new WithdrawResponse(
                    "수강이 취소되었습니다: " + result.courseName(),
                    result.courseName(),
                    result.remainingEnrollments()
            );
        }
    }
}
