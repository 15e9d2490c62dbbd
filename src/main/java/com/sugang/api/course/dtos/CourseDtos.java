package com.sugang.api.course.dtos;

import com.sugang.domain.course.Course;
import com.sugang.domain.course.CourseTimeSlot;
import com.sugang.service.course.CourseSummary;

import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;

public class CourseDtos {

    public record TimeSlot(
            Integer dayOfWeek,
            LocalTime startTime,
            LocalTime endTime,
            String location
    ) {
        public static TimeSlot from(CourseTimeSlot slot) {
            return new TimeSlot(
                    slot.getDayOfWeek(),
                    slot.getStartTime(),
                    slot.getEndTime(),
                    slot.getLocation()
            );
        }

        public static List<TimeSlot> listOf(Course course) {
            return course.getTimeSlots().stream()
                    .sorted(Comparator.comparing(CourseTimeSlot::getDayOfWeek)
                            .thenComparing(CourseTimeSlot::getStartTime))
                    .map(TimeSlot::from)
                    .toList();
        }
    }

    public record Response(
            Long id,
            String name,
            String code,
            String type,
            Integer capacity,
            Integer credits,
            String semester,
            String description,
            String professorName,
            long enrolledCount,
            long remainingCapacity,
            List<TimeSlot> timeSlots
    ) {
        public static Response from(CourseSummary summary) {
            return of(summary.course(), summary.enrolledCount());
        }

        public static Response of(Course course, long enrolledCount) {
            return new Response(
                    course.getId(),
                    course.getName(),
                    course.getCode(),
                    course.getType().name(),
                    course.getCapacity(),
                    course.getCredits(),
                    course.getSemester(),
                    course.getDescription(),
                    course.getProfessor() != null ? course.getProfessor().getName() : null,
                    enrolledCount,
                    course.remainingCapacity(enrolledCount),
                    TimeSlot.listOf(course)
            );
        }
    }

    public record ConflictResponse(
            Long courseId,
            Long studentId,
            boolean conflict
    ) {
    }
}
