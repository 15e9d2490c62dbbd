package com.sugang.service.enrollment;

import com.sugang.domain.course.Course;
import com.sugang.domain.course.CourseRepository;
import com.sugang.domain.course.CourseTimeSlot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 학생이 이미 수강 중인 강좌들과 후보 강좌의 시간표가 겹치는지 검사한다.
 * 읽기 전용이며 호출자의 트랜잭션 안에서 동작한다.
 */
@Component
@RequiredArgsConstructor
public class ScheduleConflictChecker {

    private final CourseRepository courseRepository;

    public boolean hasConflict(Long studentId, Course candidate) {
        List<Course> enrolledCourses = courseRepository.findEnrolledCoursesWithTimeSlots(studentId);

        for (CourseTimeSlot newSlot : candidate.getTimeSlots()) {
            for (Course enrolled : enrolledCourses) {
                for (CourseTimeSlot enrolledSlot : enrolled.getTimeSlots()) {
                    if (newSlot.overlaps(enrolledSlot)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }
}
