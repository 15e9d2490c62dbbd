package com.sugang.service.course;

import com.sugang.api.exception.BusinessException;
import com.sugang.api.exception.ErrorCode;
import com.sugang.domain.course.Course;
import com.sugang.domain.course.CourseRepository;
import com.sugang.domain.course.CourseType;
import com.sugang.domain.enrollment.CourseEnrollmentCount;
import com.sugang.domain.enrollment.EnrollmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CourseService {

    private final CourseRepository courseRepository;
    private final EnrollmentRepository enrollmentRepository;

    /**
     * 강좌 목록과 강좌별 수강 인원을 한 트랜잭션에서 조회한다. 모든 필터는 선택 사항.
     *
     * @param search 강좌명 부분 일치 (대소문자 무시)
     */
    public List<CourseSummary> findAll(String semester, CourseType type, String search) {
        List<Course> courses = (semester == null && type == null && search == null)
                ? courseRepository.findAllWithDetails()
                : courseRepository.findByFilter(semester, type, search);

        // 신청자가 없는 강좌는 집계 결과에 없다
        Map<Long, Long> enrolledCounts = enrollmentRepository.countGroupByCourse().stream()
                .collect(Collectors.toMap(CourseEnrollmentCount::getCourseId, CourseEnrollmentCount::getEnrolledCount));

        return courses.stream()
                .map(c -> new CourseSummary(c, enrolledCounts.getOrDefault(c.getId(), 0L)))
                .toList();
    }

    public CourseSummary findById(Long courseId) {
        Course course = courseRepository.findByIdWithTimeSlots(courseId)
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));
        return new CourseSummary(course, enrollmentRepository.countByCourseId(courseId));
    }
}
