package com.sugang.service.enrollment;

import com.sugang.api.exception.BusinessException;
import com.sugang.api.exception.ErrorCode;
import com.sugang.domain.course.Course;
import com.sugang.domain.course.CourseRepository;
import com.sugang.domain.enrollment.Enrollment;
import com.sugang.domain.enrollment.EnrollmentRepository;
import com.sugang.domain.student.Student;
import com.sugang.domain.student.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * 수강신청/취소 규칙을 검증하고 하나의 트랜잭션으로 반영한다.
 *
 * <p>동시성: 학생 행과 강좌 행에 비관적 락(PESSIMISTIC_WRITE)을 학생 → 강좌 순서로 잡은 뒤
 * 모든 검증을 수행한다. 같은 강좌의 정원 검사와 신청 저장, 같은 학생의 수강 과목 수 검사와
 * 저장/삭제는 락이 풀리기 전까지 다른 요청과 섞이지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    public static final int MAX_COURSE_LIMIT = 8;
    public static final int MIN_COURSE_LIMIT = 2;

    private final EnrollmentRepository enrollmentRepository;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final ScheduleConflictChecker conflictChecker;

    @Transactional(readOnly = true)
    public List<Enrollment> findByStudentId(Long studentId) {
        if (!studentRepository.existsById(studentId)) {
            throw new BusinessException(ErrorCode.STUDENT_NOT_FOUND);
        }
        return enrollmentRepository.findByStudentId(studentId);
    }

    @Transactional(readOnly = true)
    public boolean hasConflict(Long studentId, Long courseId) {
        Course course = courseRepository.findByIdWithTimeSlots(courseId)
                .orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));
        return conflictChecker.hasConflict(studentId, course);
    }

    @Transactional
    public Enrollment enroll(Long studentId, Long courseId) {
        // 0. Student 비관적 락 획득
        Student student = studentRepository.findByIdWithLock(studentId)
                .orElseThrow(() -> reject(ErrorCode.STUDENT_NOT_FOUND, studentId, courseId));

        // 1. Course 비관적 락 획득 (락 순서: Student → Course)
        Course course = courseRepository.findByIdWithLock(courseId)
                .orElseThrow(() -> reject(ErrorCode.COURSE_NOT_FOUND, studentId, courseId));

        // 2. 중복 신청 검증
        if (enrollmentRepository.existsByStudentIdAndCourseId(studentId, courseId)) {
            throw reject(ErrorCode.ALREADY_ENROLLED, studentId, courseId);
        }

        // 3. 정원 검증 (락을 잡은 뒤 집계하므로 마지막 한 자리는 한 요청만 통과)
        long enrolledCount = enrollmentRepository.countByCourseId(courseId);
        if (course.isFull(enrolledCount)) {
            throw reject(ErrorCode.COURSE_FULL, studentId, courseId);
        }

        // 4. 시간표 충돌 검증
        if (conflictChecker.hasConflict(studentId, course)) {
            throw reject(ErrorCode.TIME_CONFLICT, studentId, courseId);
        }

        // 5. 수강 과목 수 상한 검증
        if (enrollmentRepository.countByStudentId(studentId) >= MAX_COURSE_LIMIT) {
            throw reject(ErrorCode.MAX_COURSE_LIMIT_REACHED, studentId, courseId);
        }

        // 6. Enrollment 저장
        Enrollment enrollment = Enrollment.builder()
                .student(student)
                .course(course)
                .enrolledAt(LocalDateTime.now())
                .build();

        try {
            enrollment = enrollmentRepository.saveAndFlush(enrollment);
        } catch (DataIntegrityViolationException e) {
            // (student_id, course_id) 유니크 제약 위반만 중복 신청으로 본다. 그 외 무결성 오류는 그대로 전파.
            if (isStudentCourseUniqueViolation(e)) {
                throw reject(ErrorCode.ALREADY_ENROLLED, studentId, courseId);
            }
            throw e;
        }

        log.info("수강신청 완료 studentId={}, courseId={}, enrollmentId={}", studentId, courseId, enrollment.getId());
        return enrollment;
    }

    @Transactional
    public WithdrawalResult withdraw(Long studentId, Long enrollmentId) {
        // 1. Student 비관적 락 획득. 학생이 없어도 다른 학생의 기록 존재 여부가 드러나지 않도록 동일한 오류.
        studentRepository.findByIdWithLock(studentId)
                .orElseThrow(() -> rejectWithdraw(ErrorCode.ENROLLMENT_NOT_FOUND, studentId, enrollmentId));

        Enrollment enrollment = enrollmentRepository.findByIdAndStudentId(enrollmentId, studentId)
                .orElseThrow(() -> rejectWithdraw(ErrorCode.ENROLLMENT_NOT_FOUND, studentId, enrollmentId));

        // 2. 최소 수강 과목 수 검증
        long currentCount = enrollmentRepository.countByStudentId(studentId);
        if (currentCount <= MIN_COURSE_LIMIT) {
            throw rejectWithdraw(ErrorCode.MIN_COURSE_LIMIT_REACHED, studentId, enrollmentId);
        }

        // 3. Enrollment 삭제
        String courseName = enrollment.getCourse().getName();
        enrollmentRepository.delete(enrollment);

        log.info("수강취소 완료 studentId={}, enrollmentId={}, course={}", studentId, enrollmentId, courseName);
        return new WithdrawalResult(courseName, currentCount - 1);
    }

    private boolean isStudentCourseUniqueViolation(DataIntegrityViolationException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraintName = ((ConstraintViolationException) cause).getConstraintName();
                return constraintName != null
                        && constraintName.toLowerCase(Locale.ROOT).contains(Enrollment.STUDENT_COURSE_UNIQUE);
            }
        }
        return false;
    }

    private BusinessException reject(ErrorCode errorCode, Long studentId, Long courseId) {
        log.debug("수강신청 거절 {} studentId={}, courseId={}", errorCode, studentId, courseId);
        return new BusinessException(errorCode);
    }

    private BusinessException rejectWithdraw(ErrorCode errorCode, Long studentId, Long enrollmentId) {
        log.debug("수강취소 거절 {} studentId={}, enrollmentId={}", errorCode, studentId, enrollmentId);
        return new BusinessException(errorCode);
    }
}
