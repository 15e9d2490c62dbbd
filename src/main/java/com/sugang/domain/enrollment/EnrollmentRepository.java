package com.sugang.domain.enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    @Query("SELECT e FROM Enrollment e JOIN FETCH e.course WHERE e.id = :id AND e.student.id = :studentId")
    Optional<Enrollment> findByIdAndStudentId(@Param("id") Long id, @Param("studentId") Long studentId);

    @Query("SELECT DISTINCT e FROM Enrollment e JOIN FETCH e.course c LEFT JOIN FETCH c.timeSlots " +
            "WHERE e.student.id = :studentId ORDER BY e.enrolledAt")
    List<Enrollment> findByStudentId(@Param("studentId") Long studentId);

    @Query("SELECT e.course.id AS courseId, COUNT(e) AS enrolledCount FROM Enrollment e GROUP BY e.course.id")
    List<CourseEnrollmentCount> countGroupByCourse();

    boolean existsByStudentIdAndCourseId(Long studentId, Long courseId);

    long countByCourseId(Long courseId);

    long countByStudentId(Long studentId);
}
