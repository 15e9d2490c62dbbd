package com.sugang.domain.course;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CourseRepository extends JpaRepository<Course, Long> {

    @Query("SELECT DISTINCT c FROM Course c LEFT JOIN FETCH c.timeSlots LEFT JOIN FETCH c.professor")
    List<Course> findAllWithDetails();

    @Query("SELECT DISTINCT c FROM Course c LEFT JOIN FETCH c.timeSlots LEFT JOIN FETCH c.professor " +
            "WHERE (:semester IS NULL OR c.semester = :semester) AND (:type IS NULL OR c.type = :type) " +
            "AND (:search IS NULL OR LOWER(c.name) LIKE LOWER(CONCAT('%', :search, '%')))")
    List<Course> findByFilter(@Param("semester") String semester,
                              @Param("type") CourseType type,
                              @Param("search") String search);

    @Query("SELECT c FROM Course c LEFT JOIN FETCH c.timeSlots LEFT JOIN FETCH c.professor WHERE c.id = :id")
    Optional<Course> findByIdWithTimeSlots(@Param("id") Long id);

    // FOR UPDATE 는 outer join 과 함께 쓰지 않는다. time slot 은 같은 트랜잭션에서 지연 로딩.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Course c WHERE c.id = :id")
    Optional<Course> findByIdWithLock(@Param("id") Long id);

    @Query("SELECT DISTINCT c FROM Course c LEFT JOIN FETCH c.timeSlots " +
            "WHERE c.id IN (SELECT e.course.id FROM Enrollment e WHERE e.student.id = :studentId)")
    List<Course> findEnrolledCoursesWithTimeSlots(@Param("studentId") Long studentId);
}
