package com.sugang.domain.enrollment;

import com.sugang.domain.course.Course;
import com.sugang.domain.student.Student;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "enrollments",
        uniqueConstraints = @UniqueConstraint(name = Enrollment.STUDENT_COURSE_UNIQUE, columnNames = {"student_id", "course_id"}),
        indexes = {
            @Index(name = "idx_enrollment_student_id", columnList = "student_id"),
            @Index(name = "idx_enrollment_course_id", columnList = "course_id")
        })
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Enrollment {

    public static final String STUDENT_COURSE_UNIQUE = "uk_enrollment_student_course";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id", nullable = false)
    private Student student;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    @Column(nullable = false, updatable = false)
    private LocalDateTime enrolledAt;
}
