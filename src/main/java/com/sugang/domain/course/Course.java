package com.sugang.domain.course;

import com.sugang.domain.professor.Professor;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "courses",
        indexes = {
            @Index(name = "idx_course_semester", columnList = "semester")
        })
@Getter
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private CourseType type;

    @Column(nullable = false)
    private Integer capacity;

    @Column(nullable = false)
    private Integer credits;

    @Column(length = 2000)
    private String description;

    private String semester;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "professor_id")
    private Professor professor;

    @Builder.Default
    @OneToMany(mappedBy = "course", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<CourseTimeSlot> timeSlots = new ArrayList<>();

    public CourseTimeSlot addTimeSlot(int dayOfWeek, LocalTime startTime, LocalTime endTime, String location) {
        if (dayOfWeek < 1 || dayOfWeek > 7) {
            throw new IllegalArgumentException("요일은 1(월)~7(일) 사이여야 합니다: " + dayOfWeek);
        }
        if (!endTime.isAfter(startTime)) {
            throw new IllegalArgumentException("종료 시각은 시작 시각보다 늦어야 합니다: " + startTime + "-" + endTime);
        }
        CourseTimeSlot slot = CourseTimeSlot.builder()
                .course(this)
                .dayOfWeek(dayOfWeek)
                .startTime(startTime)
                .endTime(endTime)
                .location(location)
                .build();
        this.timeSlots.add(slot);
        return slot;
    }

    public boolean isFull(long enrolledCount) {
        return enrolledCount >= this.capacity;
    }

    public long remainingCapacity(long enrolledCount) {
        return Math.max(this.capacity - enrolledCount, 0);
    }
}
