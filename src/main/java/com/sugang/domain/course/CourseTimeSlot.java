package com.sugang.domain.course;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Entity
@Table(name = "course_time_slots",
        uniqueConstraints = @UniqueConstraint(columnNames = {"course_id", "day_of_week", "start_time"}))
@Getter
@Builder(access = AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourseTimeSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;

    /** 1 = 월요일 ... 7 = 일요일 */
    @Column(name = "day_of_week", nullable = false)
    private Integer dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    private String location;

    /**
     * 같은 요일에 [start, end) 구간이 겹치면 true.
     * 한쪽의 종료 시각과 다른 쪽의 시작 시각이 같은 경우는 겹치지 않는다.
     */
    public boolean overlaps(CourseTimeSlot other) {
        return this.dayOfWeek.equals(other.dayOfWeek)
                && this.startTime.isBefore(other.endTime)
                && this.endTime.isAfter(other.startTime);
    }
}
