package com.sugang.service.course;

import com.sugang.domain.course.Course;

public record CourseSummary(
        Course course,
        long enrolledCount
) {
}
