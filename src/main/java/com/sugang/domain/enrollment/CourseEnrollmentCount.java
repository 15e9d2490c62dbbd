package com.sugang.domain.enrollment;

public interface CourseEnrollmentCount {

    Long getCourseId();

    Long getEnrolledCount();
}
