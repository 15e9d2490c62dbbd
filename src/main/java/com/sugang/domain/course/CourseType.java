package com.sugang.domain.course;

public enum CourseType {
    REQUIRED,
    ELECTIVE
}
