package com.sugang.api.course;

import com.sugang.api.course.dtos.CourseDtos;
import com.sugang.domain.course.CourseType;
import com.sugang.service.course.CourseService;
import com.sugang.service.enrollment.EnrollmentService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
public class CourseController {

    private final CourseService courseService;
    private final EnrollmentService enrollmentService;

    @GetMapping
    public List<CourseDtos.Response> findAll(
            @RequestParam(required = false) String semester,
            @RequestParam(required = false) CourseType type,
            @RequestParam(required = false) String search) {
        return courseService.findAll(blankToNull(semester), type, blankToNull(search)).stream()
                .map(CourseDtos.Response::from)
                .toList();
    }

    @GetMapping("/{id}")
    public CourseDtos.Response findById(@PathVariable Long id) {
        return CourseDtos.Response.from(courseService.findById(id));
    }

    @GetMapping("/{id}/conflict")
    public CourseDtos.ConflictResponse checkConflict(@PathVariable Long id, @RequestParam Long studentId) {
        boolean conflict = enrollmentService.hasConflict(studentId, id);
        return new CourseDtos.ConflictResponse(id, studentId, conflict);
    }

    private String blankToNull(String value) {
        return (value != null && !value.isBlank()) ? value.trim() : null;
    }
}
