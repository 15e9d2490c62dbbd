package com.sugang.api.enrollment;

import com.sugang.api.enrollment.dtos.EnrollmentDtos;
import com.sugang.domain.enrollment.Enrollment;
import com.sugang.service.enrollment.EnrollmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    @GetMapping
    public List<EnrollmentDtos.Response> findByStudentId(@RequestParam Long studentId) {
        return enrollmentService.findByStudentId(studentId).stream()
                .map(EnrollmentDtos.Response::from)
                .toList();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EnrollmentDtos.Response enroll(@Valid @RequestBody EnrollmentDtos.Request request) {
        Enrollment enrollment = enrollmentService.enroll(request.studentId(), request.courseId());
        return EnrollmentDtos.Response.from(enrollment);
    }

    @DeleteMapping("/{id}")
    public EnrollmentDtos.WithdrawResponse withdraw(@PathVariable Long id, @RequestParam Long studentId) {
        return EnrollmentDtos.WithdrawResponse.from(enrollmentService.withdraw(studentId, id));
    }
}
