package com.sugang.service.enrollment;

public record WithdrawalResult(
        String courseName,
        long remainingEnrollments
) {
}
