package com.sugang.api.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    STUDENT_NOT_FOUND(HttpStatus.NOT_FOUND, "학생을 찾을 수 없습니다."),
    COURSE_NOT_FOUND(HttpStatus.NOT_FOUND, "강좌를 찾을 수 없습니다."),
    ENROLLMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "수강신청 내역을 찾을 수 없거나 취소할 권한이 없습니다."),
    ALREADY_ENROLLED(HttpStatus.CONFLICT, "이미 신청한 강좌입니다."),
    COURSE_FULL(HttpStatus.CONFLICT, "강좌 정원이 마감되었습니다."),
    TIME_CONFLICT(HttpStatus.CONFLICT, "이미 신청한 강좌와 시간이 겹칩니다."),
    MAX_COURSE_LIMIT_REACHED(HttpStatus.BAD_REQUEST, "최대 수강 가능 강좌 수(8과목)에 도달했습니다."),
    MIN_COURSE_LIMIT_REACHED(HttpStatus.BAD_REQUEST, "최소 2과목 이상 수강해야 하므로 취소할 수 없습니다."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "요청 값이 올바르지 않습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "요청한 경로를 찾을 수 없습니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "지원하지 않는 HTTP 메서드입니다."),
    UNSUPPORTED_MEDIA_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "지원하지 않는 Content-Type 입니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "요청을 처리하는 중 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String message;
}
