package com.sugang.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sugang.api.enrollment.dtos.EnrollmentDtos;
import com.sugang.domain.course.Course;
import com.sugang.domain.course.CourseRepository;
import com.sugang.domain.course.CourseType;
import com.sugang.domain.professor.Professor;
import com.sugang.domain.professor.ProfessorRepository;
import com.sugang.domain.student.Student;
import com.sugang.domain.student.StudentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.time.LocalTime;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class EnrollmentApiTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StudentRepository studentRepository;

    @Autowired
    private CourseRepository courseRepository;

    @Autowired
    private ProfessorRepository professorRepository;

    private Professor professor;
    private Student student;
    private Course course;

    @BeforeEach
    void setUp() {
        professor = professorRepository.save(Professor.builder().name("테스트교수").build());

        student = saveStudent("TEST0001");
        course = saveCourse("자료구조", "CS201", CourseType.REQUIRED, 30, 1, 9);
    }

    @Test
    @DisplayName("GET /health - 헬스체크")
    void healthCheck() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    @DisplayName("POST /api/enrollments - 수강신청 성공 201")
    void enrollSuccess() throws Exception {
        enroll(student.getId(), course.getId())
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.studentId").value(student.getId()))
                .andExpect(jsonPath("$.courseId").value(course.getId()))
                .andExpect(jsonPath("$.courseName").value("자료구조"))
                .andExpect(jsonPath("$.courseCode").value("CS201"))
                .andExpect(jsonPath("$.timeSlots[0].dayOfWeek").value(1))
                .andExpect(jsonPath("$.timeSlots[0].startTime").value("09:00:00"))
                .andExpect(jsonPath("$.enrolledAt").isNotEmpty());
    }

    @Test
    @DisplayName("POST /api/enrollments - 정원 마감 시 409 COURSE_FULL")
    void enrollCourseFull() throws Exception {
        Course fullCourse = saveCourse("인기강좌", "CS999", CourseType.ELECTIVE, 1, 2, 9);
        Student other = saveStudent("TEST0002");
        enroll(other.getId(), fullCourse.getId()).andExpect(status().isCreated());

        enroll(student.getId(), fullCourse.getId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("COURSE_FULL"))
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    @DisplayName("POST /api/enrollments - 중복 신청 시 409 ALREADY_ENROLLED")
    void enrollDuplicate() throws Exception {
        enroll(student.getId(), course.getId()).andExpect(status().isCreated());

        enroll(student.getId(), course.getId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_ENROLLED"));
    }

    @Test
    @DisplayName("POST /api/enrollments - 시간 충돌 시 409 TIME_CONFLICT")
    void enrollTimeConflict() throws Exception {
        Course overlapping = saveCourse("알고리즘", "CS202", CourseType.REQUIRED, 30, 1, 9);
        enroll(student.getId(), course.getId()).andExpect(status().isCreated());

        enroll(student.getId(), overlapping.getId())
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("TIME_CONFLICT"));
    }

    @Test
    @DisplayName("POST /api/enrollments - 존재하지 않는 강좌 404")
    void enrollCourseNotFound() throws Exception {
        enroll(student.getId(), 999999L)
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("COURSE_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /api/enrollments - courseId 누락 시 400 INVALID_REQUEST")
    void enrollInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/enrollments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"studentId\": " + student.getId() + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("DELETE /api/enrollments/{id} - 수강취소 성공 200")
    void withdrawSuccess() throws Exception {
        Long enrollmentId = enrollAndGetId(student.getId(), course.getId());
        enrollAndGetId(student.getId(), saveCourse("운영체제", "CS301", CourseType.REQUIRED, 30, 2, 9).getId());
        enrollAndGetId(student.getId(), saveCourse("인공지능", "CS401", CourseType.ELECTIVE, 30, 3, 9).getId());

        mockMvc.perform(delete("/api/enrollments/" + enrollmentId)
                        .param("studentId", student.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.courseName").value("자료구조"))
                .andExpect(jsonPath("$.remainingEnrollments").value(2));
    }

    @Test
    @DisplayName("DELETE /api/enrollments/{id} - 최소 과목 수 미만이 되면 400 MIN_COURSE_LIMIT_REACHED")
    void withdrawMinLimit() throws Exception {
        Long enrollmentId = enrollAndGetId(student.getId(), course.getId());
        enrollAndGetId(student.getId(), saveCourse("운영체제", "CS301", CourseType.REQUIRED, 30, 2, 9).getId());

        mockMvc.perform(delete("/api/enrollments/" + enrollmentId)
                        .param("studentId", student.getId().toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MIN_COURSE_LIMIT_REACHED"));
    }

    @Test
    @DisplayName("DELETE /api/enrollments/{id} - 다른 학생의 수강신청은 404 ENROLLMENT_NOT_FOUND")
    void withdrawOthersEnrollment() throws Exception {
        Long enrollmentId = enrollAndGetId(student.getId(), course.getId());
        Student intruder = saveStudent("TEST0002");

        mockMvc.perform(delete("/api/enrollments/" + enrollmentId)
                        .param("studentId", intruder.getId().toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ENROLLMENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("DELETE /api/enrollments/{id} - studentId 누락 시 400 INVALID_REQUEST")
    void withdrawWithoutStudentId() throws Exception {
        Long enrollmentId = enrollAndGetId(student.getId(), course.getId());

        mockMvc.perform(delete("/api/enrollments/" + enrollmentId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    @DisplayName("PUT /api/enrollments/{id} - 수강신청 수정은 지원하지 않아 405")
    void updateNotSupported() throws Exception {
        mockMvc.perform(put("/api/enrollments/1"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.error").value("METHOD_NOT_ALLOWED"))
                .andExpect(jsonPath("$.message").value("지원하지 않는 HTTP 메서드입니다."));
    }

    @Test
    @DisplayName("존재하지 않는 경로는 404 NOT_FOUND")
    void unknownPath() throws Exception {
        mockMvc.perform(get("/api/unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("요청한 경로를 찾을 수 없습니다."));
    }

    @Test
    @DisplayName("GET /api/enrollments?studentId={id} - 시간표 조회")
    void getEnrollments() throws Exception {
        enroll(student.getId(), course.getId()).andExpect(status().isCreated());

        mockMvc.perform(get("/api/enrollments")
                        .param("studentId", student.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].courseName").value("자료구조"))
                .andExpect(jsonPath("$[0].timeSlots[0].endTime").value("10:00:00"));
    }

    @Test
    @DisplayName("GET /api/courses - 수강 인원과 남은 정원 포함, 유형 필터")
    void getCourses() throws Exception {
        saveCourse("인공지능", "CS401", CourseType.ELECTIVE, 40, 3, 9);
        enroll(student.getId(), course.getId()).andExpect(status().isCreated());

        mockMvc.perform(get("/api/courses").param("type", "REQUIRED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].code").value("CS201"))
                .andExpect(jsonPath("$[0].professorName").value("테스트교수"))
                .andExpect(jsonPath("$[0].enrolledCount").value(1))
                .andExpect(jsonPath("$[0].remainingCapacity").value(29));

        mockMvc.perform(get("/api/courses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    @DisplayName("GET /api/courses?search= - 강좌명 부분 일치, 대소문자 무시")
    void searchCourses() throws Exception {
        saveCourse("Data Mining", "CS402", CourseType.ELECTIVE, 40, 3, 9);
        saveCourse("운영체제", "CS301", CourseType.REQUIRED, 30, 2, 9);

        mockMvc.perform(get("/api/courses").param("search", "mining"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].code").value("CS402"));

        mockMvc.perform(get("/api/courses").param("search", "자료").param("type", "REQUIRED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].code").value("CS201"));

        mockMvc.perform(get("/api/courses").param("search", " "))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    @DisplayName("GET /api/courses/{id} - 강좌 상세, 현재 수강 인원 포함")
    void getCourse() throws Exception {
        enroll(student.getId(), course.getId()).andExpect(status().isCreated());

        mockMvc.perform(get("/api/courses/" + course.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(course.getId()))
                .andExpect(jsonPath("$.name").value("자료구조"))
                .andExpect(jsonPath("$.professorName").value("테스트교수"))
                .andExpect(jsonPath("$.enrolledCount").value(1))
                .andExpect(jsonPath("$.remainingCapacity").value(29))
                .andExpect(jsonPath("$.timeSlots[0].dayOfWeek").value(1));
    }

    @Test
    @DisplayName("GET /api/courses/{id} - 존재하지 않는 강좌 404 COURSE_NOT_FOUND")
    void getCourseNotFound() throws Exception {
        mockMvc.perform(get("/api/courses/999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("COURSE_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /api/courses/{id}/conflict - 시간 충돌 여부 조회")
    void checkConflict() throws Exception {
        Course overlapping = saveCourse("알고리즘", "CS202", CourseType.REQUIRED, 30, 1, 9);
        enroll(student.getId(), course.getId()).andExpect(status().isCreated());

        mockMvc.perform(get("/api/courses/" + overlapping.getId() + "/conflict")
                        .param("studentId", student.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conflict").value(true));
    }

    private ResultActions enroll(Long studentId, Long courseId) throws Exception {
        EnrollmentDtos.Request request = new EnrollmentDtos.Request(studentId, courseId);
        return mockMvc.perform(post("/api/enrollments")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)));
    }

    private Long enrollAndGetId(Long studentId, Long courseId) throws Exception {
        String response = enroll(studentId, courseId)
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("id").asLong();
    }

    private Student saveStudent(String studentNumber) {
        return studentRepository.save(
                Student.builder()
                        .name("테스트학생")
                        .studentNumber(studentNumber)
                        .grade(1)
                        .build());
    }

    private Course saveCourse(String name, String code, CourseType type, int capacity, int day, int startHour) {
        Course saved = Course.builder()
                .name(name)
                .code(code)
                .type(type)
                .capacity(capacity)
                .credits(3)
                .semester("2026-1")
                .professor(professor)
                .build();
        saved.addTimeSlot(day, LocalTime.of(startHour, 0), LocalTime.of(startHour + 1, 0), "공학관 101호");
        return courseRepository.save(saved);
    }
}
