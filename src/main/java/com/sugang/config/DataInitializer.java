package com.sugang.config;

import com.sugang.domain.course.Course;
import com.sugang.domain.course.CourseRepository;
import com.sugang.domain.course.CourseType;
import com.sugang.domain.professor.Professor;
import com.sugang.domain.professor.ProfessorRepository;
import com.sugang.domain.student.Student;
import com.sugang.domain.student.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * local 프로필에서만 동작하는 데모 데이터 생성기.
 */
@Slf4j
@Component
@Profile("local")
@RequiredArgsConstructor
public class DataInitializer implements CommandLineRunner {

    private static final String SEMESTER = "2026-1";
    private static final int STUDENT_COUNT = 200;

    private static final String[] LAST_NAMES = {
            "김", "이", "박", "최", "정", "강", "조", "윤", "장", "임"
    };

    private static final String[] FIRST_NAMES = {
            "민준", "서연", "예준", "서윤", "도윤", "지우", "시우", "하은",
            "주원", "하윤", "지호", "소율", "지한", "다은", "준서", "수아"
    };

    private static final String[][] COURSES = {
            // name, code, type
            {"자료구조", "CS201", "REQUIRED"},
            {"알고리즘", "CS202", "REQUIRED"},
            {"운영체제", "CS301", "REQUIRED"},
            {"데이터베이스", "CS302", "REQUIRED"},
            {"컴퓨터네트워크", "CS303", "REQUIRED"},
            {"인공지능", "CS401", "ELECTIVE"},
            {"머신러닝", "CS402", "ELECTIVE"},
            {"정보보안", "CS403", "ELECTIVE"},
            {"컴파일러", "CS404", "ELECTIVE"},
            {"분산시스템", "CS405", "ELECTIVE"},
            {"웹프로그래밍", "CS306", "ELECTIVE"},
            {"소프트웨어공학", "CS307", "REQUIRED"}
    };

    // 09:00 부터 3시간 블록 두 개: 09-12, 13-16
    private static final int[] BLOCK_START_HOURS = {9, 13};

    private final ProfessorRepository professorRepository;
    private final CourseRepository courseRepository;
    private final StudentRepository studentRepository;

    @Override
    @Transactional
    public void run(String... args) {
        long startTime = System.currentTimeMillis();
        log.info("초기 데이터 생성 시작...");

        List<Professor> professors = createProfessors();
        createCourses(professors);
        createStudents();

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("초기 데이터 생성 완료 ({}ms)", elapsed);
    }

    private List<Professor> createProfessors() {
        Random random = new Random(42);
        List<Professor> professors = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            professors.add(Professor.builder()
                    .name(randomName(random))
                    .build());
        }
        return professorRepository.saveAll(professors);
    }

    private void createCourses(List<Professor> professors) {
        Random random = new Random(123);
        List<Course> courses = new ArrayList<>();

        for (int i = 0; i < COURSES.length; i++) {
            String[] row = COURSES[i];
            Course course = Course.builder()
                    .name(row[0])
                    .code(row[1])
                    .type(CourseType.valueOf(row[2]))
                    .capacity(20 + random.nextInt(21)) // 20~40명
                    .credits(3)
                    .semester(SEMESTER)
                    .description(row[0] + " 강의")
                    .professor(professors.get(i % professors.size()))
                    .build();

            // 월~금 x 오전/오후 10개 블록을 순환 배정, 11번째 강좌부터는 앞 강좌와 겹친다
            int block = i % (5 * BLOCK_START_HOURS.length);
            int day = block / BLOCK_START_HOURS.length + 1;
            int startHour = BLOCK_START_HOURS[block % BLOCK_START_HOURS.length];
            course.addTimeSlot(day, LocalTime.of(startHour, 0), LocalTime.of(startHour + 3, 0),
                    "공학관 " + (101 + i) + "호");

            courses.add(course);
        }

        courseRepository.saveAll(courses);
    }

    private void createStudents() {
        Random random = new Random(456);
        List<Student> students = new ArrayList<>(STUDENT_COUNT);

        for (int i = 0; i < STUDENT_COUNT; i++) {
            students.add(Student.builder()
                    .name(randomName(random))
                    .studentNumber(String.format("2026%04d", i + 1))
                    .grade((i % 4) + 1)
                    .build());
        }

        studentRepository.saveAll(students);
    }

    private String randomName(Random random) {
        return LAST_NAMES[random.nextInt(LAST_NAMES.length)]
                + FIRST_NAMES[random.nextInt(FIRST_NAMES.length)];
    }
}
