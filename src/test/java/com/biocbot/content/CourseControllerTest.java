package com.biocbot.content;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CourseControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void createsCourseAndEditsUnits() throws Exception {
        String courseId = TestDocuments.uniqueCourseId();
        Map<String, Object> course = Map.of(
                "courseId", courseId,
                "courseName", "Biochemistry",
                "weeks", 1,
                "lecturesPerWeek", 2,
                "learningOutcomes", List.of("Explain enzyme kinetics"));

        mockMvc.perform(post("/api/courses").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(course)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.totalUnits").value(2));

        mockMvc.perform(put("/api/courses/{c}/units/{u}/publish", courseId, "Unit 2").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"isPublished\":true}"))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/courses/{c}/publish-status", courseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['Unit 1']").value(false))
                .andExpect(jsonPath("$['Unit 2']").value(true));

        mockMvc.perform(post("/api/courses/{c}/units/{u}/questions", courseId, "Unit 1").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionType\":\"TRUE_FALSE\",\"prompt\":\"Enzymes are proteins\",\"correctAnswer\":\"true\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appended").value(true));

        mockMvc.perform(get("/api/courses/{c}/units/{u}", courseId, "Unit 1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.assessmentQuestions.length()").value(1))
                .andExpect(jsonPath("$.passThreshold").value(2));

        mockMvc.perform(post("/api/courses/{c}/reconcile", courseId).header("X-Actor-Id", "inst-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orphanReferencesRemoved").value(0));
    }

    @Test
    void unknownCourseAndUnitAreNotFound() throws Exception {
        mockMvc.perform(get("/api/courses/{c}", "NOPE-" + TestDocuments.uniqueCourseId()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Not Found"));

        String courseId = TestDocuments.uniqueCourseId();
        mockMvc.perform(post("/api/courses").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("courseId", courseId, "courseName", "X", "weeks", 1, "lecturesPerWeek", 1))))
                .andExpect(status().isCreated());

        mockMvc.perform(put("/api/courses/{c}/units/{u}/pass-threshold", courseId, "Unit 7").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"passThreshold\":3}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingCourseNameIsBadRequest() throws Exception {
        String courseId = TestDocuments.uniqueCourseId();

        mockMvc.perform(post("/api/courses").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("courseId", courseId, "weeks", 1, "lecturesPerWeek", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("MISSING_FIELD"))
                .andExpect(jsonPath("$.errors[0].field").value("courseName"));

        mockMvc.perform(get("/api/courses/{c}", courseId))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingCourseIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/courses").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("courseName", "X", "weeks", 1, "lecturesPerWeek", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("courseId"));
    }

    @Test
    void invalidStructureIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/courses").header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("courseId", TestDocuments.uniqueCourseId(),
                                "courseName", "X", "weeks", 0, "lecturesPerWeek", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("INVALID_WEEKS"));
    }
}
