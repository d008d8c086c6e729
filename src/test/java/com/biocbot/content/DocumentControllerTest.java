package com.biocbot.content;

import com.biocbot.content.course.CourseAggregateStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DocumentControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CourseAggregateStore courseStore;

    @Test
    void uploadsFileAndListsIt() throws Exception {
        String courseId = TestDocuments.uniqueCourseId();
        courseStore.createCourse(TestDocuments.twoUnitCourse(courseId));
        var file = new MockMultipartFile("file", "notes.txt", "text/plain", "Glycolysis overview".getBytes(StandardCharsets.UTF_8));

        String body = mockMvc.perform(multipart("/api/documents")
                        .file(file)
                        .param("courseId", courseId)
                        .param("unitName", "Unit 1")
                        .param("documentType", "lecture-notes")
                        .param("tags", "week-1, metabolism")
                        .header("X-Actor-Id", "inst-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.linkedToCourse").value(true))
                .andExpect(jsonPath("$.displayName").value("notes.txt"))
                .andReturn().getResponse().getContentAsString();
        String documentId = objectMapper.readTree(body).get("documentId").asText();

        mockMvc.perform(get("/api/documents").param("courseId", courseId).param("unitName", "Unit 1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.documents[0].documentId").value(documentId))
                .andExpect(jsonPath("$.documents[0].textContent").value("Glycolysis overview"))
                .andExpect(jsonPath("$.documents[0].metadata.tags[1]").value("metabolism"));

        mockMvc.perform(get("/api/documents/stats").param("courseId", courseId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalDocuments").value(1));
    }

    @Test
    void submitsTextAndDeletesIt() throws Exception {
        String courseId = TestDocuments.uniqueCourseId();
        courseStore.createCourse(TestDocuments.twoUnitCourse(courseId));
        Map<String, Object> request = Map.of(
                "courseId", courseId,
                "unitName", "Unit 2",
                "documentType", "practice-quiz",
                "title", "Buffers",
                "content", "A buffer resists pH change.",
                "tags", List.of("acid-base"));

        String body = mockMvc.perform(post("/api/documents/text")
                        .header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.linkedToCourse").value(true))
                .andReturn().getResponse().getContentAsString();
        String documentId = objectMapper.readTree(body).get("documentId").asText();
        assertEquals(1, courseStore.documentReferences(courseId, "Unit 2").size());

        mockMvc.perform(delete("/api/documents/{id}", documentId).header("X-Actor-Id", "inst-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedCount").value(1))
                .andExpect(jsonPath("$.removedFromCourse").value(true));
        assertTrue(courseStore.documentReferences(courseId, "Unit 2").isEmpty());

        mockMvc.perform(get("/api/documents/{id}", documentId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void invalidSubmissionIsRejectedWithErrors() throws Exception {
        Map<String, Object> request = Map.of("courseId", "C1", "unitName", "Unit 1", "title", "Empty");

        String body = mockMvc.perform(post("/api/documents/text")
                        .header("X-Actor-Id", "inst-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andReturn().getResponse().getContentAsString();

        JsonNode errors = objectMapper.readTree(body).get("errors");
        assertTrue(errors.isArray());
        List<String> fields = new ArrayList<>();
        errors.forEach(e -> fields.add(e.get("field").asText()));
        assertTrue(fields.containsAll(List.of("documentType", "content")), fields.toString());
    }

    @Test
    void uploadWithoutContentTypeIsRejected() throws Exception {
        var file = new MockMultipartFile("file", "notes.bin", null, new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/api/documents")
                        .file(file)
                        .param("courseId", TestDocuments.uniqueCourseId())
                        .param("unitName", "Unit 1")
                        .param("documentType", "lecture-notes")
                        .header("X-Actor-Id", "inst-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].code").value("UNSUPPORTED_MIME_TYPE"));
    }

    @Test
    void missingActorHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/documents/text")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void extractionCallbackAfterDeleteReportsDocumentGone() throws Exception {
        mockMvc.perform(put("/api/documents/{id}/content", "doc_never_existed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"late\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentGone").value(true))
                .andExpect(jsonPath("$.stored").value(false));
    }
}
