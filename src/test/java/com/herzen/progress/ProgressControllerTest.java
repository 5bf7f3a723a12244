package com.herzen.progress;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ProgressControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void servesProgressAfterPublishingAndCompleting() throws Exception {
        String subject = "web-" + UUID.randomUUID();
        mockMvc.perform(post("/api/subjects/{subjectId}/structure", subject)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequential\": true, \"children\": [{\"id\": \"" + subject + "-a\", \"bitPosition\": 0}, {\"id\": \"" + subject + "-b\", \"bitPosition\": 1}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(post("/api/progress/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learnerId\": \"u1\", \"lessonId\": \"" + subject + "-a\", \"performanceScore\": 3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.xpAwarded").value(40))
                .andExpect(jsonPath("$.isFirstCompletion").value(true));

        mockMvc.perform(get("/api/progress/{subjectId}", subject).param("learnerId", "u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completionPercentage").value(50.0))
                .andExpect(jsonPath("$.suggestedNextLessonId").value(subject + "-b"))
                .andExpect(jsonPath("$.tree.children[0].status").value("PASSED"))
                .andExpect(jsonPath("$.tree.children[0].bestScore").value(3));

        mockMvc.perform(post("/api/subjects/{subjectId}/lessons/{lessonId}/position", subject, subject + "-c"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bitPosition").value(2));
    }

    @Test
    void mapsErrorsToStatusCodes() throws Exception {
        mockMvc.perform(get("/api/progress/{subjectId}", "missing-" + UUID.randomUUID()).param("learnerId", "u1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SUBJECT_NOT_FOUND"))
                .andExpect(jsonPath("$.retryable").value(false));

        mockMvc.perform(post("/api/progress/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learnerId\": \"u1\", \"subjectId\": \"s\", \"lessonId\": \"x\", \"performanceScore\": 9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        mockMvc.perform(post("/api/subjects/{subjectId}/structure", "bad-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1, 2]"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.valid").value(false));
    }
}
