package com.mathquest.learning;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class LearningApiControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @Test
    void nextQuestionHonoursExcludeList() throws Exception {
        mockMvc.perform(get("/api/practice/web-1/next")
                        .param("excludeIds", "add-001,add-002,add-003,add-004")
                        .param("skill", "DIVISION"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skill").value("DIVISION"));
    }

    @Test
    void unknownSkillParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/practice/web-5/next").param("skill", "GEOMETRY"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("Invalid value for parameter skill"));
    }

    @Test
    void malformedAnswerBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/practice/web-5/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.path").value("/api/practice/web-5/answer"));
    }

    @Test
    void practiceAnswerForUnknownQuestionIsNotFound() throws Exception {
        mockMvc.perform(post("/api/practice/web-2/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"nope\",\"answerIndex\":0,\"responseTimeMs\":1000}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.path").value("/api/practice/web-2/answer"));
    }

    @Test
    void answerForUnknownSessionIsNotFound() throws Exception {
        mockMvc.perform(post("/api/assessment/missing-session/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answerIndex\":0,\"responseTimeMs\":1000}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void resultWithoutFinishedAssessmentIsConflict() throws Exception {
        mockMvc.perform(get("/api/assessment/web-3/result"))
                .andExpect(status().isConflict());
    }

    @Test
    void startedAssessmentReturnsFirstQuestion() throws Exception {
        mockMvc.perform(post("/api/assessment/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learnerId\":\"web-4\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.complete").value(false))
                .andExpect(jsonPath("$.currentQuestion.rung").value("EASY"))
                .andExpect(jsonPath("$.progress.currentSkillName").value("Addition"));
    }

    @Test
    void recommendationsWelcomeNewLearner() throws Exception {
        mockMvc.perform(get("/api/recommendations/web-5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recommendation.recommendation").value("Let's start with some addition problems!"))
                .andExpect(jsonPath("$.skills.length()").value(5));
    }
}
