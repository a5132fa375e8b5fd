package com.mathquest.learning.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathquest.learning.assessment.AssessmentModels.DiagnosticResult;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Repository
public class LearnerStateJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public LearnerStateJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void saveState(String learnerId, AdaptiveLearningState state) {
        jdbcTemplate.update(
                "MERGE INTO learner_state(learner_id, state_json, updated_at) KEY(learner_id) VALUES (?,?,?)",
                learnerId, write(state), clock.instant().toString());
    }

    public Optional<AdaptiveLearningState> loadState(String learnerId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT state_json FROM learner_state WHERE learner_id=?",
                (rs, n) -> rs.getString(1),
                learnerId);
        return rows.stream().findFirst().map(json -> read(json, AdaptiveLearningState.class));
    }

    public void saveDiagnostic(String learnerId, DiagnosticResult result) {
        jdbcTemplate.update(
                "INSERT INTO diagnostic_results(learner_id, overall_level, estimated_grade_level, result_json, ts) VALUES (?,?,?,?,?)",
                learnerId, result.overallLevel().name(), result.estimatedGradeLevel(), write(result), clock.instant().toString());
    }

    public Optional<DiagnosticResult> loadLatestDiagnostic(String learnerId) {
        List<String> rows = jdbcTemplate.query(
                "SELECT result_json FROM diagnostic_results WHERE learner_id=? ORDER BY id DESC LIMIT 1",
                (rs, n) -> rs.getString(1),
                learnerId);
        return rows.stream().findFirst().map(json -> read(json, DiagnosticResult.class));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new LearnerStateSerializationException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new LearnerStateSerializationException("Cannot deserialize " + type.getSimpleName(), e);
        }
    }
}
