package com.mathquest.learning.mastery;

import com.mathquest.learning.domain.DomainModels.Skill;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MasteryModels {
    public enum Trend { IMPROVING, STABLE, STRUGGLING }

    public enum DifficultyMode { EASY, MEDIUM, ADAPTIVE }

    public record QuestionHistory(String questionId,
                                  int attempts,
                                  int correct,
                                  Instant lastAttempted,
                                  boolean lastCorrect,
                                  double averageTimeMs) {
        public double accuracy() {
            return attempts == 0 ? 0.0 : (double) correct / attempts;
        }
    }

    public record SkillMastery(Skill skill,
                               int totalAttempts,
                               int totalCorrect,
                               List<Integer> recentOutcomes,
                               int mastery,
                               Trend trend) {
        public SkillMastery {
            recentOutcomes = recentOutcomes == null ? List.of() : List.copyOf(recentOutcomes);
            trend = trend == null ? Trend.STABLE : trend;
        }

        public static SkillMastery neutral(Skill skill) {
            return new SkillMastery(skill, 0, 0, List.of(), SkillMasteryTracker.NEUTRAL_MASTERY, Trend.STABLE);
        }
    }

    public record AdaptiveLearningState(Map<Skill, SkillMastery> skillMastery,
                                        Map<String, QuestionHistory> questionHistory,
                                        DifficultyMode difficultyMode,
                                        int consecutiveCorrect,
                                        int consecutiveWrong,
                                        LocalDate lastSessionDate,
                                        long totalPlayTimeMs) {
        public AdaptiveLearningState {
            EnumMap<Skill, SkillMastery> total = new EnumMap<>(Skill.class);
            for (Skill skill : Skill.values()) {
                SkillMastery m = skillMastery == null ? null : skillMastery.get(skill);
                total.put(skill, m == null ? SkillMastery.neutral(skill) : m);
            }
            skillMastery = Collections.unmodifiableMap(total);
            questionHistory = questionHistory == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(questionHistory));
            difficultyMode = difficultyMode == null ? DifficultyMode.EASY : difficultyMode;
        }

        public SkillMastery mastery(Skill skill) {
            return skillMastery.get(skill);
        }

        public QuestionHistory history(String questionId) {
            return questionHistory.get(questionId);
        }
    }
}
