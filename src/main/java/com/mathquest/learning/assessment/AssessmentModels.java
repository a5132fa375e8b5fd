package com.mathquest.learning.assessment;

import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class AssessmentModels {
    /** Placement rung. The question source has no hard tier, so HARD is served from medium content. */
    public enum Rung {
        EASY, MEDIUM, HARD;

        public Difficulty contentDifficulty() {
            return this == EASY ? Difficulty.EASY : Difficulty.MEDIUM;
        }

        public Rung up() {
            return this == EASY ? MEDIUM : HARD;
        }

        public Rung down() {
            return this == HARD ? MEDIUM : EASY;
        }
    }

    public enum GradeBand { BELOW, ON, ABOVE }

    public record AssessmentQuestion(Question question, Rung rung, double gradeLevel, double skillWeight) {
        public String id() {
            return question.id();
        }
    }

    public record AssessmentResponse(Skill skill,
                                     AssessmentQuestion question,
                                     boolean correct,
                                     long responseTimeMs,
                                     Instant answeredAt) {}

    public record AssessmentState(Skill currentSkill,
                                  int skillIndex,
                                  int questionsInSkill,
                                  int correctInSkill,
                                  Rung rung,
                                  List<AssessmentResponse> responses,
                                  Map<Skill, SkillAssessmentResult> skillResults,
                                  boolean complete,
                                  AssessmentQuestion currentQuestion) {
        public AssessmentState {
            responses = responses == null ? List.of() : List.copyOf(responses);
            skillResults = skillResults == null || skillResults.isEmpty()
                    ? Map.of()
                    : Collections.unmodifiableMap(new EnumMap<>(skillResults));
        }
    }

    public record SkillAssessmentResult(Skill skill,
                                        int questionsAsked,
                                        int correct,
                                        GradeBand estimatedLevel,
                                        int confidence,
                                        Difficulty startingDifficulty,
                                        List<String> weaknessExamples) {
        public SkillAssessmentResult {
            weaknessExamples = weaknessExamples == null ? List.of() : List.copyOf(weaknessExamples);
        }

        public double accuracy() {
            return (double) correct / Math.max(1, questionsAsked);
        }
    }

    public record DiagnosticResult(GradeBand overallLevel,
                                   int overallConfidence,
                                   Map<Skill, SkillAssessmentResult> skillResults,
                                   String recommendedStartingWorld,
                                   Skill recommendedFocusSkill,
                                   String personalizedMessage,
                                   double estimatedGradeLevel,
                                   AdaptiveLearningState adaptiveState) {
        public DiagnosticResult {
            skillResults = Collections.unmodifiableMap(new EnumMap<>(skillResults));
        }
    }

    public record AssessmentProgress(String currentSkillName,
                                     int skillNumber,
                                     int totalSkills,
                                     int questionInSkill,
                                     int overallPercent) {}
}
