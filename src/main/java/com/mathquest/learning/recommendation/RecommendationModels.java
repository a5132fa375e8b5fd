package com.mathquest.learning.recommendation;

import com.mathquest.learning.domain.DomainModels.Skill;

import java.util.List;

public class RecommendationModels {
    public record LearningRecommendation(Skill weakestSkill,
                                         Skill strongestSkill,
                                         String recommendation,
                                         String encouragement) {}

    public enum EncouragementType { MILESTONE, STREAK, IMPROVEMENT, PERSISTENCE }

    public record Encouragement(EncouragementType type, String message) {}

    public record SkillSummary(Skill skill, String label, int accuracy, int total) {}

    public record LearnerOverview(LearningRecommendation recommendation, List<SkillSummary> skills) {}
}
