package com.mathquest.learning.service;

import com.mathquest.learning.assessment.AssessmentModels.AssessmentProgress;
import com.mathquest.learning.assessment.AssessmentModels.AssessmentQuestion;
import com.mathquest.learning.assessment.AssessmentModels.DiagnosticResult;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.DifficultyMode;
import com.mathquest.learning.mastery.MasteryModels.SkillMastery;
import com.mathquest.learning.recommendation.RecommendationModels.Encouragement;

public class SessionModels {
    public record PracticeAnswerResult(String questionId,
                                       boolean correct,
                                       int correctIndex,
                                       String hint,
                                       Skill skill,
                                       SkillMastery skillMastery,
                                       DifficultyMode difficultyMode,
                                       Encouragement encouragement) {}

    public record AssessmentStep(String sessionId,
                                 boolean complete,
                                 AssessmentQuestion currentQuestion,
                                 AssessmentProgress progress,
                                 String encouragement,
                                 DiagnosticResult result) {}
}
