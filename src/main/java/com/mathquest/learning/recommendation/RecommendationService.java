package com.mathquest.learning.recommendation;

import com.mathquest.learning.config.RandomSource;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import com.mathquest.learning.mastery.MasteryModels.SkillMastery;
import com.mathquest.learning.mastery.MasteryModels.Trend;
import com.mathquest.learning.recommendation.RecommendationModels.*;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
public class RecommendationService {
    static final double IMPROVEMENT_SHOW_PROBABILITY = 0.3;

    private final RandomSource messageRandom;

    public RecommendationService(@Qualifier("messageRandom") RandomSource messageRandom) {
        this.messageRandom = messageRandom;
    }

    public LearningRecommendation summarize(AdaptiveLearningState state) {
        List<SkillMastery> attempted = attempted(state).stream()
                .sorted(Comparator.comparingInt(SkillMastery::mastery))
                .toList();
        if (attempted.isEmpty()) {
            return new LearningRecommendation(Skill.ADDITION, Skill.ADDITION,
                    "Let's start with some addition problems!",
                    "Welcome to your math adventure!");
        }

        SkillMastery weakest = attempted.get(0);
        SkillMastery strongest = attempted.get(attempted.size() - 1);
        String weakName = weakest.skill().displayName();

        String recommendation;
        String encouragement;
        if (weakest.mastery() < 50) {
            recommendation = "Let's practice " + weakName + " - you've got this!";
            encouragement = weakest.trend() == Trend.IMPROVING
                    ? "You're getting better at " + weakName + "! Keep it up!"
                    : weakName + " is tricky, but practice makes perfect!";
        } else if (weakest.mastery() < 75) {
            recommendation = weakName + " is almost mastered - a few more practice rounds!";
            encouragement = "You're doing great! " + strongest.skill().displayName() + " is your superpower!";
        } else {
            recommendation = "Amazing! Try some harder problems to challenge yourself!";
            encouragement = "Math Champion in the making! All skills above 75%!";
        }
        return new LearningRecommendation(weakest.skill(), strongest.skill(), recommendation, encouragement);
    }

    public Optional<Encouragement> checkEncouragement(AdaptiveLearningState state) {
        List<SkillMastery> skills = Arrays.stream(Skill.values()).map(state::mastery).toList();

        Optional<SkillMastery> mastered = skills.stream()
                .filter(s -> s.mastery() >= 80 && s.totalAttempts() >= 10 && lastOutcomesCorrect(s, 3))
                .findFirst();
        if (mastered.isPresent()) {
            return Optional.of(new Encouragement(EncouragementType.MILESTONE,
                    "You've mastered " + mastered.get().skill().displayName() + "! Amazing work!"));
        }

        if (state.consecutiveCorrect() == 5) {
            return Optional.of(new Encouragement(EncouragementType.STREAK, "5 in a row! You're on fire!"));
        }
        if (state.consecutiveCorrect() == 10) {
            return Optional.of(new Encouragement(EncouragementType.STREAK, "10 in a row! Unstoppable!"));
        }

        Optional<SkillMastery> improving = skills.stream()
                .filter(s -> s.trend() == Trend.IMPROVING && s.totalAttempts() >= 10 && s.mastery() > 60)
                .findFirst();
        if (improving.isPresent() && messageRandom.nextDouble() < IMPROVEMENT_SHOW_PROBABILITY) {
            return Optional.of(new Encouragement(EncouragementType.IMPROVEMENT,
                    "Your " + improving.get().skill().displayName() + " is really improving! Great effort!"));
        }

        if (state.consecutiveWrong() == 3) {
            return Optional.of(new Encouragement(EncouragementType.PERSISTENCE,
                    "Tough problems! But you're learning with each try!"));
        }
        return Optional.empty();
    }

    public List<SkillSummary> skillSummary(AdaptiveLearningState state) {
        return Arrays.stream(Skill.values())
                .map(state::mastery)
                .map(m -> new SkillSummary(m.skill(), m.skill().displayName(),
                        accuracyPercent(m.totalCorrect(), m.totalAttempts()), m.totalAttempts()))
                .toList();
    }

    public LearnerOverview overview(AdaptiveLearningState state) {
        return new LearnerOverview(summarize(state), skillSummary(state));
    }

    public static int accuracyPercent(int correct, int total) {
        if (total == 0) return 0;
        return (int) Math.round(100.0 * correct / total);
    }

    private List<SkillMastery> attempted(AdaptiveLearningState state) {
        return Arrays.stream(Skill.values())
                .map(state::mastery)
                .filter(m -> m.totalAttempts() > 0)
                .toList();
    }

    private boolean lastOutcomesCorrect(SkillMastery mastery, int count) {
        List<Integer> recent = mastery.recentOutcomes();
        if (recent.size() < count) return false;
        return recent.subList(recent.size() - count, recent.size()).stream().allMatch(v -> v == 1);
    }
}
