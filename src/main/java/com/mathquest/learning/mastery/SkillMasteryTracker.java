package com.mathquest.learning.mastery;

import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class SkillMasteryTracker {
    private static final Logger log = LoggerFactory.getLogger(SkillMasteryTracker.class);

    public static final int RECENT_WINDOW = 10;
    public static final int NEUTRAL_MASTERY = 50;
    public static final int MIN_OUTCOMES_FOR_TREND = 4;
    public static final double TREND_THRESHOLD = 0.15;
    public static final int PROMOTE_AFTER_CORRECT = 5;
    public static final int DEMOTE_AFTER_WRONG = 3;

    private final Clock clock;

    public SkillMasteryTracker(Clock clock) {
        this.clock = clock;
    }

    public AdaptiveLearningState initialState() {
        return new AdaptiveLearningState(Map.of(), Map.of(), DifficultyMode.EASY, 0, 0, LocalDate.now(clock), 0L);
    }

    public AdaptiveLearningState recordOutcome(AdaptiveLearningState state, Question question, boolean correct, long responseTimeMs) {
        Instant now = clock.instant();

        Map<String, QuestionHistory> history = new LinkedHashMap<>(state.questionHistory());
        QuestionHistory previous = history.get(question.id());
        int attempts = previous == null ? 1 : previous.attempts() + 1;
        int correctCount = (previous == null ? 0 : previous.correct()) + (correct ? 1 : 0);
        double oldMean = previous == null ? 0.0 : previous.averageTimeMs();
        double mean = (oldMean * (attempts - 1) + responseTimeMs) / attempts;
        history.put(question.id(), new QuestionHistory(question.id(), attempts, correctCount, now, correct, mean));

        SkillMastery before = state.mastery(question.skill());
        List<Integer> recent = appendOutcome(before.recentOutcomes(), correct);
        SkillMastery after = new SkillMastery(
                question.skill(),
                before.totalAttempts() + 1,
                before.totalCorrect() + (correct ? 1 : 0),
                recent,
                weightedMastery(recent),
                trend(recent));
        Map<Skill, SkillMastery> mastery = new EnumMap<>(state.skillMastery());
        mastery.put(question.skill(), after);

        int streakCorrect = correct ? state.consecutiveCorrect() + 1 : 0;
        int streakWrong = correct ? 0 : state.consecutiveWrong() + 1;

        DifficultyMode mode = state.difficultyMode();
        if (streakCorrect >= PROMOTE_AFTER_CORRECT && mode == DifficultyMode.EASY) {
            mode = DifficultyMode.ADAPTIVE;
            log.debug("Difficulty mode promoted to {} after {} correct in a row", mode, streakCorrect);
        } else if (streakWrong >= DEMOTE_AFTER_WRONG && mode != DifficultyMode.EASY) {
            mode = DifficultyMode.EASY;
            log.debug("Difficulty mode demoted to {} after {} wrong in a row", mode, streakWrong);
        }

        return new AdaptiveLearningState(mastery, history, mode, streakCorrect, streakWrong,
                state.lastSessionDate(), state.totalPlayTimeMs());
    }

    public AdaptiveLearningState startSession(AdaptiveLearningState state) {
        return new AdaptiveLearningState(state.skillMastery(), state.questionHistory(), state.difficultyMode(),
                state.consecutiveCorrect(), state.consecutiveWrong(), LocalDate.now(clock), state.totalPlayTimeMs());
    }

    public AdaptiveLearningState addPlayTime(AdaptiveLearningState state, long millis) {
        if (millis <= 0) return state;
        return new AdaptiveLearningState(state.skillMastery(), state.questionHistory(), state.difficultyMode(),
                state.consecutiveCorrect(), state.consecutiveWrong(), state.lastSessionDate(), state.totalPlayTimeMs() + millis);
    }

    public static int weightedMastery(List<Integer> recentOutcomes) {
        if (recentOutcomes == null || recentOutcomes.isEmpty()) return NEUTRAL_MASTERY;
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < recentOutcomes.size(); i++) {
            int weight = i + 1;
            weightedSum += recentOutcomes.get(i) * weight;
            totalWeight += weight;
        }
        return (int) Math.round(100.0 * weightedSum / totalWeight);
    }

    public static Trend trend(List<Integer> recentOutcomes) {
        if (recentOutcomes == null || recentOutcomes.size() < MIN_OUTCOMES_FOR_TREND) return Trend.STABLE;
        int split = recentOutcomes.size() / 2;
        double firstMean = mean(recentOutcomes.subList(0, split));
        double secondMean = mean(recentOutcomes.subList(split, recentOutcomes.size()));
        double diff = secondMean - firstMean;
        if (diff > TREND_THRESHOLD) return Trend.IMPROVING;
        if (diff < -TREND_THRESHOLD) return Trend.STRUGGLING;
        return Trend.STABLE;
    }

    static List<Integer> appendOutcome(List<Integer> recent, boolean correct) {
        List<Integer> next = new ArrayList<>(recent);
        next.add(correct ? 1 : 0);
        if (next.size() > RECENT_WINDOW) {
            next = next.subList(next.size() - RECENT_WINDOW, next.size());
        }
        return List.copyOf(next);
    }

    private static double mean(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    }
}
