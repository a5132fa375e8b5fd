package com.mathquest.learning.selection;

import com.mathquest.learning.config.RandomSource;
import com.mathquest.learning.content.QuestionRepository;
import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import com.mathquest.learning.mastery.MasteryModels.QuestionHistory;
import com.mathquest.learning.mastery.MasteryModels.SkillMastery;
import com.mathquest.learning.mastery.MasteryModels.Trend;
import com.mathquest.learning.selection.SelectionModels.FactorScore;
import com.mathquest.learning.selection.SelectionModels.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class AdaptiveQuestionSelector {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveQuestionSelector.class);

    static final double WEAKEST_SKILL_PROBABILITY = 0.7;
    static final double BASE_SCORE = 100.0;
    static final double JITTER_RANGE = 20.0;
    static final Skill ON_RAMP_SKILL = Skill.ADDITION;

    private static final double MILLIS_PER_HOUR = 60.0 * 60 * 1000;
    private static final double MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;

    private final QuestionRepository repository;
    private final Clock clock;
    private final RandomSource skillChoiceRandom;
    private final RandomSource jitterRandom;

    public AdaptiveQuestionSelector(QuestionRepository repository,
                                    Clock clock,
                                    @Qualifier("skillChoiceRandom") RandomSource skillChoiceRandom,
                                    @Qualifier("jitterRandom") RandomSource jitterRandom) {
        this.repository = repository;
        this.clock = clock;
        this.skillChoiceRandom = skillChoiceRandom;
        this.jitterRandom = jitterRandom;
    }

    public Question selectNext(AdaptiveLearningState state, Set<String> excludeIds) {
        return selectNext(state, excludeIds, null);
    }

    public Question selectNext(AdaptiveLearningState state, Set<String> excludeIds, Skill forcedSkill) {
        Set<String> excluded = excludeIds == null ? Set.of() : excludeIds;
        Skill target = forcedSkill != null ? forcedSkill : chooseTargetSkill(state);

        List<Question> candidates = repository.questionsFor(target).stream()
                .filter(q -> !excluded.contains(q.id()))
                .toList();

        if (candidates.isEmpty()) {
            List<Question> fallback = repository.anyQuestions(excluded);
            if (fallback.isEmpty()) {
                log.warn("No question left outside {} excluded ids, serving repository default", excluded.size());
                return repository.defaultQuestion();
            }
            log.warn("No {} questions available, falling back to any remaining question", target);
            return fallback.get(jitterRandom.nextInt(fallback.size()));
        }

        return scoreCandidates(state, target, candidates).get(0).question();
    }

    public List<String> buildAdaptiveQuest(AdaptiveLearningState state, int count) {
        Set<String> picked = new LinkedHashSet<>();
        for (int i = 0; i < count; i++) {
            Question next = selectNext(state, picked);
            if (!picked.add(next.id())) break;
        }
        return List.copyOf(picked);
    }

    public Skill chooseTargetSkill(AdaptiveLearningState state) {
        List<SkillMastery> attempted = new ArrayList<>();
        for (Skill skill : Skill.values()) {
            SkillMastery m = state.mastery(skill);
            if (m.totalAttempts() > 0) attempted.add(m);
        }
        if (attempted.isEmpty()) return ON_RAMP_SKILL;

        if (skillChoiceRandom.nextDouble() < WEAKEST_SKILL_PROBABILITY) {
            SkillMastery weakest = attempted.get(0);
            for (SkillMastery m : attempted) {
                if (m.mastery() < weakest.mastery()) weakest = m;
            }
            return weakest.skill();
        }
        return attempted.get(skillChoiceRandom.nextInt(attempted.size())).skill();
    }

    public List<ScoredCandidate> scoreCandidates(AdaptiveLearningState state, Skill target, List<Question> candidates) {
        Instant now = clock.instant();
        SkillMastery mastery = state.mastery(target);
        return candidates.stream()
                .map(q -> score(q, state.history(q.id()), mastery, now))
                .sorted(Comparator.comparingDouble(ScoredCandidate::score).reversed())
                .toList();
    }

    private ScoredCandidate score(Question question, QuestionHistory history, SkillMastery mastery, Instant now) {
        List<FactorScore> factors = new ArrayList<>();
        factors.add(new FactorScore("base", BASE_SCORE));

        if (history != null) {
            factors.add(new FactorScore("spaced_repetition", spacedRepetition(history, now)));
            if (history.accuracy() < 0.5) {
                factors.add(new FactorScore("low_accuracy", 30));
            }
        } else {
            factors.add(new FactorScore("novelty", 20));
        }

        factors.add(new FactorScore("mastery_match", masteryMatch(mastery.mastery(), question.difficulty())));
        factors.add(new FactorScore("trend", trendAdjustment(mastery.trend(), question.difficulty())));
        factors.add(new FactorScore("jitter", jitterRandom.nextDouble() * JITTER_RANGE));

        double total = factors.stream().mapToDouble(FactorScore::value).sum();
        return new ScoredCandidate(question, total, List.copyOf(factors));
    }

    public static double spacedRepetition(QuestionHistory history, Instant now) {
        double elapsedMs = history.lastAttempted() == null
                ? Double.MAX_VALUE
                : Duration.between(history.lastAttempted(), now).toMillis();
        if (!history.lastCorrect()) {
            double hours = elapsedMs / MILLIS_PER_HOUR;
            if (hours >= 1 && hours < 24) return 50;
            if (hours >= 24) return 30;
            return 0;
        }
        double days = elapsedMs / MILLIS_PER_DAY;
        if (days < 1) return -40;
        if (days >= 3) return 10;
        return 0;
    }

    public static double masteryMatch(int mastery, Difficulty difficulty) {
        boolean easy = difficulty == Difficulty.EASY;
        if (mastery < 50) return easy ? 40 : -20;
        if (mastery < 75) return easy ? 10 : 20;
        return easy ? -10 : 30;
    }

    public static double trendAdjustment(Trend trend, Difficulty difficulty) {
        if (trend == Trend.STRUGGLING && difficulty == Difficulty.EASY) return 20;
        if (trend == Trend.IMPROVING && difficulty == Difficulty.MEDIUM) return 15;
        return 0;
    }
}
