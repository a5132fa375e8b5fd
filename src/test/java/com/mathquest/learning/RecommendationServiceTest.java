package com.mathquest.learning;

import com.mathquest.learning.content.QuestionBank;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import com.mathquest.learning.mastery.SkillMasteryTracker;
import com.mathquest.learning.recommendation.RecommendationModels.*;
import com.mathquest.learning.recommendation.RecommendationService;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationServiceTest {
    private final SkillMasteryTracker tracker = new SkillMasteryTracker(
            Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    private final QuestionBank bank = new QuestionBank();
    private final Question addition = bank.findById("add-001").orElseThrow();
    private final Question subtraction = bank.findById("sub-001").orElseThrow();

    private final RecommendationService alwaysShow = new RecommendationService(new FixedRandomSource(0.1));
    private final RecommendationService neverShow = new RecommendationService(new FixedRandomSource(0.9));

    @Test
    void freshLearnerGetsWelcome() {
        LearningRecommendation rec = alwaysShow.summarize(tracker.initialState());

        assertEquals(Skill.ADDITION, rec.weakestSkill());
        assertEquals(Skill.ADDITION, rec.strongestSkill());
        assertEquals("Let's start with some addition problems!", rec.recommendation());
        assertEquals("Welcome to your math adventure!", rec.encouragement());
    }

    @Test
    void weakSkillBelowHalfGetsPracticeNudge() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 0, 0, 0);

        LearningRecommendation rec = alwaysShow.summarize(state);

        assertEquals(Skill.ADDITION, rec.weakestSkill());
        assertEquals("Let's practice Addition - you've got this!", rec.recommendation());
        assertEquals("Addition is tricky, but practice makes perfect!", rec.encouragement());
    }

    @Test
    void improvingWeakSkillIsCheeredOn() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 0, 0, 0, 0, 0, 0, 1, 1);

        LearningRecommendation rec = alwaysShow.summarize(state);

        assertEquals("You're getting better at Addition! Keep it up!", rec.encouragement());
    }

    @Test
    void almostMasteredBandNamesStrongestSkill() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 1, 1, 1);
        state = record(state, subtraction, 1, 0, 1);

        LearningRecommendation rec = alwaysShow.summarize(state);

        assertEquals(Skill.SUBTRACTION, rec.weakestSkill());
        assertEquals(Skill.ADDITION, rec.strongestSkill());
        assertEquals("Subtraction is almost mastered - a few more practice rounds!", rec.recommendation());
        assertTrue(rec.encouragement().contains("Addition is your superpower"));
    }

    @Test
    void everythingStrongSuggestsHarderProblems() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 1, 1, 1);

        LearningRecommendation rec = alwaysShow.summarize(state);

        assertEquals("Amazing! Try some harder problems to challenge yourself!", rec.recommendation());
    }

    @Test
    void fiveInARowIsAStreak() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 1, 1, 1, 1, 1);

        Encouragement e = alwaysShow.checkEncouragement(state).orElseThrow();

        assertEquals(EncouragementType.STREAK, e.type());
    }

    @Test
    void masteredSkillMilestoneWinsOverStreak() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 1, 1, 1, 1, 1, 1, 1, 1, 1, 1);

        Encouragement e = alwaysShow.checkEncouragement(state).orElseThrow();

        assertEquals(EncouragementType.MILESTONE, e.type());
        assertEquals("You've mastered Addition! Amazing work!", e.message());
    }

    @Test
    void improvementShownOnlyWhenDrawFavoursIt() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 0, 0, 0, 1, 0, 1, 1, 1, 0, 1);

        assertEquals(EncouragementType.IMPROVEMENT, alwaysShow.checkEncouragement(state).orElseThrow().type());
        assertTrue(neverShow.checkEncouragement(state).isEmpty());
    }

    @Test
    void threeMissesInARowEncouragePersistence() {
        AdaptiveLearningState state = record(tracker.initialState(), addition, 0, 0, 0);

        assertEquals(EncouragementType.PERSISTENCE, neverShow.checkEncouragement(state).orElseThrow().type());
        assertTrue(neverShow.checkEncouragement(record(state, addition, 0)).isEmpty());
    }

    @Test
    void freshLearnerHasNoEncouragement() {
        assertTrue(alwaysShow.checkEncouragement(tracker.initialState()).isEmpty());
    }

    @Test
    void skillSummaryListsEverySkillWithRoundedAccuracy() {
        AdaptiveLearningState state = record(tracker.initialState(), subtraction, 1, 0, 1);

        List<SkillSummary> summary = alwaysShow.skillSummary(state);

        assertEquals(Skill.values().length, summary.size());
        SkillSummary sub = summary.get(Skill.SUBTRACTION.ordinal());
        assertEquals("Subtraction", sub.label());
        assertEquals(67, sub.accuracy());
        assertEquals(3, sub.total());
        assertEquals(0, summary.get(0).accuracy());
        assertEquals(0, summary.get(0).total());
    }

    @Test
    void accuracyPercentHandlesZeroAttempts() {
        assertEquals(0, RecommendationService.accuracyPercent(0, 0));
        assertEquals(33, RecommendationService.accuracyPercent(1, 3));
    }

    private AdaptiveLearningState record(AdaptiveLearningState state, Question question, int... outcomes) {
        AdaptiveLearningState current = state;
        for (int outcome : outcomes) {
            current = tracker.recordOutcome(current, question, outcome == 1, 1000);
        }
        return current;
    }
}
