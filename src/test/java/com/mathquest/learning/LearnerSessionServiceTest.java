package com.mathquest.learning;

import com.mathquest.learning.assessment.AssessmentModels.DiagnosticResult;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import com.mathquest.learning.service.AssessmentIncompleteException;
import com.mathquest.learning.service.LearnerSessionService;
import com.mathquest.learning.service.SessionModels.AssessmentStep;
import com.mathquest.learning.service.SessionModels.PracticeAnswerResult;
import com.mathquest.learning.service.UnknownQuestionException;
import com.mathquest.learning.service.UnknownSessionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class LearnerSessionServiceTest {
    @Autowired
    private LearnerSessionService sessionService;

    @Test
    void practiceAnswerUpdatesAndPersistsLearnerState() {
        Question first = sessionService.nextQuestion("practice-1", Set.of(), null);
        assertEquals(Skill.ADDITION, first.skill());

        PracticeAnswerResult result = sessionService.submitPracticeAnswer("practice-1", first.id(), first.correctIndex(), 4200);
        assertTrue(result.correct());
        assertNull(result.hint());
        assertEquals(1, result.skillMastery().totalAttempts());
        assertEquals(100, result.skillMastery().mastery());

        AdaptiveLearningState stored = sessionService.currentState("practice-1");
        assertEquals(1, stored.mastery(Skill.ADDITION).totalCorrect());
        assertEquals(1, stored.history(first.id()).attempts());
        assertEquals(4200.0, stored.history(first.id()).averageTimeMs(), 1e-9);
        assertEquals(4200, stored.totalPlayTimeMs());
        assertEquals(1, stored.consecutiveCorrect());
    }

    @Test
    void wrongPracticeAnswerReturnsHint() {
        Question q = sessionService.nextQuestion("practice-2", Set.of(), Skill.MULTIPLICATION);

        PracticeAnswerResult result = sessionService.submitPracticeAnswer("practice-2", q.id(), (q.correctIndex() + 1) % 4, 3000);

        assertFalse(result.correct());
        assertEquals(q.hint(), result.hint());
        assertEquals(q.correctIndex(), result.correctIndex());
        assertEquals(0, sessionService.currentState("practice-2").mastery(Skill.MULTIPLICATION).mastery());
    }

    @Test
    void unknownQuestionIsRejected() {
        assertThrows(UnknownQuestionException.class,
                () -> sessionService.submitPracticeAnswer("practice-3", "no-such-question", 0, 1000));
    }

    @Test
    void adaptiveQuestHasDistinctQuestions() {
        List<String> quest = sessionService.adaptiveQuest("practice-4", 5);

        assertEquals(5, quest.size());
        assertEquals(5, new HashSet<>(quest).size());
    }

    @Test
    void completedAssessmentStoresResultAndSeedsPractice() {
        AssessmentStep step = sessionService.startAssessment("assess-1");
        assertFalse(step.complete());
        assertEquals(1, step.progress().skillNumber());

        int answers = 0;
        while (!step.complete()) {
            int correctIndex = step.currentQuestion().question().correctIndex();
            step = sessionService.answerAssessment(step.sessionId(), correctIndex, 2000);
            answers++;
        }

        assertEquals(15, answers);
        assertNotNull(step.result());
        assertEquals(100, step.progress().overallPercent());

        DiagnosticResult stored = sessionService.assessmentResult("assess-1");
        assertEquals(step.result().overallLevel(), stored.overallLevel());
        assertEquals(step.result().estimatedGradeLevel(), stored.estimatedGradeLevel());
        assertEquals(step.result().skillResults(), stored.skillResults());

        AdaptiveLearningState seeded = sessionService.currentState("assess-1");
        assertEquals(step.result().adaptiveState(), seeded);
        assertEquals(100, seeded.mastery(Skill.DIVISION).mastery());

        String finishedSession = step.sessionId();
        assertThrows(UnknownSessionException.class, () -> sessionService.answerAssessment(finishedSession, 0, 1000));
    }

    @Test
    void unknownAssessmentSessionIsRejected() {
        assertThrows(UnknownSessionException.class, () -> sessionService.answerAssessment("missing", 0, 1000));
    }

    @Test
    void resultBeforeCompletionIsUnavailable() {
        sessionService.startAssessment("assess-2");

        assertThrows(AssessmentIncompleteException.class, () -> sessionService.assessmentResult("assess-2"));
    }

    @Test
    void freshLearnerRecommendationCoversEverySkill() {
        var overview = sessionService.recommendations("fresh-1");

        assertEquals(Skill.ADDITION, overview.recommendation().weakestSkill());
        assertEquals(Skill.values().length, overview.skills().size());
    }

    @Test
    void concurrentPracticeAnswersAreAllRecorded() throws Exception {
        Question q = sessionService.nextQuestion("practice-5", Set.of(), Skill.ADDITION);
        List<Callable<PracticeAnswerResult>> answers = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            answers.add(() -> sessionService.submitPracticeAnswer("practice-5", q.id(), q.correctIndex(), 1000));
        }

        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            for (Future<PracticeAnswerResult> f : pool.invokeAll(answers)) {
                assertTrue(f.get().correct());
            }
        } finally {
            pool.shutdown();
        }

        AdaptiveLearningState stored = sessionService.currentState("practice-5");
        assertEquals(64, stored.history(q.id()).attempts());
        assertEquals(64, stored.mastery(Skill.ADDITION).totalAttempts());
        assertEquals(64, stored.mastery(Skill.ADDITION).totalCorrect());
        assertEquals(64_000, stored.totalPlayTimeMs());
    }

    @Test
    void concurrentAssessmentAnswersAdvanceOneStepEach() throws Exception {
        String sessionId = sessionService.startAssessment("assess-3").sessionId();
        List<Callable<AssessmentStep>> answers = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            answers.add(() -> sessionService.answerAssessment(sessionId, 0, 1500));
        }

        List<AssessmentStep> accepted = new ArrayList<>();
        int rejected = 0;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            for (Future<AssessmentStep> f : pool.invokeAll(answers)) {
                try {
                    accepted.add(f.get());
                } catch (ExecutionException e) {
                    assertInstanceOf(UnknownSessionException.class, e.getCause());
                    rejected++;
                }
            }
        } finally {
            pool.shutdown();
        }

        List<AssessmentStep> finished = accepted.stream().filter(AssessmentStep::complete).toList();
        assertEquals(1, finished.size());
        assertEquals(40, accepted.size() + rejected);
        assertTrue(accepted.size() >= 15 && accepted.size() <= 30, "accepted " + accepted.size());

        AdaptiveLearningState seeded = finished.get(0).result().adaptiveState();
        int recorded = 0;
        for (Skill skill : Skill.values()) {
            recorded += seeded.mastery(skill).totalAttempts();
        }
        assertEquals(accepted.size(), recorded);
        assertEquals(seeded, sessionService.currentState("assess-3"));
    }
}
