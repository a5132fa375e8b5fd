package com.mathquest.learning.service;

import com.mathquest.learning.assessment.AssessmentModels.AssessmentState;
import com.mathquest.learning.assessment.AssessmentModels.DiagnosticResult;
import com.mathquest.learning.assessment.DiagnosticAssessmentService;
import com.mathquest.learning.content.QuestionRepository;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.AdaptiveLearningState;
import com.mathquest.learning.mastery.SkillMasteryTracker;
import com.mathquest.learning.recommendation.RecommendationModels.LearnerOverview;
import com.mathquest.learning.recommendation.RecommendationService;
import com.mathquest.learning.repository.LearnerStateJdbcRepository;
import com.mathquest.learning.selection.AdaptiveQuestionSelector;
import com.mathquest.learning.service.SessionModels.AssessmentStep;
import com.mathquest.learning.service.SessionModels.PracticeAnswerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class LearnerSessionService {
    private static final Logger log = LoggerFactory.getLogger(LearnerSessionService.class);

    private final SkillMasteryTracker tracker;
    private final AdaptiveQuestionSelector selector;
    private final DiagnosticAssessmentService assessmentService;
    private final RecommendationService recommendationService;
    private final QuestionRepository questionRepository;
    private final LearnerStateJdbcRepository repository;

    private final Map<String, AssessmentSession> assessments = new ConcurrentHashMap<>();
    private final Map<String, Object> learnerLocks = new ConcurrentHashMap<>();

    public LearnerSessionService(SkillMasteryTracker tracker,
                                 AdaptiveQuestionSelector selector,
                                 DiagnosticAssessmentService assessmentService,
                                 RecommendationService recommendationService,
                                 QuestionRepository questionRepository,
                                 LearnerStateJdbcRepository repository) {
        this.tracker = tracker;
        this.selector = selector;
        this.assessmentService = assessmentService;
        this.recommendationService = recommendationService;
        this.questionRepository = questionRepository;
        this.repository = repository;
    }

    public AdaptiveLearningState currentState(String learnerId) {
        return repository.loadState(learnerId).orElseGet(tracker::initialState);
    }

    public Question nextQuestion(String learnerId, Set<String> excludeIds, Skill forcedSkill) {
        return selector.selectNext(currentState(learnerId), excludeIds, forcedSkill);
    }

    public List<String> adaptiveQuest(String learnerId, int count) {
        return selector.buildAdaptiveQuest(currentState(learnerId), count);
    }

    public PracticeAnswerResult submitPracticeAnswer(String learnerId, String questionId, int answerIndex, long responseTimeMs) {
        Question question = questionRepository.findById(questionId)
                .orElseThrow(() -> new UnknownQuestionException(questionId));
        boolean correct = question.isCorrect(answerIndex);

        AdaptiveLearningState after;
        synchronized (lockFor(learnerId)) {
            AdaptiveLearningState before = tracker.startSession(currentState(learnerId));
            after = tracker.addPlayTime(
                    tracker.recordOutcome(before, question, correct, responseTimeMs), responseTimeMs);
            repository.saveState(learnerId, after);
        }

        log.debug("Learner {} answered {} ({}), {} mastery now {}", learnerId, questionId,
                correct ? "correct" : "wrong", question.skill(), after.mastery(question.skill()).mastery());

        return new PracticeAnswerResult(questionId, correct, question.correctIndex(),
                correct ? null : question.hint(),
                question.skill(),
                after.mastery(question.skill()),
                after.difficultyMode(),
                recommendationService.checkEncouragement(after).orElse(null));
    }

    public AssessmentStep startAssessment(String learnerId) {
        String sessionId = UUID.randomUUID().toString();
        AssessmentState state = assessmentService.createAssessment();
        assessments.put(sessionId, new AssessmentSession(learnerId, state));
        log.info("Started placement assessment {} for learner {}", sessionId, learnerId);
        return step(sessionId, state, null);
    }

    public AssessmentStep answerAssessment(String sessionId, int answerIndex, long responseTimeMs) {
        AtomicReference<AssessmentStep> answered = new AtomicReference<>();
        assessments.computeIfPresent(sessionId, (id, session) -> {
            AssessmentState next = assessmentService.processAnswer(session.state(), answerIndex, responseTimeMs);
            if (!next.complete()) {
                answered.set(step(id, next, null));
                return new AssessmentSession(session.learnerId(), next);
            }
            answered.set(step(id, next, finish(id, session.learnerId(), next)));
            return null;
        });
        if (answered.get() == null) {
            log.warn("Answer received for unknown assessment session {}", sessionId);
            throw new UnknownSessionException(sessionId);
        }
        return answered.get();
    }

    public DiagnosticResult assessmentResult(String learnerId) {
        return repository.loadLatestDiagnostic(learnerId)
                .orElseThrow(() -> new AssessmentIncompleteException(learnerId));
    }

    public LearnerOverview recommendations(String learnerId) {
        return recommendationService.overview(currentState(learnerId));
    }

    private DiagnosticResult finish(String sessionId, String learnerId, AssessmentState completed) {
        DiagnosticResult result = assessmentService.buildResult(completed);
        synchronized (lockFor(learnerId)) {
            repository.saveDiagnostic(learnerId, result);
            repository.saveState(learnerId, result.adaptiveState());
        }
        log.info("Placement assessment {} finished for learner {}: level {}, grade {}, focus {}",
                sessionId, learnerId, result.overallLevel(), result.estimatedGradeLevel(), result.recommendedFocusSkill());
        return result;
    }

    // Load-modify-save of one learner's state must not interleave.
    private Object lockFor(String learnerId) {
        return learnerLocks.computeIfAbsent(learnerId, id -> new Object());
    }

    private AssessmentStep step(String sessionId, AssessmentState state, DiagnosticResult result) {
        return new AssessmentStep(sessionId, state.complete(), state.currentQuestion(),
                assessmentService.progress(state),
                assessmentService.encouragement(state).orElse(null),
                result);
    }

    private record AssessmentSession(String learnerId, AssessmentState state) {}
}
