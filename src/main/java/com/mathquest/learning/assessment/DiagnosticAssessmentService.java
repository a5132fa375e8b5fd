package com.mathquest.learning.assessment;

import com.mathquest.learning.assessment.AssessmentModels.*;
import com.mathquest.learning.config.RandomSource;
import com.mathquest.learning.content.QuestionGenerator;
import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import com.mathquest.learning.mastery.MasteryModels.*;
import com.mathquest.learning.mastery.SkillMasteryTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

@Service
public class DiagnosticAssessmentService {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticAssessmentService.class);

    public static final List<Skill> SKILL_ORDER = List.of(Skill.values());

    static final int MIN_QUESTIONS_PER_SKILL = 3;
    static final int BASE_QUESTIONS_PER_SKILL = 4;
    static final int MAX_QUESTIONS_PER_SKILL = 6;
    static final int MAX_WEAKNESS_EXAMPLES = 3;
    static final int CONFIDENCE_PER_QUESTION = 20;
    // Perfect and zero scores on a handful of questions are weak evidence.
    static final int EXTREME_SCORE_CONFIDENCE_CAP = 70;

    public static final String STARTER_WORLD = "world-school";
    public static final String SECOND_WORLD = "world-forest";

    private static final List<String> SKILL_SWITCH_MESSAGES = List.of(
            "Great job! On to the next challenge!",
            "Nice work! Keep it up!",
            "You're doing awesome!",
            "Fantastic! Let's keep going!");
    private static final List<String> MISS_MESSAGES = List.of(
            "Tricky one! Let's try another!",
            "Good try! You're learning!",
            "That's okay, practice makes perfect!");

    private final QuestionGenerator generator;
    private final Clock clock;
    private final RandomSource messageRandom;

    public DiagnosticAssessmentService(QuestionGenerator generator,
                                       Clock clock,
                                       @Qualifier("messageRandom") RandomSource messageRandom) {
        this.generator = generator;
        this.clock = clock;
        this.messageRandom = messageRandom;
    }

    public AssessmentState createAssessment() {
        Skill first = SKILL_ORDER.get(0);
        return new AssessmentState(first, 0, 0, 0, Rung.EASY, List.of(), Map.of(), false,
                nextQuestion(first, Rung.EASY));
    }

    public AssessmentState processAnswer(AssessmentState state, int answerIndex, long responseTimeMs) {
        if (state.complete() || state.currentQuestion() == null) {
            return state;
        }

        AssessmentQuestion asked = state.currentQuestion();
        boolean correct = asked.question().isCorrect(answerIndex);

        List<AssessmentResponse> responses = new ArrayList<>(state.responses());
        responses.add(new AssessmentResponse(state.currentSkill(), asked, correct, responseTimeMs, clock.instant()));

        int questionsInSkill = state.questionsInSkill() + 1;
        int correctInSkill = state.correctInSkill() + (correct ? 1 : 0);

        if (!shouldAdvance(questionsInSkill, correctInSkill)) {
            Rung rung = nextRung(correctInSkill, questionsInSkill, state.rung());
            return new AssessmentState(state.currentSkill(), state.skillIndex(), questionsInSkill, correctInSkill, rung,
                    responses, state.skillResults(), false, nextQuestion(state.currentSkill(), rung));
        }

        Map<Skill, SkillAssessmentResult> results = new EnumMap<>(Skill.class);
        results.putAll(state.skillResults());
        SkillAssessmentResult skillResult = calculateResult(state.currentSkill(), responses);
        results.put(state.currentSkill(), skillResult);

        int nextIndex = state.skillIndex() + 1;
        if (nextIndex >= SKILL_ORDER.size()) {
            log.debug("Assessment complete after {} answers", responses.size());
            return new AssessmentState(state.currentSkill(), state.skillIndex(), questionsInSkill, correctInSkill,
                    state.rung(), responses, results, true, null);
        }

        Skill nextSkill = SKILL_ORDER.get(nextIndex);
        log.debug("Assessment leaving {} after {} questions ({} correct, level {}), moving to {}",
                state.currentSkill(), questionsInSkill, correctInSkill, skillResult.estimatedLevel(), nextSkill);
        return new AssessmentState(nextSkill, nextIndex, 0, 0, Rung.EASY, responses, results, false,
                nextQuestion(nextSkill, Rung.EASY));
    }

    public DiagnosticResult buildResult(AssessmentState state) {
        Map<Skill, SkillAssessmentResult> results = new EnumMap<>(Skill.class);
        for (Skill skill : SKILL_ORDER) {
            SkillAssessmentResult known = state.skillResults().get(skill);
            results.put(skill, known != null ? known : calculateResult(skill, state.responses()));
        }

        long below = results.values().stream().filter(r -> r.estimatedLevel() == GradeBand.BELOW).count();
        long above = results.values().stream().filter(r -> r.estimatedLevel() == GradeBand.ABOVE).count();
        GradeBand overall = below >= 3 ? GradeBand.BELOW : above >= 3 ? GradeBand.ABOVE : GradeBand.ON;

        int overallConfidence = (int) Math.round(results.values().stream()
                .mapToInt(SkillAssessmentResult::confidence)
                .average()
                .orElse(0.0));

        double levelSum = results.values().stream().mapToDouble(r -> levelScore(r.estimatedLevel())).sum();
        double estimatedGradeLevel = Math.round(levelSum / SKILL_ORDER.size() * 10) / 10.0;

        SkillAssessmentResult focus = null;
        for (SkillAssessmentResult r : results.values()) {
            if (focus == null || r.accuracy() < focus.accuracy()) focus = r;
        }

        String world = overall == GradeBand.ABOVE ? SECOND_WORLD : STARTER_WORLD;

        return new DiagnosticResult(overall, overallConfidence, results, world, focus.skill(),
                personalizedMessage(results, overall), estimatedGradeLevel,
                bootstrapState(state.responses(), results));
    }

    public AssessmentProgress progress(AssessmentState state) {
        int percent = state.complete()
                ? 100
                : (int) Math.round((state.skillIndex() + state.questionsInSkill() / (double) BASE_QUESTIONS_PER_SKILL)
                / SKILL_ORDER.size() * 100);
        return new AssessmentProgress(state.currentSkill().displayName(), state.skillIndex() + 1, SKILL_ORDER.size(),
                state.questionsInSkill() + 1, percent);
    }

    public Optional<String> encouragement(AssessmentState state) {
        if (state.questionsInSkill() == 0 && state.skillIndex() > 0) {
            return Optional.of(SKILL_SWITCH_MESSAGES.get(state.skillIndex() % SKILL_SWITCH_MESSAGES.size()));
        }
        if (state.correctInSkill() >= 3 && state.questionsInSkill() == state.correctInSkill()) {
            return Optional.of("On fire! You really know this!");
        }
        if (state.questionsInSkill() > 0 && state.correctInSkill() < state.questionsInSkill() && !state.responses().isEmpty()) {
            AssessmentResponse last = state.responses().get(state.responses().size() - 1);
            if (!last.correct()) {
                return Optional.of(MISS_MESSAGES.get(messageRandom.nextInt(MISS_MESSAGES.size())));
            }
        }
        return Optional.empty();
    }

    public static boolean shouldAdvance(int questionsInSkill, int correctInSkill) {
        if (questionsInSkill < MIN_QUESTIONS_PER_SKILL) return false;
        if (questionsInSkill >= MAX_QUESTIONS_PER_SKILL) return true;
        if (correctInSkill == questionsInSkill || correctInSkill == 0) return true;
        return questionsInSkill >= BASE_QUESTIONS_PER_SKILL;
    }

    public static Rung nextRung(int correct, int asked, Rung current) {
        double accuracy = asked > 0 ? (double) correct / asked : 0.0;
        if (accuracy >= 0.8 && current != Rung.HARD) return current.up();
        if (accuracy < 0.4 && current != Rung.EASY) return current.down();
        return current;
    }

    public static SkillAssessmentResult calculateResult(Skill skill, List<AssessmentResponse> responses) {
        List<AssessmentResponse> forSkill = responses.stream().filter(r -> r.skill() == skill).toList();
        int total = forSkill.size();
        int correct = (int) forSkill.stream().filter(AssessmentResponse::correct).count();
        double accuracy = total > 0 ? (double) correct / total : 0.0;

        GradeBand level = accuracy >= 0.8 ? GradeBand.ABOVE : accuracy >= 0.5 ? GradeBand.ON : GradeBand.BELOW;

        int confidence = Math.min(100, total * CONFIDENCE_PER_QUESTION);
        if (correct == total || correct == 0) {
            confidence = Math.min(confidence, EXTREME_SCORE_CONFIDENCE_CAP);
        }

        Difficulty starting = accuracy >= 0.7 ? Difficulty.MEDIUM : Difficulty.EASY;

        List<String> weaknesses = forSkill.stream()
                .filter(r -> !r.correct())
                .map(r -> r.question().question().prompt())
                .limit(MAX_WEAKNESS_EXAMPLES)
                .toList();

        return new SkillAssessmentResult(skill, total, correct, level, confidence, starting, weaknesses);
    }

    private AssessmentQuestion nextQuestion(Skill skill, Rung rung) {
        Question generated = generator.generate(skill, rung.contentDifficulty());
        Question tagged = new Question("assess-" + generated.id(), generated.prompt(), generated.choices(),
                generated.correctIndex(), generated.skill(), generated.difficulty(), generated.hint());
        double gradeLevel = switch (rung) {
            case EASY -> 2.0;
            case MEDIUM -> 3.0;
            case HARD -> 4.0;
        };
        if (skill == Skill.WORD_PROBLEM) gradeLevel += 0.5;
        return new AssessmentQuestion(tagged, rung, gradeLevel, rung == Rung.MEDIUM ? 1.5 : 1.0);
    }

    private static double levelScore(GradeBand band) {
        return switch (band) {
            case BELOW -> 2.0;
            case ON -> 3.0;
            case ABOVE -> 4.0;
        };
    }

    private String personalizedMessage(Map<Skill, SkillAssessmentResult> results, GradeBand overall) {
        List<SkillAssessmentResult> byStrength = results.values().stream()
                .sorted(Comparator.comparingDouble(SkillAssessmentResult::accuracy).reversed())
                .toList();
        String strongest = byStrength.get(0).skill().displayName();
        String weakest = byStrength.get(byStrength.size() - 1).skill().displayName();

        return switch (overall) {
            case ABOVE -> "Wow! You're a math superstar! You're especially amazing at " + strongest
                    + "! Let's challenge you with some harder adventures!";
            case ON -> "Great job! You know your 3rd grade math! " + strongest + " is your superpower! "
                    + "Let's practice " + weakest + " to make you even stronger!";
            case BELOW -> "Good effort! Everyone starts somewhere! You did well with " + strongest
                    + "! We'll practice together and you'll be a math hero in no time!";
        };
    }

    private AdaptiveLearningState bootstrapState(List<AssessmentResponse> responses,
                                                 Map<Skill, SkillAssessmentResult> results) {
        Map<Skill, SkillMastery> mastery = new EnumMap<>(Skill.class);
        for (SkillAssessmentResult result : results.values()) {
            List<Integer> outcomes = responses.stream()
                    .filter(r -> r.skill() == result.skill())
                    .map(r -> r.correct() ? 1 : 0)
                    .toList();
            if (outcomes.size() > SkillMasteryTracker.RECENT_WINDOW) {
                outcomes = outcomes.subList(outcomes.size() - SkillMasteryTracker.RECENT_WINDOW, outcomes.size());
            }
            int seeded = result.questionsAsked() == 0
                    ? SkillMasteryTracker.NEUTRAL_MASTERY
                    : (int) Math.round(100.0 * result.correct() / result.questionsAsked());
            Trend trend = result.estimatedLevel() == GradeBand.BELOW ? Trend.STRUGGLING : Trend.STABLE;
            mastery.put(result.skill(), new SkillMastery(result.skill(), result.questionsAsked(), result.correct(),
                    outcomes, seeded, trend));
        }

        Map<String, QuestionHistory> history = new LinkedHashMap<>();
        for (AssessmentResponse r : responses) {
            String id = r.question().id();
            QuestionHistory previous = history.get(id);
            int attempts = previous == null ? 1 : previous.attempts() + 1;
            int correct = (previous == null ? 0 : previous.correct()) + (r.correct() ? 1 : 0);
            double mean = previous == null
                    ? r.responseTimeMs()
                    : (previous.averageTimeMs() * previous.attempts() + r.responseTimeMs()) / attempts;
            history.put(id, new QuestionHistory(id, attempts, correct, r.answeredAt(), r.correct(), mean));
        }

        long correctTotal = responses.stream().filter(AssessmentResponse::correct).count();
        double overallAccuracy = responses.isEmpty() ? 0.0 : (double) correctTotal / responses.size();
        DifficultyMode mode = overallAccuracy >= 0.7 ? DifficultyMode.ADAPTIVE : DifficultyMode.EASY;

        // No responses means no session date; startSession stamps it on first practice.
        LocalDate lastSession = responses.isEmpty()
                ? null
                : LocalDate.ofInstant(latest(responses), clock.getZone());
        long playTime = responses.stream().mapToLong(AssessmentResponse::responseTimeMs).filter(t -> t > 0).sum();

        return new AdaptiveLearningState(mastery, history, mode, 0, 0, lastSession, playTime);
    }

    private static Instant latest(List<AssessmentResponse> responses) {
        return responses.stream().map(AssessmentResponse::answeredAt).max(Comparator.naturalOrder()).orElseThrow();
    }
}
