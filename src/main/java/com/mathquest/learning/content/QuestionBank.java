package com.mathquest.learning.content;

import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.mathquest.learning.domain.DomainModels.Difficulty.EASY;
import static com.mathquest.learning.domain.DomainModels.Difficulty.MEDIUM;
import static com.mathquest.learning.domain.DomainModels.Skill.*;

@Component
public class QuestionBank implements QuestionRepository {
    private final List<Question> questions;
    private final Map<String, Question> byId;

    public QuestionBank() {
        this(defaultBank());
    }

    public QuestionBank(List<Question> questions) {
        this.questions = List.copyOf(questions);
        this.byId = this.questions.stream()
                .collect(Collectors.toMap(Question::id, Function.identity(), (a, b) -> a));
    }

    @Override
    public List<Question> questionsFor(Skill skill, Difficulty difficulty) {
        return questions.stream()
                .filter(q -> q.skill() == skill && q.difficulty() == difficulty)
                .toList();
    }

    @Override
    public List<Question> questionsFor(Skill skill) {
        return questions.stream().filter(q -> q.skill() == skill).toList();
    }

    @Override
    public List<Question> anyQuestions(Set<String> excludeIds) {
        Set<String> excluded = excludeIds == null ? Set.of() : excludeIds;
        return questions.stream().filter(q -> !excluded.contains(q.id())).toList();
    }

    @Override
    public Optional<Question> findById(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    @Override
    public Question defaultQuestion() {
        return questions.isEmpty() ? FALLBACK : questions.get(0);
    }

    public int size() {
        return questions.size();
    }

    private static final Question FALLBACK = new Question("default-001", "What is 2 + 3?",
            List.of(5, 4, 6, 7), 0, ADDITION, EASY, "Count up from 2: three more steps!");

    private static List<Question> defaultBank() {
        return List.of(
                q("add-001", "What is 247 + 156?", List.of(403, 393, 413, 303), 0, ADDITION, EASY,
                        "Try adding the ones first (7+6), then the tens (40+50), then the hundreds (200+100)!"),
                q("add-002", "What is 389 + 245?", List.of(534, 624, 634, 644), 2, ADDITION, MEDIUM,
                        "Remember to carry over when digits add up to more than 9!"),
                q("add-003", "What is 512 + 298?", List.of(800, 810, 710, 820), 1, ADDITION, MEDIUM,
                        "298 is close to 300. Try adding 512 + 300 first, then subtract 2!"),
                q("add-004", "What is 175 + 125?", List.of(200, 290, 300, 310), 2, ADDITION, EASY,
                        "175 + 125 is the same as 175 + 100 + 25. Can you solve it step by step?"),

                q("sub-001", "What is 500 - 237?", List.of(263, 273, 363, 253), 0, SUBTRACTION, MEDIUM,
                        "Try counting up from 237 to 500. How many do you need to add?"),
                q("sub-002", "What is 842 - 156?", List.of(686, 696, 676, 786), 0, SUBTRACTION, MEDIUM,
                        "Work from right to left. You may need to borrow from the next column!"),
                q("sub-003", "What is 400 - 125?", List.of(285, 275, 265, 375), 1, SUBTRACTION, EASY,
                        "Think of 400 as 3 hundreds + 9 tens + 10 ones to help you borrow."),
                q("sub-004", "What is 725 - 250?", List.of(475, 485, 465, 575), 0, SUBTRACTION, EASY,
                        "250 is the same as 200 + 50. Subtract 200 first, then subtract 50!"),

                q("mult-001", "What is 7 × 8?", List.of(54, 56, 58, 48), 1, MULTIPLICATION, EASY,
                        "Try skip counting by 7s: 7, 14, 21, 28, 35, 42, 49, 56!"),
                q("mult-002", "What is 9 × 6?", List.of(56, 52, 54, 64), 2, MULTIPLICATION, EASY,
                        "9 × 6 is the same as (10 × 6) - 6. Can you figure it out?"),
                q("mult-003", "What is 8 × 9?", List.of(72, 63, 81, 64), 0, MULTIPLICATION, MEDIUM,
                        "8 × 9 is the same as 9 × 8. Use the trick: (10 × 8) - 8!"),
                q("mult-004", "What is 6 × 7?", List.of(48, 42, 36, 49), 1, MULTIPLICATION, EASY,
                        "Think of 6 × 7 as (6 × 5) + (6 × 2). That's 30 + 12!"),

                q("div-001", "What is 56 ÷ 8?", List.of(6, 7, 8, 9), 1, DIVISION, EASY,
                        "Think: What number times 8 equals 56?"),
                q("div-002", "What is 72 ÷ 9?", List.of(7, 8, 9, 6), 1, DIVISION, EASY,
                        "Division is the opposite of multiplication. 9 times what equals 72?"),
                q("div-003", "What is 63 ÷ 7?", List.of(8, 7, 9, 6), 2, DIVISION, EASY,
                        "Count by 7s until you reach 63: 7, 14, 21, 28, 35, 42, 49, 56, 63!"),
                q("div-004", "What is 81 ÷ 9?", List.of(8, 9, 7, 10), 1, DIVISION, MEDIUM,
                        "81 is a special number - it's 9 × 9!"),

                q("word-001", "Sam has 345 stickers. He gets 178 more. How many stickers does Sam have now?",
                        List.of(523, 513, 533, 423), 0, WORD_PROBLEM, MEDIUM,
                        "\"Gets more\" means you need to add! Add 345 + 178."),
                q("word-002", "A bookshelf has 8 shelves. Each shelf holds 7 books. How many books total?",
                        List.of(54, 56, 15, 49), 1, WORD_PROBLEM, EASY,
                        "When you have equal groups, multiply! 8 shelves × 7 books each."),
                q("word-003", "Maya had 500 coins. She spent 235 coins. How many coins does she have left?",
                        List.of(275, 265, 365, 255), 1, WORD_PROBLEM, MEDIUM,
                        "\"Spent\" means she used some coins. Subtract 235 from 500!"),
                q("word-004", "48 students need to split into 6 equal teams. How many students per team?",
                        List.of(7, 9, 8, 6), 2, WORD_PROBLEM, EASY,
                        "Splitting into equal groups means division! Divide 48 by 6.")
        );
    }

    private static Question q(String id, String prompt, List<Integer> choices, int correctIndex,
                              Skill skill, Difficulty difficulty, String hint) {
        return new Question(id, prompt, choices, correctIndex, skill, difficulty, hint);
    }
}
