package com.mathquest.learning;

import com.mathquest.learning.config.SeededRandomSource;
import com.mathquest.learning.content.ProceduralQuestionGenerator;
import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class ProceduralQuestionGeneratorTest {
    private static final Pattern ARITHMETIC = Pattern.compile("What is (\\d+) ([+\\-×÷]) (\\d+)\\?");

    private final ProceduralQuestionGenerator generator = new ProceduralQuestionGenerator(new SeededRandomSource(17));

    @Test
    void everyQuestionHasFourDistinctPositiveChoices() {
        for (Skill skill : Skill.values()) {
            for (Difficulty difficulty : Difficulty.values()) {
                for (int i = 0; i < 50; i++) {
                    Question q = generator.generate(skill, difficulty);

                    assertEquals(skill, q.skill());
                    assertEquals(difficulty, q.difficulty());
                    assertEquals(4, q.choices().size());
                    assertEquals(4, new HashSet<>(q.choices()).size(), q.prompt() + " " + q.choices());
                    assertTrue(q.choices().stream().allMatch(c -> c > 0), q.prompt() + " " + q.choices());
                    assertTrue(q.correctIndex() >= 0 && q.correctIndex() < 4);
                    assertNotNull(q.hint());
                    assertTrue(q.id().startsWith("gen-"));
                }
            }
        }
    }

    @Test
    void arithmeticAnswerSitsAtCorrectIndex() {
        List<Skill> arithmetic = List.of(Skill.ADDITION, Skill.SUBTRACTION, Skill.MULTIPLICATION, Skill.DIVISION);
        for (Skill skill : arithmetic) {
            for (Difficulty difficulty : Difficulty.values()) {
                for (int i = 0; i < 50; i++) {
                    Question q = generator.generate(skill, difficulty);
                    Matcher m = ARITHMETIC.matcher(q.prompt());
                    assertTrue(m.matches(), q.prompt());

                    int a = Integer.parseInt(m.group(1));
                    int b = Integer.parseInt(m.group(3));
                    int expected = switch (m.group(2)) {
                        case "+" -> a + b;
                        case "-" -> a - b;
                        case "×" -> a * b;
                        default -> {
                            assertEquals(0, a % b, "division must be exact: " + q.prompt());
                            yield a / b;
                        }
                    };
                    assertEquals(expected, q.choices().get(q.correctIndex()), q.prompt());
                    assertTrue(q.isCorrect(q.correctIndex()));
                }
            }
        }
    }

    @Test
    void wordProblemsCarryNoTemplatePlaceholders() {
        for (int i = 0; i < 100; i++) {
            Question q = generator.generate(Skill.WORD_PROBLEM, i % 2 == 0 ? Difficulty.EASY : Difficulty.MEDIUM);

            assertFalse(q.prompt().contains("{"), q.prompt());
            assertFalse(q.hint().contains("{"), q.hint());
        }
    }

    @Test
    void smallAnswersStillGetPositiveDistinctDistractors() {
        for (int i = 0; i < 200; i++) {
            Question q = generator.generate(Skill.DIVISION, Difficulty.EASY);

            assertTrue(q.choices().get(q.correctIndex()) <= 9, q.prompt());
            assertEquals(4, new HashSet<>(q.choices()).size(), q.choices().toString());
            assertTrue(q.choices().stream().allMatch(v -> v > 0), q.choices().toString());
        }
    }
}
