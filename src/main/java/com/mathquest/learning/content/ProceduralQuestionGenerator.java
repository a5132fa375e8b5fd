package com.mathquest.learning.content;

import com.mathquest.learning.config.RandomSource;
import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Component
public class ProceduralQuestionGenerator implements QuestionGenerator {
    private static final int[] DISTRACTOR_OFFSETS = {1, -1, 10, -10, 2, -2, 5, -5, 11, -11, 9, -9};
    private static final int[][] EASY_FACTS = {
            {2, 3}, {2, 4}, {2, 5}, {3, 3}, {3, 4}, {4, 4}, {5, 5},
            {2, 6}, {3, 5}, {4, 5}, {2, 7}, {3, 6}, {5, 6}
    };
    private static final List<String> NAMES = List.of(
            "Emma", "Liam", "Olivia", "Noah", "Ava", "James", "Sophia", "Lucas", "Mia", "Ethan");
    private static final List<String> GIVERS = List.of(
            "their friend", "their teacher", "their mom", "their dad", "their sister", "their brother");

    private final RandomSource random;
    private final List<WordTemplate> templates;

    public ProceduralQuestionGenerator(@Qualifier("contentRandom") RandomSource random) {
        this.random = random;
        this.templates = wordTemplates();
    }

    @Override
    public Question generate(Skill skill, Difficulty difficulty) {
        return switch (skill) {
            case ADDITION -> addition(difficulty);
            case SUBTRACTION -> subtraction(difficulty);
            case MULTIPLICATION -> multiplication(difficulty);
            case DIVISION -> division(difficulty);
            case WORD_PROBLEM -> wordProblem(difficulty);
        };
    }

    private Question addition(Difficulty difficulty) {
        int a;
        int b;
        String hint;
        if (difficulty == Difficulty.EASY) {
            a = between(10, 59);
            b = between(10, 59);
            hint = String.format("Try adding the ones first (%d + %d), then add the tens!", a % 10, b % 10);
        } else {
            a = between(100, 599);
            b = between(100, 499);
            int rounded = Math.round(b / 100f) * 100;
            hint = String.format("Break it down: %d + %d = %d, then add the rest!", a, rounded, a + rounded);
        }
        return build("add", String.format("What is %d + %d?", a, b), a + b, Skill.ADDITION, difficulty, hint);
    }

    private Question subtraction(Difficulty difficulty) {
        int a;
        int b;
        String hint;
        if (difficulty == Difficulty.EASY) {
            a = between(50, 99);
            b = between(10, 39);
            hint = String.format("Count up from %d to %d. How many steps?", b, a);
        } else {
            a = between(300, 799);
            b = between(100, 349);
            int rounded = Math.round(b / 100f) * 100;
            hint = String.format("%d - %d = %d, then subtract the rest!", a, rounded, a - rounded);
        }
        if (b >= a) {
            a += 100;
        }
        return build("sub", String.format("What is %d - %d?", a, b), a - b, Skill.SUBTRACTION, difficulty, hint);
    }

    private Question multiplication(Difficulty difficulty) {
        int a;
        int b;
        String hint;
        if (difficulty == Difficulty.EASY) {
            int[] pair = EASY_FACTS[random.nextInt(EASY_FACTS.length)];
            a = pair[0];
            b = pair[1];
            int step = a;
            hint = "Skip count by " + a + ": " + IntStream.rangeClosed(1, b)
                    .mapToObj(i -> String.valueOf(step * i))
                    .collect(Collectors.joining(", "));
        } else {
            a = between(6, 11);
            b = between(6, 11);
            if (a == 9 || b == 9) {
                int other = a == 9 ? b : a;
                hint = String.format("9 × %d = 10 × %d - %d = %d - %d", other, other, other, 10 * other, other);
            } else {
                hint = String.format("Split it up: %d × %d = (%d × %d) + (%d × %d)", a, b, a, b - 1, a, 1);
            }
        }
        return build("mult", String.format("What is %d × %d?", a, b), a * b, Skill.MULTIPLICATION, difficulty, hint);
    }

    private Question division(Difficulty difficulty) {
        int divisor;
        int quotient;
        String hint;
        if (difficulty == Difficulty.EASY) {
            divisor = between(2, 6);
            quotient = between(2, 9);
            hint = String.format("Think: What times %d equals %d?", divisor, divisor * quotient);
        } else {
            divisor = between(5, 10);
            quotient = between(5, 12);
            hint = String.format("%d × ? = %d. Count by %ds!", divisor, divisor * quotient, divisor);
        }
        int dividend = divisor * quotient;
        return build("div", String.format("What is %d ÷ %d?", dividend, divisor), quotient, Skill.DIVISION, difficulty, hint);
    }

    private Question wordProblem(Difficulty difficulty) {
        WordTemplate template = templates.get(random.nextInt(templates.size()));
        int[] numbers = template.numbers().apply(difficulty);
        int a = numbers[0];
        int b = numbers[1];
        String name = NAMES.get(random.nextInt(NAMES.size()));
        String giver = GIVERS.get(random.nextInt(GIVERS.size()));

        int correct = switch (template.operation()) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> a / b;
        };

        String prompt = template.text()
                .replace("{name}", name)
                .replace("{giver}", giver)
                .replace("{a}", String.valueOf(a))
                .replace("{b}", String.valueOf(b));
        String hint = template.hint()
                .replace("{a}", String.valueOf(a))
                .replace("{b}", String.valueOf(b));
        return build("word", prompt, correct, Skill.WORD_PROBLEM, difficulty, hint);
    }

    private Question build(String prefix, String prompt, int correct, Skill skill, Difficulty difficulty, String hint) {
        List<Integer> choices = new ArrayList<>();
        choices.add(correct);
        choices.addAll(distractors(correct));
        shuffle(choices);
        return new Question("gen-" + prefix + "-" + suffix(), prompt, choices, choices.indexOf(correct), skill, difficulty, hint);
    }

    private List<Integer> distractors(int correct) {
        Set<Integer> wrong = new LinkedHashSet<>();
        List<Integer> offsets = new ArrayList<>();
        for (int offset : DISTRACTOR_OFFSETS) {
            offsets.add(offset);
        }
        shuffle(offsets);
        for (int offset : offsets) {
            if (wrong.size() >= 3) break;
            int value = correct + offset;
            if (value > 0) {
                wrong.add(value);
            }
        }
        while (wrong.size() < 3) {
            int value = correct + random.nextInt(20) - 10;
            if (value > 0 && value != correct) {
                wrong.add(value);
            }
        }
        return new ArrayList<>(wrong);
    }

    private <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T tmp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, tmp);
        }
    }

    private int between(int minInclusive, int maxInclusive) {
        return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
    }

    private String suffix() {
        return Integer.toString(random.nextInt(36 * 36 * 36 * 36 * 36), 36);
    }

    private List<WordTemplate> wordTemplates() {
        return List.of(
                new WordTemplate("{name} has {a} stickers. {giver} gives them {b} more. How many stickers does {name} have now?",
                        Operation.ADD,
                        d -> d == Difficulty.EASY ? pair(between(20, 69), between(10, 39)) : pair(between(100, 399), between(50, 249)),
                        "\"Gives more\" means add! {a} + {b} = ?"),
                new WordTemplate("A bakery made {a} muffins in the morning and {b} in the afternoon. How many muffins total?",
                        Operation.ADD,
                        d -> d == Difficulty.EASY ? pair(between(20, 59), between(20, 59)) : pair(between(100, 299), between(100, 299)),
                        "\"Total\" means add them together!"),
                new WordTemplate("{name} had {a} coins. {name} spent {b} coins at the store. How many coins are left?",
                        Operation.SUBTRACT,
                        d -> portionOf(d == Difficulty.EASY ? between(50, 99) : between(200, 599), 0.4, 0.3),
                        "\"Spent\" means it's gone! Subtract {b} from {a}."),
                new WordTemplate("The library has {a} books. Students borrowed {b} books. How many books are still in the library?",
                        Operation.SUBTRACT,
                        d -> portionOf(d == Difficulty.EASY ? between(100, 199) : between(300, 799), 0.3, 0.3),
                        "\"Borrowed\" means taken away. {a} - {b} = ?"),
                new WordTemplate("There are {a} rows of desks. Each row has {b} desks. How many desks in total?",
                        Operation.MULTIPLY,
                        d -> d == Difficulty.EASY ? pair(between(3, 7), between(3, 7)) : pair(between(6, 10), between(6, 10)),
                        "Rows × desks per row = total desks. {a} × {b} = ?"),
                new WordTemplate("{name} bought {a} packs of pencils. Each pack has {b} pencils. How many pencils in all?",
                        Operation.MULTIPLY,
                        d -> d == Difficulty.EASY ? pair(between(2, 7), between(4, 9)) : pair(between(5, 10), between(6, 11)),
                        "Packs × pencils per pack = total. Multiply!"),
                new WordTemplate("{a} students need to form {b} equal teams. How many students per team?",
                        Operation.DIVIDE,
                        d -> d == Difficulty.EASY ? exact(between(3, 6), between(4, 9)) : exact(between(5, 9), between(6, 11)),
                        "\"Equal teams\" means divide! {a} ÷ {b} = ?"),
                new WordTemplate("{name} has {a} cookies to share equally among {b} friends. How many cookies does each friend get?",
                        Operation.DIVIDE,
                        d -> d == Difficulty.EASY ? exact(between(2, 5), between(3, 8)) : exact(between(4, 8), between(5, 10)),
                        "\"Share equally\" = divide. {a} ÷ {b} = ?")
        );
    }

    private static int[] pair(int a, int b) {
        return new int[]{a, b};
    }

    // Subtrahend is a share of the total so the difference stays positive.
    private int[] portionOf(int total, double base, double spread) {
        int b = (int) Math.floor(total * base) + random.nextInt(Math.max(1, (int) (total * spread)));
        return pair(total, b);
    }

    private static int[] exact(int divisor, int quotient) {
        return pair(divisor * quotient, divisor);
    }

    private enum Operation { ADD, SUBTRACT, MULTIPLY, DIVIDE }

    private record WordTemplate(String text, Operation operation, Function<Difficulty, int[]> numbers, String hint) {}
}
