package com.mathquest.learning.domain;

import java.util.List;

public class DomainModels {
    public enum Skill {
        ADDITION("Addition"),
        SUBTRACTION("Subtraction"),
        MULTIPLICATION("Multiplication"),
        DIVISION("Division"),
        WORD_PROBLEM("Word Problems");

        private final String displayName;

        Skill(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }
    }

    public enum Difficulty { EASY, MEDIUM }

    public record Question(String id,
                           String prompt,
                           List<Integer> choices,
                           int correctIndex,
                           Skill skill,
                           Difficulty difficulty,
                           String hint) {
        public Question {
            choices = choices == null ? List.of() : List.copyOf(choices);
        }

        /** Any index other than the correct one, including out-of-range values, is a wrong answer. */
        public boolean isCorrect(int answerIndex) {
            return answerIndex == correctIndex;
        }
    }
}
