package com.mathquest.learning.content;

import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface QuestionRepository {
    List<Question> questionsFor(Skill skill, Difficulty difficulty);

    default List<Question> questionsFor(Skill skill) {
        List<Question> all = new ArrayList<>();
        for (Difficulty difficulty : Difficulty.values()) {
            all.addAll(questionsFor(skill, difficulty));
        }
        return all;
    }

    List<Question> anyQuestions(Set<String> excludeIds);

    Optional<Question> findById(String id);

    /** Returned when nothing else is available; never null. */
    Question defaultQuestion();
}
