package com.mathquest.learning.content;

import com.mathquest.learning.domain.DomainModels.Difficulty;
import com.mathquest.learning.domain.DomainModels.Question;
import com.mathquest.learning.domain.DomainModels.Skill;

public interface QuestionGenerator {
    Question generate(Skill skill, Difficulty difficulty);
}
