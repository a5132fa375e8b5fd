package com.mathquest.learning.selection;

import com.mathquest.learning.domain.DomainModels.Question;

import java.util.List;

public class SelectionModels {
    public record ScoredCandidate(Question question, double score, List<FactorScore> factors) {}

    public record FactorScore(String name, double value) {}
}
