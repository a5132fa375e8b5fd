package com.mathquest.learning.config;

public interface RandomSource {
    double nextDouble();

    int nextInt(int bound);
}
