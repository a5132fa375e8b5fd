package com.mathquest.learning.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LearningConfig {
    private static final Logger log = LoggerFactory.getLogger(LearningConfig.class);

    private final Long seed;

    public LearningConfig(@Value("${learning.random.seed:}") String seed) {
        this.seed = (seed == null || seed.isBlank()) ? null : Long.parseLong(seed.trim());
        if (this.seed != null) {
            log.info("Learning engine randomness seeded with {}", this.seed);
        }
    }

    @Bean
    public Clock learningClock() {
        return Clock.systemUTC();
    }

    @Bean
    public RandomSource skillChoiceRandom() {
        return stream(1);
    }

    @Bean
    public RandomSource jitterRandom() {
        return stream(2);
    }

    @Bean
    public RandomSource messageRandom() {
        return stream(3);
    }

    @Bean
    public RandomSource contentRandom() {
        return stream(4);
    }

    // Distinct offset per stream.
    private RandomSource stream(long offset) {
        return seed == null ? new SeededRandomSource() : new SeededRandomSource(seed * 31 + offset);
    }
}
