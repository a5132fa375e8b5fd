package com.mathquest.learning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LearningEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(LearningEngineApplication.class, args);
    }
}
