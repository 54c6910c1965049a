package com.ai.flashcards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Flashcard Generator Application
 * Main entry point for the Spring Boot application.
 */
@SpringBootApplication
@EnableScheduling
public class FlashcardGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlashcardGeneratorApplication.class, args);
    }
}
