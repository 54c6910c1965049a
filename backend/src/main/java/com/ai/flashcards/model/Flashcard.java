package com.ai.flashcards.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single front/back study card. Front and back are never blank once a card
 * has passed normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Flashcard {

    private String front;

    private String back;

    private String subject;

    private Difficulty difficulty;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
