package com.example.epubgloss.service.difficulty;

import com.example.epubgloss.dto.WordMatch;

import java.util.List;

/**
 * Decides which words of a text are worth glossing.
 */
public interface DifficultyClassifier {

    /**
     * Candidate words of {@code text} in left-to-right order, never overlapping.
     */
    List<WordMatch> extractWords(String text);

    boolean isDifficult(String word);
}
