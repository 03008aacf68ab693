package com.example.epubgloss.service.difficulty;

public interface Lemmatizer {

    /**
     * Returns the base form of {@code word} read as the given category, or {@code word}
     * itself when no base form is known.
     */
    String lemmatize(String word, PartOfSpeech partOfSpeech);
}
