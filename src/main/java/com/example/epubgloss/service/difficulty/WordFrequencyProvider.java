package com.example.epubgloss.service.difficulty;

/**
 * Source of word frequencies on the Zipf scale.
 */
public interface WordFrequencyProvider {

    /**
     * @param word lowercase word form
     * @param language language code, e.g. "en"
     * @return Zipf frequency in [0, 8]; 0 when the word is unknown
     */
    double frequency(String word, String language);
}
