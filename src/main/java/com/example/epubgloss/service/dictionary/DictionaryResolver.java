package com.example.epubgloss.service.dictionary;

import java.util.Optional;

/**
 * Resolves a word to a short, display-ready gloss.
 */
public interface DictionaryResolver {

    /**
     * @return the formatted gloss, or empty when the word is unknown
     */
    Optional<String> lookup(String word);
}
