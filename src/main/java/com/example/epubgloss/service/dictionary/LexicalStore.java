package com.example.epubgloss.service.dictionary;

import java.util.Optional;

/**
 * Read-only, exact-match record retrieval by lowercase word form.
 */
public interface LexicalStore {

    Optional<LexicalRecord> findByWord(String word);
}
