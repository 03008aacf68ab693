package com.example.epubgloss.service.dictionary;

import com.example.epubgloss.model.StardictEntry;
import com.example.epubgloss.repository.StardictEntryRepository;

import java.util.Objects;
import java.util.Optional;

/**
 * Lexical store over the ECDICT {@code stardict} table.
 */
public class JpaLexicalStore implements LexicalStore {

    private final StardictEntryRepository repository;

    public JpaLexicalStore(StardictEntryRepository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    @Override
    public Optional<LexicalRecord> findByWord(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        return repository.findFirstByWordOrderByIdAsc(word).map(JpaLexicalStore::toRecord);
    }

    private static LexicalRecord toRecord(StardictEntry entry) {
        return LexicalRecord.builder()
            .word(entry.getWord())
            .translation(entry.getTranslation())
            .exchange(entry.getExchange())
            .phonetic(entry.getPhonetic())
            .build();
    }
}
