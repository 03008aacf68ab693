package com.example.epubgloss.service.dictionary;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lexical store held in memory, keyed by lowercase word. The first record for a word wins.
 *
 * <p>{@link #load(InputStream)} reads tab-separated lines of
 * {@code word, phonetic, translation, exchange}, ECDICT CSV style: line breaks inside the
 * translation are written as a literal {@code \n}, trailing columns may be omitted.</p>
 */
public class InMemoryLexicalStore implements LexicalStore {

    private final Map<String, LexicalRecord> records;

    public InMemoryLexicalStore(Collection<LexicalRecord> records) {
        Map<String, LexicalRecord> byWord = new LinkedHashMap<>();
        for (LexicalRecord record : records) {
            byWord.putIfAbsent(record.getWord().toLowerCase(Locale.ROOT), record);
        }
        this.records = Collections.unmodifiableMap(byWord);
    }

    public static InMemoryLexicalStore load(InputStream input) {
        if (input == null) {
            throw new LinguisticDataUnavailableException("Dictionary not found");
        }
        List<LexicalRecord> records = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] columns = line.split("\t", -1);
                if (columns[0].isBlank()) {
                    continue;
                }
                records.add(LexicalRecord.builder()
                    .word(columns[0].trim())
                    .phonetic(column(columns, 1))
                    .translation(unescape(column(columns, 2)))
                    .exchange(column(columns, 3))
                    .build());
            }
        } catch (IOException e) {
            throw new LinguisticDataUnavailableException("Could not read dictionary", e);
        }
        return new InMemoryLexicalStore(records);
    }

    @Override
    public Optional<LexicalRecord> findByWord(String word) {
        if (word == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(word.toLowerCase(Locale.ROOT)));
    }

    public int size() {
        return records.size();
    }

    private static String column(String[] columns, int index) {
        if (index >= columns.length || columns[index].isBlank()) {
            return null;
        }
        return columns[index].trim();
    }

    private static String unescape(String value) {
        return value == null ? null : value.replace("\\n", "\n");
    }
}
