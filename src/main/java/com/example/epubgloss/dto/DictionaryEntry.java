package com.example.epubgloss.dto;

import lombok.Value;

import java.util.List;

/**
 * Condensed view of a dictionary record: optional phonetic notation plus the glosses kept
 * for display, in first-seen order and without duplicates.
 */
@Value
public class DictionaryEntry {
    String phonetic;
    List<String> glosses;
    /** First translation line as stored, shown when no gloss could be extracted. */
    String rawFirstLine;

    public DictionaryEntry(String phonetic, List<String> glosses, String rawFirstLine) {
        this.phonetic = phonetic;
        this.glosses = List.copyOf(glosses);
        this.rawFirstLine = rawFirstLine;
    }

    public String format(boolean includePhonetic) {
        String gloss = glosses.isEmpty() ? rawFirstLine : String.join("; ", glosses);
        if (includePhonetic && phonetic != null && !phonetic.isBlank()) {
            return "/" + phonetic.trim() + "/ " + gloss;
        }
        return gloss;
    }
}
