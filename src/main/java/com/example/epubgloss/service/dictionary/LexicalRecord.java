package com.example.epubgloss.service.dictionary;

import lombok.Builder;
import lombok.Value;

/**
 * Dictionary record as returned by a {@link LexicalStore}.
 */
@Value
@Builder
public class LexicalRecord {
    String word;
    String translation;
    String exchange;
    String phonetic;

    public boolean hasTranslation() {
        return translation != null && !translation.isBlank();
    }
}
