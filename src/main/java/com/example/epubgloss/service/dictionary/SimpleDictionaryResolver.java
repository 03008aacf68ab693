package com.example.epubgloss.service.dictionary;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Small in-memory glossary. Handles a plain trailing "s" so "exploits" finds "exploit".
 */
public class SimpleDictionaryResolver implements DictionaryResolver {

    private final Map<String, String> glosses;

    public SimpleDictionaryResolver(Map<String, String> glosses) {
        Map<String, String> normalized = new HashMap<>();
        glosses.forEach((word, gloss) -> normalized.put(word.toLowerCase(Locale.ROOT), gloss));
        this.glosses = Collections.unmodifiableMap(normalized);
    }

    @Override
    public Optional<String> lookup(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        String base = word.toLowerCase(Locale.ROOT);
        String gloss = glosses.get(base);
        if (gloss == null && base.endsWith("s")) {
            gloss = glosses.get(base.substring(0, base.length() - 1));
        }
        return Optional.ofNullable(gloss).filter(g -> !g.isBlank());
    }
}
