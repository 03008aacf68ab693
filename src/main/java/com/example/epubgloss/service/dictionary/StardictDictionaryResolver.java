package com.example.epubgloss.service.dictionary;

import com.example.epubgloss.dto.DictionaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves glosses from ECDICT-style records.
 *
 * <p>Lookup goes to the exact lowercase word first. A record without a translation is
 * followed to its base form through the {@code exchange} field
 * ({@code "p:ran/d:ran/i:running/3:runs/s:runs/0:run"}), where code 0 is the lemma and
 * 1-3 are inflected forms. The first form coded 0, 1 or 2 is used, whichever comes first.</p>
 *
 * <p>Translations are condensed to at most {@code maxDefinitions} distinct glosses taken in
 * order across lines, with leading part-of-speech tags ("n. ", "vt. ") removed.</p>
 */
public class StardictDictionaryResolver implements DictionaryResolver {

    private static final Logger logger = LoggerFactory.getLogger(StardictDictionaryResolver.class);

    public static final int DEFAULT_MAX_DEFINITIONS = 2;

    private static final Pattern LEMMA_PATTERN = Pattern.compile("[012]:(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern POS_PREFIX = Pattern.compile("^[a-z]{1,4}\\.\\s+");
    private static final Pattern GLOSS_DELIMITER = Pattern.compile("[,;，；]");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private final LexicalStore store;
    private final int maxDefinitions;
    private final boolean includePhonetic;

    public StardictDictionaryResolver(LexicalStore store) {
        this(store, DEFAULT_MAX_DEFINITIONS, true);
    }

    public StardictDictionaryResolver(LexicalStore store, int maxDefinitions, boolean includePhonetic) {
        if (maxDefinitions < 1) {
            throw new IllegalArgumentException("maxDefinitions must be at least 1, got " + maxDefinitions);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.maxDefinitions = maxDefinitions;
        this.includePhonetic = includePhonetic;
    }

    @Override
    public Optional<String> lookup(String word) {
        return resolve(word).map(entry -> entry.format(includePhonetic));
    }

    /**
     * Finds the record that carries the translation for {@code word}, following the lemma
     * link when the word's own record has none.
     */
    public Optional<DictionaryEntry> resolve(String word) {
        if (word == null || word.isBlank()) {
            return Optional.empty();
        }
        String normalized = word.toLowerCase(Locale.ROOT);
        Optional<LexicalRecord> record = store.findByWord(normalized);
        if (record.isEmpty()) {
            return Optional.empty();
        }
        if (record.get().hasTranslation()) {
            return Optional.of(toEntry(record.get()));
        }

        String lemma = extractLemma(record.get().getExchange());
        if (lemma == null) {
            logger.debug("No translation and no lemma link for '{}'", normalized);
            return Optional.empty();
        }
        logger.debug("Following lemma link {} -> {}", normalized, lemma);
        return store.findByWord(lemma.toLowerCase(Locale.ROOT))
            .filter(LexicalRecord::hasTranslation)
            .map(this::toEntry);
    }

    DictionaryEntry toEntry(LexicalRecord record) {
        String translation = record.getTranslation();
        String[] lines = LINE_BREAK.split(translation);

        Set<String> glosses = new LinkedHashSet<>();
        for (String line : lines) {
            if (glosses.size() >= maxDefinitions) {
                break;
            }
            String cleaned = POS_PREFIX.matcher(line.trim()).replaceFirst("");
            for (String fragment : GLOSS_DELIMITER.split(cleaned)) {
                String gloss = fragment.trim();
                if (!gloss.isEmpty()) {
                    glosses.add(gloss);
                }
                if (glosses.size() >= maxDefinitions) {
                    break;
                }
            }
        }

        String rawFirstLine = lines.length > 0 ? lines[0] : translation;
        return new DictionaryEntry(record.getPhonetic(), new ArrayList<>(glosses), rawFirstLine);
    }

    /**
     * Base form from an exchange field, or null when no code 0-2 form is present.
     */
    static String extractLemma(String exchange) {
        if (exchange == null || exchange.isEmpty()) {
            return null;
        }
        Matcher matcher = LEMMA_PATTERN.matcher(exchange);
        return matcher.find() ? matcher.group(1) : null;
    }

    public int getMaxDefinitions() {
        return maxDefinitions;
    }

    public boolean isIncludePhonetic() {
        return includePhonetic;
    }
}
