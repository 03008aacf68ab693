package com.example.epubgloss.service.difficulty;

import com.example.epubgloss.dto.WordMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags words whose Zipf frequency is known and below a threshold.
 *
 * <p>Zipf scale reference points: ~7 for "the", ~4 for "paradigm", ~2 for "esoteric".
 * A threshold of 4.0 roughly keeps the top 10,000 words unflagged, 3.0 the top 30,000.</p>
 *
 * <p>Inflected forms are scored by the best frequency among the surface word and its base
 * form read as a verb, noun, adjective and adverb, so "paradigms" scores like "paradigm".
 * Words with no frequency data at all (names, typos) are never flagged.</p>
 */
public class ZipfDifficultyClassifier implements DifficultyClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ZipfDifficultyClassifier.class);

    public static final int MIN_WORD_LENGTH = 3;

    // Apostrophe class: ' ‘ ’ ʼ `
    private static final String APOSTROPHES = "'‘’ʼ`";

    // Runs touching an apostrophe are contraction pieces ("hadn", "isn"), not words
    private static final Pattern WORD_PATTERN = Pattern.compile(
        "\\b(?<![" + APOSTROPHES + "])[a-zA-Z]{" + MIN_WORD_LENGTH + ",}\\b(?![" + APOSTROPHES + "])");

    private final WordFrequencyProvider frequencyProvider;
    private final Lemmatizer lemmatizer;
    private final String language;
    private final double threshold;

    public ZipfDifficultyClassifier(WordFrequencyProvider frequencyProvider, Lemmatizer lemmatizer,
                                    String language, double threshold) {
        this.frequencyProvider = Objects.requireNonNull(frequencyProvider, "frequencyProvider");
        this.lemmatizer = Objects.requireNonNull(lemmatizer, "lemmatizer");
        this.language = Objects.requireNonNull(language, "language");
        this.threshold = threshold;
    }

    @Override
    public List<WordMatch> extractWords(String text) {
        List<WordMatch> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return matches;
        }
        Matcher matcher = WORD_PATTERN.matcher(text);
        while (matcher.find()) {
            matches.add(new WordMatch(matcher.start(), matcher.end(), matcher.group()));
        }
        return matches;
    }

    @Override
    public boolean isDifficult(String word) {
        if (word == null || word.length() < MIN_WORD_LENGTH) {
            return false;
        }
        double frequency = bestFrequency(word.toLowerCase(Locale.ROOT));
        return frequency > 0 && frequency < threshold;
    }

    /**
     * Highest frequency among the word and its base forms.
     */
    double bestFrequency(String lowercaseWord) {
        double best = frequencyProvider.frequency(lowercaseWord, language);
        for (PartOfSpeech partOfSpeech : PartOfSpeech.values()) {
            String lemma;
            try {
                lemma = lemmatizer.lemmatize(lowercaseWord, partOfSpeech);
            } catch (RuntimeException e) {
                logger.debug("Lemmatizer failed for '{}' as {}: {}", lowercaseWord, partOfSpeech, e.getMessage());
                continue;
            }
            if (lemma == null || lemma.isEmpty() || lemma.equals(lowercaseWord)) {
                continue;
            }
            best = Math.max(best, frequencyProvider.frequency(lemma.toLowerCase(Locale.ROOT), language));
        }
        return best;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getLanguage() {
        return language;
    }
}
