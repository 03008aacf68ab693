package com.example.epubgloss.service.difficulty;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory Zipf frequency list for a single language.
 *
 * <p>The list is a UTF-8 text file with one {@code word<TAB>zipf} pair per line. Blank lines
 * and lines starting with {@code #} are ignored. Values are clamped to [0, 8].</p>
 */
public class ZipfFrequencyTable implements WordFrequencyProvider {

    private static final Logger logger = LoggerFactory.getLogger(ZipfFrequencyTable.class);

    public static final double MAX_ZIPF = 8.0;

    private final String language;
    private final Map<String, Double> frequencies;

    public ZipfFrequencyTable(String language, Map<String, Double> frequencies) {
        this.language = Objects.requireNonNull(language, "language");
        Map<String, Double> normalized = new HashMap<>();
        frequencies.forEach((word, zipf) -> normalized.put(word.toLowerCase(Locale.ROOT), clamp(zipf)));
        this.frequencies = Collections.unmodifiableMap(normalized);
    }

    /**
     * Reads a frequency list. Fails fast on unreadable or empty input.
     */
    public static ZipfFrequencyTable load(String language, InputStream input) {
        if (input == null) {
            throw new LinguisticDataUnavailableException("Frequency list for '" + language + "' not found");
        }

        Map<String, Double> frequencies = new HashMap<>();
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = trimmed.split("\t");
                if (parts.length < 2) {
                    skipped++;
                    continue;
                }
                try {
                    frequencies.put(parts[0].trim(), Double.parseDouble(parts[1].trim()));
                } catch (NumberFormatException e) {
                    skipped++;
                }
            }
        } catch (IOException e) {
            throw new LinguisticDataUnavailableException("Could not read frequency list for '" + language + "'", e);
        }

        if (frequencies.isEmpty()) {
            throw new LinguisticDataUnavailableException("Frequency list for '" + language + "' is empty");
        }
        if (skipped > 0) {
            logger.warn("Skipped {} malformed lines in frequency list for '{}'", skipped, language);
        }
        logger.info("Loaded {} word frequencies for '{}'", frequencies.size(), language);
        return new ZipfFrequencyTable(language, frequencies);
    }

    @Override
    public double frequency(String word, String language) {
        if (word == null || !this.language.equalsIgnoreCase(language)) {
            return 0.0;
        }
        return frequencies.getOrDefault(word.toLowerCase(Locale.ROOT), 0.0);
    }

    public String getLanguage() {
        return language;
    }

    public int size() {
        return frequencies.size();
    }

    private static double clamp(Double zipf) {
        if (zipf == null || zipf.isNaN() || zipf < 0) {
            return 0.0;
        }
        return Math.min(zipf, MAX_ZIPF);
    }
}
