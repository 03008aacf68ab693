package com.example.epubgloss.service.difficulty;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import opennlp.tools.lemmatizer.DictionaryLemmatizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Dictionary-based lemmatizer backed by OpenNLP.
 *
 * <p>The dictionary uses the OpenNLP format: {@code word<TAB>postag<TAB>lemma} with Penn
 * Treebank tags. A category matches when any of its tags has an entry for the word; the
 * first tag with an entry wins.</p>
 */
public class OpenNlpLemmatizer implements Lemmatizer {

    private static final Logger logger = LoggerFactory.getLogger(OpenNlpLemmatizer.class);

    // DictionaryLemmatizer's marker for "no entry"
    private static final String NO_LEMMA = "O";

    private final DictionaryLemmatizer dictionaryLemmatizer;

    public OpenNlpLemmatizer(DictionaryLemmatizer dictionaryLemmatizer) {
        this.dictionaryLemmatizer = Objects.requireNonNull(dictionaryLemmatizer, "dictionaryLemmatizer");
    }

    /**
     * Loads a lemma dictionary. Fails fast when it is missing or unreadable.
     */
    public static OpenNlpLemmatizer load(InputStream dictionary) {
        if (dictionary == null) {
            throw new LinguisticDataUnavailableException("Lemma dictionary not found");
        }
        try (InputStream in = dictionary) {
            OpenNlpLemmatizer lemmatizer = new OpenNlpLemmatizer(new DictionaryLemmatizer(in));
            logger.info("✅ OpenNLP dictionary lemmatizer initialized (local, no model download)");
            return lemmatizer;
        } catch (IOException | RuntimeException e) {
            throw new LinguisticDataUnavailableException("Could not read lemma dictionary", e);
        }
    }

    @Override
    public String lemmatize(String word, PartOfSpeech partOfSpeech) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        for (String tag : partOfSpeech.getPennTags()) {
            String[] lemmas = dictionaryLemmatizer.lemmatize(new String[]{word}, new String[]{tag});
            if (lemmas.length > 0 && lemmas[0] != null && !NO_LEMMA.equals(lemmas[0])) {
                return lemmas[0];
            }
        }
        return word;
    }
}
