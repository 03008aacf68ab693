package com.example.epubgloss.config;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import com.example.epubgloss.repository.StardictEntryRepository;
import com.example.epubgloss.service.annotation.AnnotationEngine;
import com.example.epubgloss.service.annotation.AnnotationStyle;
import com.example.epubgloss.service.dictionary.DictionaryResolver;
import com.example.epubgloss.service.dictionary.InMemoryLexicalStore;
import com.example.epubgloss.service.dictionary.JpaLexicalStore;
import com.example.epubgloss.service.dictionary.LexicalStore;
import com.example.epubgloss.service.dictionary.StardictDictionaryResolver;
import com.example.epubgloss.service.difficulty.DifficultyClassifier;
import com.example.epubgloss.service.difficulty.Lemmatizer;
import com.example.epubgloss.service.difficulty.OpenNlpLemmatizer;
import com.example.epubgloss.service.difficulty.WordFrequencyProvider;
import com.example.epubgloss.service.difficulty.ZipfDifficultyClassifier;
import com.example.epubgloss.service.difficulty.ZipfFrequencyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Wires the classifier, resolver and annotation engine from {@code annotation.*} properties.
 * Linguistic data is loaded here, once; a missing file stops the context from starting.
 */
@Configuration
public class AnnotationConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(AnnotationConfiguration.class);

    @Value("${annotation.style:INLINE}")
    private AnnotationStyle style;

    @Value("${annotation.skip-tags:script,style,pre,code}")
    private List<String> skipTags;

    @Value("${annotation.difficulty.threshold:4.0}")
    private double threshold;

    @Value("${annotation.difficulty.language:en}")
    private String language;

    @Value("${annotation.frequency.location:file:data/frequency/en.tsv}")
    private String frequencyLocation;

    @Value("${annotation.lemmatizer.location:file:data/lemmatizer/en-lemmatizer.dict}")
    private String lemmatizerLocation;

    @Value("${annotation.dictionary.max-definitions:2}")
    private int maxDefinitions;

    @Value("${annotation.dictionary.include-phonetic:true}")
    private boolean includePhonetic;

    @Value("${annotation.dictionary.allow-empty-store:false}")
    private boolean allowEmptyStore;

    @Value("${annotation.dictionary.memory.location:file:data/dictionary.tsv}")
    private String memoryDictionaryLocation;

    @Bean
    public WordFrequencyProvider wordFrequencyProvider(ResourceLoader resourceLoader) {
        try (InputStream in = open(resourceLoader, frequencyLocation, "frequency list")) {
            return ZipfFrequencyTable.load(language, in);
        } catch (IOException e) {
            throw new LinguisticDataUnavailableException("Could not read frequency list " + frequencyLocation, e);
        }
    }

    @Bean
    public Lemmatizer lemmatizer(ResourceLoader resourceLoader) {
        return OpenNlpLemmatizer.load(open(resourceLoader, lemmatizerLocation, "lemma dictionary"));
    }

    @Bean
    public DifficultyClassifier difficultyClassifier(WordFrequencyProvider wordFrequencyProvider, Lemmatizer lemmatizer) {
        logger.info("Difficulty classifier: language={}, threshold={}", language, threshold);
        return new ZipfDifficultyClassifier(wordFrequencyProvider, lemmatizer, language, threshold);
    }

    @Bean
    @ConditionalOnProperty(name = "annotation.dictionary.store", havingValue = "jpa", matchIfMissing = true)
    public LexicalStore jpaLexicalStore(StardictEntryRepository stardictEntryRepository) {
        long records;
        try {
            records = stardictEntryRepository.count();
        } catch (DataAccessException e) {
            logger.error("ECDICT stardict table is not readable: {}", e.getMessage());
            throw new LinguisticDataUnavailableException("ECDICT stardict table is not readable", e);
        }
        if (records == 0 && !allowEmptyStore) {
            logger.error("ECDICT stardict table is empty");
            throw new LinguisticDataUnavailableException("ECDICT stardict table is empty");
        }
        logger.info("Dictionary store: ECDICT via JPA, {} records", records);
        return new JpaLexicalStore(stardictEntryRepository);
    }

    @Bean
    @ConditionalOnProperty(name = "annotation.dictionary.store", havingValue = "memory")
    public LexicalStore inMemoryLexicalStore(ResourceLoader resourceLoader) {
        try (InputStream in = open(resourceLoader, memoryDictionaryLocation, "dictionary")) {
            InMemoryLexicalStore store = InMemoryLexicalStore.load(in);
            logger.info("Dictionary store: in-memory, {} records from {}", store.size(), memoryDictionaryLocation);
            return store;
        } catch (IOException e) {
            throw new LinguisticDataUnavailableException("Could not read dictionary " + memoryDictionaryLocation, e);
        }
    }

    @Bean
    public DictionaryResolver dictionaryResolver(LexicalStore lexicalStore) {
        return new StardictDictionaryResolver(lexicalStore, maxDefinitions, includePhonetic);
    }

    @Bean
    public AnnotationEngine annotationEngine(DifficultyClassifier difficultyClassifier,
                                             DictionaryResolver dictionaryResolver) {
        AnnotationEngine engine = new AnnotationEngine(difficultyClassifier, dictionaryResolver, style, skipTags);
        logger.info("✅ Annotation engine ready: style={}, skip tags={}", style, engine.getSkipTags());
        return engine;
    }

    private static InputStream open(ResourceLoader resourceLoader, String location, String what) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            logger.error("Missing {} at {}", what, location);
            throw new LinguisticDataUnavailableException("Missing " + what + " at " + location);
        }
        try {
            return resource.getInputStream();
        } catch (IOException e) {
            throw new LinguisticDataUnavailableException("Could not open " + what + " at " + location, e);
        }
    }
}
