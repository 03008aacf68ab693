package com.example.epubgloss.service.difficulty;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class OpenNlpLemmatizerTest {

    private OpenNlpLemmatizer lemmatizer;

    @BeforeAll
    void setUp() {
        lemmatizer = OpenNlpLemmatizer.load(getClass().getResourceAsStream("/lemmatizer/en-sample.dict"));
    }

    @Test
    void findsLemmaThroughAnyTagOfTheCategory() {
        assertThat(lemmatizer.lemmatize("running", PartOfSpeech.VERB)).isEqualTo("run");
        assertThat(lemmatizer.lemmatize("ran", PartOfSpeech.VERB)).isEqualTo("run");
        assertThat(lemmatizer.lemmatize("paradigms", PartOfSpeech.NOUN)).isEqualTo("paradigm");
    }

    @Test
    void returnsWordUnchangedWhenCategoryHasNoEntry() {
        assertThat(lemmatizer.lemmatize("running", PartOfSpeech.NOUN)).isEqualTo("running");
        assertThat(lemmatizer.lemmatize("paradigms", PartOfSpeech.ADVERB)).isEqualTo("paradigms");
        assertThat(lemmatizer.lemmatize("unknown", PartOfSpeech.ADJECTIVE)).isEqualTo("unknown");
    }

    @Test
    void missingDictionaryFailsFast() {
        assertThatThrownBy(() -> OpenNlpLemmatizer.load(null))
            .isInstanceOf(LinguisticDataUnavailableException.class);
    }
}
