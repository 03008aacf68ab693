package com.example.epubgloss.service.dictionary;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryLexicalStoreTest {

    @Test
    void loadsTabSeparatedRecordsWithEscapedLineBreaks() {
        String tsv = "# word\tphonetic\ttranslation\texchange\n"
            + "paradigm\tˈpærədaɪm\tn. 范式\\nv. 做范例\t\n"
            + "running\t\t\t0:run\n"
            + "bare\n";

        InMemoryLexicalStore store = InMemoryLexicalStore.load(
            new ByteArrayInputStream(tsv.getBytes(StandardCharsets.UTF_8)));

        assertThat(store.size()).isEqualTo(3);
        LexicalRecord paradigm = store.findByWord("paradigm").orElseThrow();
        assertThat(paradigm.getTranslation()).isEqualTo("n. 范式\nv. 做范例");
        assertThat(paradigm.getPhonetic()).isEqualTo("ˈpærədaɪm");
        assertThat(paradigm.getExchange()).isNull();

        LexicalRecord running = store.findByWord("running").orElseThrow();
        assertThat(running.hasTranslation()).isFalse();
        assertThat(running.getExchange()).isEqualTo("0:run");

        assertThat(store.findByWord("bare")).get().extracting(LexicalRecord::getTranslation).isNull();
    }

    @Test
    void keysAreLowercaseAndFirstRecordWins() {
        InMemoryLexicalStore store = new InMemoryLexicalStore(List.of(
            LexicalRecord.builder().word("Paris").translation("巴黎").build(),
            LexicalRecord.builder().word("paris").translation("duplicate").build()));

        assertThat(store.findByWord("PARIS")).get()
            .extracting(LexicalRecord::getTranslation).isEqualTo("巴黎");
        assertThat(store.findByWord(null)).isEmpty();
    }

    @Test
    void missingInputFailsFast() {
        assertThatThrownBy(() -> InMemoryLexicalStore.load(null))
            .isInstanceOf(LinguisticDataUnavailableException.class);
    }
}
