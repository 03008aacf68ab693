package com.example.epubgloss.repository;

import com.example.epubgloss.model.StardictEntry;
import com.example.epubgloss.service.dictionary.JpaLexicalStore;
import com.example.epubgloss.service.dictionary.LexicalRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class StardictEntryRepositoryTest {

    @Autowired
    private StardictEntryRepository repository;

    @BeforeEach
    void setUp() {
        repository.save(new StardictEntry(null, "paradigm", "ˈpærədaɪm", "a standard or typical example",
            "n. 范式; 模式\nv. 做范例", null));
        repository.save(new StardictEntry(null, "running", null, null, null,
            "p:ran/d:ran/i:running/3:runs/s:runs/0:run"));
    }

    @Test
    void findsEntryByExactWord() {
        Optional<StardictEntry> entry = repository.findFirstByWordOrderByIdAsc("paradigm");

        assertThat(entry).isPresent();
        assertThat(entry.get().getTranslation()).isEqualTo("n. 范式; 模式\nv. 做范例");
        assertThat(repository.findFirstByWordOrderByIdAsc("missing")).isEmpty();
    }

    @Test
    void storeMapsEntityColumnsToRecords() {
        JpaLexicalStore store = new JpaLexicalStore(repository);

        LexicalRecord running = store.findByWord("running").orElseThrow();
        assertThat(running.hasTranslation()).isFalse();
        assertThat(running.getExchange()).endsWith("0:run");

        LexicalRecord paradigm = store.findByWord("paradigm").orElseThrow();
        assertThat(paradigm.getPhonetic()).isEqualTo("ˈpærədaɪm");
        assertThat(store.findByWord("")).isEmpty();
    }
}
