package com.example.epubgloss.service.dictionary;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SimpleDictionaryResolverTest {

    private final SimpleDictionaryResolver resolver = new SimpleDictionaryResolver(Map.of(
        "multimodal", "多模态",
        "exploit", "利用",
        "Modality", "模态",
        "blank", " "));

    @Test
    void findsExactWordIgnoringCase() {
        assertThat(resolver.lookup("Multimodal")).contains("多模态");
        assertThat(resolver.lookup("modality")).contains("模态");
    }

    @Test
    void stripsSingleTrailingS() {
        assertThat(resolver.lookup("exploits")).contains("利用");
        assertThat(resolver.lookup("exploitss")).isEmpty();
    }

    @Test
    void unknownOrBlankGlossIsNotFound() {
        assertThat(resolver.lookup("paradigm")).isEmpty();
        assertThat(resolver.lookup("blank")).isEmpty();
        assertThat(resolver.lookup(null)).isEmpty();
    }
}
