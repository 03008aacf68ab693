package com.example.epubgloss.config;

import com.example.epubgloss.EpubGlossApplication;
import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.builder.SpringApplicationBuilder;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnnotationConfigurationTest {

    @Test
    void missingStardictDatabaseStopsTheContext(@TempDir Path dir) {
        Path database = dir.resolve("stardict.db");

        assertThatThrownBy(() -> start(
            "spring.datasource.url=jdbc:sqlite:" + database,
            "spring.datasource.driver-class-name=org.sqlite.JDBC",
            "spring.jpa.database-platform=org.hibernate.community.dialect.SQLiteDialect",
            "spring.jpa.hibernate.ddl-auto=none"))
            .satisfies(e -> assertThat(ExceptionUtils.indexOfType(e, LinguisticDataUnavailableException.class))
                .isNotNegative());
    }

    @Test
    void schemaWithoutStardictTableStopsTheContext() {
        assertThatThrownBy(() -> start(
            "spring.datasource.url=jdbc:h2:mem:no-stardict;DB_CLOSE_DELAY=-1",
            "spring.jpa.hibernate.ddl-auto=none"))
            .satisfies(e -> assertThat(ExceptionUtils.indexOfType(e, LinguisticDataUnavailableException.class))
                .isNotNegative());
    }

    @Test
    void emptyStardictTableStopsTheContextUnlessAllowed() {
        assertThatThrownBy(() -> start(
            "spring.datasource.url=jdbc:h2:mem:empty-stardict;DB_CLOSE_DELAY=-1",
            "annotation.dictionary.allow-empty-store=false"))
            .satisfies(e -> assertThat(ExceptionUtils.indexOfType(e, LinguisticDataUnavailableException.class))
                .isNotNegative())
            .hasStackTraceContaining("empty");
    }

    @Test
    void missingFrequencyListStopsTheContext(@TempDir Path dir) {
        Path absent = dir.resolve("absent.tsv");
        assertThat(Files.exists(absent)).isFalse();

        assertThatThrownBy(() -> start(
            "spring.datasource.url=jdbc:h2:mem:no-frequency;DB_CLOSE_DELAY=-1",
            "annotation.frequency.location=file:" + absent))
            .satisfies(e -> assertThat(ExceptionUtils.indexOfType(e, LinguisticDataUnavailableException.class))
                .isNotNegative());
    }

    private static void start(String... properties) {
        new SpringApplicationBuilder(EpubGlossApplication.class)
            .profiles("test")
            .properties(properties)
            .run()
            .close();
    }
}
