package com.example.epubgloss.service.difficulty;

import com.example.epubgloss.exception.LinguisticDataUnavailableException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipfFrequencyTableTest {

    @Test
    void loadsTabSeparatedListAndSkipsCommentsAndBadLines() {
        ZipfFrequencyTable table = ZipfFrequencyTable.load("en", stream(
            "# word\tzipf\n" +
            "The\t7.73\n" +
            "\n" +
            "paradigm\t3.3\n" +
            "broken line\n" +
            "odd\tnot-a-number\n"));

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.frequency("the", "en")).isEqualTo(7.73);
        assertThat(table.frequency("PARADIGM", "en")).isEqualTo(3.3);
        assertThat(table.frequency("odd", "en")).isZero();
    }

    @Test
    void unknownWordAndOtherLanguageYieldZero() {
        ZipfFrequencyTable table = ZipfFrequencyTable.load("en", stream("paradigm\t3.3\n"));

        assertThat(table.frequency("missing", "en")).isZero();
        assertThat(table.frequency("paradigm", "fr")).isZero();
        assertThat(table.frequency(null, "en")).isZero();
    }

    @Test
    void valuesAreClampedToZipfRange() {
        ZipfFrequencyTable table = ZipfFrequencyTable.load("en", stream("huge\t11.2\nnegative\t-1\n"));

        assertThat(table.frequency("huge", "en")).isEqualTo(ZipfFrequencyTable.MAX_ZIPF);
        assertThat(table.frequency("negative", "en")).isZero();
    }

    @Test
    void missingOrEmptyListFailsFast() {
        assertThatThrownBy(() -> ZipfFrequencyTable.load("en", null))
            .isInstanceOf(LinguisticDataUnavailableException.class);
        assertThatThrownBy(() -> ZipfFrequencyTable.load("en", stream("# nothing here\n")))
            .isInstanceOf(LinguisticDataUnavailableException.class)
            .hasMessageContaining("empty");
    }

    private static InputStream stream(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }
}
