package org.elogsync.pipeline.utils;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ExcludePatternsTest {

    @Test
    void prefixWildcardExcludesMatchingIdentifiersOnly() {
        ExcludePatterns patterns = ExcludePatterns.of(List.of("txi*"));

        assertThat(patterns.excludes("txi9999")).isTrue();
        assertThat(patterns.excludes("mfxl1033223")).isFalse();
        assertThat(patterns.excludes("mfxtxi01")).isFalse();
    }

    @Test
    void matchingIsCaseSensitive() {
        assertThat(ExcludePatterns.of(List.of("txi*")).excludes("TXI9999")).isFalse();
    }

    @Test
    void suffixAndSingleCharacterWildcards() {
        ExcludePatterns patterns = ExcludePatterns.of(List.of("*23", "cxi000?"));

        assertThat(patterns.excludes("mfxl1033223")).isTrue();
        assertThat(patterns.excludes("cxi0001")).isTrue();
        assertThat(patterns.excludes("cxi00012")).isFalse();
    }

    @Test
    void regexCharactersAreLiteral() {
        ExcludePatterns patterns = ExcludePatterns.of(List.of("a.b*"));

        assertThat(patterns.excludes("a.bc")).isTrue();
        assertThat(patterns.excludes("axbc")).isFalse();
    }

    @Test
    void blankPatternsAreIgnored() {
        ExcludePatterns patterns = ExcludePatterns.of(Arrays.asList("", "  ", null));

        assertThat(patterns.isEmpty()).isTrue();
        assertThat(patterns.excludes("anything")).isFalse();
    }
}
