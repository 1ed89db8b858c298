package com.phillippitts.mediatoolbox.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateReturnsEmptyForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
    }

    @Test
    void truncateReturnsEmptyForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello", 0)).isEmpty();
    }

    @Test
    void truncateKeepsShortStrings() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
    }

    @Test
    void truncateCutsLongStrings() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void describeArgumentsJoinsWithSpaces() {
        assertThat(LogSanitizer.describeArguments(List.of("-i", "in.mp4", "out.mkv"), 100))
                .isEqualTo("-i in.mp4 out.mkv");
    }

    @Test
    void describeArgumentsHandlesEmptyVector() {
        assertThat(LogSanitizer.describeArguments(List.of(), 100)).isEqualTo("[]");
        assertThat(LogSanitizer.describeArguments(null, 100)).isEqualTo("[]");
    }

    @Test
    void describeArgumentsTruncatesLongVectors() {
        assertThat(LogSanitizer.describeArguments(List.of("abcdef", "ghijkl"), 8)).isEqualTo("abcdef g");
    }
}
