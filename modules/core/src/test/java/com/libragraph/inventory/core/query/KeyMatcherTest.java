package com.libragraph.inventory.core.query;

import com.libragraph.inventory.types.MatchMode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KeyMatcherTest {

    @Test
    void exactFolderMatchesWholeSegmentsOnly() {
        KeyMatcher matcher = KeyMatcher.of(SearchQuery.exactFolder("logs"));

        assertThat(matcher.matches("a/logs/b.txt")).isTrue();
        assertThat(matcher.matches("logs/b.txt")).isTrue();
        assertThat(matcher.matches("a/logsarchive/b.txt")).isFalse();
        assertThat(matcher.matches("a/old-logs/b.txt")).isFalse();
    }

    @Test
    void leafNameIsNotAFolder() {
        KeyMatcher matcher = KeyMatcher.of(SearchQuery.exactFolder("logs"));

        assertThat(matcher.matches("a/logs")).isFalse();
        assertThat(matcher.matches("a/logs/")).isTrue();
    }

    @Test
    void folderPathEndsAtFirstMatchingSegment() {
        KeyMatcher matcher = KeyMatcher.of(SearchQuery.exactFolder("logs"));

        assertThat(matcher.folderPath("a/logs/x/logs/b.txt")).isEqualTo("a/logs");
        assertThat(matcher.folderPath("a/b.txt")).isNull();
    }

    @Test
    void substringAndPrefixUseFullKey() {
        KeyMatcher substring = KeyMatcher.of(SearchQuery.substring("b"));
        KeyMatcher prefix = KeyMatcher.of(SearchQuery.prefix("a/b"));

        assertThat(substring.matches("a/b/c.txt")).isTrue();
        assertThat(substring.matches("a/d.txt")).isFalse();
        assertThat(substring.folderPath("a/b/c.txt")).isNull();
        assertThat(prefix.matches("a/b/c.txt")).isTrue();
        assertThat(prefix.matches("x/a/b")).isFalse();
    }

    @Test
    void caseFlagAppliesToEveryMode() {
        assertThat(KeyMatcher.of(SearchQuery.substring("REPORT")).matches("q1/report.pdf")).isFalse();
        assertThat(KeyMatcher.of(SearchQuery.substring("REPORT").ignoringCase()).matches("q1/report.pdf")).isTrue();
        assertThat(KeyMatcher.of(SearchQuery.prefix("Q1").ignoringCase()).matches("q1/report.pdf")).isTrue();
        assertThat(KeyMatcher.of(SearchQuery.exactFolder("LOGS").ignoringCase()).matches("a/Logs/b")).isTrue();
        assertThat(KeyMatcher.of(SearchQuery.exactFolder("LOGS")).matches("a/Logs/b")).isFalse();
    }

    @Test
    void folderContainingMatchesPartialSegmentNames() {
        KeyMatcher matcher = KeyMatcher.folderContaining("log", false);

        assertThat(matcher.folderPath("a/Old-Logs/2024/b.txt")).isEqualTo("a/Old-Logs");
        assertThat(matcher.matches("a/catalog.txt")).isFalse();
    }

    @Test
    void exactFolderQueryMustBeOneSegment() {
        assertThatThrownBy(() -> new SearchQuery("a/b", MatchMode.EXACT_FOLDER, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SearchQuery.exactFolder(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
