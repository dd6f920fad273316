package com.libragraph.inventory.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PathSegmentsTest {

    @Test
    void splitKeepsEmptySegments() {
        assertThat(PathSegments.split("a/b/")).containsExactly("a", "b", "");
        assertThat(PathSegments.split("file.txt")).containsExactly("file.txt");
    }

    @Test
    void directoryDepthCountsSeparators() {
        assertThat(PathSegments.directoryDepth("a/b/c.txt")).isEqualTo(2);
        assertThat(PathSegments.directoryDepth("c.txt")).isZero();
    }

    @Test
    void truncateAtZeroIsBucketWide() {
        assertThat(PathSegments.truncate("a/b/c.txt", 0)).isEmpty();
    }

    @Test
    void truncateWithinDirectories() {
        assertThat(PathSegments.truncate("a/b/c.txt", 1)).isEqualTo("a");
        assertThat(PathSegments.truncate("a/b/c.txt", 2)).isEqualTo("a/b");
    }

    @Test
    void truncateBeyondDirectoriesReturnsFullKey() {
        assertThat(PathSegments.truncate("a/b/c.txt", 3)).isEqualTo("a/b/c.txt");
        assertThat(PathSegments.truncate("a/d.txt", 2)).isEqualTo("a/d.txt");
        assertThat(PathSegments.truncate("top.txt", 1)).isEqualTo("top.txt");
    }

    @Test
    void deeperTruncationExtendsShallowerOne() {
        String key = "logs/2024/01/15/app.log";
        for (int d1 = 0; d1 < 6; d1++) {
            for (int d2 = d1 + 1; d2 < 7; d2++) {
                assertThat(PathSegments.truncate(key, d2))
                        .startsWith(PathSegments.truncate(key, d1));
            }
        }
    }

    @Test
    void truncateRejectsNegativeDepth() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> PathSegments.truncate("a/b", -1));
    }

    @Test
    void joinUsesSeparator() {
        assertThat(PathSegments.join(List.of("a", "b", "c"), 2)).isEqualTo("a/b");
    }
}
