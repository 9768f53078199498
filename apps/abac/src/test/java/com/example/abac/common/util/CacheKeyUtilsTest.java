package com.example.abac.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheKeyUtils")
class CacheKeyUtilsTest {

    @Test
    @DisplayName("should leave plain ids unchanged")
    void shouldKeepPlainIds() {
        assertThat(CacheKeyUtils.qualify("abac:subject", "user-5")).isEqualTo("abac:subject:user-5");
    }

    @Test
    @DisplayName("should give ids that differ only by delimiter or whitespace distinct keys")
    void shouldKeepSimilarIdsDistinct() {
        assertThat(CacheKeyUtils.encode("a:b"))
                .isNotEqualTo(CacheKeyUtils.encode("a_b"))
                .isNotEqualTo(CacheKeyUtils.encode("a b"))
                .doesNotContain(":");
        assertThat(CacheKeyUtils.encode("a b")).isNotEqualTo(CacheKeyUtils.encode("a+b"));
        assertThat(CacheKeyUtils.encode("line\nbreak")).doesNotContain("\n");
    }

    @Test
    @DisplayName("should reject blank keys")
    void shouldRejectBlankKeys() {
        assertThatThrownBy(() -> CacheKeyUtils.encode(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheKeyUtils.requireKey("")).isInstanceOf(IllegalArgumentException.class);
    }
}
