package com.telemetrysentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the parts of {@link RedisKeyValueStore} that need no server.
 */
class RedisKeyValueStoreTest {

    @Test
    @DisplayName("Key prefixes become SCAN MATCH patterns with glob characters escaped")
    void shouldBuildGlobPrefix() {
        assertThat(RedisKeyValueStore.globPrefix("telemetry:metrics:LCP:"))
                .isEqualTo("telemetry:metrics:LCP:*");
        assertThat(RedisKeyValueStore.globPrefix("tm[1]:*?"))
                .isEqualTo("tm\\[1\\]:\\*\\?*");
    }
}
