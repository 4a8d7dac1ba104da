package com.respkv.core;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class StoreEntryTest {

    @Test
    void persistent_neverExpires() {
        StoreEntry entry = StoreEntry.persistent("v".getBytes(StandardCharsets.UTF_8));

        assertThat(entry.hasTtl()).isFalse();
        assertThat(entry.isExpired(Long.MAX_VALUE)).isFalse();
        assertThat(entry.isExpired(Long.MIN_VALUE)).isFalse();
    }

    @Test
    void expiringAt_liveAtDeadlineExpiredAfter() {
        StoreEntry entry = StoreEntry.expiringAt(new byte[]{1}, 5_000_000L);

        assertThat(entry.hasTtl()).isTrue();
        assertThat(entry.isExpired(4_999_999L)).isFalse();
        assertThat(entry.isExpired(5_000_000L)).isFalse();
        assertThat(entry.isExpired(5_000_001L)).isTrue();
    }

    @Test
    void isExpired_survivesTickerWrapAround() {
        long deadline = Long.MIN_VALUE + 10;
        StoreEntry entry = StoreEntry.expiringAt(new byte[]{1}, deadline);

        assertThat(entry.isExpired(Long.MAX_VALUE)).isFalse();
        assertThat(entry.isExpired(Long.MIN_VALUE + 10)).isFalse();
        assertThat(entry.isExpired(Long.MIN_VALUE + 11)).isTrue();
    }

    @Test
    void value_isDefensivelyCopied() {
        byte[] value = {1, 2, 3};
        StoreEntry entry = StoreEntry.persistent(value);

        value[0] = 9;
        entry.getValue()[1] = 9;

        assertThat(entry.getValue()).containsExactly(1, 2, 3);
    }

    @Test
    void equalsAndHashCode() {
        StoreEntry a = StoreEntry.expiringAt(new byte[]{1, 2}, 42);
        StoreEntry b = StoreEntry.expiringAt(new byte[]{1, 2}, 42);
        StoreEntry c = StoreEntry.persistent(new byte[]{1, 2});

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }
}
