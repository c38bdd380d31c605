package com.passpattern.generator.resolver;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BackreferenceStore.
 */
class BackreferenceStoreTest {

    @Test
    void testKeysStartAtOne() {
        BackreferenceStore store = new BackreferenceStore();

        assertThat(store.record("alpha")).isEqualTo(1);
        assertThat(store.record("beta")).isEqualTo(2);
        assertThat(store.valueOf(1)).isEqualTo("alpha");
        assertThat(store.valueOf(2)).isEqualTo("beta");
        assertThat(store.values()).containsExactly("alpha", "beta");
    }

    @Test
    void testMissingKeysAreEmpty() {
        BackreferenceStore store = new BackreferenceStore();
        store.record("alpha");

        assertThat(store.valueOf(0)).isEmpty();
        assertThat(store.valueOf(2)).isEmpty();
        assertThat(store.valueOf(-3)).isEmpty();
        assertThat(store.get(5)).isEmpty();
    }
}
