package net.custodian.core.cache;

import net.custodian.core.spi.OptionStore;
import net.custodian.core.spi.TxRunner;
import net.custodian.core.support.InMemoryOptionStore;
import net.custodian.core.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TransientCacheTest {

    private final MutableClock clock = MutableClock.at("2026-03-10T12:00:00Z");
    private final InMemoryOptionStore options = new InMemoryOptionStore();
    private final TransientCache cache = new TransientCache("custodian_", options, TxRunner.direct(), clock);

    @Test
    void storesEnvelopeUnderPrefixedName() throws Exception {
        cache.set("k", "v", 0);

        assertThat(options.get("_transient_custodian_k")).hasValueSatisfying(raw ->
                assertThat(raw).contains("\"found\":true"));
        assertThat(options.get("_transient_timeout_custodian_k")).isEmpty();
    }

    @Test
    void falseAndNullAreFound() {
        cache.set("f", false);
        cache.set("n", null);

        assertThat(cache.has("f")).isTrue();
        assertThat(cache.get("f", "dflt")).isEqualTo(false);
        assertThat(cache.lookup("n")).isEqualTo(Lookup.found(null));
        assertThat(cache.get("missing", "dflt")).isEqualTo("dflt");
    }

    @Test
    void ttlBoundary() {
        cache.set("k", "v", 10);

        clock.advanceSeconds(9);
        assertThat(cache.has("k")).isTrue();

        clock.advanceSeconds(2);
        assertThat(cache.has("k")).isFalse();
        assertThat(options.size()).isZero();   // 만료 행은 읽을 때 정리
    }

    @Test
    void overwriteWithoutTtlDropsTimeoutRow() {
        cache.set("k", "v", 10);
        cache.set("k", "v2", 0);
        clock.advanceSeconds(60);

        assertThat(cache.get("k")).isEqualTo("v2");
    }

    @Test
    void corruptTimeoutCountsAsExpired() throws Exception {
        cache.set("k", "v", 10);
        options.put("_transient_timeout_custodian_k", "soon");

        assertThat(cache.has("k")).isFalse();
    }

    @Test
    void unreadableEnvelopeIsAMiss() throws Exception {
        options.put("_transient_custodian_k", "{not json");

        assertThat(cache.lookup("k").found()).isFalse();
    }

    @Test
    void longKeysAreHashedToFitTheOptionName() {
        String longKey = "x".repeat(300);
        String built = cache.buildKey(longKey);

        assertThat(built).hasSize(TransientCache.MAX_KEY_LENGTH);
        assertThat(built).isNotEqualTo(cache.buildKey(longKey + "y"));
        assertThat(cache.set(longKey, 1)).isTrue();
        assertThat(cache.get(longKey)).isEqualTo(1);
    }

    @Test
    void clearByPrefixTreatsWildcardsLiterally() {
        TransientCache other = new TransientCache("other_", options, TxRunner.direct(), clock);
        cache.set("a_1", 1, 60);
        cache.set("a_2", 2);
        cache.set("ab", 3);      // '_' 가 와일드카드였다면 함께 지워졌을 키
        other.set("a_1", 4);

        assertThat(cache.clear("a_")).isTrue();

        assertThat(cache.has("a_1")).isFalse();
        assertThat(cache.has("a_2")).isFalse();
        assertThat(cache.has("ab")).isTrue();
        assertThat(other.has("a_1")).isTrue();
    }

    @Test
    void clearAllRemovesOnlyOwnPrefix() {
        TransientCache other = new TransientCache("other_", options, TxRunner.direct(), clock);
        cache.set("k", 1);
        other.set("k", 2);

        cache.clear();

        assertThat(cache.has("k")).isFalse();
        assertThat(other.get("k")).isEqualTo(2);
    }

    @Test
    void counters() {
        assertThat(cache.increment("n", 3)).hasValue(3);
        assertThat(cache.increment("n")).hasValue(4);
        assertThat(cache.decrement("n", 9)).hasValue(0);

        cache.set("s", "abc");
        assertThat(cache.increment("s")).isEmpty();
        assertThat(cache.supportsAtomicIncrement()).isFalse();
    }

    @Test
    void counterKeepsItsExpiry() {
        cache.set("n", 1, 10);
        cache.increment("n");
        clock.advanceSeconds(10);

        assertThat(cache.has("n")).isFalse();
    }

    @Test
    void storeFailuresAreSoft() throws Exception {
        OptionStore broken = mock(OptionStore.class);
        when(broken.get(anyString())).thenThrow(new IllegalStateException("db down"));
        doThrow(new IllegalStateException("db down")).when(broken).put(anyString(), anyString());
        TransientCache c = new TransientCache("p_", broken, TxRunner.direct(), clock);

        assertThat(c.lookup("k").found()).isFalse();
        assertThat(c.set("k", 1)).isFalse();
        assertThat(c.increment("k")).isEmpty();
    }

    @Test
    void multiDefaults() {
        cache.setMultiple(Map.of("a", 1), 0);

        assertThat(cache.getMultiple(List.of("a", "b"), 0)).containsEntry("a", 1).containsEntry("b", 0);
    }
}
