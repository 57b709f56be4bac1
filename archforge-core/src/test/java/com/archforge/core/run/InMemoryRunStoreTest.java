package com.archforge.core.run;

import com.archforge.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InMemoryRunStore}.
 */
class InMemoryRunStoreTest {

    private MutableClock clock;
    private InMemoryRunStore<String> store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        store = new InMemoryRunStore<>(clock);
    }

    @Test
    void get_beforeExpiry_returnsValue() {
        store.set("run-1", "PARSING", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));

        assertThat(store.get("run-1")).contains("PARSING");
    }

    @Test
    void get_atExpiry_isEmptyAndEntryIsRemoved() {
        store.set("run-1", "PARSING", Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.get("run-1")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void set_again_refreshesValueAndTtl() {
        store.set("run-1", "PARSING", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4));

        store.set("run-1", "PLANNING", Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(4));

        assertThat(store.get("run-1")).contains("PLANNING");
    }

    @Test
    void purgeExpired_removesOnlyExpiredEntries() {
        store.set("short", "a", Duration.ofSeconds(10));
        store.set("long", "b", Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(1));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.get("long")).contains("b");
    }

    @Test
    void expire_removesImmediately() {
        store.set("run-1", "DONE", Duration.ofHours(1));

        store.expire("run-1");

        assertThat(store.get("run-1")).isEmpty();
    }
}
