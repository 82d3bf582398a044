package tech.mediagateway.auth.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.mediagateway.auth.test.MutableClock;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class InMemoryCredentialStoreTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private InMemoryCredentialStore store;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        CredentialStoreConfig config = mock(CredentialStoreConfig.class);
        when(config.maxSize()).thenReturn(10_000L);

        store = new InMemoryCredentialStore();
        store.config = config;
        store.clock = clock;
        store.init();
    }

    // ==================== TTL ====================

    @Test
    @DisplayName("get should return empty once the TTL has elapsed")
    void get_shouldReturnEmpty_whenTtlElapsed() {
        store.put("pkce:abc", "value", TTL);
        assertThat(store.get("pkce:abc")).contains("value");

        clock.advance(TTL.plusSeconds(1));

        assertThat(store.get("pkce:abc")).isEmpty();
    }

    @Test
    @DisplayName("updatePreservingTtl should keep the remaining TTL")
    void updatePreservingTtl_shouldKeepRemainingTtl() {
        store.put("devicecode:x", "v1", TTL);
        clock.advance(Duration.ofMinutes(3));

        boolean updated = store.updatePreservingTtl("devicecode:x", "v2");

        assertThat(updated).isTrue();
        assertThat(store.get("devicecode:x")).contains("v2");
        assertThat(store.ttl("devicecode:x")).hasValueSatisfying(ttl ->
            assertThat(ttl).isLessThanOrEqualTo(Duration.ofMinutes(2)));

        clock.advance(Duration.ofMinutes(2).plusSeconds(1));
        assertThat(store.get("devicecode:x")).isEmpty();
    }

    @Test
    @DisplayName("updatePreservingTtl should not create a missing key")
    void updatePreservingTtl_shouldReturnFalse_whenKeyMissing() {
        assertThat(store.updatePreservingTtl("missing", "v")).isFalse();
        assertThat(store.get("missing")).isEmpty();
    }

    // ==================== Conditional writes ====================

    @Test
    @DisplayName("compareAndSet should only replace the expected value")
    void compareAndSet_shouldReplace_onlyWhenValueMatches() {
        store.put("authcode:c", "unused", TTL);

        assertThat(store.compareAndSet("authcode:c", "other", "used")).isFalse();
        assertThat(store.compareAndSet("authcode:c", "unused", "used")).isTrue();
        assertThat(store.compareAndSet("authcode:c", "unused", "used")).isFalse();
        assertThat(store.get("authcode:c")).contains("used");
    }

    @Test
    @DisplayName("compareAndSet should let exactly one of many concurrent callers win")
    void compareAndSet_shouldHaveSingleWinner_whenCalledConcurrently() throws Exception {
        store.put("authcode:race", "unused", TTL);
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    return store.compareAndSet("authcode:race", "unused", "used");
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("putAllIfAbsent should write nothing when any key exists")
    void putAllIfAbsent_shouldWriteNothing_whenAnyKeyExists() {
        store.put("devicecode:user:ABCD-EFGH", "existing", TTL);

        boolean stored = store.putAllIfAbsent(Map.of(
            "devicecode:new", "record",
            "devicecode:user:ABCD-EFGH", "new"), TTL);

        assertThat(stored).isFalse();
        assertThat(store.get("devicecode:new")).isEmpty();
        assertThat(store.get("devicecode:user:ABCD-EFGH")).contains("existing");
    }

    @Test
    @DisplayName("compareAndDelete should remove companions together with the key")
    void compareAndDelete_shouldRemoveCompanions() {
        store.putAllIfAbsent(Map.of("devicecode:d", "approved", "devicecode:user:U", "d"), TTL);

        assertThat(store.compareAndDelete("devicecode:d", "pending", "devicecode:user:U")).isFalse();
        assertThat(store.get("devicecode:user:U")).contains("d");

        assertThat(store.compareAndDelete("devicecode:d", "approved", "devicecode:user:U")).isTrue();
        assertThat(store.get("devicecode:d")).isEmpty();
        assertThat(store.get("devicecode:user:U")).isEmpty();
    }

    @Test
    @DisplayName("getAndDelete should return the value once")
    void getAndDelete_shouldReturnValueOnce() {
        store.put("pkce:s", "challenge", TTL);

        assertThat(store.getAndDelete("pkce:s")).contains("challenge");
        assertThat(store.getAndDelete("pkce:s")).isEmpty();
    }

    @Test
    @DisplayName("putIfAbsent should succeed again after the previous entry expired")
    void putIfAbsent_shouldSucceed_whenPreviousEntryExpired() {
        assertThat(store.putIfAbsent("revoked:j", "1", Duration.ofSeconds(10))).isTrue();
        assertThat(store.putIfAbsent("revoked:j", "2", Duration.ofSeconds(10))).isFalse();

        clock.advance(Duration.ofSeconds(11));

        assertThat(store.putIfAbsent("revoked:j", "3", Duration.ofSeconds(10))).isTrue();
    }

    // ==================== Counters and sets ====================

    @Test
    @DisplayName("increment should count within the TTL and restart after it")
    void increment_shouldRestart_whenTtlElapsed() {
        Duration window = Duration.ofSeconds(60);
        assertThat(store.increment("ratelimit:k", window)).isEqualTo(1);
        assertThat(store.increment("ratelimit:k", window)).isEqualTo(2);

        clock.advance(Duration.ofSeconds(30));
        assertThat(store.increment("ratelimit:k", window)).isEqualTo(3);

        // TTL was not extended by the later increments
        clock.advance(Duration.ofSeconds(31));
        assertThat(store.increment("ratelimit:k", window)).isEqualTo(1);
    }

    @Test
    @DisplayName("set members should be added and removed")
    void members_shouldReflectAddAndRemove() {
        store.addMember("sessions:user:u1", "jti-1", TTL);
        store.addMember("sessions:user:u1", "jti-2", TTL);
        store.removeMember("sessions:user:u1", "jti-1");

        assertThat(store.members("sessions:user:u1")).containsExactly("jti-2");
        assertThat(store.members("sessions:user:nobody")).isEmpty();
    }

    @Test
    @DisplayName("delete should remove several keys and count the existing ones")
    void delete_shouldCountExistingKeys() {
        store.put("a", "1", TTL);
        store.put("b", "2", TTL);

        assertThat(store.delete("a", "b", "c")).isEqualTo(2);
        assertThat(store.get("a")).isEmpty();
        assertThat(store.get("b")).isEmpty();
    }
}
