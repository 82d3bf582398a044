package tech.mediagateway.auth.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.shared.Instrumented;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory credential store using Caffeine.
 *
 * <p>Single-node only: state is not shared across instances. Suitable for
 * development, tests and single-server deployments.
 *
 * <p>Each entry carries its own expiry instant. Conditional operations run
 * inside {@link ConcurrentMap#compute}, which is atomic per key. Single-key
 * mutations share a read lock; the multi-key operations take the write lock so
 * no single-key mutation interleaves with them.
 *
 * <p>Note: @Typed excludes CredentialStore from bean types so only the
 * CredentialStoreProducer can provide the CredentialStore interface.
 */
@Singleton
@Instrumented(backend = "memory")
@Typed(InMemoryCredentialStore.class)
public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStore.class);

    @Inject
    CredentialStoreConfig config;

    @Inject
    Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private Cache<String, Entry> cache;

    @PostConstruct
    void init() {
        this.cache = Caffeine.newBuilder()
            .maximumSize(config.maxSize())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfter(new EntryExpiry())
            .build();
        LOG.debugf("In-memory credential store ready (maxSize=%d)", config.maxSize());
    }

    @Override
    public Optional<String> get(String key) {
        return live(key).map(Entry::value);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        shared(() -> map().put(key, Entry.value(value, expiry(ttl))));
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        AtomicBoolean stored = new AtomicBoolean(false);
        shared(() -> map().compute(key, (k, existing) -> {
            if (isLive(existing)) {
                return existing;
            }
            stored.set(true);
            return Entry.value(value, expiry(ttl));
        }));
        return stored.get();
    }

    @Override
    public boolean putAllIfAbsent(Map<String, String> entries, Duration ttl) {
        return exclusive(() -> {
            for (String key : entries.keySet()) {
                if (live(key).isPresent()) {
                    return false;
                }
            }
            Instant expiresAt = expiry(ttl);
            entries.forEach((key, value) -> map().put(key, Entry.value(value, expiresAt)));
            return true;
        });
    }

    @Override
    public long delete(String... keys) {
        return exclusive(() -> {
            long removed = 0;
            for (String key : keys) {
                if (isLive(map().remove(key))) {
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public Optional<String> getAndDelete(String key) {
        Entry entry = shared(() -> map().remove(key));
        return isLive(entry) ? Optional.of(entry.value()) : Optional.empty();
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update) {
        AtomicBoolean replaced = new AtomicBoolean(false);
        shared(() -> map().computeIfPresent(key, (k, existing) -> {
            if (!isLive(existing)) {
                return null;
            }
            if (!expected.equals(existing.value())) {
                return existing;
            }
            replaced.set(true);
            return Entry.value(update, existing.expiresAt());
        }));
        return replaced.get();
    }

    @Override
    public boolean compareAndDelete(String key, String expected, String... companions) {
        return exclusive(() -> {
            Optional<Entry> existing = live(key);
            if (existing.isEmpty() || !expected.equals(existing.get().value())) {
                return false;
            }
            map().remove(key);
            for (String companion : companions) {
                map().remove(companion);
            }
            return true;
        });
    }

    @Override
    public boolean updatePreservingTtl(String key, String value) {
        AtomicBoolean updated = new AtomicBoolean(false);
        shared(() -> map().computeIfPresent(key, (k, existing) -> {
            if (!isLive(existing)) {
                return null;
            }
            updated.set(true);
            return Entry.value(value, existing.expiresAt());
        }));
        return updated.get();
    }

    @Override
    public Optional<Duration> ttl(String key) {
        return live(key).map(entry -> Duration.between(clock.instant(), entry.expiresAt()));
    }

    @Override
    public long increment(String key, Duration ttl) {
        AtomicLong result = new AtomicLong();
        shared(() -> map().compute(key, (k, existing) -> {
            if (!isLive(existing)) {
                result.set(1);
                return Entry.value("1", expiry(ttl));
            }
            long next = Long.parseLong(existing.value()) + 1;
            result.set(next);
            return Entry.value(Long.toString(next), existing.expiresAt());
        }));
        return result.get();
    }

    @Override
    public void addMember(String key, String member, Duration ttl) {
        Instant requested = expiry(ttl);
        shared(() -> map().compute(key, (k, existing) -> {
            if (!isLive(existing)) {
                return Entry.set(Set.of(member), requested);
            }
            Instant expiresAt = existing.expiresAt().isAfter(requested) ? existing.expiresAt() : requested;
            return Entry.set(existing.withMember(member), expiresAt);
        }));
    }

    @Override
    public Set<String> members(String key) {
        return live(key).map(Entry::members).orElse(Set.of());
    }

    @Override
    public void removeMember(String key, String member) {
        shared(() -> map().computeIfPresent(key, (k, existing) -> {
            if (!isLive(existing)) {
                return null;
            }
            Set<String> remaining = existing.withoutMember(member);
            return remaining.isEmpty() ? null : Entry.set(remaining, existing.expiresAt());
        }));
    }

    private ConcurrentMap<String, Entry> map() {
        return cache.asMap();
    }

    private <T> T shared(Supplier<T> operation) {
        lock.readLock().lock();
        try {
            return operation.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T exclusive(Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            return operation.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<Entry> live(String key) {
        Entry entry = cache.getIfPresent(key);
        return isLive(entry) ? Optional.of(entry) : Optional.empty();
    }

    private boolean isLive(Entry entry) {
        return entry != null && entry.expiresAt().isAfter(clock.instant());
    }

    private Instant expiry(Duration ttl) {
        return clock.instant().plus(ttl);
    }

    private class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Entry entry) {
            long nanos = Duration.between(clock.instant(), entry.expiresAt()).toNanos();
            return Math.max(nanos, 0);
        }
    }

    /**
     * A stored value or set, with its absolute expiry.
     */
    record Entry(String value, Set<String> members, Instant expiresAt) {

        static Entry value(String value, Instant expiresAt) {
            return new Entry(value, Set.of(), expiresAt);
        }

        static Entry set(Set<String> members, Instant expiresAt) {
            return new Entry(null, Set.copyOf(members), expiresAt);
        }

        Set<String> withMember(String member) {
            HashSet<String> copy = new HashSet<>(members);
            copy.add(member);
            return copy;
        }

        Set<String> withoutMember(String member) {
            HashSet<String> copy = new HashSet<>(members);
            copy.remove(member);
            return copy;
        }
    }
}
