package tech.mediagateway.auth.store;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * TTL-bound key-value storage shared by every instance of the authorization core.
 *
 * <p>Holds PKCE challenges, authorization codes, device codes, session records,
 * revocation markers and rate-limit counters. Every operation is atomic at the
 * key level; the multi-key operations ({@link #putAllIfAbsent}, {@link #delete},
 * {@link #compareAndDelete}) are atomic across all keys they name.
 *
 * <p>Implementations surface every connectivity failure or timeout as a
 * {@link CredentialStoreUnavailableException}. Callers never retry.
 */
public interface CredentialStore {

    /**
     * Get the value stored under a key.
     *
     * @return the value, or empty if absent or expired
     */
    Optional<String> get(String key);

    /**
     * Store a value, replacing any existing value and TTL.
     */
    void put(String key, String value, Duration ttl);

    /**
     * Store a value only if the key does not exist.
     *
     * @return true if the value was stored
     */
    boolean putIfAbsent(String key, String value, Duration ttl);

    /**
     * Store several values with a shared TTL, only if none of the keys exist.
     * Either all entries are written or none are.
     *
     * @return true if every entry was stored
     */
    boolean putAllIfAbsent(Map<String, String> entries, Duration ttl);

    /**
     * Delete one or more keys in a single operation.
     *
     * @return number of keys that existed
     */
    long delete(String... keys);

    /**
     * Read and delete a key in a single operation.
     */
    Optional<String> getAndDelete(String key);

    /**
     * Replace the value of a key only if it currently equals {@code expected}.
     * The remaining TTL of the key is kept.
     *
     * @return true if the value was replaced
     */
    boolean compareAndSet(String key, String expected, String update);

    /**
     * Delete a key only if its value equals {@code expected}. When the delete
     * happens, {@code companions} are deleted in the same operation.
     *
     * @return true if the key was deleted
     */
    boolean compareAndDelete(String key, String expected, String... companions);

    /**
     * Overwrite the value of an existing key without touching its TTL.
     *
     * @return false if the key does not exist
     */
    boolean updatePreservingTtl(String key, String value);

    /**
     * Remaining time to live of a key.
     */
    Optional<Duration> ttl(String key);

    /**
     * Increment a counter, creating it at 1 with the given TTL when absent.
     * The TTL is not extended by later increments.
     *
     * @return the counter value after the increment
     */
    long increment(String key, Duration ttl);

    /**
     * Add a member to a set, extending the set's TTL to at least {@code ttl}.
     */
    void addMember(String key, String member, Duration ttl);

    Set<String> members(String key);

    void removeMember(String key, String member);

    /**
     * Backend type for the credential store.
     */
    enum StoreType {
        MEMORY,
        REDIS
    }
}
