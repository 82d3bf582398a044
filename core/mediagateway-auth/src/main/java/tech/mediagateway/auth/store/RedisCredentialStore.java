package tech.mediagateway.auth.store;

import io.quarkus.arc.lookup.LookupIfProperty;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Typed;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.mediagateway.auth.shared.Instrumented;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed credential store, shared by all instances.
 *
 * <p>Conditional and multi-key operations run as Lua scripts so each is a single
 * atomic step on the server. Every call is bounded by
 * {@code mediagateway.store.operation-timeout}; a failure or timeout surfaces as
 * {@link CredentialStoreUnavailableException} and is never retried here.
 */
@ApplicationScoped
@Instrumented(backend = "redis")
@Typed(RedisCredentialStore.class)
@LookupIfProperty(name = "mediagateway.store.type", stringValue = "REDIS")
public class RedisCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(RedisCredentialStore.class);

    private static final String PUT_ALL_IF_ABSENT_SCRIPT = """
        for i = 1, #KEYS do
            if redis.call('EXISTS', KEYS[i]) == 1 then
                return 0
            end
        end
        for i = 1, #KEYS do
            redis.call('SET', KEYS[i], ARGV[i + 1], 'PX', ARGV[1])
        end
        return 1
        """;

    private static final String COMPARE_AND_SET_SCRIPT = """
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            redis.call('SET', KEYS[1], ARGV[2], 'KEEPTTL')
            return 1
        else
            return 0
        end
        """;

    private static final String COMPARE_AND_DELETE_SCRIPT = """
        if redis.call('GET', KEYS[1]) == ARGV[1] then
            return redis.call('DEL', unpack(KEYS))
        else
            return 0
        end
        """;

    private static final String INCREMENT_SCRIPT = """
        local count = redis.call('INCR', KEYS[1])
        if count == 1 then
            redis.call('PEXPIRE', KEYS[1], ARGV[1])
        end
        return count
        """;

    private static final String ADD_MEMBER_SCRIPT = """
        redis.call('SADD', KEYS[1], ARGV[1])
        if redis.call('PTTL', KEYS[1]) < tonumber(ARGV[2]) then
            redis.call('PEXPIRE', KEYS[1], ARGV[2])
        end
        return 1
        """;

    @Inject
    CredentialStoreConfig config;

    @Inject
    Instance<ReactiveRedisDataSource> redisInstance;

    @Override
    public Optional<String> get(String key) {
        Response response = call("GET", "GET", k(key));
        return Optional.ofNullable(response).map(Response::toString);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        call("SET", "SET", k(key), value, "PX", millis(ttl));
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        return call("SET NX", "SET", k(key), value, "NX", "PX", millis(ttl)) != null;
    }

    @Override
    public boolean putAllIfAbsent(Map<String, String> entries, Duration ttl) {
        List<String> args = new ArrayList<>();
        args.add(PUT_ALL_IF_ABSENT_SCRIPT);
        args.add(Integer.toString(entries.size()));
        List<String> values = new ArrayList<>();
        entries.forEach((key, value) -> {
            args.add(k(key));
            values.add(value);
        });
        args.add(millis(ttl));
        args.addAll(values);
        return call("putAllIfAbsent", "EVAL", args.toArray(String[]::new)).toInteger() == 1;
    }

    @Override
    public long delete(String... keys) {
        if (keys.length == 0) {
            return 0;
        }
        Response response = call("DEL", "DEL", prefixed(keys));
        return response.toLong();
    }

    @Override
    public Optional<String> getAndDelete(String key) {
        Response response = call("GETDEL", "GETDEL", k(key));
        return Optional.ofNullable(response).map(Response::toString);
    }

    @Override
    public boolean compareAndSet(String key, String expected, String update) {
        Response response = call("compareAndSet", "EVAL", COMPARE_AND_SET_SCRIPT, "1", k(key), expected, update);
        return response.toInteger() == 1;
    }

    @Override
    public boolean compareAndDelete(String key, String expected, String... companions) {
        List<String> args = new ArrayList<>();
        args.add(COMPARE_AND_DELETE_SCRIPT);
        args.add(Integer.toString(companions.length + 1));
        args.add(k(key));
        for (String companion : companions) {
            args.add(k(companion));
        }
        args.add(expected);
        Response response = call("compareAndDelete", "EVAL", args.toArray(String[]::new));
        return response.toLong() > 0;
    }

    @Override
    public boolean updatePreservingTtl(String key, String value) {
        return call("SET XX KEEPTTL", "SET", k(key), value, "XX", "KEEPTTL") != null;
    }

    @Override
    public Optional<Duration> ttl(String key) {
        long millis = call("PTTL", "PTTL", k(key)).toLong();
        // -2: key missing, -1: key without expiry
        if (millis == -2) {
            return Optional.empty();
        }
        if (millis == -1) {
            LOG.warnf("Credential store key without expiry: %s", key);
            return Optional.of(Duration.ZERO);
        }
        return Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public long increment(String key, Duration ttl) {
        return call("increment", "EVAL", INCREMENT_SCRIPT, "1", k(key), millis(ttl)).toLong();
    }

    @Override
    public void addMember(String key, String member, Duration ttl) {
        call("addMember", "EVAL", ADD_MEMBER_SCRIPT, "1", k(key), member, millis(ttl));
    }

    @Override
    public Set<String> members(String key) {
        Response response = call("SMEMBERS", "SMEMBERS", k(key));
        Set<String> members = new HashSet<>();
        if (response != null) {
            for (int i = 0; i < response.size(); i++) {
                members.add(response.get(i).toString());
            }
        }
        return members;
    }

    @Override
    public void removeMember(String key, String member) {
        call("SREM", "SREM", k(key), member);
    }

    private Response call(String operation, String command, String... args) {
        try {
            Uni<Response> pending = redisInstance.get().execute(command, args);
            return pending.await().atMost(config.operationTimeout());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Credential store operation failed: %s", operation);
            throw new CredentialStoreUnavailableException(operation, e);
        }
    }

    private String k(String key) {
        return config.redis().keyPrefix().map(prefix -> prefix + key).orElse(key);
    }

    private String[] prefixed(String... keys) {
        String[] result = new String[keys.length];
        for (int i = 0; i < keys.length; i++) {
            result[i] = k(keys[i]);
        }
        return result;
    }

    private static String millis(Duration ttl) {
        return Long.toString(Math.max(ttl.toMillis(), 1));
    }
}
