package com.telemetrysentinel.service;

import com.telemetrysentinel.core.storage.KeyValueStore;
import com.telemetrysentinel.core.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link KeyValueStore} backed by Redis through a {@link JedisPool}.
 *
 * <p>
 * Uses {@code SETEX}, {@code GET}, {@code SCAN ... MATCH prefix*} and
 * {@code MGET}. A single {@code Jedis} connection is not thread safe, so every
 * call borrows one from the pool. Redis failures surface as
 * {@link StoreException}.
 * </p>
 *
 * @since 1.0.0
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LoggerFactory.getLogger(RedisKeyValueStore.class);

    static final int SCAN_BATCH = 500;

    private final JedisPool pool;

    public RedisKeyValueStore(String host, int port, Duration timeout) {
        this(new JedisPool(new JedisPoolConfig(), host, port, (int) timeout.toMillis()));
        LOG.info("Redis store connecting to {}:{}", host, port);
    }

    public RedisKeyValueStore(JedisPool pool) {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    @Override
    public void setex(String key, Duration ttl, String value) {
        long seconds = Math.max(1, ttl.getSeconds());
        execute("SETEX " + key, jedis -> jedis.setex(key, seconds, value));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute("GET " + key, jedis -> jedis.get(key)));
    }

    @Override
    public List<String> keys(String prefix) {
        ScanParams params = new ScanParams().match(globPrefix(prefix)).count(SCAN_BATCH);
        return execute("SCAN " + prefix, jedis -> {
            List<String> keys = new ArrayList<>();
            String cursor = ScanParams.SCAN_POINTER_START;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                keys.addAll(page.getResult());
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            return keys;
        });
    }

    @Override
    public List<String> mget(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        return execute("MGET " + keys.size() + " keys", jedis -> jedis.mget(keys.toArray(new String[0])));
    }

    @Override
    public void close() {
        pool.close();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private <T> T execute(String operation, Function<Jedis, T> command) {
        try (Jedis jedis = pool.getResource()) {
            return command.apply(jedis);
        } catch (JedisException e) {
            throw new StoreException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * @return a {@code MATCH} pattern for keys starting with {@code prefix},
     *         with glob metacharacters in the prefix escaped
     */
    static String globPrefix(String prefix) {
        StringBuilder out = new StringBuilder(prefix.length() + 1);
        for (char c : prefix.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.append('*').toString();
    }
}
