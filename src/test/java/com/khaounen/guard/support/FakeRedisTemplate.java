package com.khaounen.guard.support;

import org.springframework.data.redis.connection.BitFieldSubCommands;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * String template over an in-memory map. Plain value commands behave like Redis; scripts are
 * answered by the {@link ScriptHandler} a test installs, which sees the keys and arguments the
 * store sent.
 */
public final class FakeRedisTemplate extends StringRedisTemplate {

    @FunctionalInterface
    public interface ScriptHandler {
        Object run(List<String> keys, Object[] args);
    }

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Long> ttls = new ConcurrentHashMap<>();
    private final AtomicInteger scriptCalls = new AtomicInteger();
    private final ValueOperations<String, String> valueOperations = new MapValueOperations();
    private volatile ScriptHandler scriptHandler = (keys, args) -> {
        throw new IllegalStateException("no script handler installed");
    };

    public void onScript(ScriptHandler handler) {
        this.scriptHandler = handler;
    }

    public int scriptCalls() {
        return scriptCalls.get();
    }

    public String value(String key) {
        return values.get(key);
    }

    public void put(String key, String value) {
        values.put(key, value);
        ttls.remove(key);
    }

    public void put(String key, String value, long ttlMillis) {
        values.put(key, value);
        ttls.put(key, ttlMillis);
    }

    public Long ttlMillis(String key) {
        return ttls.get(key);
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    @Override
    public ValueOperations<String, String> opsForValue() {
        return valueOperations;
    }

    @Override
    public <T> T execute(RedisScript<T> script, List<String> keys, Object... args) {
        scriptCalls.incrementAndGet();
        Object reply = scriptHandler.run(keys, args);
        return reply == null ? null : script.getResultType().cast(reply);
    }

    @Override
    public Boolean delete(String key) {
        ttls.remove(key);
        return values.remove(key) != null;
    }

    @Override
    public Long delete(Collection<String> keys) {
        long removed = 0;
        for (String key : keys) {
            if (delete(key)) {
                removed++;
            }
        }
        return removed;
    }

    private final class MapValueOperations implements ValueOperations<String, String> {

        @Override
        public void set(String key, String value) {
            put(key, value);
        }

        @Override
        public void set(String key, String value, long timeout, TimeUnit unit) {
            put(key, value, unit.toMillis(timeout));
        }

        @Override
        public Boolean setIfAbsent(String key, String value) {
            return values.putIfAbsent(key, value) == null;
        }

        @Override
        public Boolean setIfAbsent(String key, String value, long timeout, TimeUnit unit) {
            if (values.putIfAbsent(key, value) != null) {
                return false;
            }
            ttls.put(key, unit.toMillis(timeout));
            return true;
        }

        @Override
        public Boolean setIfPresent(String key, String value) {
            return values.replace(key, value) != null;
        }

        @Override
        public Boolean setIfPresent(String key, String value, long timeout, TimeUnit unit) {
            if (values.replace(key, value) == null) {
                return false;
            }
            ttls.put(key, unit.toMillis(timeout));
            return true;
        }

        @Override
        public void multiSet(Map<? extends String, ? extends String> map) {
            map.forEach(FakeRedisTemplate.this::put);
        }

        @Override
        public Boolean multiSetIfAbsent(Map<? extends String, ? extends String> map) {
            throw unused();
        }

        @Override
        public String get(Object key) {
            return values.get(key);
        }

        @Override
        public String getAndDelete(String key) {
            ttls.remove(key);
            return values.remove(key);
        }

        @Override
        public String getAndExpire(String key, long timeout, TimeUnit unit) {
            throw unused();
        }

        @Override
        public String getAndExpire(String key, Duration timeout) {
            throw unused();
        }

        @Override
        public String getAndPersist(String key) {
            throw unused();
        }

        @Override
        public String getAndSet(String key, String value) {
            ttls.remove(key);
            return values.put(key, value);
        }

        @Override
        public List<String> multiGet(Collection<String> keys) {
            List<String> result = new ArrayList<>();
            for (String key : keys) {
                result.add(values.get(key));
            }
            return result;
        }

        @Override
        public Long increment(String key) {
            return increment(key, 1L);
        }

        @Override
        public Long increment(String key, long delta) {
            String next = values.merge(key, String.valueOf(delta),
                    (current, added) -> String.valueOf(Long.parseLong(current) + Long.parseLong(added)));
            return Long.parseLong(next);
        }

        @Override
        public Double increment(String key, double delta) {
            throw unused();
        }

        @Override
        public Long decrement(String key) {
            return increment(key, -1L);
        }

        @Override
        public Long decrement(String key, long delta) {
            return increment(key, -delta);
        }

        @Override
        public Integer append(String key, String value) {
            throw unused();
        }

        @Override
        public String get(String key, long start, long end) {
            throw unused();
        }

        @Override
        public void set(String key, String value, long offset) {
            throw unused();
        }

        @Override
        public Long size(String key) {
            String value = values.get(key);
            return value == null ? 0L : (long) value.length();
        }

        @Override
        public Boolean setBit(String key, long offset, boolean value) {
            throw unused();
        }

        @Override
        public Boolean getBit(String key, long offset) {
            throw unused();
        }

        @Override
        public List<Long> bitField(String key, BitFieldSubCommands subCommands) {
            throw unused();
        }

        @Override
        public RedisOperations<String, String> getOperations() {
            return FakeRedisTemplate.this;
        }

        private UnsupportedOperationException unused() {
            return new UnsupportedOperationException("not used by the stores");
        }
    }
}
