package com.infomedia.abacox.feeschedule.component.lookupcache;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Bounded, time-limited lookup cache that loads missing keys through a loader function.
 * <p>
 * Expiry is measured with the given {@link Clock}, so tests can advance time without sleeping.
 * Keys the loader cannot resolve (returns {@code null}) are not cached.
 */
@Log4j2
public class ReadThroughCache<K, V> {

    @Getter
    private final String name;
    private final LoadingCache<K, V> cache;

    public ReadThroughCache(String name, Function<K, V> loader, Duration ttl, long maxSize, Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(loader, "loader");
        Objects.requireNonNull(clock, "clock");
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .recordStats()
                .build(loader::apply);
        log.info("Created lookup cache '{}': maxSize={}, ttl={}", name, maxSize, ttl);
    }

    public Optional<V> get(K key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(key));
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
