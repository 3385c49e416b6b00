package com.tradingarena.orchestrator.marketdata;

import com.tradingarena.common.model.MarketContext;
import com.tradingarena.common.model.SymbolSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Single-flight cache of {@link MarketContext} per symbol set.
 *
 * <p>{@link ConcurrentHashMap#compute} decides atomically whether a caller joins the
 * existing slot or installs a new fetch, so within one TTL window at most one fetch runs
 * per symbol set. A failed fetch removes its own slot; the next caller starts over.
 */
@Component
public class MarketContextCache {

    private static final Logger log = LoggerFactory.getLogger(MarketContextCache.class);

    private final ConcurrentHashMap<String, CachedContext> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public MarketContextCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the cached context for {@code symbols}, joining an in-flight fetch or starting
     * one with {@code loader} when the slot is empty or expired.
     */
    public Mono<MarketContext> getOrLoad(SymbolSet symbols, Function<SymbolSet, Mono<MarketContext>> loader) {
        return Mono.defer(() -> {
            String key = symbols.key();
            Instant now = clock.instant();
            AtomicBoolean miss = new AtomicBoolean(false);

            CachedContext slot = store.compute(key, (k, existing) -> {
                if (existing != null && existing.isUsableAt(now)) {
                    return existing;
                }
                miss.set(true);
                return new CachedContext(loader.apply(symbols), now, failed -> evict(key, failed));
            });

            if (miss.get()) {
                log.info("CACHE_MISS symbols={}", key);
            } else {
                log.info("CACHE_HIT symbols={} inFlight={}", key, slot.resolved() == null);
            }
            return slot.shared();
        });
    }

    public void invalidate(SymbolSet symbols) {
        store.remove(symbols.key());
    }

    int size() {
        return store.size();
    }

    private void evict(String key, CachedContext failed) {
        if (store.remove(key, failed)) {
            log.warn("CACHE_EVICT symbols={} reason=fetch-failed", key);
        }
    }
}
