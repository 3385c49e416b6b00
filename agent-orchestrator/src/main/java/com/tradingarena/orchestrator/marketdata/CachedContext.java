package com.tradingarena.orchestrator.marketdata;

import com.tradingarena.common.model.MarketContext;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * One cache slot: a shared, replaying fetch plus the context it resolved to.
 *
 * <p>While the fetch is in flight {@link #resolved()} is {@code null} and the slot is
 * always usable, which is what lets concurrent callers join a single fetch.
 */
final class CachedContext {

    private final Mono<MarketContext> shared;
    private final Instant createdAt;
    private volatile MarketContext resolved;

    CachedContext(Mono<MarketContext> fetch, Instant createdAt, Consumer<CachedContext> onFailure) {
        this.createdAt = createdAt;
        this.shared = fetch
            .doOnNext(ctx -> this.resolved = ctx)
            .doOnError(e -> onFailure.accept(this))
            .cache();
    }

    Mono<MarketContext> shared() {
        return shared;
    }

    Instant createdAt() {
        return createdAt;
    }

    MarketContext resolved() {
        return resolved;
    }

    boolean isUsableAt(Instant now) {
        MarketContext ctx = resolved;
        return ctx == null || ctx.isValidAt(now);
    }
}
