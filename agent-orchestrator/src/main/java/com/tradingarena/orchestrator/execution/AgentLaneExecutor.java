package com.tradingarena.orchestrator.execution;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Serializes work per agent. Work submitted for the same agent runs one unit at a time
 * in submission order; work for different agents runs concurrently.
 *
 * <p>Each agent has a tail: a Mono that completes when the most recently submitted unit
 * finishes. A new unit waits on the previous tail and installs its own. A failure in
 * one unit does not block the next.
 */
@Component
public class AgentLaneExecutor {

    private final ConcurrentHashMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> submit(String agentName, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> mine = done.asMono();
            AtomicReference<Mono<Void>> previous = new AtomicReference<>(Mono.empty());
            tails.compute(agentName, (name, tail) -> {
                if (tail != null) {
                    previous.set(tail);
                }
                return mine;
            });
            return previous.get()
                .onErrorResume(e -> Mono.empty())
                .then(Mono.defer(work))
                .doFinally(signal -> {
                    tails.remove(agentName, mine);
                    done.tryEmitEmpty();
                });
        });
    }

    /** Number of agents with queued or running work. */
    int activeLanes() {
        return tails.size();
    }
}
