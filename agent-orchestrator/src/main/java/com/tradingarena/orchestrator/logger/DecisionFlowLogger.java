package com.tradingarena.orchestrator.logger;

import com.tradingarena.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage markers for a trading cycle. Pure side effects; nothing here alters the pipeline.
 *
 * <p>Stages in order:
 * <ol>
 *   <li>{@link #CYCLE_STARTED}</li>
 *   <li>{@link #CONTEXT_READY}</li>
 *   <li>{@link #AGENTS_DECIDED}: every independent agent decided, skipped or timed out</li>
 *   <li>{@link #CONSORTIUM_AGGREGATED}</li>
 *   <li>{@link #CYCLE_COMPLETED}</li>
 * </ol>
 *
 * <p>Use {@link #stage(String)} with {@code doOnEach} so the trace id is read from the
 * Reactor Context; use {@link #logWithTraceId} where the cycle id is already at hand.
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String CYCLE_STARTED         = "CYCLE_STARTED";
    public static final String CONTEXT_READY         = "CONTEXT_READY";
    public static final String AGENTS_DECIDED        = "AGENTS_DECIDED";
    public static final String CONSORTIUM_AGGREGATED = "CONSORTIUM_AGGREGATED";
    public static final String CYCLE_COMPLETED       = "CYCLE_COMPLETED";

    /** Logs on {@code onNext} only; errors and completion are left to the pipeline. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[CycleFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[CycleFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    public void logConsortium(String traceId, String action, String symbol, int confidence,
                              int voters, int staleIgnored) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[CycleFlow] stage={} action={} symbol={} confidence={} voters={} staleIgnored={} traceId={}",
                     CONSORTIUM_AGGREGATED, action, symbol, confidence, voters, staleIgnored, traceId)
        );
    }
}
