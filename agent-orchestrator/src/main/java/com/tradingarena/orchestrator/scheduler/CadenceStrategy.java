package com.tradingarena.orchestrator.scheduler;

import com.tradingarena.common.session.MarketSession;
import com.tradingarena.common.session.MarketSessionClassifier;
import com.tradingarena.orchestrator.config.ArenaProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Maps the market session to the delay before the next cycle: the open interval during
 * the regular session, the closed interval otherwise. Pure; safe to share.
 */
public final class CadenceStrategy {

    private final Duration openInterval;
    private final Duration closedInterval;

    public CadenceStrategy(Duration openInterval, Duration closedInterval) {
        this.openInterval   = openInterval;
        this.closedInterval = closedInterval;
    }

    public static CadenceStrategy from(ArenaProperties.Schedule schedule) {
        return new CadenceStrategy(schedule.openInterval(), schedule.closedInterval());
    }

    public Duration nextDelay(Instant now) {
        return resolve(MarketSessionClassifier.classify(now));
    }

    public Duration resolve(MarketSession session) {
        return session.isOpen() ? openInterval : closedInterval;
    }
}
