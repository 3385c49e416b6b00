package com.tradingarena.orchestrator.risk;

import com.tradingarena.common.risk.LossWindow;
import com.tradingarena.orchestrator.config.ArenaProperties;
import com.tradingarena.orchestrator.execution.LedgerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-agent loss breaker checked before an agent decides.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>Equity is cash plus open positions at their last mark.</li>
 *   <li>An equity drop of at least the weekly limit since Monday pauses the agent until next Monday.</li>
 *   <li>Otherwise a drop of at least the daily limit since the day opened pauses it until tomorrow.</li>
 *   <li>Days and weeks follow the budget zone.</li>
 * </ul>
 *
 * <p>Windows live in memory; after a restart they reopen at the equity held when the agent
 * is first checked.
 */
@Component
public class LossCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(LossCircuitBreaker.class);

    private final LedgerRegistry registry;
    private final ArenaProperties.Risk settings;
    private final ZoneId zone;
    private final Clock clock;

    private final ConcurrentHashMap<String, LossWindow> windows = new ConcurrentHashMap<>();

    public LossCircuitBreaker(LedgerRegistry registry, ArenaProperties properties, Clock clock) {
        this.registry = registry;
        this.settings = properties.risk();
        this.zone     = properties.budget().zoneId();
        this.clock    = clock;
    }

    /** @return empty while the agent may trade, otherwise why it may not */
    public Optional<String> check(String agentName) {
        if (!settings.circuitBreakerEnabled()) {
            return Optional.empty();
        }
        BigDecimal equity = registry.portfolioValue(agentName);
        LocalDate today = LocalDate.ofInstant(clock.instant(), zone);
        AtomicReference<String> verdict = new AtomicReference<>();

        windows.compute(agentName, (name, current) -> {
            LossWindow window = current == null ? LossWindow.open(today, equity) : current.rollTo(today, equity);
            if (window.isPaused(today)) {
                verdict.set("paused until " + window.pausedUntil());
                return window;
            }
            BigDecimal weekly = window.weeklyLoss(equity);
            if (weekly.compareTo(settings.weeklyLossLimit()) >= 0) {
                verdict.set("weekly loss " + percent(weekly) + " reached limit " + percent(settings.weeklyLossLimit()));
                return window.pauseUntil(window.nextWeek());
            }
            BigDecimal daily = window.dailyLoss(equity);
            if (daily.compareTo(settings.dailyLossLimit()) >= 0) {
                verdict.set("daily loss " + percent(daily) + " reached limit " + percent(settings.dailyLossLimit()));
                return window.pauseUntil(today.plusDays(1));
            }
            return window;
        });

        String reason = verdict.get();
        if (reason != null) {
            log.warn("CIRCUIT_OPEN agent={} equity={} reason={}", agentName, equity.toPlainString(), reason);
        }
        return Optional.ofNullable(reason);
    }

    private static String percent(BigDecimal fraction) {
        return fraction.movePointRight(2).stripTrailingZeros().toPlainString() + "%";
    }
}
