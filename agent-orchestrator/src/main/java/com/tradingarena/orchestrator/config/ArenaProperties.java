package com.tradingarena.orchestrator.config;

import com.tradingarena.common.budget.ModelPrice;
import com.tradingarena.common.model.AgentProfile;
import com.tradingarena.common.model.ModelTier;
import com.tradingarena.common.model.StrategyVariant;
import com.tradingarena.common.model.SymbolSet;
import com.tradingarena.common.risk.ExitRules;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Arena settings bound from the {@code arena.*} tree. Every nested group falls back to
 * defaults when absent, so an empty configuration yields a runnable (disabled) arena.
 */
@ConfigurationProperties(prefix = "arena")
public record ArenaProperties(
    Boolean tradingEnabled,
    List<Agent> agents,
    Consortium consortium,
    List<String> universe,
    Schedule schedule,
    Budget budget,
    Decision decision,
    Execution execution,
    Timeouts timeouts,
    Store store,
    MarketData marketData,
    Risk risk
) {

    public ArenaProperties {
        if (tradingEnabled == null) {
            tradingEnabled = Boolean.FALSE;
        }
        if (agents == null || agents.isEmpty()) {
            agents = defaultAgents();
        }
        if (consortium == null) {
            consortium = new Consortium(null, null, null, null, null);
        }
        universe = sanitizeSymbols(universe);
        if (schedule == null) {
            schedule = new Schedule(null, null, null, null, null, null);
        }
        if (budget == null) {
            budget = new Budget(null, null, null);
        }
        if (decision == null) {
            decision = new Decision(null, null, null, null, null, null);
        }
        if (execution == null) {
            execution = new Execution(null);
        }
        if (timeouts == null) {
            timeouts = new Timeouts(null, null, null, null, null);
        }
        if (store == null) {
            store = new Store(null, null);
        }
        if (marketData == null) {
            marketData = new MarketData(null, null, null, null);
        }
        if (risk == null) {
            risk = new Risk(null, null, null, null, null, null, null, null);
        }
        validateNames(agents, consortium);
    }

    public static ArenaProperties defaults() {
        return new ArenaProperties(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /** Inference agents followed by the consortium, when enabled. */
    public List<AgentProfile> profiles() {
        List<AgentProfile> profiles = new ArrayList<>();
        for (Agent a : agents) {
            profiles.add(new AgentProfile(a.name(), a.variant(), a.modelId(), a.tier(), a.initialCapital(), false));
        }
        if (consortium.enabled()) {
            profiles.add(AgentProfile.consortium(consortium.name(), consortium.initialCapital()));
        }
        return List.copyOf(profiles);
    }

    public SymbolSet universeSet() {
        return SymbolSet.of(universe);
    }

    private static List<String> sanitizeSymbols(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of("AAPL", "MSFT", "NVDA", "TSLA", "SPY");
        }
        return values.stream()
            .filter(Objects::nonNull)
            .map(s -> s.trim().toUpperCase())
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList();
    }

    private static List<Agent> defaultAgents() {
        return List.of(
            new Agent("hunter", StrategyVariant.HUNTER, "x-ai/grok-3-mini", null, null),
            new Agent("analyst", StrategyVariant.ANALYST, "deepseek/deepseek-chat", null, null),
            new Agent("strategist", StrategyVariant.STRATEGIST, "openai/gpt-4o", null, null));
    }

    private static void validateNames(List<Agent> agents, Consortium consortium) {
        Set<String> seen = new HashSet<>();
        for (Agent a : agents) {
            if (!seen.add(a.name())) {
                throw new IllegalArgumentException("duplicate agent name: " + a.name());
            }
        }
        if (consortium.enabled() && seen.contains(consortium.name())) {
            throw new IllegalArgumentException("consortium name clashes with an agent: " + consortium.name());
        }
    }

    public record Agent(
        String name,
        StrategyVariant variant,
        String modelId,
        ModelTier tier,
        BigDecimal initialCapital
    ) {
        public Agent {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("arena.agents[].name is required");
            }
            if (variant == null) {
                throw new IllegalArgumentException("arena.agents[].variant is required for " + name);
            }
            if (modelId == null || modelId.isBlank()) {
                throw new IllegalArgumentException("arena.agents[].model-id is required for " + name);
            }
            if (tier == null) {
                tier = variant.defaultTier();
            }
            if (initialCapital == null) {
                initialCapital = new BigDecimal("10000.00");
            }
        }
    }

    public record Consortium(
        Boolean enabled,
        String name,
        BigDecimal initialCapital,
        Double defaultWinRate,
        Integer minResolvedTrades
    ) {
        public Consortium {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (name == null || name.isBlank()) {
                name = "consortium";
            }
            if (initialCapital == null) {
                initialCapital = new BigDecimal("10000.00");
            }
            if (defaultWinRate == null) {
                defaultWinRate = 0.5;
            }
            if (minResolvedTrades == null) {
                minResolvedTrades = 3;
            }
        }
    }

    /**
     * @param openInterval   cycle cadence while the regular session is open
     * @param closedInterval cycle cadence outside the regular session
     * @param reviewInterval position review cadence, reviews only run while the market is open
     */
    public record Schedule(
        Duration initialDelay,
        Duration openInterval,
        Duration closedInterval,
        Duration reviewInterval,
        Duration maintenanceInterval,
        Boolean enabled
    ) {
        public Schedule {
            if (initialDelay == null) {
                initialDelay = Duration.ofSeconds(30);
            }
            if (openInterval == null) {
                openInterval = Duration.ofMinutes(30);
            }
            if (closedInterval == null) {
                closedInterval = Duration.ofMinutes(120);
            }
            if (reviewInterval == null) {
                reviewInterval = Duration.ofMinutes(5);
            }
            if (maintenanceInterval == null) {
                maintenanceInterval = Duration.ofSeconds(60);
            }
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
        }
    }

    /**
     * @param pricing model id to USD per one million tokens; models missing here are priced by tier
     */
    public record Budget(
        BigDecimal dailyCeiling,
        String zone,
        Map<String, Price> pricing
    ) {
        public Budget {
            if (dailyCeiling == null) {
                dailyCeiling = new BigDecimal("0.80");
            }
            if (dailyCeiling.signum() < 0) {
                throw new IllegalArgumentException("arena.budget.daily-ceiling must be non-negative");
            }
            if (zone == null || zone.isBlank()) {
                zone = "America/New_York";
            }
            if (pricing == null || pricing.isEmpty()) {
                pricing = defaultPricing();
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }

        private static Map<String, Price> defaultPricing() {
            Map<String, Price> table = new LinkedHashMap<>();
            table.put("openai/gpt-4o", new Price(new BigDecimal("2.50"), new BigDecimal("10.00")));
            table.put("openai/gpt-4o-mini", new Price(new BigDecimal("0.15"), new BigDecimal("0.60")));
            table.put("deepseek/deepseek-chat", new Price(new BigDecimal("0.14"), new BigDecimal("0.28")));
            table.put("x-ai/grok-3-mini", new Price(new BigDecimal("0.30"), new BigDecimal("0.50")));
            return table;
        }
    }

    public record Price(BigDecimal inputPerMillion, BigDecimal outputPerMillion) {
        public ModelPrice toModelPrice() {
            return new ModelPrice(inputPerMillion, outputPerMillion);
        }
    }

    /**
     * @param critiqueEvery  filled trades between self-critique refreshes
     * @param maxPromptChars upper bound on the user prompt; news is dropped first when exceeded
     */
    public record Decision(
        Integer critiqueEvery,
        Integer critiqueWindow,
        Integer maxTokens,
        Double temperature,
        Integer maxPromptChars,
        Integer historyLimit
    ) {
        public Decision {
            if (critiqueEvery == null) {
                critiqueEvery = 5;
            }
            if (critiqueEvery < 1) {
                throw new IllegalArgumentException("arena.decision.critique-every must be >= 1");
            }
            if (critiqueWindow == null) {
                critiqueWindow = 10;
            }
            if (maxTokens == null) {
                maxTokens = 1500;
            }
            if (temperature == null) {
                temperature = 0.5;
            }
            if (maxPromptChars == null) {
                maxPromptChars = 12_000;
            }
            if (historyLimit == null) {
                historyLimit = 50;
            }
        }
    }

    public record Execution(BigDecimal fee) {
        public Execution {
            if (fee == null) {
                fee = new BigDecimal("1.00");
            }
        }
    }

    /**
     * @param agentDecision upper bound on one agent's whole decision step, inference included
     */
    public record Timeouts(
        Duration inference,
        Duration marketData,
        Duration news,
        Duration brokerage,
        Duration agentDecision
    ) {
        public Timeouts {
            if (inference == null) {
                inference = Duration.ofSeconds(60);
            }
            if (marketData == null) {
                marketData = Duration.ofSeconds(10);
            }
            if (news == null) {
                news = Duration.ofSeconds(10);
            }
            if (brokerage == null) {
                brokerage = Duration.ofSeconds(15);
            }
            if (agentDecision == null) {
                agentDecision = Duration.ofSeconds(90);
            }
        }
    }

    public record Store(Integer maxRetries, Duration initialBackoff) {
        public Store {
            if (maxRetries == null) {
                maxRetries = 3;
            }
            if (initialBackoff == null) {
                initialBackoff = Duration.ofMillis(200);
            }
        }
    }

    public record MarketData(Duration contextTtl, String timeframe, Integer barLimit, Integer newsLimit) {
        public MarketData {
            if (contextTtl == null) {
                contextTtl = Duration.ofMinutes(2);
            }
            if (timeframe == null || timeframe.isBlank()) {
                timeframe = "1Hour";
            }
            if (barLimit == null) {
                barLimit = 100;
            }
            if (newsLimit == null) {
                newsLimit = 10;
            }
        }
    }

    /**
     * Position exits applied by the review and the per-agent loss breaker checked before
     * each decision. Every threshold is a fraction: 0.03 means 3%.
     *
     * @param dailyLossLimit  equity drop since the day opened that pauses an agent for the rest of the day
     * @param weeklyLossLimit equity drop since Monday that pauses an agent for the rest of the week
     */
    public record Risk(
        Boolean exitsEnabled,
        BigDecimal stopLoss,
        BigDecimal takeProfit,
        BigDecimal partialTakeProfit,
        BigDecimal partialTakeProfitRatio,
        Boolean circuitBreakerEnabled,
        BigDecimal dailyLossLimit,
        BigDecimal weeklyLossLimit
    ) {
        public Risk {
            if (exitsEnabled == null) {
                exitsEnabled = Boolean.TRUE;
            }
            if (stopLoss == null) {
                stopLoss = new BigDecimal("0.03");
            }
            if (takeProfit == null) {
                takeProfit = new BigDecimal("0.10");
            }
            if (partialTakeProfit == null) {
                partialTakeProfit = new BigDecimal("0.06");
            }
            if (partialTakeProfitRatio == null) {
                partialTakeProfitRatio = new BigDecimal("0.5");
            }
            if (circuitBreakerEnabled == null) {
                circuitBreakerEnabled = Boolean.TRUE;
            }
            if (dailyLossLimit == null) {
                dailyLossLimit = new BigDecimal("0.05");
            }
            if (weeklyLossLimit == null) {
                weeklyLossLimit = new BigDecimal("0.10");
            }
            if (dailyLossLimit.signum() <= 0 || weeklyLossLimit.signum() <= 0) {
                throw new IllegalArgumentException("arena.risk loss limits must be positive");
            }
        }

        public ExitRules exitRules() {
            return new ExitRules(stopLoss, takeProfit, partialTakeProfit, partialTakeProfitRatio);
        }
    }
}
