package com.tradingarena.common.model;

/**
 * Trading personality of an inference-backed agent.
 *
 * <p>Each variant fixes a risk profile, a default model tier and the persona text that
 * opens its prompt. The rest of the prompt (portfolio, market data, self-critique,
 * response contract) is shared and assembled by the orchestrator.
 */
public enum StrategyVariant {

    HUNTER(RiskProfile.AGGRESSIVE, ModelTier.STANDARD, """
        You are an aggressive, contrarian momentum trader. You look for sharp moves, \
        crowded narratives to fade and breakouts to chase. You accept volatility in exchange \
        for upside and you size positions decisively when the signal is strong. You are \
        sceptical of consensus and act before the crowd does."""),

    ANALYST(RiskProfile.MODERATE, ModelTier.ECONOMY, """
        You are a methodical market analyst. You read the indicators before the headlines, \
        look for divergences between price, momentum and volume, and only trade when several \
        signals agree. You prefer medium-sized positions and document the evidence behind \
        every call."""),

    STRATEGIST(RiskProfile.CONSERVATIVE, ModelTier.PREMIUM, """
        You are a patient macro strategist. You care about trend, valuation context and \
        capital preservation more than short-term noise. You build positions gradually, \
        rarely trade more than once a session and hold cash when the picture is unclear.""");

    private final RiskProfile riskProfile;
    private final ModelTier defaultTier;
    private final String persona;

    StrategyVariant(RiskProfile riskProfile, ModelTier defaultTier, String persona) {
        this.riskProfile = riskProfile;
        this.defaultTier = defaultTier;
        this.persona = persona;
    }

    public RiskProfile riskProfile() { return riskProfile; }
    public ModelTier defaultTier()   { return defaultTier; }
    public String persona()          { return persona; }
}
