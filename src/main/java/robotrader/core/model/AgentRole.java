package robotrader.core.model;

/**
 * Specialisation of a registered agent.
 */
public enum AgentRole {
    TECHNICAL_ANALYST,
    FUNDAMENTAL_SCREENER,
    RISK_MANAGER,
    PORTFOLIO_ANALYST,
    MARKET_MONITOR,
    STRATEGY_AGENT
}
