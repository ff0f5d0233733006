package in.elpyfi.service.allocation;

import java.math.BigDecimal;

/**
 * Per-strategy outcome history feeding the historical success multiplier.
 *
 * MULTIPLIER:
 * smoothed = (wins + 1) / (trades + 2)          (Laplace; 0.5 with no history)
 * multiplier = NEUTRAL * smoothed / 0.5         (NEUTRAL with no history)
 * clamped to [MIN_MULTIPLIER, MAX_MULTIPLIER]
 */
public record StrategyStats(
    String strategy,
    int trades,
    int wins,
    BigDecimal cumulativeProfit
) {
    public static final double NEUTRAL_MULTIPLIER = 0.8;
    public static final double MIN_MULTIPLIER = 0.1;
    public static final double MAX_MULTIPLIER = 1.5;

    public static StrategyStats empty(String strategy) {
        return new StrategyStats(strategy, 0, 0, BigDecimal.ZERO);
    }

    public StrategyStats withOutcome(boolean profitable, BigDecimal profit) {
        return new StrategyStats(
            strategy,
            trades + 1,
            profitable ? wins + 1 : wins,
            cumulativeProfit.add(profit == null ? BigDecimal.ZERO : profit)
        );
    }

    public double winRate() {
        return trades == 0 ? 0.0 : (double) wins / trades;
    }

    public double successMultiplier() {
        double smoothed = (wins + 1.0) / (trades + 2.0);
        double raw = NEUTRAL_MULTIPLIER * smoothed / 0.5;
        return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, raw));
    }
}
