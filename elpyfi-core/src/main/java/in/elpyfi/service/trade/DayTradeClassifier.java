package in.elpyfi.service.trade;

import in.elpyfi.domain.signal.Signal;

/**
 * Decides whether acting on a signal would be a day trade.
 * Quick trades (small expected profit) are assumed to close the same day.
 */
public final class DayTradeClassifier {

    public static final double DEFAULT_PROFIT_THRESHOLD = 0.03;

    private final double profitThreshold;

    public DayTradeClassifier() {
        this(DEFAULT_PROFIT_THRESHOLD);
    }

    public DayTradeClassifier(double profitThreshold) {
        this.profitThreshold = profitThreshold;
    }

    /**
     * @return null when there is no signal to judge
     */
    public Boolean isDayTrade(Signal signal) {
        if (signal == null) {
            return null;
        }
        return signal.estimatedProfit() < profitThreshold;
    }

    public double profitThreshold() {
        return profitThreshold;
    }
}
