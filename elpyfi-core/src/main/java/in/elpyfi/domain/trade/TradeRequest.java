package in.elpyfi.domain.trade;

import in.elpyfi.domain.signal.Signal;

/**
 * Request to trade on a signal, created by the execution side.
 *
 * dayTrade is nullable: a request that does not say whether it is a day trade
 * is ambiguous and is handled as one that needs a slot.
 */
public record TradeRequest(
    Signal signal,
    Boolean dayTrade,
    double requestedPositionFraction
) {
    public static TradeRequest dayTrade(Signal signal, double fraction) {
        return new TradeRequest(signal, Boolean.TRUE, fraction);
    }

    public static TradeRequest swing(Signal signal, double fraction) {
        return new TradeRequest(signal, Boolean.FALSE, fraction);
    }

    /**
     * Whether admission must go through the day-trade slot accounting.
     * Ambiguous requests always do, whatever their flag says.
     */
    public boolean requiresSlot() {
        return isAmbiguous() || !Boolean.FALSE.equals(dayTrade);
    }

    /**
     * Missing signal or missing day-trade flag.
     */
    public boolean isAmbiguous() {
        return signal == null || dayTrade == null;
    }

    public String symbol() {
        return signal != null ? signal.symbol() : null;
    }

    public String strategy() {
        return signal != null ? signal.strategy() : null;
    }
}
