package in.elpyfi.domain.trade;

import java.time.Instant;

/**
 * Ledger entry for an approved day trade.
 * closeTime == openTime means the position has not been closed yet.
 */
public record DayTrade(
    String symbol,
    Instant openTime,
    Instant closeTime,
    String strategy,
    boolean emergency
) {
    public static DayTrade opened(String symbol, String strategy, Instant at, boolean emergency) {
        return new DayTrade(symbol, at, at, strategy, emergency);
    }

    public boolean isOpen() {
        return closeTime.equals(openTime);
    }

    public DayTrade closedAt(Instant at) {
        return new DayTrade(symbol, openTime, at, strategy, emergency);
    }
}
