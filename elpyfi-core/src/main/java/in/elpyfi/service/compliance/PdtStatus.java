package in.elpyfi.service.compliance;

import in.elpyfi.domain.trade.DayTrade;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the week's day-trade budget.
 */
public record PdtStatus(
    int tradesUsed,
    int tradesRemaining,
    boolean canDayTrade,       // an ordinary day trade would be admitted now
    Instant weekStart,
    List<DayTrade> recentTrades,
    int pendingAllocations,
    int emergencyReserve,
    int weeklyLimit
) {}
