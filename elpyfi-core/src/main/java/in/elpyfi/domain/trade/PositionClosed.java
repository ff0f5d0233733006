package in.elpyfi.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Position closed by the execution side.
 */
public record PositionClosed(
    long positionId,
    String symbol,
    String strategy,
    BigDecimal exitPrice,
    BigDecimal realizedPnl,
    Instant closedAt
) {
    public boolean isProfitable() {
        return realizedPnl != null && realizedPnl.signum() > 0;
    }
}
