package in.elpyfi.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Position opened by the execution side after an approved trade was filled.
 * executionRef is the broker order id (positions.order_id).
 */
public record PositionOpened(
    String symbol,
    BigDecimal quantity,
    BigDecimal entryPrice,
    String strategy,
    String executionRef,
    Instant openedAt
) {}
