package in.elpyfi.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Broker confirmation of a placed order.
 */
public record OrderFill(
    String executionRef,
    String symbol,
    BigDecimal quantity,
    BigDecimal price,
    Instant filledAt
) {}
