package in.elpyfi.infrastructure.broker;

import in.elpyfi.application.port.output.OrderGateway;
import in.elpyfi.domain.trade.OrderFill;
import in.elpyfi.domain.trade.TradeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Fills every order locally at a fixed size and price.
 * Used when no broker is configured.
 */
public final class PaperOrderGateway implements OrderGateway {
    private static final Logger log = LoggerFactory.getLogger(PaperOrderGateway.class);

    static final BigDecimal FILL_QUANTITY = new BigDecimal("100");
    static final BigDecimal FILL_PRICE = new BigDecimal("100.0");

    private final Clock clock;

    public PaperOrderGateway() {
        this(Clock.systemUTC());
    }

    public PaperOrderGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<OrderFill> submit(TradeRequest request) {
        if (request == null || request.symbol() == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        String ref = "STUB_" + request.symbol() + "_" + now.getEpochSecond();
        log.warn("[PAPER] Using stub execution for {}", request.symbol());
        return Optional.of(new OrderFill(ref, request.symbol(), FILL_QUANTITY, FILL_PRICE, now));
    }
}
