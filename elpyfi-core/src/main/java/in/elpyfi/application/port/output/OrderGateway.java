package in.elpyfi.application.port.output;

import in.elpyfi.domain.trade.OrderFill;
import in.elpyfi.domain.trade.TradeRequest;

import java.util.Optional;

/**
 * Broker order placement.
 */
public interface OrderGateway {

    /**
     * Submit an order for an approved request.
     *
     * @return the fill, or empty if the order could not be placed
     */
    Optional<OrderFill> submit(TradeRequest request);
}
