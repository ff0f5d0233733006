package in.elpyfi.service.allocation;

import in.elpyfi.domain.trade.TradeRequest;

/**
 * Outcome of one queued request in a weekly batch.
 */
public record AllocationDecision(
    AllocationRequest allocation,
    boolean approved,
    String reason
) {
    public TradeRequest tradeRequest() {
        return allocation.tradeRequest();
    }
}
