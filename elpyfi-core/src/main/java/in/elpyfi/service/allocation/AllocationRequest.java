package in.elpyfi.service.allocation;

import in.elpyfi.domain.trade.TradeRequest;

/**
 * Queued request for a day-trade slot.
 * Score is fixed at enqueue time; re-scoring means queuing a new request.
 */
public record AllocationRequest(
    TradeRequest tradeRequest,
    double score,
    long sequence    // arrival order, breaks score ties
) {}
