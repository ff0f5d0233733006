package in.elpyfi.domain.trade;

/**
 * Admission decision for one trade request, published on day_trade.approved.
 * Carries both approvals and rejections.
 */
public record TradeApproval(
    TradeRequest request,
    boolean approved,
    String reason
) {
    public static TradeApproval approve(TradeRequest request, String reason) {
        return new TradeApproval(request, true, reason);
    }

    public static TradeApproval reject(TradeRequest request, String reason) {
        return new TradeApproval(request, false, reason);
    }
}
