package in.elpyfi.domain.common;

import in.elpyfi.domain.market.MarketData;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.trade.PositionClosed;
import in.elpyfi.domain.trade.PositionOpened;
import in.elpyfi.domain.trade.TradeApproval;
import in.elpyfi.domain.trade.TradeRequest;

import java.util.List;

/**
 * Dispatcher topics. Closed set: each topic fixes the payload type its handlers receive.
 *
 * @param <P> payload type
 */
public final class Topic<P> {

    // ═══════════════════════════════════════════════════════════════
    // INBOUND (from collaborators)
    // ═══════════════════════════════════════════════════════════════

    public static final Topic<MarketData> MARKET_DATA_RECEIVED =
        new Topic<>("market_data.received", MarketData.class);

    public static final Topic<Signal> SIGNAL_GENERATED =
        new Topic<>("signal.generated", Signal.class);

    public static final Topic<PositionClosed> POSITION_CLOSED =
        new Topic<>("position.closed", PositionClosed.class);

    // ═══════════════════════════════════════════════════════════════
    // ADMISSION
    // ═══════════════════════════════════════════════════════════════

    public static final Topic<TradeRequest> DAY_TRADE_REQUESTED =
        new Topic<>("day_trade.requested", TradeRequest.class);

    public static final Topic<TradeApproval> DAY_TRADE_APPROVED =
        new Topic<>("day_trade.approved", TradeApproval.class);

    // ═══════════════════════════════════════════════════════════════
    // EXECUTION
    // ═══════════════════════════════════════════════════════════════

    public static final Topic<PositionOpened> POSITION_OPENED =
        new Topic<>("position.opened", PositionOpened.class);

    private static final List<Topic<?>> ALL = List.of(
        MARKET_DATA_RECEIVED, SIGNAL_GENERATED, POSITION_CLOSED,
        DAY_TRADE_REQUESTED, DAY_TRADE_APPROVED, POSITION_OPENED
    );

    private final String name;
    private final Class<P> payloadType;

    private Topic(String name, Class<P> payloadType) {
        this.name = name;
        this.payloadType = payloadType;
    }

    public String name() {
        return name;
    }

    public Class<P> payloadType() {
        return payloadType;
    }

    public static List<Topic<?>> values() {
        return ALL;
    }

    @Override
    public String toString() {
        return name;
    }
}
