package in.elpyfi.application.service;

import in.elpyfi.application.port.output.OrderGateway;
import in.elpyfi.domain.common.Topic;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.trade.OrderFill;
import in.elpyfi.domain.trade.PositionOpened;
import in.elpyfi.domain.trade.TradeApproval;
import in.elpyfi.domain.trade.TradeRequest;
import in.elpyfi.service.core.EventBus;
import in.elpyfi.service.trade.DayTradeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns signals into admission requests and approved requests into orders.
 *
 * signal.generated   → classify → day_trade.requested
 * day_trade.approved → (approved only) OrderGateway → position.opened
 */
public final class ExecutionBridge {
    private static final Logger log = LoggerFactory.getLogger(ExecutionBridge.class);

    public static final double DEFAULT_POSITION_FRACTION = 0.05;

    private final EventBus bus;
    private final OrderGateway gateway;
    private final DayTradeClassifier classifier;
    private final double positionFraction;

    public ExecutionBridge(EventBus bus, OrderGateway gateway) {
        this(bus, gateway, new DayTradeClassifier(), DEFAULT_POSITION_FRACTION);
    }

    public ExecutionBridge(EventBus bus, OrderGateway gateway, DayTradeClassifier classifier, double positionFraction) {
        this.bus = bus;
        this.gateway = gateway;
        this.classifier = classifier;
        this.positionFraction = positionFraction;
    }

    public void register() {
        bus.subscribe(Topic.SIGNAL_GENERATED, this::onSignal);
        bus.subscribe(Topic.DAY_TRADE_APPROVED, this::onDecision);
    }

    void onSignal(Signal signal) {
        if (signal == null) {
            return;
        }
        log.info("[EXEC] Received signal: {} {} @ {} confidence",
            signal.action(), signal.symbol(), String.format("%.2f", signal.confidence()));

        TradeRequest request = new TradeRequest(signal, classifier.isDayTrade(signal), positionFraction);
        bus.emit(Topic.DAY_TRADE_REQUESTED, request);
    }

    void onDecision(TradeApproval decision) {
        if (decision == null || !decision.approved()) {
            return;
        }
        TradeRequest request = decision.request();

        Optional<OrderFill> fill;
        try {
            fill = gateway.submit(request);
        } catch (RuntimeException e) {
            log.error("[EXEC] Order submission failed for {}: {}", request.symbol(), e.getMessage(), e);
            return;
        }

        if (fill.isEmpty()) {
            log.warn("[EXEC] No fill for {} {}", request.strategy(), request.symbol());
            return;
        }

        OrderFill f = fill.get();
        log.info("[EXEC] Executed trade: {} - {} @ {}", f.executionRef(), f.quantity(), f.price());
        bus.emit(Topic.POSITION_OPENED, new PositionOpened(
            f.symbol(), f.quantity(), f.price(), request.strategy(), f.executionRef(), f.filledAt()));
    }
}
