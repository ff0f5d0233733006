package in.elpyfi.application.service;

import in.elpyfi.domain.common.Topic;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.trade.PositionClosed;
import in.elpyfi.domain.trade.PositionOpened;
import in.elpyfi.infrastructure.persistence.ResilientTradeStore;
import in.elpyfi.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists signals and position changes as they are published.
 * The store never throws on a failed write; anything unexpected is logged here.
 */
public final class StoreEventRecorder {
    private static final Logger log = LoggerFactory.getLogger(StoreEventRecorder.class);

    private final EventBus bus;
    private final ResilientTradeStore store;

    public StoreEventRecorder(EventBus bus, ResilientTradeStore store) {
        this.bus = bus;
        this.store = store;
    }

    public void register() {
        bus.subscribe(Topic.SIGNAL_GENERATED, this::onSignal);
        bus.subscribe(Topic.POSITION_OPENED, this::onPositionOpened);
        bus.subscribe(Topic.POSITION_CLOSED, this::onPositionClosed);
    }

    void onSignal(Signal signal) {
        try {
            store.recordSignal(signal);
        } catch (RuntimeException e) {
            log.error("[RECORDER] Failed to record signal {} {}: {}",
                signal.strategy(), signal.symbol(), e.getMessage(), e);
        }
    }

    void onPositionOpened(PositionOpened position) {
        try {
            store.recordPositionOpened(position);
        } catch (RuntimeException e) {
            log.error("[RECORDER] Failed to record opened position {}: {}",
                position.symbol(), e.getMessage(), e);
        }
    }

    void onPositionClosed(PositionClosed position) {
        try {
            store.recordPositionClosed(position);
        } catch (RuntimeException e) {
            log.error("[RECORDER] Failed to record closed position {}: {}",
                position.symbol(), e.getMessage(), e);
        }
    }
}
