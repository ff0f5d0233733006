package in.elpyfi.service.compliance;

import in.elpyfi.domain.common.Topic;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.signal.SignalAction;
import in.elpyfi.domain.trade.DayTrade;
import in.elpyfi.domain.trade.PositionClosed;
import in.elpyfi.domain.trade.TradeApproval;
import in.elpyfi.domain.trade.TradeRequest;
import in.elpyfi.infrastructure.metrics.SchedulerMetrics;
import in.elpyfi.service.allocation.AllocationDecision;
import in.elpyfi.service.allocation.PriorityAllocator;
import in.elpyfi.service.core.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * PDT (Pattern Day Trading) tracker.
 *
 * ADMISSION RULES (per day_trade.requested):
 * - Not a day trade        → approve, no slot used
 * - Emergency exit         → approve, ledger entry, outside the ordinary budget
 *   (sell with stop_loss metadata)
 * - Ordinary, slot free    → approve, ledger entry
 *   (ordinary used < weeklyLimit - emergencyReserve)
 * - Ordinary, budget spent → queue in allocator AND reject for this cycle
 *
 * Requests missing the signal or the day-trade flag take the ordinary path.
 *
 * The decision and the ledger append happen under one lock so two concurrent
 * requests cannot both take the last slot. Events are emitted after the lock is released.
 *
 * WEEK:
 * Anchored at Monday 00:00 (market zone). Checked lazily on every call; when the
 * boundary moved, entries older than it are dropped.
 */
public final class PdtTracker {
    private static final Logger log = LoggerFactory.getLogger(PdtTracker.class);

    static final String REASON_SWING = "Swing trade - no PDT restrictions";
    static final String REASON_EMERGENCY = "Emergency stop-loss exit";
    static final String REASON_SLOT = "Day trade slot available";
    static final String REASON_QUEUED = "PDT limit reached: %d/%d trades used. Request queued for weekly allocation.";

    private static final int RECENT_TRADES = 5;

    private final EventBus bus;
    private final PriorityAllocator allocator;
    private final PdtRules rules;
    private final Clock clock;
    private final ZoneId zone;
    private final SchedulerMetrics metrics;

    private final Object lock = new Object();
    private final List<DayTrade> ledger = new ArrayList<>();
    private Instant weekStart;

    public PdtTracker(EventBus bus, PriorityAllocator allocator, PdtRules rules, Clock clock, ZoneId zone) {
        this(bus, allocator, rules, clock, zone, SchedulerMetrics.NOOP);
    }

    public PdtTracker(EventBus bus, PriorityAllocator allocator, PdtRules rules,
                      Clock clock, ZoneId zone, SchedulerMetrics metrics) {
        this.bus = bus;
        this.allocator = allocator;
        this.rules = rules;
        this.clock = clock;
        this.zone = zone;
        this.metrics = metrics;
        this.weekStart = WeekWindow.weekStart(clock.instant(), zone);
    }

    /**
     * Listen for admission requests and position closures.
     */
    public void register() {
        bus.subscribe(Topic.DAY_TRADE_REQUESTED, this::handleRequest);
        bus.subscribe(Topic.POSITION_CLOSED, this::handlePositionClosed);
        log.info("[PDT] Tracker registered: limit={}, reserve={}, week start={}",
            rules.weeklyLimit(), rules.emergencyReserve(), weekStart);
    }

    // ═══════════════════════════════════════════════════════════════
    // ADMISSION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Decide a trade request and publish the decision on day_trade.approved.
     */
    public TradeApproval handleRequest(TradeRequest request) {
        if (request == null) {
            log.warn("[PDT] Null trade request ignored");
            return null;
        }

        TradeApproval decision;
        synchronized (lock) {
            Instant now = clock.instant();
            rollWeekIfNeeded(now);
            decision = decide(request, now);
        }

        log.info("[PDT] {} {} {}: {}",
            decision.approved() ? "APPROVED" : "REJECTED",
            request.strategy(), request.symbol(), decision.reason());

        bus.emit(Topic.DAY_TRADE_APPROVED, decision);
        return decision;
    }

    private TradeApproval decide(TradeRequest request, Instant now) {
        if (request.isAmbiguous()) {
            log.warn("[PDT] Ambiguous request (signal={}, dayTrade={}), treating as ordinary day trade",
                request.signal() != null, request.dayTrade());
        }

        if (!request.requiresSlot()) {
            metrics.recordAdmission("SWING");
            return TradeApproval.approve(request, REASON_SWING);
        }

        if (!request.isAmbiguous() && isEmergencyExit(request.signal())) {
            ledger.add(DayTrade.opened(request.symbol(), request.strategy(), now, true));
            if (emergencyUsed() > rules.emergencyReserve()) {
                log.warn("[PDT] Emergency exits this week ({}) exceed reserve ({})",
                    emergencyUsed(), rules.emergencyReserve());
            }
            metrics.recordAdmission("EMERGENCY");
            return TradeApproval.approve(request, REASON_EMERGENCY);
        }

        if (ordinaryUsed() < rules.ordinaryCapacity()) {
            ledger.add(DayTrade.opened(request.symbol(), request.strategy(), now, false));
            metrics.recordAdmission("SLOT");
            return TradeApproval.approve(request, REASON_SLOT);
        }

        allocator.requestAllocation(request);
        metrics.recordAdmission("QUEUED");
        return TradeApproval.reject(request,
            String.format(REASON_QUEUED, tradesUsed(), rules.weeklyLimit()));
    }

    /**
     * Loss-cutting exit: a sell whose metadata carries stop_loss.
     */
    static boolean isEmergencyExit(Signal signal) {
        return signal != null && signal.action() == SignalAction.SELL && signal.isStopLoss();
    }

    // ═══════════════════════════════════════════════════════════════
    // WEEKLY BATCH
    // ═══════════════════════════════════════════════════════════════

    /**
     * Hand this week's free ordinary slots to the best queued requests.
     * Publishes one decision per queued request.
     */
    public List<TradeApproval> runWeeklyBatch() {
        List<TradeApproval> approvals = new ArrayList<>();
        synchronized (lock) {
            Instant now = clock.instant();
            rollWeekIfNeeded(now);

            int slots = rules.ordinaryCapacity() - ordinaryUsed();
            for (AllocationDecision d : allocator.scheduleWeeklyBatch(slots)) {
                TradeRequest request = d.tradeRequest();
                if (d.approved()) {
                    ledger.add(DayTrade.opened(request.symbol(), request.strategy(), now, false));
                    metrics.recordAdmission("BATCH_APPROVED");
                    approvals.add(TradeApproval.approve(request, d.reason()));
                } else {
                    metrics.recordAdmission("BATCH_REJECTED");
                    approvals.add(TradeApproval.reject(request, d.reason()));
                }
            }
        }

        for (TradeApproval approval : approvals) {
            bus.emit(Topic.DAY_TRADE_APPROVED, approval);
        }
        return approvals;
    }

    // ═══════════════════════════════════════════════════════════════
    // POSITION CLOSURE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Close the oldest open ledger entry for the symbol and feed the outcome to the allocator.
     */
    public void handlePositionClosed(PositionClosed event) {
        if (event == null) {
            return;
        }
        Instant closedAt = event.closedAt() != null ? event.closedAt() : clock.instant();

        boolean matched = false;
        synchronized (lock) {
            for (int i = 0; i < ledger.size(); i++) {
                DayTrade trade = ledger.get(i);
                if (trade.symbol() != null && trade.symbol().equals(event.symbol()) && trade.isOpen()) {
                    ledger.set(i, trade.closedAt(closedAt));
                    matched = true;
                    break;
                }
            }
        }

        if (matched) {
            log.info("[PDT] Day trade closed: {} at {}", event.symbol(), closedAt);
        } else {
            log.debug("[PDT] No open day trade for {}", event.symbol());
        }

        allocator.recordOutcome(event.symbol(), event.strategy(), event.isProfitable(), event.realizedPnl());
    }

    // ═══════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════

    public int getTradesThisWeek() {
        synchronized (lock) {
            rollWeekIfNeeded(clock.instant());
            return tradesUsed();
        }
    }

    public int getRemainingTrades() {
        synchronized (lock) {
            rollWeekIfNeeded(clock.instant());
            return Math.max(0, rules.weeklyLimit() - tradesUsed());
        }
    }

    /**
     * Whether an ordinary day trade would be admitted right now.
     */
    public boolean canDayTrade() {
        synchronized (lock) {
            rollWeekIfNeeded(clock.instant());
            return ordinaryUsed() < rules.ordinaryCapacity();
        }
    }

    public PdtStatus getStatus() {
        synchronized (lock) {
            rollWeekIfNeeded(clock.instant());
            int used = tradesUsed();
            List<DayTrade> recent = List.copyOf(
                ledger.subList(Math.max(0, ledger.size() - RECENT_TRADES), ledger.size()));
            return new PdtStatus(
                used,
                Math.max(0, rules.weeklyLimit() - used),
                ordinaryUsed() < rules.ordinaryCapacity(),
                weekStart,
                recent,
                allocator.pendingCount(),
                rules.emergencyReserve(),
                rules.weeklyLimit()
            );
        }
    }

    public PdtRules rules() {
        return rules;
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL (caller holds lock)
    // ═══════════════════════════════════════════════════════════════

    private void rollWeekIfNeeded(Instant now) {
        Instant current = WeekWindow.weekStart(now, zone);
        if (current.isAfter(weekStart)) {
            int before = ledger.size();
            ledger.removeIf(t -> t.openTime().isBefore(current));
            weekStart = current;
            log.info("[PDT] New week from {}: dropped {} ledger entries", current, before - ledger.size());
        }
    }

    private int tradesUsed() {
        int count = 0;
        for (DayTrade t : ledger) {
            if (!t.openTime().isBefore(weekStart)) count++;
        }
        return count;
    }

    private int ordinaryUsed() {
        int count = 0;
        for (DayTrade t : ledger) {
            if (!t.emergency() && !t.openTime().isBefore(weekStart)) count++;
        }
        return count;
    }

    private int emergencyUsed() {
        return tradesUsed() - ordinaryUsed();
    }
}
