package in.elpyfi.service.compliance;

import in.elpyfi.domain.common.Topic;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.signal.SignalAction;
import in.elpyfi.domain.trade.DayTrade;
import in.elpyfi.domain.trade.PositionClosed;
import in.elpyfi.domain.trade.TradeApproval;
import in.elpyfi.domain.trade.TradeRequest;
import in.elpyfi.service.allocation.PriorityAllocator;
import in.elpyfi.service.core.EventBus;
import in.elpyfi.support.MutableClock;
import in.elpyfi.support.Signals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PdtTrackerTest {

    private MutableClock clock;
    private EventBus bus;
    private PriorityAllocator allocator;
    private PdtTracker tracker;
    private List<TradeApproval> published;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Signals.T0);
        bus = new EventBus();
        allocator = new PriorityAllocator();
        tracker = new PdtTracker(bus, allocator, PdtRules.defaults(), clock, ZoneOffset.UTC);
        tracker.register();

        published = new CopyOnWriteArrayList<>();
        bus.subscribe(Topic.DAY_TRADE_APPROVED, published::add);
    }

    private TradeRequest dayTrade(String strategy, String symbol) {
        return TradeRequest.dayTrade(Signals.buy(strategy, symbol, 0.7, 0.02), 0.05);
    }

    @Test
    void swingTradeApprovedWithoutSlot() {
        TradeApproval decision = tracker.handleRequest(
            TradeRequest.swing(Signals.buy("s", "AAPL", 0.7, 0.05), 0.05));

        assertTrue(decision.approved());
        assertEquals("Swing trade - no PDT restrictions", decision.reason());
        assertEquals(0, tracker.getTradesThisWeek());
    }

    @Test
    void limitThreeReserveOneAdmitsTwoOrdinary() {
        TradeApproval first = tracker.handleRequest(dayTrade("a", "AAPL"));
        TradeApproval second = tracker.handleRequest(dayTrade("b", "MSFT"));
        TradeApproval third = tracker.handleRequest(dayTrade("c", "TSLA"));

        assertTrue(first.approved());
        assertEquals("Day trade slot available", first.reason());
        assertTrue(second.approved());
        assertFalse(third.approved());
        assertEquals("PDT limit reached: 2/3 trades used. Request queued for weekly allocation.", third.reason());

        assertEquals(1, allocator.pendingCount());
        assertEquals(2, tracker.getTradesThisWeek());
        assertEquals(1, tracker.getRemainingTrades());
        assertFalse(tracker.canDayTrade());
    }

    @Test
    void emergencyExitUsesReserveAfterOrdinarySlotsSpent() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        tracker.handleRequest(dayTrade("b", "MSFT"));

        TradeApproval emergency = tracker.handleRequest(
            TradeRequest.dayTrade(Signals.stopLossSell("a", "AAPL"), 0.05));

        assertTrue(emergency.approved());
        assertEquals("Emergency stop-loss exit", emergency.reason());
        assertEquals(3, tracker.getTradesThisWeek());
        assertEquals(0, tracker.getRemainingTrades());
        assertTrue(tracker.getStatus().recentTrades().get(2).emergency());
    }

    @Test
    void emergencyDoesNotConsumeOrdinarySlot() {
        tracker.handleRequest(TradeRequest.dayTrade(Signals.stopLossSell("a", "AAPL"), 0.05));

        assertTrue(tracker.canDayTrade());
        assertTrue(tracker.handleRequest(dayTrade("a", "MSFT")).approved());
        assertTrue(tracker.handleRequest(dayTrade("b", "TSLA")).approved());
        assertFalse(tracker.handleRequest(dayTrade("c", "NVDA")).approved());
    }

    @Test
    void emergencyBeyondReserveStillApproved() {
        tracker.handleRequest(TradeRequest.dayTrade(Signals.stopLossSell("a", "AAPL"), 0.05));
        TradeApproval second = tracker.handleRequest(TradeRequest.dayTrade(Signals.stopLossSell("a", "MSFT"), 0.05));

        assertTrue(second.approved());
        assertEquals(2, tracker.getTradesThisWeek());
    }

    @Test
    void buyWithStopLossIsNotEmergency() {
        Signal buy = new Signal("a", "AAPL", SignalAction.BUY, 0.9, 0.01, Signals.T0,
            Map.of(Signal.META_STOP_LOSS, true));
        TradeApproval decision = tracker.handleRequest(TradeRequest.dayTrade(buy, 0.05));

        assertEquals("Day trade slot available", decision.reason());
    }

    @Test
    void missingDayTradeFlagTakesSlotPath() {
        TradeRequest ambiguous = new TradeRequest(Signals.stopLossSell("a", "AAPL"), null, 0.05);

        TradeApproval decision = tracker.handleRequest(ambiguous);

        // Not treated as an emergency even though the signal says stop_loss
        assertEquals("Day trade slot available", decision.reason());
        assertEquals(1, tracker.getTradesThisWeek());
    }

    @Test
    void missingSignalTakesSlotPath() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        tracker.handleRequest(dayTrade("b", "MSFT"));

        TradeApproval decision = tracker.handleRequest(new TradeRequest(null, Boolean.TRUE, 0.05));

        assertFalse(decision.approved());
        assertEquals(1, allocator.pendingCount());
    }

    @Test
    void missingSignalFlaggedSwingStillTakesSlotPath() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        tracker.handleRequest(dayTrade("b", "MSFT"));

        TradeApproval decision = tracker.handleRequest(new TradeRequest(null, Boolean.FALSE, 0.05));

        assertFalse(decision.approved());
        assertTrue(decision.reason().startsWith("PDT limit reached"));
        assertEquals(1, allocator.pendingCount());
    }

    @Test
    void missingSignalFlaggedSwingUsesFreeSlot() {
        TradeApproval decision = tracker.handleRequest(new TradeRequest(null, Boolean.FALSE, 0.05));

        assertTrue(decision.approved());
        assertEquals(PdtTracker.REASON_SLOT, decision.reason());
        assertEquals(1, tracker.getTradesThisWeek());
        assertTrue(tracker.canDayTrade());
    }

    @Test
    void rulesExposed() {
        assertEquals(PdtRules.defaults(), tracker.rules());
        assertEquals(2, tracker.rules().ordinaryCapacity());
    }

    @Test
    void nullRequestIgnored() {
        assertNull(tracker.handleRequest(null));
        assertTrue(published.isEmpty());
    }

    @Test
    void everyDecisionPublishedOnce() {
        bus.emit(Topic.DAY_TRADE_REQUESTED, dayTrade("a", "AAPL"));
        bus.emit(Topic.DAY_TRADE_REQUESTED, dayTrade("b", "MSFT"));
        bus.emit(Topic.DAY_TRADE_REQUESTED, dayTrade("c", "TSLA"));

        assertEquals(3, published.size());
        assertEquals(List.of(true, true, false), published.stream().map(TradeApproval::approved).toList());
    }

    @Test
    void newWeekResetsBudget() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        tracker.handleRequest(dayTrade("b", "MSFT"));
        assertFalse(tracker.canDayTrade());

        // Tuesday → next Monday 00:00
        clock.set(Instant.parse("2025-06-30T00:00:00Z"));

        assertEquals(0, tracker.getTradesThisWeek());
        assertEquals(3, tracker.getRemainingTrades());
        assertTrue(tracker.canDayTrade());
        assertEquals(Instant.parse("2025-06-30T00:00:00Z"), tracker.getStatus().weekStart());
        assertTrue(tracker.getStatus().recentTrades().isEmpty());
    }

    @Test
    void sameWeekDoesNotReset() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        clock.advance(Duration.ofDays(4));   // Saturday

        assertEquals(1, tracker.getTradesThisWeek());
    }

    @Test
    void positionClosedClosesOldestOpenEntryAndFeedsAllocator() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        clock.advance(Duration.ofMinutes(5));
        tracker.handleRequest(dayTrade("a", "AAPL"));
        Instant closedAt = Signals.T0.plus(Duration.ofHours(2));

        bus.emit(Topic.POSITION_CLOSED,
            new PositionClosed(1, "AAPL", "a", new BigDecimal("101"), new BigDecimal("12.5"), closedAt));

        List<DayTrade> trades = tracker.getStatus().recentTrades();
        assertFalse(trades.get(0).isOpen());
        assertEquals(closedAt, trades.get(0).closeTime());
        assertTrue(trades.get(1).isOpen());
        assertEquals(2, tracker.getTradesThisWeek());

        assertEquals(1, allocator.statsFor("a").wins());
    }

    @Test
    void positionClosedForUnknownSymbolStillRecordsOutcome() {
        tracker.handlePositionClosed(
            new PositionClosed(0, "ZZZ", "b", BigDecimal.TEN, new BigDecimal("-1"), null));

        assertEquals(1, allocator.statsFor("b").trades());
        assertEquals(0, allocator.statsFor("b").wins());
    }

    @Test
    void weeklyBatchHandsFreeSlotsToQueuedRequests() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        tracker.handleRequest(dayTrade("b", "MSFT"));
        tracker.handleRequest(TradeRequest.dayTrade(Signals.buy("low", "TSLA", 0.2, 0.01), 0.05));
        tracker.handleRequest(TradeRequest.dayTrade(Signals.buy("high", "NVDA", 0.9, 0.02), 0.05));
        tracker.handleRequest(TradeRequest.dayTrade(Signals.buy("mid", "AMD", 0.5, 0.02), 0.05));
        published.clear();

        clock.set(Instant.parse("2025-06-30T00:00:00Z"));
        List<TradeApproval> decisions = tracker.runWeeklyBatch();

        assertEquals(3, decisions.size());
        assertEquals("high", decisions.get(0).request().strategy());
        assertTrue(decisions.get(0).approved());
        assertEquals("mid", decisions.get(1).request().strategy());
        assertTrue(decisions.get(1).approved());
        assertFalse(decisions.get(2).approved());

        assertEquals(decisions, published);
        assertEquals(2, tracker.getTradesThisWeek());
        assertFalse(tracker.canDayTrade());
        assertEquals(0, allocator.pendingCount());
    }

    @Test
    void weeklyBatchWithoutFreeSlotsRejectsAll() {
        tracker.handleRequest(dayTrade("a", "AAPL"));
        tracker.handleRequest(dayTrade("b", "MSFT"));
        tracker.handleRequest(dayTrade("c", "TSLA"));

        List<TradeApproval> decisions = tracker.runWeeklyBatch();

        assertEquals(1, decisions.size());
        assertFalse(decisions.get(0).approved());
        assertEquals(2, tracker.getTradesThisWeek());
    }

    @Test
    void statusReportsBudget() {
        tracker.handleRequest(dayTrade("a", "AAPL"));

        PdtStatus status = tracker.getStatus();

        assertEquals(1, status.tradesUsed());
        assertEquals(2, status.tradesRemaining());
        assertTrue(status.canDayTrade());
        assertEquals(Instant.parse("2025-06-23T00:00:00Z"), status.weekStart());
        assertEquals(1, status.emergencyReserve());
        assertEquals(3, status.weeklyLimit());
        assertEquals(0, status.pendingAllocations());
    }

    @Test
    void statusKeepsLastFiveEntries() {
        PdtTracker roomy = new PdtTracker(bus, allocator, new PdtRules(10, 1), clock, ZoneOffset.UTC);
        for (int i = 0; i < 7; i++) {
            roomy.handleRequest(dayTrade("s", "SYM" + i));
        }

        List<DayTrade> recent = roomy.getStatus().recentTrades();
        assertEquals(5, recent.size());
        assertEquals("SYM2", recent.get(0).symbol());
        assertEquals("SYM6", recent.get(4).symbol());
    }

    @Test
    void concurrentRequestsNeverExceedOrdinaryCapacity() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<TradeApproval> decisions = new CopyOnWriteArrayList<>();

        for (int i = 0; i < threads; i++) {
            String symbol = "SYM" + i;
            pool.submit(() -> {
                start.await();
                decisions.add(tracker.handleRequest(dayTrade("s", symbol)));
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(threads, decisions.size());
        assertEquals(2, decisions.stream().filter(TradeApproval::approved).count());
        assertEquals(threads - 2, allocator.pendingCount());
        assertEquals(2, tracker.getTradesThisWeek());
    }

    @Test
    void emergencyExitDetection() {
        assertTrue(PdtTracker.isEmergencyExit(Signals.stopLossSell("a", "AAPL")));
        assertFalse(PdtTracker.isEmergencyExit(Signals.buy("a", "AAPL", 0.5, 0.01)));
        assertFalse(PdtTracker.isEmergencyExit(null));
    }
}
