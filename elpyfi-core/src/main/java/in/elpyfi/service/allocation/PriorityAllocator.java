package in.elpyfi.service.allocation;

import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.trade.TradeRequest;
import in.elpyfi.infrastructure.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which queued requests get the week's day trades.
 *
 * SCORE = confidence × estimated profit × historical success multiplier
 *
 * Requests are only queued here; nothing is approved until scheduleWeeklyBatch runs.
 * The batch approves the top N by score (ties: first to arrive wins), rejects the rest
 * and always empties the queue. Rejected strategies have to resubmit.
 */
public final class PriorityAllocator {
    private static final Logger log = LoggerFactory.getLogger(PriorityAllocator.class);

    static final String REASON_TOP_N = "Top-N allocation for the week";
    static final String REASON_NOT_TOP_N = "not in top-N this week";
    static final String REASON_NO_SLOTS = "no slots available";

    private static final Comparator<AllocationRequest> BY_SCORE_THEN_ARRIVAL =
        Comparator.comparingDouble(AllocationRequest::score).reversed()
            .thenComparingLong(AllocationRequest::sequence);

    private final List<AllocationRequest> pending = new ArrayList<>();
    private final Map<String, StrategyStats> history = new ConcurrentHashMap<>();
    private final SchedulerMetrics metrics;
    private long nextSequence = 0;

    public PriorityAllocator() {
        this(SchedulerMetrics.NOOP);
    }

    public PriorityAllocator(SchedulerMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Queue a request for the next weekly batch.
     *
     * @return always true: the request is pending, not approved
     */
    public synchronized boolean requestAllocation(TradeRequest request) {
        AllocationRequest allocation = new AllocationRequest(request, score(request), nextSequence++);
        pending.add(allocation);
        metrics.recordPendingAllocations(pending.size());

        log.info("[ALLOCATOR] Queued {} {} score={} (pending={})",
            request.strategy(), request.symbol(), String.format("%.6f", allocation.score()), pending.size());
        return true;
    }

    /**
     * Run the weekly batch against the given number of free slots.
     *
     * @param availableSlots Slots that may be handed out
     * @return one decision per pending request, best first
     */
    public synchronized List<AllocationDecision> scheduleWeeklyBatch(int availableSlots) {
        List<AllocationRequest> ranked = new ArrayList<>(pending);
        pending.clear();
        metrics.recordPendingAllocations(0);

        if (ranked.isEmpty()) {
            log.info("[ALLOCATOR] Weekly batch: nothing pending");
            return List.of();
        }

        ranked.sort(BY_SCORE_THEN_ARRIVAL);

        List<AllocationDecision> decisions = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            AllocationRequest r = ranked.get(i);
            if (availableSlots <= 0) {
                decisions.add(new AllocationDecision(r, false, REASON_NO_SLOTS));
            } else if (i < availableSlots) {
                decisions.add(new AllocationDecision(r, true, REASON_TOP_N));
            } else {
                decisions.add(new AllocationDecision(r, false, REASON_NOT_TOP_N));
            }
        }

        long approved = decisions.stream().filter(AllocationDecision::approved).count();
        log.info("[ALLOCATOR] Weekly batch: {} pending, {} slots, {} approved, {} rejected",
            ranked.size(), availableSlots, approved, ranked.size() - approved);
        return decisions;
    }

    /**
     * Record how a strategy's trade turned out.
     */
    public void recordOutcome(String symbol, String strategy, boolean wasProfitable, BigDecimal profitAmount) {
        if (strategy == null) {
            log.warn("[ALLOCATOR] Outcome for {} has no strategy, ignored", symbol);
            return;
        }
        StrategyStats updated = history.merge(
            strategy,
            StrategyStats.empty(strategy).withOutcome(wasProfitable, profitAmount),
            (old, fresh) -> old.withOutcome(wasProfitable, profitAmount)
        );
        log.debug("[ALLOCATOR] Outcome {} {} profitable={} -> trades={} wins={} multiplier={}",
            strategy, symbol, wasProfitable, updated.trades(), updated.wins(), updated.successMultiplier());
    }

    public double successMultiplier(String strategy) {
        if (strategy == null) {
            return StrategyStats.NEUTRAL_MULTIPLIER;
        }
        return history.getOrDefault(strategy, StrategyStats.empty(strategy)).successMultiplier();
    }

    public StrategyStats statsFor(String strategy) {
        return history.getOrDefault(strategy, StrategyStats.empty(strategy));
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized List<AllocationRequest> pendingSnapshot() {
        return List.copyOf(pending);
    }

    private double score(TradeRequest request) {
        Signal signal = request.signal();
        if (signal == null) {
            // Nothing to rank on; keeps its place behind every scored request
            return 0.0;
        }
        return signal.confidence() * signal.estimatedProfit() * successMultiplier(signal.strategy());
    }
}
