package in.elpyfi.application.engine;

import in.elpyfi.application.port.output.OrderGateway;
import in.elpyfi.application.port.output.Strategy;
import in.elpyfi.application.service.ExecutionBridge;
import in.elpyfi.application.service.StoreEventRecorder;
import in.elpyfi.config.EngineConfig;
import in.elpyfi.domain.common.Topic;
import in.elpyfi.domain.market.MarketData;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.infrastructure.metrics.SchedulerMetrics;
import in.elpyfi.infrastructure.persistence.PgNotifyChannel;
import in.elpyfi.infrastructure.persistence.ResilientTradeStore;
import in.elpyfi.infrastructure.persistence.SchemaMismatchException;
import in.elpyfi.infrastructure.persistence.SchemaMonitor;
import in.elpyfi.infrastructure.persistence.StoreUnavailableException;
import in.elpyfi.service.allocation.PriorityAllocator;
import in.elpyfi.service.compliance.PdtTracker;
import in.elpyfi.service.compliance.WeekWindow;
import in.elpyfi.service.core.EventBus;
import in.elpyfi.service.trade.DayTradeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Wires the scheduler together and drives it.
 *
 * market_data.received → strategies → signal.generated
 *   → ExecutionBridge → day_trade.requested → PdtTracker → day_trade.approved
 *   → ExecutionBridge → OrderGateway → position.opened
 * signal.generated / position.opened / position.closed → StoreEventRecorder → store
 *
 * The store is optional: without it, or while it is unavailable, admission keeps running.
 */
public final class TradingEngine {
    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private static final Map<String, String> COLUMN_IMPACT = Map.of(
        "order_id", "Trade tracking may be incomplete",
        "closed_at", "Position closure timestamps unavailable",
        "metadata", "Cannot store additional signal context"
    );

    private final EventBus bus;
    private final PriorityAllocator allocator;
    private final PdtTracker tracker;
    private final ExecutionBridge bridge;
    private final ResilientTradeStore store;    // null: no database
    private final SchemaMonitor monitor;        // null with store
    private final List<Strategy> strategies;
    private final EngineConfig config;
    private final Clock clock;

    private final ScheduledExecutorService batchScheduler;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private ScheduledFuture<?> nextBatch;
    private volatile boolean initialized = false;
    private volatile boolean running = false;

    public TradingEngine(EngineConfig config, EventBus bus, PriorityAllocator allocator, PdtTracker tracker,
                         ExecutionBridge bridge, ResilientTradeStore store, SchemaMonitor monitor,
                         List<Strategy> strategies, Clock clock) {
        this.config = config;
        this.bus = bus;
        this.allocator = allocator;
        this.tracker = tracker;
        this.bridge = bridge;
        this.store = store;
        this.monitor = monitor;
        this.strategies = List.copyOf(strategies);
        this.clock = clock;
        this.batchScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "weekly-batch");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Build the whole object graph.
     *
     * @param dataSource null to run without a database
     */
    public static TradingEngine create(EngineConfig config, DataSource dataSource, OrderGateway gateway,
                                       List<Strategy> strategies, SchedulerMetrics metrics, Clock clock) {
        EventBus bus = new EventBus(metrics);
        PriorityAllocator allocator = new PriorityAllocator(metrics);
        PdtTracker tracker = new PdtTracker(bus, allocator, config.pdtRules(), clock, config.marketZone(), metrics);
        ExecutionBridge bridge = new ExecutionBridge(bus, gateway,
            new DayTradeClassifier(config.dayTradeProfitThreshold()), config.positionFraction());

        ResilientTradeStore store = null;
        SchemaMonitor monitor = null;
        if (dataSource != null) {
            PgNotifyChannel channel = new PgNotifyChannel(dataSource, config.notifyChannel(),
                config.dbStatementTimeoutSec());
            store = new ResilientTradeStore(dataSource, config.storeSettings(), channel, metrics, clock);
            monitor = new SchemaMonitor(store);
        }
        return new TradingEngine(config, bus, allocator, tracker, bridge, store, monitor, strategies, clock);
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        log.info("[ENGINE] Initializing ElPyFi Engine...");

        initializeStore();

        if (store != null) {
            new StoreEventRecorder(bus, store).register();
        }
        tracker.register();
        bridge.register();
        bus.subscribe(Topic.MARKET_DATA_RECEIVED, this::processMarketData);

        log.info("[ENGINE] Loaded {} strategies", strategies.size());
        log.info("[ENGINE] PDT rules: weekly limit {}, emergency reserve {}",
            tracker.rules().weeklyLimit(), tracker.rules().emergencyReserve());
        scheduleNextBatch();
        initialized = true;
    }

    public synchronized void start() {
        if (!initialized) {
            initialize();
        }
        running = true;
        log.info("[ENGINE] Engine started");
    }

    /**
     * Block until stop() is called.
     */
    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public synchronized void stop() {
        if (!running && stopped.getCount() == 0) {
            return;
        }
        running = false;

        if (nextBatch != null) {
            nextBatch.cancel(false);
        }
        batchScheduler.shutdownNow();

        if (monitor != null) {
            monitor.stop();
        }
        if (store != null) {
            store.close();
        }
        stopped.countDown();
        log.info("[ENGINE] Engine stopped");
    }

    // ═══════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════

    /**
     * Run every strategy on the update and publish the signals worth acting on.
     */
    public void processMarketData(MarketData data) {
        for (Strategy strategy : strategies) {
            try {
                Optional<Signal> signal = strategy.analyze(data);
                if (signal.isPresent() && strategy.shouldEmit(signal.get())) {
                    bus.emit(Topic.SIGNAL_GENERATED, signal.get());
                }
            } catch (RuntimeException e) {
                log.error("[ENGINE] Strategy {} error: {}", strategy.name(), e.getMessage(), e);
            }
        }
    }

    /**
     * Publish a synthetic market data update (test mode).
     */
    public void injectMarketData(String symbol, double price, double volume) {
        MarketData data = new MarketData(
            symbol,
            clock.instant(),
            price,
            volume,
            price * 1.01,
            price * 0.99,
            price,
            price,
            Map.of("vwap", price, "avg_volume", volume * 0.8)
        );
        bus.emit(Topic.MARKET_DATA_RECEIVED, data);
    }

    // ═══════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════

    public EngineStatus status() {
        return new EngineStatus(
            running,
            strategies.size(),
            tracker.getStatus(),
            store != null ? store.status() : null
        );
    }

    public EventBus bus() {
        return bus;
    }

    public PdtTracker tracker() {
        return tracker;
    }

    public PriorityAllocator allocator() {
        return allocator;
    }

    public boolean isRunning() {
        return running;
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void initializeStore() {
        if (store == null) {
            log.warn("[ENGINE] No database configured, engine starting without database functionality");
            return;
        }

        try {
            store.initialize();
            log.info("[ENGINE] Database schema validation: PASSED");
        } catch (SchemaMismatchException e) {
            logDegradedBanner(e);
            log.warn("[ENGINE] Engine starting with degraded database functionality");
        } catch (StoreUnavailableException e) {
            log.warn("[ENGINE] Database connection failed: {}", e.getMessage());
            log.warn("[ENGINE] Engine starting without database functionality; reconnect will be retried");
        }

        monitor.start();
    }

    private void logDegradedBanner(SchemaMismatchException e) {
        log.warn("[ENGINE] ════════════════════════════════════════════════════════");
        log.warn("[ENGINE] DATABASE SCHEMA MISMATCH");
        log.warn("[ENGINE] ════════════════════════════════════════════════════════");
        log.warn("[ENGINE] {}", e.getMessage());

        if (!e.getMissingTables().isEmpty()) {
            log.warn("[ENGINE] Missing tables: {}", String.join(", ", e.getMissingTables()));
            log.warn("[ENGINE]   → Impact: Cannot record trades or signals for these tables");
        }
        e.getMissingColumns().forEach((table, cols) -> {
            log.warn("[ENGINE] Missing columns in {}: {}", table, String.join(", ", cols));
            for (String col : cols) {
                String impact = COLUMN_IMPACT.get(col);
                if (impact != null) {
                    log.warn("[ENGINE]   → Impact: {}", impact);
                }
            }
        });

        String fixSql = e.getFixSql();
        if (!fixSql.isEmpty()) {
            log.warn("[ENGINE] To fix, run the following SQL:");
            for (String line : fixSql.split("\n")) {
                log.warn("[ENGINE]    {}", line);
            }
        }

        log.warn("[ENGINE] Admission and signal generation: OPERATIONAL");
        log.warn("[ENGINE] Database recording: DEGRADED (with fallback)");
        log.warn("[ENGINE] Schema monitoring: ACTIVE, fixes applied live are picked up automatically");
        log.warn("[ENGINE] ════════════════════════════════════════════════════════");
    }

    private synchronized void scheduleNextBatch() {
        if (batchScheduler.isShutdown()) {
            return;
        }
        Instant now = clock.instant();
        Instant next = WeekWindow.nextWeekStart(now, config.marketZone());
        long delayMs = Math.max(0, Duration.between(now, next).toMillis());
        nextBatch = batchScheduler.schedule(this::runWeeklyBatch, delayMs, TimeUnit.MILLISECONDS);
        log.info("[ENGINE] Weekly allocation batch scheduled for {}", next);
    }

    private void runWeeklyBatch() {
        try {
            log.info("[ENGINE] Running weekly allocation batch ({} pending)", allocator.pendingCount());
            tracker.runWeeklyBatch();
        } catch (RuntimeException e) {
            log.error("[ENGINE] Weekly batch failed: {}", e.getMessage(), e);
        } finally {
            scheduleNextBatch();
        }
    }
}
