package in.elpyfi.infrastructure.persistence;

import in.elpyfi.infrastructure.common.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Brings the store back to HEALTHY.
 *
 * Idle while the store is healthy. When it leaves HEALTHY the monitor restarts its
 * ladder (30s, 60s, 5min, then every 10min) and on each step:
 * - DISCONNECTED → reconnect, then revalidate
 * - DEGRADED     → revalidate, log the fix SQL while still degraded
 *
 * Runs on one daemon thread. stop() cancels the pending step and interrupts a running one.
 * Transitions reported while a check runs are not acted on directly; the outcome of the
 * check is taken from the store's health afterwards, so a connection lost mid-check still
 * gets a reconnect.
 */
public final class SchemaMonitor implements StoreHealthListener {
    private static final Logger log = LoggerFactory.getLogger(SchemaMonitor.class);

    public enum State { IDLE, WAITING, CHECKING, STOPPED }

    private final ResilientTradeStore store;
    private final BackoffPolicy policy;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> pending;
    private volatile State state = State.IDLE;
    private volatile String lastFixSql = "";

    public SchemaMonitor(ResilientTradeStore store) {
        this(store, BackoffPolicy.forSchemaMonitor());
    }

    public SchemaMonitor(ResilientTradeStore store, BackoffPolicy policy) {
        this.store = store;
        this.policy = policy;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "schema-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Attach to the store and schedule a first check unless it is already healthy.
     */
    public synchronized void start() {
        if (state == State.STOPPED) {
            throw new IllegalStateException("Schema monitor already stopped");
        }
        store.addHealthListener(this);
        log.info("[SCHEMA-MONITOR] Started (store {})", store.health());
        if (store.health() != StoreHealth.HEALTHY) {
            scheduleNext();
        }
    }

    /**
     * Cancel the pending check and interrupt one in progress.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        if (pending != null) {
            pending.cancel(true);
            pending = null;
        }
        scheduler.shutdownNow();
        log.info("[SCHEMA-MONITOR] Stopped");
    }

    @Override
    public synchronized void onHealthChanged(StoreHealth previous, StoreHealth current) {
        if (state == State.STOPPED || state == State.CHECKING) {
            return;
        }
        if (current == StoreHealth.DEGRADED || current == StoreHealth.DISCONNECTED) {
            // Back to the first rung
            policy.reset();
            log.info("[SCHEMA-MONITOR] Store {} → {}, next check in {}s",
                previous, current, policy.getNextDelay().toSeconds());
            scheduleNext();
        }
    }

    /**
     * Run one recovery step on the calling thread.
     *
     * @return true if the store is healthy afterwards
     */
    public boolean checkNow() {
        StoreHealth before = store.health();
        try {
            if (before == StoreHealth.DISCONNECTED) {
                log.info("[SCHEMA-MONITOR] Reconnecting to database...");
                store.connect();
            }

            Optional<SchemaMismatchException> mismatch = store.validate();
            if (mismatch.isPresent()) {
                String fixSql = mismatch.get().getFixSql();
                log.warn("[SCHEMA-MONITOR] Schema still invalid (attempt {}): {}",
                    policy.getAttemptCount() + 1, mismatch.get().getMessage());
                if (!fixSql.equals(lastFixSql)) {
                    log.warn("[SCHEMA-MONITOR] To fix, run:\n{}", fixSql);
                    lastFixSql = fixSql;
                }
                return false;
            }

            lastFixSql = "";
            if (before != StoreHealth.HEALTHY) {
                log.info("[SCHEMA-MONITOR] Database schema is now valid, store recovered");
            }
            return true;
        } catch (StoreUnavailableException e) {
            log.warn("[SCHEMA-MONITOR] Database still unavailable: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("[SCHEMA-MONITOR] Check failed: {}", e.getMessage(), e);
            return false;
        }
    }

    public State state() {
        return state;
    }

    /**
     * Delay until the next scheduled check.
     */
    public Duration nextDelay() {
        return policy.getNextDelay();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private synchronized void scheduleNext() {
        if (state == State.STOPPED) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        Duration delay = policy.getNextDelay();
        pending = scheduler.schedule(this::runScheduledCheck, delay.toMillis(), TimeUnit.MILLISECONDS);
        state = State.WAITING;
        log.debug("[SCHEMA-MONITOR] Next check in {}ms", delay.toMillis());
    }

    private void runScheduledCheck() {
        synchronized (this) {
            if (state == State.STOPPED) {
                return;
            }
            state = State.CHECKING;
            pending = null;
        }

        boolean healthy = checkNow();

        synchronized (this) {
            if (state == State.STOPPED) {
                return;
            }
            StoreHealth after = store.health();
            if (healthy && after == StoreHealth.HEALTHY) {
                policy.recordSuccess();
                state = State.IDLE;
            } else if (healthy) {
                // Lost again while checking
                policy.reset();
                log.info("[SCHEMA-MONITOR] Store {} after check, next check in {}s",
                    after, policy.getNextDelay().toSeconds());
                scheduleNext();
            } else {
                policy.recordFailure();
                scheduleNext();
            }
        }
    }
}
