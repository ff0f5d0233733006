package in.elpyfi.infrastructure.metrics;

/**
 * Scheduler metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Admission decisions by outcome
 * - Dispatcher handler failures by topic
 * - Store writes by table and outcome
 * - Store health state
 * - Pending allocation queue depth
 */
public interface SchedulerMetrics {

    /**
     * Record an admission decision.
     *
     * @param outcome SWING, EMERGENCY, SLOT, QUEUED, BATCH_APPROVED, BATCH_REJECTED
     */
    void recordAdmission(String outcome);

    /**
     * Record a dispatcher subscriber that threw.
     *
     * @param topic Topic name
     */
    void recordHandlerFailure(String topic);

    /**
     * Record a store write attempt.
     *
     * @param table Table name
     * @param outcome OK, FALLBACK, DROPPED
     */
    void recordStoreWrite(String table, String outcome);

    /**
     * Record the store health state (VALIDATING, HEALTHY, DEGRADED, DISCONNECTED).
     */
    void recordStoreHealth(String state);

    /**
     * Record how many requests wait for the weekly batch.
     */
    void recordPendingAllocations(int pending);

    /**
     * Metrics sink that drops everything. Used where no registry is wired.
     */
    SchedulerMetrics NOOP = new SchedulerMetrics() {
        @Override public void recordAdmission(String outcome) {}
        @Override public void recordHandlerFailure(String topic) {}
        @Override public void recordStoreWrite(String table, String outcome) {}
        @Override public void recordStoreHealth(String state) {}
        @Override public void recordPendingAllocations(int pending) {}
    };
}
