package in.elpyfi.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.util.List;

/**
 * Prometheus implementation of SchedulerMetrics.
 *
 * Key Metrics:
 * - elpyfi_admissions_total{outcome}
 * - elpyfi_handler_failures_total{topic}
 * - elpyfi_store_writes_total{table, outcome}
 * - elpyfi_store_health{state} - 1 for the current state, 0 otherwise
 * - elpyfi_pending_allocations
 */
public class PrometheusSchedulerMetrics implements SchedulerMetrics {

    private static final List<String> HEALTH_STATES =
        List.of("VALIDATING", "HEALTHY", "DEGRADED", "DISCONNECTED");

    private final CollectorRegistry registry;

    private final Counter admissionCounter;
    private final Counter handlerFailureCounter;
    private final Counter storeWriteCounter;
    private final Gauge storeHealth;
    private final Gauge pendingAllocations;

    public PrometheusSchedulerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSchedulerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.admissionCounter = Counter.build()
            .name("elpyfi_admissions_total")
            .help("Day-trade admission decisions")
            .labelNames("outcome")
            .register(registry);

        this.handlerFailureCounter = Counter.build()
            .name("elpyfi_handler_failures_total")
            .help("Dispatcher subscribers that threw")
            .labelNames("topic")
            .register(registry);

        this.storeWriteCounter = Counter.build()
            .name("elpyfi_store_writes_total")
            .help("Store write attempts")
            .labelNames("table", "outcome")
            .register(registry);

        this.storeHealth = Gauge.build()
            .name("elpyfi_store_health")
            .help("Store health state (1=current)")
            .labelNames("state")
            .register(registry);

        this.pendingAllocations = Gauge.build()
            .name("elpyfi_pending_allocations")
            .help("Requests waiting for the weekly batch")
            .register(registry);
    }

    @Override
    public void recordAdmission(String outcome) {
        admissionCounter.labels(outcome).inc();
    }

    @Override
    public void recordHandlerFailure(String topic) {
        handlerFailureCounter.labels(topic).inc();
    }

    @Override
    public void recordStoreWrite(String table, String outcome) {
        storeWriteCounter.labels(table, outcome).inc();
    }

    @Override
    public void recordStoreHealth(String state) {
        for (String s : HEALTH_STATES) {
            storeHealth.labels(s).set(s.equals(state) ? 1 : 0);
        }
    }

    @Override
    public void recordPendingAllocations(int pending) {
        pendingAllocations.set(pending);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
