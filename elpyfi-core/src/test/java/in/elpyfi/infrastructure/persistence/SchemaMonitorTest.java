package in.elpyfi.infrastructure.persistence;

import in.elpyfi.infrastructure.common.BackoffPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SchemaMonitorTest {

    @Mock ResilientTradeStore store;

    private SchemaMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new SchemaMonitor(store, BackoffPolicy.ladder(Duration.ofMillis(20), Duration.ofMillis(40)));
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    private static SchemaMismatchException missingOrderId() {
        return new SchemaMismatchException(List.of(), Map.of("positions", List.of("order_id")));
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void degradedCheckRevalidatesOnly() {
        when(store.health()).thenReturn(StoreHealth.DEGRADED);
        when(store.validate()).thenReturn(Optional.of(missingOrderId()));

        assertFalse(monitor.checkNow());

        verify(store, never()).connect();
        verify(store).validate();
    }

    @Test
    void fixedSchemaRecovers() {
        when(store.health()).thenReturn(StoreHealth.DEGRADED);
        when(store.validate()).thenReturn(Optional.empty());

        assertTrue(monitor.checkNow());
    }

    @Test
    void disconnectedCheckReconnectsFirst() {
        when(store.health()).thenReturn(StoreHealth.DISCONNECTED);
        when(store.validate()).thenReturn(Optional.empty());

        assertTrue(monitor.checkNow());

        var order = inOrder(store);
        order.verify(store).connect();
        order.verify(store).validate();
    }

    @Test
    void stillUnreachableIsNotHealthy() {
        when(store.health()).thenReturn(StoreHealth.DISCONNECTED);
        doThrow(new StoreUnavailableException("down")).when(store).connect();

        assertFalse(monitor.checkNow());
        verify(store, never()).validate();
    }

    @Test
    void unexpectedErrorIsContained() {
        when(store.health()).thenReturn(StoreHealth.DEGRADED);
        when(store.validate()).thenThrow(new IllegalStateException("boom"));

        assertFalse(monitor.checkNow());
    }

    @Test
    void healthyStoreLeavesMonitorIdle() {
        when(store.health()).thenReturn(StoreHealth.HEALTHY);

        monitor.start();

        assertEquals(SchemaMonitor.State.IDLE, monitor.state());
        verify(store).addHealthListener(monitor);
    }

    @Test
    void degradedStoreIsCheckedUntilFixed() throws InterruptedException {
        AtomicReference<StoreHealth> health = new AtomicReference<>(StoreHealth.DEGRADED);
        when(store.health()).thenAnswer(inv -> health.get());
        when(store.validate())
            .thenReturn(Optional.of(missingOrderId()))
            .thenAnswer(inv -> {
                health.set(StoreHealth.HEALTHY);
                return Optional.empty();
            });

        monitor.start();

        await(() -> monitor.state() == SchemaMonitor.State.IDLE);
        verify(store, times(2)).validate();
        assertEquals(Duration.ofMillis(20), monitor.nextDelay());
    }

    @Test
    void healthDropSchedulesCheck() throws InterruptedException {
        when(store.health()).thenReturn(StoreHealth.HEALTHY);
        monitor.start();

        AtomicReference<StoreHealth> health = new AtomicReference<>(StoreHealth.DEGRADED);
        when(store.health()).thenAnswer(inv -> health.get());
        when(store.validate()).thenAnswer(inv -> {
            health.set(StoreHealth.HEALTHY);
            return Optional.empty();
        });
        monitor.onHealthChanged(StoreHealth.HEALTHY, StoreHealth.DEGRADED);

        verify(store, timeout(1000)).validate();
        await(() -> monitor.state() == SchemaMonitor.State.IDLE);
    }

    @Test
    void connectionLostDuringCheckIsReconnected() throws InterruptedException {
        AtomicReference<StoreHealth> health = new AtomicReference<>(StoreHealth.DEGRADED);
        when(store.health()).thenAnswer(inv -> health.get());
        when(store.validate())
            .thenAnswer(inv -> {
                // A concurrent write loses the connection right after the schema passed
                health.set(StoreHealth.DISCONNECTED);
                monitor.onHealthChanged(StoreHealth.HEALTHY, StoreHealth.DISCONNECTED);
                return Optional.empty();
            })
            .thenAnswer(inv -> {
                health.set(StoreHealth.HEALTHY);
                return Optional.empty();
            });

        monitor.start();

        verify(store, timeout(2000)).connect();
        verify(store, timeout(2000).times(2)).validate();
        await(() -> monitor.state() == SchemaMonitor.State.IDLE);
        assertEquals(StoreHealth.HEALTHY, health.get());
    }

    @Test
    void unhealthyAfterPassingCheckKeepsMonitorWaiting() throws InterruptedException {
        monitor = new SchemaMonitor(store, BackoffPolicy.ladder(Duration.ofMillis(20), Duration.ofMinutes(10)));
        when(store.health()).thenReturn(StoreHealth.DEGRADED);
        when(store.validate()).thenReturn(Optional.empty());

        monitor.start();

        verify(store, timeout(2000).atLeastOnce()).validate();
        await(() -> monitor.state() == SchemaMonitor.State.WAITING);
        assertEquals(Duration.ofMillis(20), monitor.nextDelay());
    }

    @Test
    void recoveryIsIgnoredForScheduling() {
        when(store.health()).thenReturn(StoreHealth.HEALTHY);
        monitor.start();

        monitor.onHealthChanged(StoreHealth.DEGRADED, StoreHealth.HEALTHY);

        assertEquals(SchemaMonitor.State.IDLE, monitor.state());
    }

    @Test
    void stopIsFinal() {
        monitor = new SchemaMonitor(store, BackoffPolicy.ladder(Duration.ofMinutes(10)));
        when(store.health()).thenReturn(StoreHealth.DEGRADED);
        monitor.start();
        assertEquals(SchemaMonitor.State.WAITING, monitor.state());

        monitor.stop();
        monitor.onHealthChanged(StoreHealth.HEALTHY, StoreHealth.DEGRADED);

        assertEquals(SchemaMonitor.State.STOPPED, monitor.state());
        assertThrows(IllegalStateException.class, monitor::start);
    }
}
