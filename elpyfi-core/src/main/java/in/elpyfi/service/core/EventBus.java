package in.elpyfi.service.core;

import in.elpyfi.domain.common.Topic;
import in.elpyfi.infrastructure.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe dispatcher.
 *
 * Delivery is synchronous, in registration order, at most once. No persistence, no replay.
 * Handler lists are copy-on-write: emit iterates a snapshot, so subscribe/unsubscribe
 * from any thread (including from inside a handler) never disturbs an emission in flight,
 * and emissions to different topics never contend.
 *
 * A handler that throws is logged and counted; the remaining handlers still run
 * and the emitter never sees the exception.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Topic<?>, List<Consumer<?>>> subscribers = new ConcurrentHashMap<>();
    private final SchedulerMetrics metrics;

    public EventBus() {
        this(SchedulerMetrics.NOOP);
    }

    public EventBus(SchedulerMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Register a handler. The same handler may be registered more than once.
     */
    public <P> void subscribe(Topic<P> topic, Consumer<? super P> handler) {
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(handler);
        log.debug("Subscribed handler to {}", topic);
    }

    /**
     * Remove one registration of the handler. No-op if it is not registered.
     */
    public <P> void unsubscribe(Topic<P> topic, Consumer<? super P> handler) {
        List<Consumer<?>> handlers = subscribers.get(topic);
        if (handlers != null && handlers.remove(handler)) {
            log.debug("Unsubscribed handler from {}", topic);
        }
    }

    /**
     * Deliver payload to every handler of the topic.
     */
    @SuppressWarnings("unchecked")
    public <P> void emit(Topic<P> topic, P payload) {
        List<Consumer<?>> handlers = subscribers.get(topic);
        if (handlers == null || handlers.isEmpty()) {
            return;
        }

        for (Consumer<?> raw : handlers) {
            Consumer<? super P> handler = (Consumer<? super P>) raw;
            try {
                handler.accept(payload);
            } catch (Exception e) {
                handlerFailed(topic, e);
            } catch (AssertionError | LinkageError | StackOverflowError e) {
                // Bad handler code; OutOfMemoryError and other VM errors still propagate
                handlerFailed(topic, e);
            }
        }
    }

    private void handlerFailed(Topic<?> topic, Throwable e) {
        log.error("Handler failed on {}: {}", topic, e.getMessage(), e);
        metrics.recordHandlerFailure(topic.name());
    }

    public int subscriberCount(Topic<?> topic) {
        List<Consumer<?>> handlers = subscribers.get(topic);
        return handlers == null ? 0 : handlers.size();
    }
}
