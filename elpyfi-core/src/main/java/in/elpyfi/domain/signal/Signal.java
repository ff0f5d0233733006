package in.elpyfi.domain.signal;

import java.time.Instant;
import java.util.Map;

/**
 * Trading signal emitted by a strategy.
 * Immutable once emitted; one signal yields at most one trade request.
 */
public record Signal(
    String strategy,
    String symbol,
    SignalAction action,
    double confidence,        // 0..1
    double estimatedProfit,   // fractional, 0.01 = 1%
    Instant createdAt,

    // Free-form context (e.g. stop_loss=true on a loss-cutting exit)
    Map<String, Object> metadata
) {
    public static final String META_STOP_LOSS = "stop_loss";

    public Signal {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Signal(String strategy, String symbol, SignalAction action,
                  double confidence, double estimatedProfit, Instant createdAt) {
        this(strategy, symbol, action, confidence, estimatedProfit, createdAt, Map.of());
    }

    /**
     * True when the metadata flags this signal as a loss-cutting exit.
     */
    public boolean isStopLoss() {
        Object flag = metadata.get(META_STOP_LOSS);
        if (flag instanceof Boolean) return (Boolean) flag;
        return flag != null && "true".equalsIgnoreCase(flag.toString());
    }
}
