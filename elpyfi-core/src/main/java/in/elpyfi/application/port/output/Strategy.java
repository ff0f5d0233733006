package in.elpyfi.application.port.output;

import in.elpyfi.domain.market.MarketData;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.signal.SignalAction;

import java.util.Optional;

/**
 * Signal logic plugged into the engine. Implementations are found with ServiceLoader.
 */
public interface Strategy {

    String name();

    /**
     * Analyze one market data update.
     *
     * @return a signal, or empty when the strategy has nothing to say
     */
    Optional<Signal> analyze(MarketData data);

    /**
     * Whether the signal is worth publishing. Holds and zero-confidence signals are not.
     */
    default boolean shouldEmit(Signal signal) {
        return signal != null && signal.action() != SignalAction.HOLD && signal.confidence() > 0;
    }
}
