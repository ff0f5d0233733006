package in.elpyfi.domain.signal;

import java.util.Locale;

/**
 * Action carried by a strategy signal.
 * Wire form is lowercase ("buy", "sell", "hold") as stored in signals.action.
 */
public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse wire form. Unknown values resolve to null so callers can treat them as ambiguous.
     */
    public static SignalAction fromWire(String value) {
        if (value == null) return null;
        try {
            return SignalAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
