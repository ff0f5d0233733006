package in.elpyfi.domain.market;

import java.time.Instant;
import java.util.Map;

/**
 * Market data snapshot delivered by the ingestion side.
 */
public record MarketData(
    String symbol,
    Instant timestamp,
    double currentPrice,
    double volume,
    double high,
    double low,
    double open,
    double close,
    Map<String, Double> indicators
) {
    public MarketData {
        indicators = indicators == null ? Map.of() : Map.copyOf(indicators);
    }
}
