package in.elpyfi.infrastructure.persistence;

import java.time.Duration;

/**
 * Store tuning.
 */
public record StoreSettings(
    String schemaName,
    int connectAttempts,
    Duration connectRetryDelay,
    int validationTimeoutSeconds,
    int statementTimeoutSeconds
) {
    public static StoreSettings defaults() {
        return new StoreSettings("public", 3, Duration.ofSeconds(1), 5, 10);
    }
}
