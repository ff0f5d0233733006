package in.elpyfi.infrastructure.persistence;

/**
 * Store health.
 *
 * VALIDATING → HEALTHY | DEGRADED | DISCONNECTED
 * DEGRADED / DISCONNECTED → HEALTHY once the schema monitor succeeds.
 */
public enum StoreHealth {
    VALIDATING,
    HEALTHY,

    /** Schema mismatch: writes continue with the confirmed columns */
    DEGRADED,

    /** Database unreachable: writes are dropped */
    DISCONNECTED
}
