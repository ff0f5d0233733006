package in.elpyfi.infrastructure.persistence;

import java.util.List;
import java.util.Map;

/**
 * Operator view of the store.
 * fixSql is empty unless a mismatch is active.
 */
public record StoreStatus(
    StoreHealth health,
    boolean degraded,
    List<String> missingTables,
    Map<String, List<String>> missingColumns,
    String fixSql
) {}
