package in.elpyfi.application.engine;

import in.elpyfi.infrastructure.persistence.StoreStatus;
import in.elpyfi.service.compliance.PdtStatus;

/**
 * Engine status for operators.
 * store is null when the engine runs without a database.
 */
public record EngineStatus(
    boolean running,
    int strategies,
    PdtStatus pdt,
    StoreStatus store
) {
    public boolean degraded() {
        return store == null || store.degraded();
    }
}
