package in.elpyfi.infrastructure.persistence;

/**
 * Notified on every store health transition.
 */
@FunctionalInterface
public interface StoreHealthListener {
    void onHealthChanged(StoreHealth previous, StoreHealth current);
}
