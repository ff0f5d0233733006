package in.elpyfi.infrastructure.persistence;

/**
 * Outward channel for store notifications (API/dashboard processes listen on it).
 * Implementations log failures instead of throwing; a lost notification never fails a write.
 */
@FunctionalInterface
public interface NotificationChannel {
    void publish(StoreNotification notification);
}
