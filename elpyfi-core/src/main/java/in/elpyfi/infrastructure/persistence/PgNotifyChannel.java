package in.elpyfi.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;

/**
 * Publishes notifications with PostgreSQL pg_notify.
 */
public final class PgNotifyChannel implements NotificationChannel {
    private static final Logger log = LoggerFactory.getLogger(PgNotifyChannel.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_CHANNEL = "trading_events";

    private final DataSource dataSource;
    private final String channel;
    private final int timeoutSeconds;

    public PgNotifyChannel(DataSource dataSource, String channel, int timeoutSeconds) {
        this.dataSource = dataSource;
        this.channel = channel;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void publish(StoreNotification notification) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT pg_notify(?, ?)")) {

            ps.setQueryTimeout(timeoutSeconds);
            ps.setString(1, channel);
            ps.setString(2, MAPPER.writeValueAsString(notification.toJson(MAPPER)));
            ps.execute();
            log.debug("[NOTIFY] {} on {}", notification.type(), channel);
        } catch (Exception e) {
            log.error("[NOTIFY] Failed to send {} notification: {}", notification.type(), e.getMessage());
        }
    }
}
