package in.elpyfi.config;

import in.elpyfi.infrastructure.persistence.PgNotifyChannel;
import in.elpyfi.infrastructure.persistence.StoreSettings;
import in.elpyfi.service.compliance.PdtRules;
import in.elpyfi.util.Env;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Engine settings, read once at startup.
 */
public record EngineConfig(
    String databaseUrl,
    String dbUser,               // overrides the user in the URL when set
    String dbPass,
    int dbPoolSize,
    int dbConnectAttempts,
    long dbConnectTimeoutMs,
    int dbStatementTimeoutSec,
    String notifyChannel,
    int pdtWeeklyLimit,
    int pdtEmergencyReserve,
    ZoneId marketZone,
    double dayTradeProfitThreshold,  // estimated profit below this is a day trade
    double positionFraction
) {
    public static final String DEFAULT_DATABASE_URL = "postgresql://d@localhost/elpyfi";

    public static EngineConfig fromEnv() {
        return new EngineConfig(
            Env.get("CORE_DATABASE_URL", DEFAULT_DATABASE_URL),
            Env.get("DB_USER", null),
            Env.get("DB_PASS", null),
            Env.getInt("DB_POOL_SIZE", 5),
            Env.getInt("DB_CONNECT_ATTEMPTS", 3),
            Env.getLong("DB_CONNECT_TIMEOUT_MS", 5000L),
            Env.getInt("DB_STATEMENT_TIMEOUT_SEC", 10),
            Env.get("NOTIFY_CHANNEL", PgNotifyChannel.DEFAULT_CHANNEL),
            Env.getInt("PDT_WEEKLY_LIMIT", 3),
            Env.getInt("PDT_EMERGENCY_RESERVE", 1),
            ZoneId.of(Env.get("MARKET_ZONE", "America/New_York")),
            Env.getDouble("DAY_TRADE_PROFIT_THRESHOLD", 0.03),
            Env.getDouble("POSITION_FRACTION", 0.05)
        );
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_DATABASE_URL, null, null, 5, 3, 5000L, 10,
            PgNotifyChannel.DEFAULT_CHANNEL, 3, 1, ZoneId.of("America/New_York"), 0.03, 0.05);
    }

    public ConnectionString connection() {
        ConnectionString parsed = ConnectionString.parse(databaseUrl);
        return new ConnectionString(
            parsed.jdbcUrl(),
            dbUser != null ? dbUser : parsed.user(),
            dbPass != null ? dbPass : parsed.password()
        );
    }

    public PdtRules pdtRules() {
        return new PdtRules(pdtWeeklyLimit, pdtEmergencyReserve);
    }

    public StoreSettings storeSettings() {
        return new StoreSettings("public", dbConnectAttempts, Duration.ofSeconds(1), 5, dbStatementTimeoutSec);
    }
}
