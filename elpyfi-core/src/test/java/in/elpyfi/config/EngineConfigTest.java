package in.elpyfi.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static final String[] KEYS = {
        "PDT_WEEKLY_LIMIT", "PDT_EMERGENCY_RESERVE", "MARKET_ZONE", "DB_CONNECT_ATTEMPTS", "DB_USER"
    };

    @AfterEach
    void clearProperties() {
        for (String key : KEYS) {
            System.clearProperty(key);
        }
    }

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(3, config.pdtRules().weeklyLimit());
        assertEquals(1, config.pdtRules().emergencyReserve());
        assertEquals(ZoneId.of("America/New_York"), config.marketZone());
        assertEquals(0.03, config.dayTradeProfitThreshold());
        assertEquals(0.05, config.positionFraction());
        assertEquals("trading_events", config.notifyChannel());
        assertEquals("jdbc:postgresql://localhost/elpyfi", config.connection().jdbcUrl());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("PDT_WEEKLY_LIMIT", "5");
        System.setProperty("PDT_EMERGENCY_RESERVE", "2");
        System.setProperty("MARKET_ZONE", "UTC");
        System.setProperty("DB_CONNECT_ATTEMPTS", "7");

        EngineConfig config = EngineConfig.fromEnv();

        assertEquals(5, config.pdtWeeklyLimit());
        assertEquals(3, config.pdtRules().ordinaryCapacity());
        assertEquals(ZoneId.of("UTC"), config.marketZone());
        assertEquals(7, config.storeSettings().connectAttempts());
    }

    @Test
    void malformedNumberFallsBack() {
        System.setProperty("PDT_WEEKLY_LIMIT", "three");

        assertEquals(3, EngineConfig.fromEnv().pdtWeeklyLimit());
    }

    @Test
    void explicitUserOverridesUrl() {
        System.setProperty("DB_USER", "svc");

        assertEquals("svc", EngineConfig.fromEnv().connection().user());
    }
}
