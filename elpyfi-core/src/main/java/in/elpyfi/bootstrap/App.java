package in.elpyfi.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.elpyfi.application.engine.TradingEngine;
import in.elpyfi.application.port.output.Strategy;
import in.elpyfi.config.ConnectionString;
import in.elpyfi.config.EngineConfig;
import in.elpyfi.infrastructure.broker.PaperOrderGateway;
import in.elpyfi.infrastructure.metrics.PrometheusSchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.ServiceLoader;

/**
 * ElPyFi core entry point (NO Spring).
 *
 * Usage: App [--test]
 *   --test  inject two synthetic AAPL updates, print the PDT status and exit
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== ElPyFi Core Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        boolean testMode = Arrays.asList(args).contains("--test");
        EngineConfig config = EngineConfig.fromEnv();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        DataSource dataSource = createDataSource(config);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusSchedulerMetrics metrics = new PrometheusSchedulerMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Strategies
        // ═══════════════════════════════════════════════════════════════
        List<Strategy> strategies = new ArrayList<>();
        for (Strategy s : ServiceLoader.load(Strategy.class)) {
            strategies.add(s);
            log.info("✓ Strategy loaded: {}", s.name());
        }
        if (strategies.isEmpty()) {
            log.warn("No strategies on the classpath; no signals will be generated");
        }

        TradingEngine engine = TradingEngine.create(
            config, dataSource, new PaperOrderGateway(), strategies, metrics, Clock.systemUTC());
        engine.initialize();

        if (testMode) {
            log.info("Running in test mode - injecting fake market data");
            engine.injectMarketData("AAPL", 150.0, 1_000_000);
            Thread.sleep(1000);
            engine.injectMarketData("AAPL", 150.5, 1_500_000);  // volume spike
            Thread.sleep(1000);
            log.info("PDT Status: {}", engine.tracker().getStatus());
            engine.stop();
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(engine::stop, "shutdown"));
        engine.start();
        engine.awaitShutdown();
    }

    private static DataSource createDataSource(EngineConfig config) {
        ConnectionString conn;
        try {
            conn = config.connection();
        } catch (IllegalArgumentException e) {
            log.error("Invalid CORE_DATABASE_URL: {}", e.getMessage());
            return null;
        }

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(conn.jdbcUrl());
        if (conn.user() != null) hikari.setUsername(conn.user());
        if (conn.password() != null) hikari.setPassword(conn.password());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(1);
        hikari.setConnectionTimeout(config.dbConnectTimeoutMs());
        hikari.setPoolName("elpyfi-hikari");
        // Start even when the database is down; the store reconnects later
        hikari.setInitializationFailTimeout(-1);

        log.info("DB: url={}, user={}, pool={}",
            ConnectionString.redact(conn.jdbcUrl()), conn.user(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }
}
