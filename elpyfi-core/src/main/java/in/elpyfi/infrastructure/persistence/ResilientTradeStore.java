package in.elpyfi.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.elpyfi.domain.signal.Signal;
import in.elpyfi.domain.trade.PositionClosed;
import in.elpyfi.domain.trade.PositionOpened;
import in.elpyfi.infrastructure.common.BackoffPolicy;
import in.elpyfi.infrastructure.metrics.SchedulerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Trade store that keeps working while the database schema drifts.
 *
 * LIFECYCLE:
 * VALIDATING → HEALTHY      schema matches
 *            → DEGRADED     tables/columns missing, writes use what exists
 *            → DISCONNECTED unreachable, writes dropped until reconnected
 *
 * WRITE FALLBACK:
 * Optional columns known to be absent are left out of the statement. When a write
 * fails on an undefined optional column, that column is marked absent and the write
 * is retried once without it. Later writes skip it without a failed round trip.
 *
 * FAILURES (by SQLSTATE, see DbErrorClassifier):
 * - CONNECTIVITY    → ERROR, store DISCONNECTED, monitor reconnects
 * - SCHEMA_MISMATCH → WARN, revalidate and log fix SQL
 * - DATA_VALIDATION → WARN, write dropped
 * - UNKNOWN         → ERROR, write dropped
 *
 * No write failure propagates to the caller.
 */
public final class ResilientTradeStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResilientTradeStore.class);

    private final DataSource dataSource;
    private final StoreSettings settings;
    private final NotificationChannel channel;
    private final SchedulerMetrics metrics;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final SchemaInspector inspector;
    private final SchemaState schemaState = new SchemaState();
    private final AtomicReference<StoreHealth> health = new AtomicReference<>(StoreHealth.VALIDATING);
    private final List<StoreHealthListener> listeners = new CopyOnWriteArrayList<>();

    public ResilientTradeStore(DataSource dataSource, StoreSettings settings, NotificationChannel channel) {
        this(dataSource, settings, channel, SchedulerMetrics.NOOP, Clock.systemUTC());
    }

    public ResilientTradeStore(DataSource dataSource, StoreSettings settings, NotificationChannel channel,
                               SchedulerMetrics metrics, Clock clock) {
        this.dataSource = dataSource;
        this.settings = settings;
        this.channel = channel;
        this.metrics = metrics;
        this.clock = clock;
        this.inspector = new SchemaInspector(ExpectedSchema.ALL, settings.schemaName(),
            settings.validationTimeoutSeconds());
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Connect and validate the schema.
     *
     * @throws StoreUnavailableException if the database stays unreachable
     * @throws SchemaMismatchException if tables or columns are missing; the store stays usable
     */
    public void initialize() {
        setHealth(StoreHealth.VALIDATING);
        connect();
        Optional<SchemaMismatchException> mismatch = validate();
        if (mismatch.isPresent()) {
            throw mismatch.get();
        }
    }

    /**
     * Probe the database with bounded retries.
     */
    public void connect() {
        BackoffPolicy policy = BackoffPolicy.forStoreConnect(settings.connectAttempts(), settings.connectRetryDelay());
        SQLException lastError = null;

        while (policy.shouldRetry()) {
            try (Connection conn = dataSource.getConnection()) {
                if (conn.isValid(settings.validationTimeoutSeconds())) {
                    log.info("[STORE] Connected to database");
                    return;
                }
                lastError = new SQLException("Connection failed validation", "08000");
            } catch (SQLException e) {
                lastError = e;
            }

            Duration delay = policy.getNextDelay();
            policy.recordFailure();
            if (!policy.shouldRetry()) {
                break;
            }
            log.warn("[STORE] Connection attempt {} failed: {} (retry in {}ms)",
                policy.getAttemptCount(), lastError.getMessage(), delay.toMillis());
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                setHealth(StoreHealth.DISCONNECTED);
                throw new StoreUnavailableException("Interrupted while connecting to database", ie);
            }
        }

        setHealth(StoreHealth.DISCONNECTED);
        log.error("[STORE] Failed to connect to database after {} attempts: {}",
            policy.getAttemptCount(), lastError != null ? lastError.getMessage() : "unknown");
        throw new StoreUnavailableException(
            "Database unreachable after " + policy.getAttemptCount() + " attempts", lastError);
    }

    /**
     * Re-read the live schema and swap the column snapshot.
     *
     * @return the mismatch, or empty when the schema is complete
     * @throws StoreUnavailableException if the schema cannot be read
     */
    public Optional<SchemaMismatchException> validate() {
        Map<String, Set<String>> live;
        try (Connection conn = dataSource.getConnection()) {
            live = inspector.inspect(conn);
        } catch (SQLException e) {
            if (DbErrorClassifier.classify(e) == DbErrorKind.CONNECTIVITY) {
                setHealth(StoreHealth.DISCONNECTED);
            }
            log.error("[STORE] Schema validation failed: {}", e.getMessage());
            throw new StoreUnavailableException("Cannot read database schema", e);
        }

        Optional<SchemaMismatchException> mismatch = inspector.compare(live);
        schemaState.update(live, mismatch.orElse(null));

        if (mismatch.isPresent()) {
            setHealth(StoreHealth.DEGRADED);
        } else {
            setHealth(StoreHealth.HEALTHY);
            log.info("[STORE] Database schema validation passed");
        }
        return mismatch;
    }

    @Override
    public void close() {
        setHealth(StoreHealth.DISCONNECTED);
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
            } catch (Exception e) {
                log.warn("[STORE] Error closing data source: {}", e.getMessage());
            }
        }
        log.info("[STORE] Closed");
    }

    // ═══════════════════════════════════════════════════════════════
    // WRITES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Insert an open position.
     *
     * @return the new position id, or empty if the write was dropped
     */
    public OptionalLong recordPositionOpened(PositionOpened position) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("symbol", position.symbol());
        values.put("quantity", position.quantity());
        values.put("entry_price", position.entryPrice());
        values.put("current_price", position.entryPrice());
        values.put("unrealized_pl", BigDecimal.ZERO);
        values.put("strategy", position.strategy());
        values.put("status", "open");
        values.put("order_id", position.executionRef());
        if (position.openedAt() != null) {
            values.put("created_at", position.openedAt());
        }

        Optional<Long> id = write(ExpectedSchema.POSITIONS, "position opened",
            include -> insertSql(ExpectedSchema.POSITIONS, values, include),
            rs -> rs.getLong(1)).map(Written::row);
        if (id.isEmpty()) {
            return OptionalLong.empty();
        }

        if (!schemaState.mayWrite(ExpectedSchema.POSITIONS_TABLE, "order_id")) {
            log.warn("[STORE] Execution ref '{}' not recorded: positions.order_id missing", position.executionRef());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", id.get());
        data.put("symbol", position.symbol());
        data.put("quantity", position.quantity());
        data.put("entry_price", position.entryPrice());
        data.put("strategy", position.strategy());
        data.put("order_id", position.executionRef());
        notify(StoreNotification.POSITION_OPENED, data);

        log.info("[STORE] Recorded position opened: {} x{} @ {}",
            position.symbol(), position.quantity(), position.entryPrice());
        return OptionalLong.of(id.get());
    }

    /**
     * Mark a position closed. Without a position id, the oldest open position for the symbol is closed.
     *
     * @return whether a row was updated
     */
    public boolean recordPositionClosed(PositionClosed event) {
        Instant closedAt = event.closedAt() != null ? event.closedAt() : clock.instant();

        Optional<Written<ClosedRow>> written = write(ExpectedSchema.POSITIONS, "position closed",
            include -> closeSql(event, closedAt, include),
            rs -> new ClosedRow(rs.getLong(1), rs.getString(2), rs.getBigDecimal(3), rs.getString(4)));
        if (written.isEmpty()) {
            return false;
        }
        ClosedRow closed = written.get().row();
        if (closed == null) {
            log.warn("[STORE] No open position to close for {} (id={})", event.symbol(), event.positionId());
            return false;
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", closed.id());
        data.put("symbol", closed.symbol());
        data.put("quantity", closed.quantity());
        data.put("exit_price", event.exitPrice());
        data.put("realized_pl", event.realizedPnl());
        data.put("strategy", closed.strategy());
        notify(StoreNotification.POSITION_CLOSED, data);

        log.info("[STORE] Recorded position closed: {} @ {}, PL: {}",
            closed.symbol(), event.exitPrice(), event.realizedPnl());
        return true;
    }

    /**
     * Insert a generated signal.
     *
     * @return the new signal id, or empty if the write was dropped
     */
    public OptionalLong recordSignal(Signal signal) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("strategy", signal.strategy());
        values.put("symbol", signal.symbol());
        values.put("action", signal.action() != null ? signal.action().wire() : null);
        values.put("confidence", BigDecimal.valueOf(signal.confidence()));
        values.put("expected_profit", BigDecimal.valueOf(signal.estimatedProfit()));
        values.put("metadata", toJson(signal.metadata()));
        if (signal.createdAt() != null) {
            values.put("created_at", signal.createdAt());
        }

        Optional<Long> id = write(ExpectedSchema.SIGNALS, "signal",
            include -> insertSql(ExpectedSchema.SIGNALS, values, include),
            rs -> rs.getLong(1)).map(Written::row);
        if (id.isEmpty()) {
            return OptionalLong.empty();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", id.get());
        data.put("strategy", signal.strategy());
        data.put("symbol", signal.symbol());
        data.put("action", values.get("action"));
        data.put("confidence", signal.confidence());
        data.put("expected_profit", signal.estimatedProfit());
        notify(StoreNotification.SIGNAL_GENERATED, data);

        log.info("[STORE] Recorded signal: {} {} @ {}", values.get("action"), signal.symbol(),
            String.format("%.2f", signal.confidence()));
        return OptionalLong.of(id.get());
    }

    // ═══════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════

    public StoreHealth health() {
        return health.get();
    }

    public boolean isDegraded() {
        return health.get() == StoreHealth.DEGRADED;
    }

    public SchemaState schemaState() {
        return schemaState;
    }

    public StoreStatus status() {
        StoreHealth current = health.get();
        Optional<SchemaMismatchException> mismatch = schemaState.lastMismatch();
        return new StoreStatus(
            current,
            current == StoreHealth.DEGRADED,
            mismatch.map(SchemaMismatchException::getMissingTables).orElse(List.of()),
            mismatch.map(SchemaMismatchException::getMissingColumns).orElse(Map.of()),
            mismatch.map(SchemaMismatchException::getFixSql).orElse("")
        );
    }

    /**
     * Full DDL for a fresh database.
     */
    public String schemaCreationSql() {
        return ExpectedSchema.creationSql();
    }

    public void addHealthListener(StoreHealthListener listener) {
        listeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private record BoundSql(String sql, List<String> columns, List<Object> params) {}

    private record ClosedRow(long id, String symbol, BigDecimal quantity, String strategy) {}

    /** Statement ran; row is null when nothing matched. */
    private record Written<T>(T row) {}

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /**
     * Run one statement with the optional-column fallback.
     *
     * @param plan builds the statement from a filter of usable columns
     * @return empty if the write was dropped
     */
    private <T> Optional<Written<T>> write(TableSchema table, String what,
                                  Function<Predicate<String>, BoundSql> plan, RowMapper<T> mapper) {
        if (health.get() == StoreHealth.DISCONNECTED) {
            log.warn("[STORE] Database disconnected, {} write dropped", what);
            metrics.recordStoreWrite(table.name(), "DROPPED");
            return Optional.empty();
        }

        Set<String> skipped = new HashSet<>();
        boolean retried = false;

        while (true) {
            BoundSql bound = plan.apply(col -> !skipped.contains(col)
                && (!table.isOptional(col) || schemaState.mayWrite(table.name(), col)));

            try (Connection conn = dataSource.getConnection();
                 PreparedStatement ps = conn.prepareStatement(bound.sql())) {

                ps.setQueryTimeout(settings.statementTimeoutSeconds());
                bind(ps, bound.params());

                try (ResultSet rs = ps.executeQuery()) {
                    T row = rs.next() ? mapper.map(rs) : null;
                    metrics.recordStoreWrite(table.name(), retried ? "FALLBACK" : "OK");
                    return Optional.of(new Written<>(row));
                }
            } catch (SQLException e) {
                Optional<String> column = DbErrorClassifier.undefinedColumn(e)
                    .filter(c -> bound.columns().contains(c) && table.isOptional(c));

                if (!retried && column.isPresent()) {
                    String col = column.get();
                    schemaState.markAbsent(table.name(), col);
                    skipped.add(col);
                    retried = true;
                    setHealth(StoreHealth.DEGRADED);
                    log.warn("[STORE] Column '{}.{}' does not exist, retrying {} write without it",
                        table.name(), col, what);
                    continue;
                }

                handleFailure(table, what, e);
                return Optional.empty();
            }
        }
    }

    private void handleFailure(TableSchema table, String what, SQLException e) {
        metrics.recordStoreWrite(table.name(), "DROPPED");

        switch (DbErrorClassifier.classify(e)) {
            case CONNECTIVITY -> {
                log.error("[STORE] Database connection lost during {} write: {}", what, e.getMessage());
                setHealth(StoreHealth.DISCONNECTED);
            }
            case SCHEMA_MISMATCH -> {
                log.warn("[STORE] Schema mismatch on {} write: {}", what, e.getMessage());
                revalidateAfterFailure();
            }
            case DATA_VALIDATION ->
                log.warn("[STORE] {} write rejected by database [{}]: {}", what, e.getSQLState(), e.getMessage());
            default ->
                log.error("[STORE] Database error on {} write [{}]: {}", what, e.getSQLState(), e.getMessage(), e);
        }
    }

    private void revalidateAfterFailure() {
        try {
            validate().ifPresent(m -> {
                String fixSql = m.getFixSql();
                if (!fixSql.isEmpty()) {
                    log.warn("[STORE] To fix the schema, run:\n{}", fixSql);
                }
            });
        } catch (StoreUnavailableException e) {
            log.warn("[STORE] Revalidation after schema error failed: {}", e.getMessage());
        }
    }

    private BoundSql insertSql(TableSchema table, Map<String, Object> values, Predicate<String> include) {
        List<String> cols = new ArrayList<>();
        List<String> placeholders = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        values.forEach((col, value) -> {
            if (!include.test(col)) {
                return;
            }
            ColumnSpec spec = table.column(col)
                .orElseThrow(() -> new IllegalArgumentException("Unknown column " + table.name() + "." + col));
            cols.add(col);
            placeholders.add(spec.placeholder());
            params.add(value);
        });

        String sql = "INSERT INTO " + table.name() + " (" + String.join(", ", cols) + ")"
            + " VALUES (" + String.join(", ", placeholders) + ") RETURNING id";
        return new BoundSql(sql, cols, params);
    }

    private BoundSql closeSql(PositionClosed event, Instant closedAt, Predicate<String> include) {
        List<String> cols = new ArrayList<>(List.of("status", "current_price", "realized_pl"));
        List<Object> params = new ArrayList<>(List.of("closed"));
        params.add(event.exitPrice());
        params.add(event.realizedPnl());

        StringBuilder sql = new StringBuilder("UPDATE positions SET status = ?, current_price = ?, realized_pl = ?");
        if (include.test("closed_at")) {
            cols.add("closed_at");
            params.add(closedAt);
            sql.append(", closed_at = ?");
        }

        if (event.positionId() > 0) {
            sql.append(" WHERE id = ?");
            params.add(event.positionId());
        } else {
            sql.append(" WHERE id = (SELECT id FROM positions WHERE symbol = ? AND status = 'open' ORDER BY id LIMIT 1)");
            params.add(event.symbol());
        }
        sql.append(" RETURNING id, symbol, quantity, strategy");
        return new BoundSql(sql.toString(), cols, params);
    }

    private static void bind(PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object v = params.get(i);
            if (v == null) {
                ps.setNull(i + 1, Types.NULL);
            } else if (v instanceof Instant) {
                ps.setTimestamp(i + 1, Timestamp.from((Instant) v));
            } else {
                ps.setObject(i + 1, v);
            }
        }
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.warn("[STORE] Signal metadata not serializable, stored without it: {}", e.getMessage());
            return null;
        }
    }

    private void notify(String type, Map<String, Object> data) {
        try {
            channel.publish(new StoreNotification(type, data, clock.instant()));
        } catch (RuntimeException e) {
            log.error("[STORE] Notification {} failed: {}", type, e.getMessage());
        }
    }

    private void setHealth(StoreHealth next) {
        StoreHealth previous = health.getAndSet(next);
        if (previous == next) {
            return;
        }
        metrics.recordStoreHealth(next.name());
        log.info("[STORE] Health {} → {}", previous, next);
        for (StoreHealthListener listener : listeners) {
            try {
                listener.onHealthChanged(previous, next);
            } catch (RuntimeException e) {
                log.error("[STORE] Health listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
