package in.elpyfi.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reads live table columns from information_schema and compares them with the expected schema.
 * A table with no visible columns is reported missing.
 */
public final class SchemaInspector {
    private static final Logger log = LoggerFactory.getLogger(SchemaInspector.class);

    static final String COLUMNS_SQL = """
        SELECT column_name
        FROM information_schema.columns
        WHERE table_schema = ? AND table_name = ?
        """;

    private final List<TableSchema> expected;
    private final String schemaName;
    private final int timeoutSeconds;

    public SchemaInspector(List<TableSchema> expected, String schemaName, int timeoutSeconds) {
        this.expected = List.copyOf(expected);
        this.schemaName = schemaName;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @return live columns per table; tables not found are absent from the map
     */
    public Map<String, Set<String>> inspect(Connection conn) throws SQLException {
        Map<String, Set<String>> live = new LinkedHashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(COLUMNS_SQL)) {
            ps.setQueryTimeout(timeoutSeconds);
            for (TableSchema table : expected) {
                ps.setString(1, schemaName);
                ps.setString(2, table.name());
                Set<String> cols = new HashSet<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        cols.add(rs.getString(1));
                    }
                }
                if (!cols.isEmpty()) {
                    live.put(table.name(), cols);
                }
            }
        }
        return live;
    }

    /**
     * @return the mismatch, or empty when every expected table and column exists
     */
    public Optional<SchemaMismatchException> compare(Map<String, Set<String>> live) {
        List<String> missingTables = new ArrayList<>();
        Map<String, List<String>> missingColumns = new LinkedHashMap<>();

        for (TableSchema table : expected) {
            Set<String> cols = live.get(table.name());
            if (cols == null) {
                missingTables.add(table.name());
                log.error("[STORE] Required table '{}' does not exist", table.name());
                continue;
            }
            List<String> missing = table.columnNames().stream().filter(c -> !cols.contains(c)).toList();
            if (!missing.isEmpty()) {
                missingColumns.put(table.name(), missing);
                log.error("[STORE] Table '{}' is missing columns: {}", table.name(), missing);
            }
        }

        if (missingTables.isEmpty() && missingColumns.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new SchemaMismatchException(missingTables, missingColumns));
    }
}
