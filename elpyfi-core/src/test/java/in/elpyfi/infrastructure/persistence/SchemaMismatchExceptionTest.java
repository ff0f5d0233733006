package in.elpyfi.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaMismatchExceptionTest {

    @Test
    void missingTableGetsCreateTableAndIndexes() {
        SchemaMismatchException e = new SchemaMismatchException(List.of("signals"), Map.of());

        String sql = e.getFixSql();

        assertTrue(sql.contains("CREATE TABLE IF NOT EXISTS signals ("));
        assertTrue(sql.contains("metadata JSONB"));
        assertTrue(sql.contains("CREATE INDEX IF NOT EXISTS idx_signals_symbol ON signals(symbol);"));
        assertFalse(sql.contains("CREATE TABLE IF NOT EXISTS positions"), "Only missing tables are created");
    }

    @Test
    void promotedColumnIsAddedBackfilledThenConstrained() {
        SchemaMismatchException e = new SchemaMismatchException(List.of(),
            Map.of("positions", List.of("order_id")));

        List<String> lines = List.of(e.getFixSql().split("\n"));

        assertEquals(List.of(
            "ALTER TABLE positions ADD COLUMN IF NOT EXISTS order_id VARCHAR(100);",
            "UPDATE positions SET order_id = 'LEGACY_' || id::text WHERE order_id IS NULL;",
            "ALTER TABLE positions ALTER COLUMN order_id SET NOT NULL;"
        ), lines);
    }

    @Test
    void nullableColumnsAreSimpleAdds() {
        Map<String, List<String>> cols = new LinkedHashMap<>();
        cols.put("positions", List.of("closed_at"));
        cols.put("signals", List.of("metadata", "expected_profit"));
        SchemaMismatchException e = new SchemaMismatchException(List.of(), cols);

        assertEquals(String.join("\n",
            "ALTER TABLE positions ADD COLUMN IF NOT EXISTS closed_at TIMESTAMP;",
            "ALTER TABLE signals ADD COLUMN IF NOT EXISTS metadata JSONB;",
            "ALTER TABLE signals ADD COLUMN IF NOT EXISTS expected_profit DECIMAL(18,8);"
        ), e.getFixSql());
        assertEquals(List.of("closed_at", "metadata", "expected_profit"), e.getAllMissingColumns());
    }

    @Test
    void requiredColumnWithoutDefaultAddedNullable() {
        SchemaMismatchException e = new SchemaMismatchException(List.of(),
            Map.of("positions", List.of("strategy")));

        assertEquals("ALTER TABLE positions ADD COLUMN IF NOT EXISTS strategy VARCHAR(100);", e.getFixSql());
    }

    @Test
    void columnWithDefaultKeepsIt() {
        SchemaMismatchException e = new SchemaMismatchException(List.of(),
            Map.of("positions", List.of("status")));

        assertEquals("ALTER TABLE positions ADD COLUMN IF NOT EXISTS status VARCHAR(20) NOT NULL DEFAULT 'open';",
            e.getFixSql());
    }

    @Test
    void messageListsEverything() {
        SchemaMismatchException e = new SchemaMismatchException(List.of("signals"),
            Map.of("positions", List.of("order_id")));

        assertTrue(e.getMessage().contains("missing tables: [signals]"));
        assertTrue(e.getMessage().contains("table 'positions' missing columns: [order_id]"));
    }

    @Test
    void creationSqlCoversBothTables() {
        String ddl = ExpectedSchema.creationSql();

        assertTrue(ddl.contains("CREATE TABLE IF NOT EXISTS positions"));
        assertTrue(ddl.contains("order_id VARCHAR(100) NOT NULL"));
        assertTrue(ddl.contains("created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP"));
        assertTrue(ddl.contains("CREATE TABLE IF NOT EXISTS signals"));
        assertTrue(ddl.contains("idx_signals_created_at"));
    }
}
