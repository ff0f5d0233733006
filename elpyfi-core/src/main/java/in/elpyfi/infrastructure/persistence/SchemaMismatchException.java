package in.elpyfi.infrastructure.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown when the live database lacks expected tables or columns.
 * Recoverable: the store keeps writing with the columns it has.
 */
public class SchemaMismatchException extends RuntimeException {

    private final List<String> missingTables;
    private final Map<String, List<String>> missingColumns;

    public SchemaMismatchException(List<String> missingTables, Map<String, List<String>> missingColumns) {
        super(describe(missingTables, missingColumns));
        this.missingTables = List.copyOf(missingTables);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        missingColumns.forEach((t, cols) -> copy.put(t, List.copyOf(cols)));
        this.missingColumns = Collections.unmodifiableMap(copy);
    }

    public List<String> getMissingTables() {
        return missingTables;
    }

    /**
     * Missing columns per existing table.
     */
    public Map<String, List<String>> getMissingColumns() {
        return missingColumns;
    }

    public List<String> getAllMissingColumns() {
        List<String> all = new ArrayList<>();
        missingColumns.values().forEach(all::addAll);
        return all;
    }

    /**
     * Statements that bring the live schema up to the expected one.
     * Only reported tables and columns are touched.
     */
    public String getFixSql() {
        List<String> statements = new ArrayList<>();

        for (String table : missingTables) {
            ExpectedSchema.table(table).ifPresent(t -> {
                statements.add(t.createTableSql());
                statements.addAll(t.createIndexSql());
            });
        }

        missingColumns.forEach((table, cols) ->
            ExpectedSchema.table(table).ifPresent(t -> {
                for (String col : cols) {
                    if (t.column(col).isPresent()) {
                        statements.addAll(t.addColumnSql(col));
                    }
                }
            })
        );

        return String.join("\n", statements);
    }

    private static String describe(List<String> missingTables, Map<String, List<String>> missingColumns) {
        StringBuilder sb = new StringBuilder("Database schema mismatch detected");
        if (!missingTables.isEmpty()) {
            sb.append("; missing tables: ").append(missingTables);
        }
        missingColumns.forEach((t, cols) ->
            sb.append("; table '").append(t).append("' missing columns: ").append(cols));
        return sb.toString();
    }
}
