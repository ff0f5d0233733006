package in.elpyfi.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Tables the store writes to.
 */
public final class ExpectedSchema {

    public static final String POSITIONS_TABLE = "positions";
    public static final String SIGNALS_TABLE = "signals";

    public static final TableSchema POSITIONS = new TableSchema(
        POSITIONS_TABLE,
        List.of(
            ColumnSpec.key("id"),
            ColumnSpec.required("symbol", "VARCHAR(20)"),
            ColumnSpec.required("quantity", "DECIMAL(18,8)"),
            ColumnSpec.required("entry_price", "DECIMAL(18,8)"),
            ColumnSpec.required("current_price", "DECIMAL(18,8)"),
            ColumnSpec.withDefault("unrealized_pl", "DECIMAL(18,8)", "0"),
            ColumnSpec.withDefault("realized_pl", "DECIMAL(18,8)", "0"),
            ColumnSpec.required("strategy", "VARCHAR(100)"),
            ColumnSpec.requiredWithDefault("status", "VARCHAR(20)", "'open'"),
            ColumnSpec.promoted("order_id", "VARCHAR(100)", "'LEGACY_' || id::text"),
            ColumnSpec.optional("closed_at", "TIMESTAMP"),
            ColumnSpec.optionalWithDefault("created_at", "TIMESTAMP", "CURRENT_TIMESTAMP")
        ),
        List.of("symbol", "status", "strategy")
    );

    public static final TableSchema SIGNALS = new TableSchema(
        SIGNALS_TABLE,
        List.of(
            ColumnSpec.key("id"),
            ColumnSpec.required("strategy", "VARCHAR(100)"),
            ColumnSpec.required("symbol", "VARCHAR(20)"),
            ColumnSpec.required("action", "VARCHAR(20)"),
            ColumnSpec.required("confidence", "DECIMAL(5,4)"),
            ColumnSpec.optional("expected_profit", "DECIMAL(18,8)"),
            ColumnSpec.optional("metadata", "JSONB"),
            ColumnSpec.optionalWithDefault("created_at", "TIMESTAMP", "CURRENT_TIMESTAMP")
        ),
        List.of("symbol", "strategy", "created_at")
    );

    public static final List<TableSchema> ALL = List.of(POSITIONS, SIGNALS);

    public static Optional<TableSchema> table(String name) {
        return ALL.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    /**
     * Full DDL for a fresh database.
     */
    public static String creationSql() {
        StringBuilder sb = new StringBuilder("-- ElPyFi Core Database Schema\n");
        for (TableSchema t : ALL) {
            sb.append('\n').append(t.createTableSql()).append("\n\n");
            for (String idx : t.createIndexSql()) {
                sb.append(idx).append('\n');
            }
        }
        return sb.toString();
    }

    private ExpectedSchema() {}
}
