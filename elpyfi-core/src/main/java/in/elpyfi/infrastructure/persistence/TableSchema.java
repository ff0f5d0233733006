package in.elpyfi.infrastructure.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Expected shape of one table: ordered columns plus its indexes.
 */
public record TableSchema(
    String name,
    List<ColumnSpec> columns,
    List<String> indexedColumns
) {
    public TableSchema {
        columns = List.copyOf(columns);
        indexedColumns = List.copyOf(indexedColumns);
    }

    public Optional<ColumnSpec> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).toList();
    }

    public boolean isOptional(String columnName) {
        return column(columnName).map(ColumnSpec::optional).orElse(false);
    }

    public String createTableSql() {
        StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(name).append(" (\n");
        for (int i = 0; i < columns.size(); i++) {
            sb.append("    ").append(columns.get(i).definition());
            sb.append(i < columns.size() - 1 ? ",\n" : "\n");
        }
        return sb.append(");").toString();
    }

    public List<String> createIndexSql() {
        List<String> out = new ArrayList<>();
        for (String col : indexedColumns) {
            out.add("CREATE INDEX IF NOT EXISTS idx_" + name + "_" + col + " ON " + name + "(" + col + ");");
        }
        return out;
    }

    /**
     * Statements that add a missing column to an existing table.
     */
    public List<String> addColumnSql(String columnName) {
        ColumnSpec c = column(columnName)
            .orElseThrow(() -> new IllegalArgumentException("Unknown column " + name + "." + columnName));

        String add = "ALTER TABLE " + name + " ADD COLUMN IF NOT EXISTS " + c.name() + " ";
        if (c.backfill() != null) {
            return List.of(
                add + c.type() + ";",
                "UPDATE " + name + " SET " + c.name() + " = " + c.backfill() + " WHERE " + c.name() + " IS NULL;",
                "ALTER TABLE " + name + " ALTER COLUMN " + c.name() + " SET NOT NULL;"
            );
        }
        if (c.notNull() && c.defaultExpr() == null && !c.primaryKey()) {
            // Existing rows would violate NOT NULL without a value
            return List.of(add + c.type() + ";");
        }
        return List.of(add + c.definition().substring(c.name().length() + 1) + ";");
    }
}
