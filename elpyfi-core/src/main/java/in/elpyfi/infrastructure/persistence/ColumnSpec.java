package in.elpyfi.infrastructure.persistence;

/**
 * One expected column.
 *
 * optional: writes may leave it out when the live table lacks it.
 * backfill: set for columns promoted to NOT NULL on existing tables; the fix SQL
 * adds the column nullable, fills it with this expression, then adds the constraint.
 */
public record ColumnSpec(
    String name,
    String type,
    boolean primaryKey,
    boolean notNull,
    String defaultExpr,
    boolean optional,
    String backfill
) {
    public static ColumnSpec key(String name) {
        return new ColumnSpec(name, "SERIAL", true, false, null, false, null);
    }

    public static ColumnSpec required(String name, String type) {
        return new ColumnSpec(name, type, false, true, null, false, null);
    }

    public static ColumnSpec requiredWithDefault(String name, String type, String defaultExpr) {
        return new ColumnSpec(name, type, false, true, defaultExpr, false, null);
    }

    public static ColumnSpec withDefault(String name, String type, String defaultExpr) {
        return new ColumnSpec(name, type, false, false, defaultExpr, false, null);
    }

    public static ColumnSpec optional(String name, String type) {
        return new ColumnSpec(name, type, false, false, null, true, null);
    }

    public static ColumnSpec optionalWithDefault(String name, String type, String defaultExpr) {
        return new ColumnSpec(name, type, false, false, defaultExpr, true, null);
    }

    /**
     * NOT NULL in the target schema, but older tables may lack it entirely.
     */
    public static ColumnSpec promoted(String name, String type, String backfill) {
        return new ColumnSpec(name, type, false, true, null, true, backfill);
    }

    public boolean isJson() {
        return "JSONB".equalsIgnoreCase(type) || "JSON".equalsIgnoreCase(type);
    }

    /**
     * Column definition as used inside CREATE TABLE.
     */
    public String definition() {
        StringBuilder sb = new StringBuilder(name).append(' ').append(type);
        if (primaryKey) sb.append(" PRIMARY KEY");
        if (notNull) sb.append(" NOT NULL");
        if (defaultExpr != null) sb.append(" DEFAULT ").append(defaultExpr);
        return sb.toString();
    }

    /**
     * Placeholder for a bound value of this column.
     */
    public String placeholder() {
        return isJson() ? "CAST(? AS " + type + ")" : "?";
    }
}
