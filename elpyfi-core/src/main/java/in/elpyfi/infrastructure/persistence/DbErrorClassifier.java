package in.elpyfi.infrastructure.persistence;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps JDBC failures to DbErrorKind by exception type and PostgreSQL SQLSTATE.
 *
 * SQLSTATE:
 * - 08xxx, 57P01-57P03, 57014 (statement timeout), 53300 → CONNECTIVITY
 * - 42703 (undefined column), 42P01 (undefined table)   → SCHEMA_MISMATCH
 * - 22xxx, 23xxx                                         → DATA_VALIDATION
 */
public final class DbErrorClassifier {

    static final String UNDEFINED_COLUMN = "42703";
    static final String UNDEFINED_TABLE = "42P01";

    private static final Set<String> CONNECTIVITY_STATES = Set.of("57P01", "57P02", "57P03", "57014", "53300");
    private static final Pattern COLUMN_MISSING =
        Pattern.compile("column \"([^\"]+)\"(?: of relation \"([^\"]+)\")? does not exist");

    public static DbErrorKind classify(SQLException e) {
        if (e instanceof SQLTimeoutException
            || e instanceof SQLTransientConnectionException
            || e instanceof SQLNonTransientConnectionException) {
            return DbErrorKind.CONNECTIVITY;
        }

        String state = e.getSQLState();
        if (state == null) {
            return DbErrorKind.UNKNOWN;
        }
        if (state.startsWith("08") || CONNECTIVITY_STATES.contains(state)) {
            return DbErrorKind.CONNECTIVITY;
        }
        if (UNDEFINED_COLUMN.equals(state) || UNDEFINED_TABLE.equals(state)) {
            return DbErrorKind.SCHEMA_MISMATCH;
        }
        if (state.startsWith("22") || state.startsWith("23")) {
            return DbErrorKind.DATA_VALIDATION;
        }
        return DbErrorKind.UNKNOWN;
    }

    /**
     * Column named by an undefined-column error.
     */
    public static Optional<String> undefinedColumn(SQLException e) {
        if (!UNDEFINED_COLUMN.equals(e.getSQLState()) || e.getMessage() == null) {
            return Optional.empty();
        }
        Matcher m = COLUMN_MISSING.matcher(e.getMessage());
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private DbErrorClassifier() {}
}
