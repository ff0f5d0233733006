package in.elpyfi.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DbErrorClassifierTest {

    private static SQLException state(String sqlState) {
        return new SQLException("error", sqlState);
    }

    @Test
    void connectionClassIsConnectivity() {
        assertEquals(DbErrorKind.CONNECTIVITY, DbErrorClassifier.classify(state("08006")));
        assertEquals(DbErrorKind.CONNECTIVITY, DbErrorClassifier.classify(state("08001")));
        assertEquals(DbErrorKind.CONNECTIVITY, DbErrorClassifier.classify(state("57P01")));
        assertEquals(DbErrorKind.CONNECTIVITY, DbErrorClassifier.classify(state("53300")));
    }

    @Test
    void timeoutsAreConnectivity() {
        assertEquals(DbErrorKind.CONNECTIVITY, DbErrorClassifier.classify(state("57014")));
        assertEquals(DbErrorKind.CONNECTIVITY, DbErrorClassifier.classify(new SQLTimeoutException("timeout")));
        assertEquals(DbErrorKind.CONNECTIVITY,
            DbErrorClassifier.classify(new SQLTransientConnectionException("pool exhausted")));
    }

    @Test
    void undefinedObjectsAreSchemaMismatch() {
        assertEquals(DbErrorKind.SCHEMA_MISMATCH, DbErrorClassifier.classify(state("42703")));
        assertEquals(DbErrorKind.SCHEMA_MISMATCH, DbErrorClassifier.classify(state("42P01")));
    }

    @Test
    void constraintAndDataErrorsAreValidation() {
        assertEquals(DbErrorKind.DATA_VALIDATION, DbErrorClassifier.classify(state("23502")));
        assertEquals(DbErrorKind.DATA_VALIDATION, DbErrorClassifier.classify(state("23505")));
        assertEquals(DbErrorKind.DATA_VALIDATION, DbErrorClassifier.classify(state("22003")));
    }

    @Test
    void everythingElseIsUnknown() {
        assertEquals(DbErrorKind.UNKNOWN, DbErrorClassifier.classify(state("42601")));
        assertEquals(DbErrorKind.UNKNOWN, DbErrorClassifier.classify(new SQLException("no state")));
    }

    @Test
    void extractsUndefinedColumn() {
        SQLException withRelation = new SQLException(
            "ERROR: column \"order_id\" of relation \"positions\" does not exist", "42703");
        SQLException bare = new SQLException("ERROR: column \"closed_at\" does not exist", "42703");

        assertEquals(Optional.of("order_id"), DbErrorClassifier.undefinedColumn(withRelation));
        assertEquals(Optional.of("closed_at"), DbErrorClassifier.undefinedColumn(bare));
        assertEquals(Optional.empty(), DbErrorClassifier.undefinedColumn(
            new SQLException("ERROR: relation \"signals\" does not exist", "42P01")));
    }
}
