package in.elpyfi.infrastructure.persistence;

/**
 * Database failure classes. Each drives its own recovery.
 */
public enum DbErrorKind {
    /** Unreachable, dropped, timed out → reconnect */
    CONNECTIVITY,

    /** Undefined table/column → revalidate and report fix SQL */
    SCHEMA_MISMATCH,

    /** Constraint or data violation → drop the write */
    DATA_VALIDATION,

    /** Anything else → log only */
    UNKNOWN
}
