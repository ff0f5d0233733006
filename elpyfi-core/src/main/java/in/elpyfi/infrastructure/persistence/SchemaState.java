package in.elpyfi.infrastructure.persistence;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Columns confirmed present per table, plus the last validation outcome.
 *
 * Readers see an immutable snapshot; updates swap the snapshot under a short lock.
 * Validation queries run before update() is called, never under the lock.
 */
public final class SchemaState {

    /**
     * inspected: columns seen by the last validation, per table found.
     * rejected: columns a write found missing since then.
     */
    private record Snapshot(Map<String, Set<String>> inspected, Map<String, Set<String>> rejected) {}

    private volatile Snapshot snapshot = new Snapshot(Map.of(), Map.of());
    private volatile boolean validated = false;
    private volatile SchemaMismatchException lastMismatch;

    /**
     * @return columns seen by the last validation, or empty if the table was not found
     */
    public Optional<Set<String>> presentColumns(String table) {
        Snapshot s = snapshot;
        Set<String> cols = s.inspected().get(table);
        if (cols == null) {
            return Optional.empty();
        }
        Set<String> rejected = s.rejected().getOrDefault(table, Set.of());
        if (rejected.isEmpty()) {
            return Optional.of(cols);
        }
        Set<String> out = new HashSet<>(cols);
        out.removeAll(rejected);
        return Optional.of(Set.copyOf(out));
    }

    /**
     * Whether a write may include the column.
     * Tables never inspected are optimistic: the write itself finds out.
     */
    public boolean mayWrite(String table, String column) {
        Snapshot s = snapshot;
        if (s.rejected().getOrDefault(table, Set.of()).contains(column)) {
            return false;
        }
        Set<String> cols = s.inspected().get(table);
        return cols == null || cols.contains(column);
    }

    public boolean isValidated() {
        return validated;
    }

    public Optional<SchemaMismatchException> lastMismatch() {
        return Optional.ofNullable(lastMismatch);
    }

    /**
     * Replace everything with a fresh validation result.
     */
    synchronized void update(Map<String, Set<String>> inspected, SchemaMismatchException mismatch) {
        Map<String, Set<String>> copy = new HashMap<>();
        inspected.forEach((t, cols) -> copy.put(t, Set.copyOf(cols)));
        this.snapshot = new Snapshot(Map.copyOf(copy), Map.of());
        this.lastMismatch = mismatch;
        this.validated = mismatch == null;
    }

    /**
     * Record that a write found the column missing.
     */
    synchronized void markAbsent(String table, String column) {
        Snapshot s = snapshot;
        Map<String, Set<String>> rejected = new HashMap<>(s.rejected());
        Set<String> cols = new HashSet<>(rejected.getOrDefault(table, Set.of()));
        if (!cols.add(column)) {
            return;
        }
        rejected.put(table, Set.copyOf(cols));
        this.snapshot = new Snapshot(s.inspected(), Map.copyOf(rejected));
        this.validated = false;
    }
}
