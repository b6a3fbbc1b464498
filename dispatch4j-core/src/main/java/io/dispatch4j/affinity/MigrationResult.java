package io.dispatch4j.affinity;

/**
 * Per-item counts of a state migration. A failed item never stops the remaining ones.
 */
public record MigrationResult(int succeeded, int failed) {

    public boolean isComplete() {
        return failed == 0;
    }
}
