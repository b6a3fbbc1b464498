package io.dispatch4j.affinity;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Moves one kind of robot state (e.g. browser cookies) from one robot to another.
 * Registered per state type with {@link StateAffinityManager#registerMigrationHandler}.
 */
@FunctionalInterface
public interface MigrationHandler {

    /**
     * @return a stage that completes when the transfer is done, or completes exceptionally on failure
     */
    CompletionStage<Void> migrate(String sourceRobotId, String targetRobotId, RobotState state);

    /**
     * Adapt a handler that does its work on the calling thread.
     */
    static MigrationHandler blocking(BlockingMigration migration) {
        return (source, target, state) -> {
            try {
                migration.migrate(source, target, state);
                return CompletableFuture.completedFuture(null);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    @FunctionalInterface
    interface BlockingMigration {
        void migrate(String sourceRobotId, String targetRobotId, RobotState state) throws Exception;
    }
}
