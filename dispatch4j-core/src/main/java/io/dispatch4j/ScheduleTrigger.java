package io.dispatch4j;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Callback invoked once per run that passes every gate. This is where the embedding application
 * submits the job, typically choosing a robot with the assignment engine.
 * Exceptions count as a failed run and are never propagated by the scheduler.
 */
@FunctionalInterface
public interface ScheduleTrigger {

    /**
     * @return an optional result, handed to dependency tracking
     */
    Object onTrigger(TriggerContext context) throws Exception;

    /**
     * Adapt an asynchronous callback. The run lasts until the stage completes and fails if it
     * completes exceptionally.
     */
    static ScheduleTrigger async(Function<TriggerContext, ? extends CompletionStage<?>> callback) {
        return context -> {
            try {
                return callback.apply(context).toCompletableFuture().join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
        };
    }
}
