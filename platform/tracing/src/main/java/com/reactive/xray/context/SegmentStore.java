package com.reactive.xray.context;

import com.reactive.xray.observe.Log;
import com.reactive.xray.segment.Entity;
import com.reactive.xray.segment.Subsegment;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Makes "the current entity" available to code running on behalf of a request.
 *
 * <ul>
 *   <li>{@link ContextMode#AUTOMATIC}: {@link #bind} makes the entity current for
 *       the work and for every task handed to {@link #wrap(Executor)} or
 *       {@link #wrap(Runnable)} from inside it. Unrelated requests never see it.</li>
 *   <li>{@link ContextMode#MANUAL}: nothing is bound; the entity travels on the
 *       request object and {@link #current()} is always empty.</li>
 * </ul>
 */
public interface SegmentStore {

    ContextMode mode();

    /**
     * The innermost entity bound for the executing request, if any.
     */
    Optional<Entity> current();

    /**
     * Run {@code work} with {@code entity} current, restoring the previous binding afterwards.
     */
    <T> T bind(Entity entity, Supplier<T> work);

    /**
     * Executor whose tasks run with the binding that was current when they were submitted.
     */
    Executor wrap(Executor executor);

    /**
     * Task that runs with the binding current at this call.
     */
    Runnable wrap(Runnable task);

    /**
     * Run {@code work} inside a new subsegment of the current entity. Without a
     * current entity the work runs untraced.
     */
    default <T> T traceSubsegment(String name, Supplier<T> work) {
        Optional<Entity> parent = current();
        if (parent.isEmpty()) {
            Log.debug("No current entity; running '{}' untraced", name);
            return work.get();
        }
        return traceSubsegment(parent.get(), name, work);
    }

    /**
     * Run {@code work} inside a new subsegment of {@code parent}. Errors are
     * recorded on the subsegment and rethrown; the subsegment is closed either way.
     */
    default <T> T traceSubsegment(Entity parent, String name, Supplier<T> work) {
        Subsegment subsegment = parent.beginSubsegment(name);
        try {
            return bind(subsegment, work);
        } catch (RuntimeException e) {
            subsegment.addError(e);
            throw e;
        } finally {
            subsegment.close();
        }
    }

    static SegmentStore forMode(ContextMode mode) {
        return switch (mode) {
            case AUTOMATIC -> new ContextSegmentStore();
            case MANUAL -> new ManualSegmentStore();
        };
    }
}
