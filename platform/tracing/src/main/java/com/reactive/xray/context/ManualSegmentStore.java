package com.reactive.xray.context;

import com.reactive.xray.observe.Log;
import com.reactive.xray.segment.Entity;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link ContextMode#MANUAL} store: binds nothing. Callers pass entities explicitly.
 */
final class ManualSegmentStore implements SegmentStore {

    @Override
    public ContextMode mode() {
        return ContextMode.MANUAL;
    }

    @Override
    public Optional<Entity> current() {
        Log.debug("Manual context mode: read the segment from the request instead");
        return Optional.empty();
    }

    @Override
    public <T> T bind(Entity entity, Supplier<T> work) {
        return work.get();
    }

    @Override
    public Executor wrap(Executor executor) {
        return executor;
    }

    @Override
    public Runnable wrap(Runnable task) {
        return task;
    }
}
