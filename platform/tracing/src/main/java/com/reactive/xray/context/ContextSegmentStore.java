package com.reactive.xray.context;

import com.reactive.xray.segment.Entity;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.Scope;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link ContextMode#AUTOMATIC} store backed by OpenTelemetry {@link Context}.
 *
 * ALL OpenTelemetry types are confined to this class.
 */
final class ContextSegmentStore implements SegmentStore {

    static final ContextKey<Entity> ENTITY_KEY = ContextKey.named("xray-entity");

    @Override
    public ContextMode mode() {
        return ContextMode.AUTOMATIC;
    }

    @Override
    public Optional<Entity> current() {
        return Optional.ofNullable(Context.current().get(ENTITY_KEY));
    }

    @Override
    public <T> T bind(Entity entity, Supplier<T> work) {
        try (Scope scope = Context.current().with(ENTITY_KEY, entity).makeCurrent()) {
            return work.get();
        }
    }

    @Override
    public Executor wrap(Executor executor) {
        return Context.taskWrapping(executor);
    }

    @Override
    public Runnable wrap(Runnable task) {
        return Context.current().wrap(task);
    }
}
