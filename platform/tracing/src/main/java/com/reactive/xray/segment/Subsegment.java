package com.reactive.xray.segment;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Narrower unit of work inside a parent entity, e.g. a downstream call.
 * Serialized embedded in its parent, so it carries no trace id of its own.
 */
public final class Subsegment extends Entity {

    private final Entity parent;
    private volatile String namespace;

    Subsegment(String name, Entity parent) {
        super(name, parent.clock());
        this.parent = parent;
    }

    public Entity parent() {
        return parent;
    }

    @Override
    public Segment root() {
        return parent.root();
    }

    @Override
    public String traceId() {
        return root().traceId();
    }

    public boolean isSampled() {
        return root().isSampled();
    }

    /**
     * {@code "remote"} for calls to other services, {@code "aws"} for AWS SDK calls.
     */
    @JsonProperty("namespace")
    public String namespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }
}
