package com.reactive.xray.context;

/**
 * Decides whether a request whose caller left the decision open gets recorded.
 *
 * Implementations are supplied by the deployment; the two constants cover tests
 * and simple setups.
 */
@FunctionalInterface
public interface Sampler {

    boolean shouldSample(SamplingRequest request);

    static Sampler always() {
        return request -> true;
    }

    static Sampler never() {
        return request -> false;
    }

    /**
     * What a sampler may look at.
     */
    record SamplingRequest(String serviceName, String host, String method, String path) {}
}
