package com.reactive.xray.context;

/**
 * Tracing was configured with values it cannot run with.
 *
 * Only raised while building tracing components, never while handling a request.
 */
public class TracingConfigurationException extends RuntimeException {

    public TracingConfigurationException(String message) {
        super(message);
    }

    public TracingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
