package com.reactive.xray.context;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.net.InetSocketAddress;

import static com.reactive.xray.config.ConfigAccessor.*;

/**
 * Type-safe access to the {@code xray} configuration block.
 *
 * Example:
 * <pre>
 *   xray {
 *     default-name = "checkout"
 *     context-mode = automatic
 *     dynamic-naming { enabled = false, host-pattern = "*" }
 *     daemon-address = "127.0.0.1:2000"
 *   }
 * </pre>
 *
 * Defaults live in {@code reference.conf}; only {@code default-name} is required.
 */
public record TracingConfig(
    String defaultName,
    ContextMode contextMode,
    boolean dynamicNaming,
    String hostPattern,
    InetSocketAddress daemonAddress
) {

    private static final String ROOT = "xray";

    public TracingConfig {
        SegmentNaming.requireName(defaultName);
    }

    public static TracingConfig load() {
        return from(ConfigFactory.load());
    }

    /**
     * Read the {@code xray} block of an already loaded configuration.
     *
     * @throws TracingConfigurationException if the block or the default name is missing or invalid
     */
    public static TracingConfig from(Config root) {
        Config c = nested(root, ROOT)
            .orElseThrow(() -> new TracingConfigurationException("Missing '" + ROOT + "' configuration block."));

        String name = strictString(c, "default-name")
            .orElseThrow(() -> new TracingConfigurationException(
                "Default segment name was not supplied. Please provide a string at " + ROOT + ".default-name."));

        try {
            return new TracingConfig(
                name,
                enumVal(c, "context-mode", ContextMode.class, ContextMode.AUTOMATIC),
                bool(c, "dynamic-naming.enabled", false),
                string(c, "dynamic-naming.host-pattern", "*"),
                parseAddress(string(c, "daemon-address", "127.0.0.1:2000"))
            );
        } catch (ConfigException | IllegalArgumentException e) {
            throw new TracingConfigurationException("Invalid " + ROOT + " configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Programmatic configuration with defaults for everything but the name.
     */
    public static TracingConfig withDefaultName(String defaultName) {
        return new TracingConfig(defaultName, ContextMode.AUTOMATIC, false, "*",
            new InetSocketAddress("127.0.0.1", 2000));
    }

    public TracingConfig withContextMode(ContextMode mode) {
        return new TracingConfig(defaultName, mode, dynamicNaming, hostPattern, daemonAddress);
    }

    public TracingConfig withDynamicNaming(String pattern) {
        return new TracingConfig(defaultName, contextMode, true, pattern, daemonAddress);
    }

    public SegmentNaming naming() {
        return dynamicNaming
            ? SegmentNaming.dynamic(defaultName, hostPattern)
            : SegmentNaming.fixed(defaultName);
    }

    static InetSocketAddress parseAddress(String hostPort) {
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw new IllegalArgumentException("daemon-address must be host:port, got '" + hostPort + "'");
        }
        String host = hostPort.substring(0, colon).trim();
        int port = Integer.parseInt(hostPort.substring(colon + 1).trim());
        return InetSocketAddress.createUnresolved(host, port);
    }
}
