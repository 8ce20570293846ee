package com.reactive.xray.context;

import java.util.Locale;

/**
 * Chooses the name of the segment opened for a request.
 *
 * The configured default name is always used unless dynamic naming was
 * switched on explicitly. With dynamic naming the request's {@code Host}
 * header becomes the name, but only when it matches the host pattern;
 * everything else falls back to the default name.
 */
public final class SegmentNaming {

    private final String defaultName;
    private final boolean dynamicNaming;
    private final String hostPattern;

    private SegmentNaming(String defaultName, boolean dynamicNaming, String hostPattern) {
        this.defaultName = requireName(defaultName);
        this.dynamicNaming = dynamicNaming;
        this.hostPattern = hostPattern;
    }

    /**
     * Fixed naming: every segment is called {@code defaultName}.
     *
     * @throws TracingConfigurationException if the name is null or empty
     */
    public static SegmentNaming fixed(String defaultName) {
        return new SegmentNaming(defaultName, false, "");
    }

    /**
     * Dynamic naming from the {@code Host} header.
     *
     * @param hostPattern wildcard pattern; {@code *} matches any run of characters, {@code ?} one character
     */
    public static SegmentNaming dynamic(String defaultName, String hostPattern) {
        if (hostPattern == null || hostPattern.isEmpty()) {
            throw new TracingConfigurationException("Dynamic naming requires a host pattern, e.g. \"*\".");
        }
        return new SegmentNaming(defaultName, true, hostPattern);
    }

    static String requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new TracingConfigurationException("Default segment name was not supplied. Please provide a string.");
        }
        return name;
    }

    public String resolve(String host) {
        if (!dynamicNaming || host == null || host.isBlank()) {
            return defaultName;
        }
        return wildcardMatch(hostPattern, host) ? host : defaultName;
    }

    public String defaultName() {
        return defaultName;
    }

    public boolean isDynamic() {
        return dynamicNaming;
    }

    static boolean wildcardMatch(String pattern, String text) {
        String p = pattern.toLowerCase(Locale.ROOT);
        String t = text.toLowerCase(Locale.ROOT);

        int pi = 0;
        int ti = 0;
        int star = -1;
        int mark = 0;
        while (ti < t.length()) {
            if (pi < p.length() && (p.charAt(pi) == '?' || p.charAt(pi) == t.charAt(ti))) {
                pi++;
                ti++;
            } else if (pi < p.length() && p.charAt(pi) == '*') {
                star = pi++;
                mark = ti;
            } else if (star >= 0) {
                pi = star + 1;
                ti = ++mark;
            } else {
                return false;
            }
        }
        while (pi < p.length() && p.charAt(pi) == '*') {
            pi++;
        }
        return pi == p.length();
    }
}
