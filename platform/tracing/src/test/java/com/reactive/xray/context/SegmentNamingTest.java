package com.reactive.xray.context;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SegmentNamingTest {

    @Test
    void fixedNamingIgnoresHost() {
        SegmentNaming naming = SegmentNaming.fixed("checkout");

        assertEquals("checkout", naming.resolve("shop.example.com"));
        assertEquals("checkout", naming.resolve(null));
        assertFalse(naming.isDynamic());
    }

    @Test
    void nameMustBeNonEmpty() {
        assertThrows(TracingConfigurationException.class, () -> SegmentNaming.fixed(null));
        assertThrows(TracingConfigurationException.class, () -> SegmentNaming.fixed(""));
        assertEquals(" ", SegmentNaming.fixed(" ").defaultName());
    }

    @Test
    void dynamicNamingUsesMatchingHost() {
        SegmentNaming naming = SegmentNaming.dynamic("checkout", "*.example.com");

        assertEquals("shop.example.com", naming.resolve("shop.example.com"));
        assertEquals("checkout", naming.resolve("evil.example.org"));
        assertEquals("checkout", naming.resolve(""));
        assertEquals("checkout", naming.resolve(null));
    }

    @Test
    void dynamicNamingRequiresPattern() {
        assertThrows(TracingConfigurationException.class, () -> SegmentNaming.dynamic("checkout", ""));
        assertThrows(TracingConfigurationException.class, () -> SegmentNaming.dynamic("", "*"));
    }

    @Test
    void wildcardMatching() {
        assertTrue(SegmentNaming.wildcardMatch("*", "anything"));
        assertTrue(SegmentNaming.wildcardMatch("api-?.example.com", "API-1.Example.com"));
        assertTrue(SegmentNaming.wildcardMatch("*.svc.*", "orders.svc.local"));
        assertFalse(SegmentNaming.wildcardMatch("api-?.example.com", "api-12.example.com"));
        assertFalse(SegmentNaming.wildcardMatch("shop", "shop.example.com"));
    }
}
