package com.reactive.xray.id;

import java.security.SecureRandom;

/**
 * Generator for trace and entity identifiers.
 *
 * Trace id format (35 chars): {@code 1-<8 hex epoch seconds>-<24 hex random>}
 * <ul>
 *   <li>version digit, always 1</li>
 *   <li>32 bits: request start time in epoch seconds</li>
 *   <li>96 bits: random</li>
 * </ul>
 *
 * Entity (segment / subsegment) ids are 64 random bits as 16 hex chars.
 *
 * Thread-safe: {@link SecureRandom} is safe for concurrent use.
 */
public final class IdGenerator {

    private static final IdGenerator INSTANCE = new IdGenerator(new SecureRandom());

    // Hex lookup table for fast conversion
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final SecureRandom random;

    IdGenerator(SecureRandom random) {
        this.random = random;
    }

    /**
     * Get the singleton instance.
     */
    public static IdGenerator getInstance() {
        return INSTANCE;
    }

    /**
     * Generate a trace id stamped with the current wall-clock second.
     */
    public String generateTraceId() {
        return generateTraceId(System.currentTimeMillis() / 1000L);
    }

    /**
     * Generate a trace id stamped with the given epoch second.
     */
    public String generateTraceId(long epochSeconds) {
        char[] chars = new char[35];
        chars[0] = '1';
        chars[1] = '-';

        long ts = epochSeconds & 0xFFFFFFFFL;
        for (int i = 9; i >= 2; i--) {
            chars[i] = HEX[(int) (ts & 0xF)];
            ts >>>= 4;
        }
        chars[10] = '-';

        // 96 random bits: 32 + 64
        long high = random.nextInt() & 0xFFFFFFFFL;
        long low = random.nextLong();
        for (int i = 18; i >= 11; i--) {
            chars[i] = HEX[(int) (high & 0xF)];
            high >>>= 4;
        }
        for (int i = 34; i >= 19; i--) {
            chars[i] = HEX[(int) (low & 0xF)];
            low >>>= 4;
        }
        return new String(chars);
    }

    /**
     * Generate a 64-bit entity id as a 16-character hex string.
     */
    public String generateEntityId() {
        long value = random.nextLong();
        char[] chars = new char[16];
        for (int i = 15; i >= 0; i--) {
            chars[i] = HEX[(int) (value & 0xF)];
            value >>>= 4;
        }
        return new String(chars);
    }
}
