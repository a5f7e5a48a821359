package io.agentfarm.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Four-character URL-safe identifiers drawn from 24 random bits.
 */
public final class ShortIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private ShortIds() {
    }

    public static String next() {
        byte[] bytes = new byte[3];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public static String prefixed(String prefix) {
        return prefix + "-" + next();
    }
}
