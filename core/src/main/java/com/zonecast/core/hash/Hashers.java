package com.zonecast.core.hash;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Hashing shared by every pusher node. Results must not depend on the JVM or the node,
 * so only seedless, specified algorithms are used here.
 */
public final class Hashers {
    private static final HashFunction MURMUR3 = Hashing.murmur3_128();

    private Hashers() {
    }

    /**
     * Lower 64 bits of the Murmur3 128-bit hash of {@code text} encoded as UTF-8.
     * Used to derive avatar colors from user names.
     */
    public static long stableHash(String text) {
        return MURMUR3.hashString(text, StandardCharsets.UTF_8).asLong();
    }

    /**
     * Lowercase hex, two characters per byte.
     */
    public static String toHex(byte[] bytes) {
        return HashCode.fromBytes(bytes).toString();
    }
}
