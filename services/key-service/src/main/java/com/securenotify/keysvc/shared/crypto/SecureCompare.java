package com.securenotify.keysvc.shared.crypto;

import java.nio.charset.StandardCharsets;

/**
 * Constant-time comparison for secrets and digests.
 * Running time depends only on the length of the expected value, never on where the inputs differ.
 */
public final class SecureCompare {

    private SecureCompare() {
    }

    /**
     * Compares two byte sequences without short-circuiting on length or content.
     * When lengths differ the expected value is compared against itself so the same
     * amount of work is done, and the length difference is folded into the result.
     */
    public static boolean constantTimeEqual(byte[] expected, byte[] actual) {
        if (expected == null || actual == null) {
            return false;
        }
        byte[] candidate = expected.length == actual.length ? actual : expected;
        int result = expected.length ^ actual.length;
        for (int i = 0; i < expected.length; i++) {
            result |= expected[i] ^ candidate[i];
        }
        return result == 0;
    }

    /**
     * Compares the UTF-8 encodings of two strings.
     */
    public static boolean constantTimeEqual(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return constantTimeEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }
}
