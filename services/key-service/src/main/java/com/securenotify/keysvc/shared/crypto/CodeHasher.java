package com.securenotify.keysvc.shared.crypto;

import com.securenotify.keysvc.config.SettingsBounds;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Confirmation code generation and salted PBKDF2 hashing.
 * Single source of truth for one-time code and credential hash operations.
 */
@Component
public class CodeHasher {

    public static final int MIN_ITERATIONS = 100_000;
    public static final int MAX_ITERATIONS = 1_000_000;

    private static final int TOKEN_BYTES = 32;
    private static final int SALT_BYTES = 32;
    private static final int DERIVED_KEY_BITS = 64 * 8;
    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final char SEPARATOR = ':';

    private final SecureRandom secureRandom;
    private final HexFormat hexFormat;
    private final int iterations;

    public CodeHasher(@Value("${app.security.pbkdf2-iterations:100000}") int iterations) {
        this.secureRandom = new SecureRandom();
        this.hexFormat = HexFormat.of();
        this.iterations = SettingsBounds.bounded("app.security.pbkdf2-iterations",
                iterations, MIN_ITERATIONS, MIN_ITERATIONS, MAX_ITERATIONS);
    }

    /**
     * Generates a secure random 32-byte token as a 64-char hex string.
     */
    public String generateToken() {
        return randomHex(TOKEN_BYTES);
    }

    public String generateSalt() {
        return randomHex(SALT_BYTES);
    }

    /**
     * Hashes a secret with a fresh salt.
     */
    public String hash(String secret) {
        return hash(secret, generateSalt());
    }

    /**
     * Derives a 64-byte PBKDF2-HMAC-SHA256 key, returned as {@code salt:digestHex}.
     */
    public String hash(String secret, String salt) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        if (salt == null || salt.isEmpty() || salt.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Salt must be non-empty and must not contain ':'");
        }
        PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(),
                salt.getBytes(StandardCharsets.UTF_8), iterations, DERIVED_KEY_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            byte[] derived = factory.generateSecret(spec).getEncoded();
            return salt + SEPARATOR + hexFormat.formatHex(derived);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(KDF_ALGORITHM + " not available", e);
        } finally {
            spec.clearPassword();
        }
    }

    /**
     * Recomputes the digest with the stored salt and compares in constant time.
     */
    public boolean verify(String secret, String storedHash) {
        if (secret == null || secret.isEmpty() || storedHash == null) {
            return false;
        }
        int separator = storedHash.indexOf(SEPARATOR);
        if (separator <= 0 || separator == storedHash.length() - 1) {
            return false;
        }
        String recomputed = hash(secret, storedHash.substring(0, separator));
        return SecureCompare.constantTimeEqual(storedHash, recomputed);
    }

    /**
     * Unsalted SHA-256 hex digest, used to look up API keys by hash.
     */
    public String sha256Hex(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Value cannot be null or empty");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return hexFormat.formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public int getIterations() {
        return iterations;
    }

    private String randomHex(int bytes) {
        byte[] buffer = new byte[bytes];
        secureRandom.nextBytes(buffer);
        return hexFormat.formatHex(buffer);
    }
}
