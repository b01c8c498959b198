package com.moonscribe.rag.team;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM encryption for stored team API keys.
 *
 * Stored form: base64(IV (16 bytes) + ciphertext + auth tag (16 bytes)).
 * The secret is used directly when it is base64 for exactly 32 bytes, otherwise its SHA-256
 * digest is the key.
 */
public class ApiKeyCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public ApiKeyCipher(String secret) {
        this.key = (secret == null || secret.isBlank()) ? null : new SecretKeySpec(deriveKey(secret), "AES");
    }

    public boolean isConfigured() {
        return key != null;
    }

    public String encrypt(String apiKey) {
        requireKey();
        try {
            byte[] iv = new byte[IV_LENGTH];
            random.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            // JCE appends the tag to the ciphertext, which matches the stored layout
            byte[] sealed = cipher.doFinal(apiKey.getBytes(StandardCharsets.UTF_8));

            byte[] combined = new byte[iv.length + sealed.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(sealed, 0, combined, iv.length, sealed.length);
            return Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt API key", e);
        }
    }

    /**
     * @throws IllegalArgumentException when the value is malformed or fails authentication
     */
    public String decrypt(String encrypted) {
        requireKey();
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(encrypted);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encrypted API key is not valid base64", e);
        }
        if (combined.length <= IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new IllegalArgumentException("Encrypted API key is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, combined, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Failed to decrypt API key", e);
        }
    }

    private void requireKey() {
        if (key == null) {
            throw new IllegalStateException("Team key encryption secret is not configured");
        }
    }

    static byte[] deriveKey(String secret) {
        byte[] decoded = decodeBase64(secret.trim());
        if (decoded != null && decoded.length == 32) {
            return decoded;
        }
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] decodeBase64(String value) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
