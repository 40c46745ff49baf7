package com.runsmart.garmin_sync_engine.util;

import com.runsmart.garmin_sync_engine.exception.GarminAuthException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * AES-GCM for OAuth tokens at rest. Stored format is {@code ivHex:tagHex:cipherHex}, shared with
 * the web app that completes the OAuth handshake.
 */
@Component
public class EncryptionUtil {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int TAG_LENGTH_BIT = 128;
    private static final int TAG_LENGTH_BYTES = TAG_LENGTH_BIT / 8;
    private static final int IV_LENGTH_BYTES = 12;

    private final SecretKey secretKey;
    private final SecureRandom random = new SecureRandom();

    public EncryptionUtil(@Value("${app.encryption.key:a-very-secret-key-that-is-32-chars-long-!!!}") String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            this.secretKey = new SecretKeySpec(digest.digest(secret.getBytes(StandardCharsets.UTF_8)), "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize EncryptionUtil", e);
        }
    }

    public String encrypt(String plainText) {
        if (plainText == null) {
            throw new IllegalArgumentException("Cannot encrypt a null token");
        }
        try {
            byte[] iv = new byte[IV_LENGTH_BYTES];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BIT, iv));
            byte[] combined = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));

            // Java appends the tag to the ciphertext; the stored form keeps them apart
            byte[] data = Arrays.copyOfRange(combined, 0, combined.length - TAG_LENGTH_BYTES);
            byte[] tag = Arrays.copyOfRange(combined, combined.length - TAG_LENGTH_BYTES, combined.length);

            HexFormat hex = HexFormat.of();
            return hex.formatHex(iv) + ":" + hex.formatHex(tag) + ":" + hex.formatHex(data);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token encryption failed", e);
        }
    }

    /**
     * @throws GarminAuthException when the value is malformed or fails authentication
     */
    public String decrypt(String encryptedText) {
        if (encryptedText == null || encryptedText.isBlank()) {
            throw new GarminAuthException("Stored Garmin token is missing");
        }
        String[] parts = encryptedText.split(":");
        if (parts.length != 3) {
            throw new GarminAuthException("Stored Garmin token is malformed");
        }

        try {
            HexFormat hex = HexFormat.of();
            byte[] iv = hex.parseHex(parts[0]);
            byte[] authTag = hex.parseHex(parts[1]);
            byte[] encryptedData = hex.parseHex(parts[2]);

            byte[] combined = new byte[encryptedData.length + authTag.length];
            System.arraycopy(encryptedData, 0, combined, 0, encryptedData.length);
            System.arraycopy(authTag, 0, combined, encryptedData.length, authTag.length);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BIT, iv));
            return new String(cipher.doFinal(combined), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new GarminAuthException("Stored Garmin token could not be decrypted", e);
        }
    }
}
