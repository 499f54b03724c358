package org.areaflow.engine.credential;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * AES-256-GCM token crypto. The key is SHA-256 of the configured secret.
 * Payload layout (base64): [version=1][12-byte IV][16-byte tag][ciphertext].
 */
@Slf4j
public class AesGcmTokenCrypto implements TokenCrypto {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final byte VERSION = 1;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmTokenCrypto(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Token encryption secret must not be blank");
        }
        this.key = new SecretKeySpec(sha256(secret), "AES");
    }

    @Override
    public String encrypt(String plain) {
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            // JCE appends the tag to the ciphertext; the stored layout puts it first
            byte[] sealed = cipher.doFinal(plain.getBytes(StandardCharsets.UTF_8));
            int ciphertextLength = sealed.length - TAG_LENGTH;

            ByteBuffer out = ByteBuffer.allocate(1 + IV_LENGTH + sealed.length);
            out.put(VERSION);
            out.put(iv);
            out.put(sealed, ciphertextLength, TAG_LENGTH);
            out.put(sealed, 0, ciphertextLength);
            return Base64.getEncoder().encodeToString(out.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token encryption failed", e);
        }
    }

    @Override
    public Optional<String> decrypt(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            byte[] data = Base64.getDecoder().decode(payload);
            if (data.length < 1 + IV_LENGTH + TAG_LENGTH || data[0] != VERSION) {
                log.warn("Token payload has unsupported layout (length={})", data.length);
                return Optional.empty();
            }
            byte[] iv = Arrays.copyOfRange(data, 1, 1 + IV_LENGTH);
            byte[] tag = Arrays.copyOfRange(data, 1 + IV_LENGTH, 1 + IV_LENGTH + TAG_LENGTH);
            byte[] ciphertext = Arrays.copyOfRange(data, 1 + IV_LENGTH + TAG_LENGTH, data.length);

            byte[] sealed = ByteBuffer.allocate(ciphertext.length + TAG_LENGTH)
                    .put(ciphertext)
                    .put(tag)
                    .array();

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return Optional.of(new String(cipher.doFinal(sealed), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.warn("Token decryption failed: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private static byte[] sha256(String secret) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
