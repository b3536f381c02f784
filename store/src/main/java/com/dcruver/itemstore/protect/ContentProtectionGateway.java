package com.dcruver.itemstore.protect;

import com.dcruver.itemstore.domain.CorruptContentException;
import com.dcruver.itemstore.domain.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encrypts and decrypts the payload of sensitive items.
 *
 * Ciphertext is {@code ENC1:} followed by Base64 of the 12-byte IV and the
 * AES/GCM output (ciphertext plus 16-byte tag). A fresh IV is drawn per call,
 * so encrypting the same text twice gives different values.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentProtectionGateway {

    public static final String PREFIX = "ENC1:";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 12;
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_TAG_BYTES = GCM_TAG_BITS / 8;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final KeyMaterialProvider keyMaterialProvider;

    public String encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new ValidationException("Cannot encrypt empty content");
        }

        byte[] iv = new byte[IV_BYTES];
        RANDOM.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyMaterialProvider.currentKey(), new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] payload = ByteBuffer.allocate(iv.length + ciphertext.length)
                .put(iv)
                .put(ciphertext)
                .array();
            return PREFIX + Base64.getEncoder().encodeToString(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Content encryption unavailable", e);
        }
    }

    public String decrypt(String value) {
        byte[] payload = decodePayload(value);
        if (payload == null) {
            throw new CorruptContentException("Content is not in protected form");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyMaterialProvider.currentKey(),
                new GCMParameterSpec(GCM_TAG_BITS, payload, 0, IV_BYTES));
            byte[] plaintext = cipher.doFinal(payload, IV_BYTES, payload.length - IV_BYTES);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            log.debug("Decryption failed: {}", e.getMessage());
            throw new CorruptContentException("Protected content cannot be decrypted", e);
        }
    }

    /**
     * Format check only: true when the value has the shape produced by {@link #encrypt}.
     * Says nothing about whether the current key can open it.
     */
    public boolean isEncrypted(String value) {
        return decodePayload(value) != null;
    }

    private byte[] decodePayload(String value) {
        if (value == null || !value.startsWith(PREFIX)) {
            return null;
        }
        try {
            byte[] payload = Base64.getDecoder().decode(value.substring(PREFIX.length()));
            return payload.length > IV_BYTES + GCM_TAG_BYTES ? payload : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
