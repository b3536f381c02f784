package com.dcruver.itemstore.protect;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Derives a 256-bit AES key from a configured passphrase with PBKDF2.
 * The key is derived once, on first use.
 */
@Component
@Slf4j
public class PassphraseKeyMaterialProvider implements KeyMaterialProvider {

    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final int KEY_BITS = 256;

    private final char[] passphrase;
    private final byte[] salt;
    private final int iterations;

    private volatile SecretKey key;

    public PassphraseKeyMaterialProvider(
        @Value("${itemstore.protection.passphrase}") String passphrase,
        @Value("${itemstore.protection.salt:itemstore}") String salt,
        @Value("${itemstore.protection.iterations:120000}") int iterations
    ) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("itemstore.protection.passphrase must be set");
        }
        this.passphrase = passphrase.toCharArray();
        this.salt = salt.getBytes(StandardCharsets.UTF_8);
        this.iterations = iterations;
    }

    @Override
    public SecretKey currentKey() {
        SecretKey derived = key;
        if (derived == null) {
            synchronized (this) {
                if (key == null) {
                    key = deriveKey();
                    log.info("Derived content protection key ({} iterations)", iterations);
                }
                derived = key;
            }
        }
        return derived;
    }

    private SecretKey deriveKey() {
        try {
            PBEKeySpec spec = new PBEKeySpec(passphrase, salt, iterations, KEY_BITS);
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF);
            byte[] keyBytes = factory.generateSecret(spec).getEncoded();
            spec.clearPassword();
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to derive content protection key", e);
        }
    }
}
