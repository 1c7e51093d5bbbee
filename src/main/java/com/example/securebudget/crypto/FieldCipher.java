package com.example.securebudget.crypto;

import com.example.securebudget.exception.DecryptionException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * AES-256-GCM encryption of individual text fields.
 *
 * Token layout: Base64(nonce[12] || ciphertext || tag[16]), standard alphabet, no AAD.
 * A token carries its own nonce, so decryption needs only the token and the key.
 *
 * Instances hold the immutable key and a thread-safe {@link SecureRandom}; a {@link Cipher} is
 * created per call, so one instance can be shared across threads.
 */
@Slf4j
public class FieldCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int IV_SIZE = 12;
    private static final int GCM_TAG_BITS = 128;
    static final int MIN_TOKEN_BYTES = IV_SIZE + GCM_TAG_BITS / 8;

    private final SecretKey key;
    private final SecureRandom secureRandom;

    public FieldCipher(SecretKey key, SecureRandom secureRandom) {
        this.key = key;
        this.secureRandom = secureRandom;
    }

    /**
     * Encrypts a field under a fresh random nonce.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        byte[] iv = new byte[IV_SIZE];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ctTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] out = new byte[iv.length + ctTag.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(ctTag, 0, out, iv.length, ctTag.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException ex) {
            // AES/GCM is mandatory on every JRE; reaching this means a broken provider setup
            throw new IllegalStateException("AES-GCM encryption unavailable", ex);
        }
    }

    /**
     * Decrypts and authenticates a token produced by {@link #encrypt(String)}.
     *
     * @throws DecryptionException if the token is malformed, fails authentication (corrupted,
     *                             truncated or written under another key) or is not valid UTF-8
     */
    public String decrypt(String token) throws DecryptionException {
        if (token == null) {
            throw new DecryptionException("Token is missing");
        }
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(token);
        } catch (IllegalArgumentException ex) {
            throw new DecryptionException("Token is not valid base64", ex);
        }
        if (blob.length < MIN_TOKEN_BYTES) {
            throw new DecryptionException("Token too short: " + blob.length + " bytes");
        }

        byte[] plain;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, blob, 0, IV_SIZE));
            plain = cipher.doFinal(blob, IV_SIZE, blob.length - IV_SIZE);
        } catch (AEADBadTagException ex) {
            throw new DecryptionException("Token failed authentication", ex);
        } catch (GeneralSecurityException ex) {
            throw new DecryptionException("Token could not be decrypted", ex);
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plain))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new DecryptionException("Decrypted field is not valid UTF-8", ex);
        } finally {
            Arrays.fill(plain, (byte) 0);
        }
    }

    /**
     * Result-typed form of {@link #decrypt(String)} for callers that render failures instead of
     * propagating them.
     */
    public DecryptedField tryDecrypt(String token) {
        try {
            return DecryptedField.success(decrypt(token));
        } catch (DecryptionException ex) {
            log.debug("Field decryption failed: {}", ex.getMessage());
            return DecryptedField.failure(ex);
        }
    }
}
