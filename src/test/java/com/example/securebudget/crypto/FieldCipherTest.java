package com.example.securebudget.crypto;

import com.example.securebudget.exception.DecryptionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldCipherTest {

    private final SecureRandom random = new SecureRandom();
    private final SecretKey key = randomKey();
    private final FieldCipher cipher = new FieldCipher(key, random);

    @ParameterizedTest
    @ValueSource(strings = {"Milk", "3.50", "", " ", "Café au lait ☕", "日本語の説明", "line\nbreak\ttab", "-0.01"})
    void decryptReturnsOriginalText(String plaintext) throws Exception {
        assertThat(cipher.decrypt(cipher.encrypt(plaintext))).isEqualTo(plaintext);
    }

    @Test
    void roundTripsLongText() throws Exception {
        String longText = "x".repeat(100_000) + "😀";
        assertThat(cipher.decrypt(cipher.encrypt(longText))).isEqualTo(longText);
    }

    @Test
    void samePlaintextGivesDifferentTokens() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            tokens.add(cipher.encrypt("Milk"));
        }
        assertThat(tokens).hasSize(100);
    }

    @Test
    void sharedInstanceIsSafeAcrossThreads() throws Exception {
        int threads = 8;
        int perThread = 250;
        Set<String> tokens = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                results.add(pool.submit(() -> {
                    start.await();
                    int ok = 0;
                    for (int i = 0; i < perThread; i++) {
                        String plaintext = "item-" + worker + "-" + i;
                        String token = cipher.encrypt(plaintext);
                        tokens.add(token);
                        if (cipher.decrypt(token).equals(plaintext)) {
                            ok++;
                        }
                    }
                    return ok;
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isEqualTo(perThread);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(tokens).hasSize(threads * perThread);
    }

    @Test
    void tokenIsNonceThenCiphertextThenTag() throws Exception {
        String plaintext = "Groceries";
        byte[] blob = Base64.getDecoder().decode(cipher.encrypt(plaintext));

        assertThat(blob).hasSize(12 + plaintext.length() + 16);

        // an independent AES-GCM decrypt over the same layout must agree
        Cipher jce = Cipher.getInstance("AES/GCM/NoPadding");
        jce.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(128, blob, 0, 12));
        byte[] plain = jce.doFinal(blob, 12, blob.length - 12);
        assertThat(new String(plain, StandardCharsets.UTF_8)).isEqualTo(plaintext);
    }

    @Test
    void decryptsTokenBuiltOutsideTheCipher() throws Exception {
        byte[] iv = new byte[12];
        random.nextBytes(iv);
        Cipher jce = Cipher.getInstance("AES/GCM/NoPadding");
        jce.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(128, iv));
        byte[] ctTag = jce.doFinal("3.50".getBytes(StandardCharsets.UTF_8));
        byte[] blob = new byte[iv.length + ctTag.length];
        System.arraycopy(iv, 0, blob, 0, iv.length);
        System.arraycopy(ctTag, 0, blob, iv.length, ctTag.length);

        assertThat(cipher.decrypt(Base64.getEncoder().encodeToString(blob))).isEqualTo("3.50");
    }

    @Test
    void flippingAnyByteFailsAuthentication() {
        byte[] blob = Base64.getDecoder().decode(cipher.encrypt("Milk"));
        for (int i = 0; i < blob.length; i++) {
            byte[] tampered = blob.clone();
            tampered[i] ^= 0x01;
            String token = Base64.getEncoder().encodeToString(tampered);
            assertThatThrownBy(() -> cipher.decrypt(token))
                    .as("byte %d", i)
                    .isInstanceOf(DecryptionException.class);
        }
    }

    @Test
    void truncatedTokenIsRejected() {
        byte[] blob = Base64.getDecoder().decode(cipher.encrypt("Milk"));
        byte[] truncated = new byte[blob.length - 1];
        System.arraycopy(blob, 0, truncated, 0, truncated.length);

        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(truncated)))
                .isInstanceOf(DecryptionException.class);
    }

    @Test
    void tokenFromAnotherKeyIsRejected() {
        FieldCipher other = new FieldCipher(randomKey(), random);
        String token = other.encrypt("Milk");

        assertThatThrownBy(() -> cipher.decrypt(token))
                .isInstanceOf(DecryptionException.class)
                .hasMessageContaining("authentication");
    }

    @Test
    void malformedTokensAreRejected() {
        assertThatThrownBy(() -> cipher.decrypt("not base64 !!"))
                .isInstanceOf(DecryptionException.class)
                .hasMessageContaining("base64");
        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(new byte[27])))
                .isInstanceOf(DecryptionException.class)
                .hasMessageContaining("too short");
        assertThatThrownBy(() -> cipher.decrypt(""))
                .isInstanceOf(DecryptionException.class);
        assertThatThrownBy(() -> cipher.decrypt(null))
                .isInstanceOf(DecryptionException.class);
    }

    @Test
    void invalidUtf8PayloadIsRejected() throws Exception {
        byte[] iv = new byte[12];
        random.nextBytes(iv);
        Cipher jce = Cipher.getInstance("AES/GCM/NoPadding");
        jce.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(128, iv));
        byte[] ctTag = jce.doFinal(new byte[] {(byte) 0xC3, (byte) 0x28});
        byte[] blob = new byte[iv.length + ctTag.length];
        System.arraycopy(iv, 0, blob, 0, iv.length);
        System.arraycopy(ctTag, 0, blob, iv.length, ctTag.length);

        assertThatThrownBy(() -> cipher.decrypt(Base64.getEncoder().encodeToString(blob)))
                .isInstanceOf(DecryptionException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    void nullPlaintextIsRejected() {
        assertThatThrownBy(() -> cipher.encrypt(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tryDecryptSeparatesValueFromFailure() {
        DecryptedField ok = cipher.tryDecrypt(cipher.encrypt("Milk"));
        DecryptedField bad = cipher.tryDecrypt("garbage");

        assertThat(ok.isSuccess()).isTrue();
        assertThat(ok.orElse("[Decryption Error]")).isEqualTo("Milk");
        assertThat(ok.error()).isEmpty();

        assertThat(bad.isSuccess()).isFalse();
        assertThat(bad.map(String::length)).isEmpty();
        assertThat(bad.error()).containsInstanceOf(DecryptionException.class);
        assertThat(bad.orElse("[Decryption Error]")).isEqualTo("[Decryption Error]");
    }

    @Test
    void toStringNeverShowsPlaintext() {
        assertThat(cipher.tryDecrypt(cipher.encrypt("secret-note")).toString()).doesNotContain("secret-note");
    }

    private SecretKey randomKey() {
        byte[] raw = new byte[32];
        new SecureRandom().nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }
}
