package com.example.securebudget.config;

import com.example.securebudget.crypto.FieldCipher;
import com.example.securebudget.crypto.KeyStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.crypto.SecretKey;
import java.nio.file.Path;
import java.security.SecureRandom;

/**
 * Wires the key store and field cipher.
 *
 * Properties:
 * - budget.crypto.key-file: location of the 32-byte key file (default budget_key.key).
 *
 * The key is loaded once while the context starts. A KeyIOException from that load fails
 * context startup, which is the intended behaviour: there is no safe degraded mode.
 */
@Configuration
public class CryptoConfig {

    @Value("${budget.crypto.key-file:budget_key.key}")
    private String keyFile;

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public KeyStore keyStore(SecureRandom secureRandom) {
        return new KeyStore(Path.of(keyFile), secureRandom);
    }

    @Bean
    public SecretKey budgetSecretKey(KeyStore keyStore) {
        return keyStore.loadOrCreate();
    }

    @Bean
    public FieldCipher fieldCipher(SecretKey budgetSecretKey, SecureRandom secureRandom) {
        return new FieldCipher(budgetSecretKey, secureRandom);
    }
}
