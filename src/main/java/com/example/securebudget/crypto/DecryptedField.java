package com.example.securebudget.crypto;

import com.example.securebudget.exception.DecryptionException;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of decrypting one field: either the plaintext or the reason it failed.
 * Keeps error and data apart so callers can decide to display, log or rethrow.
 */
public final class DecryptedField {

    private final String value;
    private final DecryptionException error;

    private DecryptedField(String value, DecryptionException error) {
        this.value = value;
        this.error = error;
    }

    public static DecryptedField success(String value) {
        return new DecryptedField(value, null);
    }

    public static DecryptedField failure(DecryptionException error) {
        return new DecryptedField(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<DecryptionException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the plaintext, or {@code placeholder} if decryption failed.
     */
    public String orElse(String placeholder) {
        return isSuccess() ? value : placeholder;
    }

    public <T> Optional<T> map(Function<String, T> mapper) {
        return isSuccess() ? Optional.ofNullable(mapper.apply(value)) : Optional.empty();
    }

    @Override
    public String toString() {
        // never print plaintext
        return isSuccess() ? "DecryptedField[ok]" : "DecryptedField[error=" + error.getMessage() + "]";
    }
}
