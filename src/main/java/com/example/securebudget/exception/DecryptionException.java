package com.example.securebudget.exception;

/**
 * A field token could not be decrypted: malformed encoding, wrong length, failed authentication
 * or invalid UTF-8. Messages never carry token contents or plaintext.
 */
public class DecryptionException extends Exception {
    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
    public DecryptionException(String message) {
        super(message);
    }
}
