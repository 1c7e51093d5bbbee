package com.example.securebudget.exception;

/**
 * The persisted secret key could not be read or written. Fatal at startup: continuing would mean
 * generating a fresh key and orphaning every stored token.
 */
public class KeyIOException extends RuntimeException {
    public KeyIOException(String message, Throwable cause) {
        super(message, cause);
    }
    public KeyIOException(String message) {
        super(message);
    }
}
