package com.example.securebudget.crypto;

import com.example.securebudget.exception.KeyIOException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.EnumSet;

/**
 * Owns the single AES-256 secret that protects every stored field.
 *
 * Design:
 * - The key is 32 raw bytes in one file. It is created on first run and only read afterwards.
 * - A file that exists but cannot be read, or has the wrong length, is fatal. We never fall back to
 *   generating a new key over it, since that would orphan every stored token.
 * - Creating a key is logged at WARN so the operator can notice it.
 */
@Slf4j
public class KeyStore {

    public static final int KEY_BYTES = 32;
    static final String KEY_ALGO = "AES";

    private final Path keyFile;
    private final SecureRandom secureRandom;

    public KeyStore(Path keyFile, SecureRandom secureRandom) {
        this.keyFile = keyFile;
        this.secureRandom = secureRandom;
    }

    /**
     * Returns the persisted key, generating and persisting one first if none exists yet.
     *
     * @throws KeyIOException if the key file is unreadable, corrupt or cannot be written
     */
    public SecretKey loadOrCreate() {
        if (Files.exists(keyFile)) {
            return load();
        }
        return create();
    }

    public Path getKeyFile() {
        return keyFile;
    }

    private SecretKey load() {
        byte[] raw;
        try {
            raw = Files.readAllBytes(keyFile);
        } catch (IOException ex) {
            throw new KeyIOException("Unable to read key file " + keyFile, ex);
        }
        try {
            if (raw.length != KEY_BYTES) {
                throw new KeyIOException("Key file " + keyFile + " is corrupt: expected "
                        + KEY_BYTES + " bytes but found " + raw.length);
            }
            log.info("Loaded encryption key from {}", keyFile);
            return new SecretKeySpec(raw, KEY_ALGO);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    private SecretKey create() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        try {
            Path parent = keyFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // CREATE_NEW: never overwrite a key another run may have written meanwhile
            try (SeekableByteChannel channel = Files.newByteChannel(keyFile,
                    EnumSet.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE, StandardOpenOption.SYNC),
                    ownerOnly())) {
                ByteBuffer buffer = ByteBuffer.wrap(raw);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
            log.warn("New encryption key generated and saved to '{}'. Tokens written under any previous key can no longer be decrypted.",
                    keyFile);
            return new SecretKeySpec(raw, KEY_ALGO);
        } catch (IOException ex) {
            throw new KeyIOException("Unable to write key file " + keyFile, ex);
        } finally {
            Arrays.fill(raw, (byte) 0);
        }
    }

    /**
     * Permissions applied atomically at creation, so the key is never readable by other users.
     * Empty where the file system has no POSIX view.
     */
    private static FileAttribute<?>[] ownerOnly() {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return new FileAttribute<?>[] {PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"))};
        }
        return new FileAttribute<?>[0];
    }
}
