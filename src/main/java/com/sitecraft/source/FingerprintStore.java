package com.sitecraft.source;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprints for source artifacts. A fingerprint depends on file bytes only, so touching a file
 * without changing it keeps its fingerprint.
 */
public class FingerprintStore {
    public static final String ALGORITHM = "SHA-256";
    /** Recorded in a dependency set for a source that was consulted but did not exist. */
    public static final String ABSENT = "absent";

    private static final int BUFFER_SIZE = 64 * 1024;

    public String fingerprint(Path path) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = new DigestInputStream(Files.newInputStream(path), digest)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            while (in.read(buffer) != -1) {
                // digest is updated by the stream
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public boolean hasChanged(String previousHash, Path path) throws IOException {
        if (previousHash == null) {
            return true;
        }
        return !previousHash.equals(fingerprint(path));
    }

    public static String fingerprint(byte[] bytes) {
        return HexFormat.of().formatHex(newDigest().digest(bytes));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " unavailable", e);
        }
    }
}
