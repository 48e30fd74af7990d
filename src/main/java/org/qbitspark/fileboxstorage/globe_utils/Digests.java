package org.qbitspark.fileboxstorage.globe_utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

public final class Digests {

    private static final int BUFFER_SIZE = 64 * 1024;

    private Digests() {
    }

    public static MessageDigest md5() {
        return getInstance("MD5");
    }

    public static MessageDigest sha256() {
        return getInstance("SHA-256");
    }

    /**
     * Streams the file through MD5 in bounded chunks; this is the etag the local backend reports.
     */
    public static String md5Hex(Path path) throws IOException {
        MessageDigest digest = md5();
        try (InputStream in = Files.newInputStream(path)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return toHex(digest.digest());
    }

    public static String toHex(byte[] hashBytes) {
        StringBuilder hexString = new StringBuilder(hashBytes.length * 2);
        for (byte b : hashBytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }

    /**
     * Object stores quote their etags and some report them upper-case.
     */
    public static String normalizeEtag(String etag) {
        if (etag == null) {
            return null;
        }
        String trimmed = etag.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static boolean sameEtag(String expected, String actual) {
        String left = normalizeEtag(expected);
        String right = normalizeEtag(actual);
        return left != null && !left.isEmpty() && left.equals(right);
    }

    private static MessageDigest getInstance(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " algorithm not available", e);
        }
    }
}
