package org.qbitspark.fileboxstorage.storage_service.utils;

import org.qbitspark.fileboxstorage.globeadvice.exceptions.InvalidStorageKeyException;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives backend keys from logical identities and decides which keys are safe to hand to a
 * backend.
 *
 * <p>Layout:
 * <ul>
 *     <li>{@code <userId>/<logical path>} for addressable files</li>
 *     <li>{@code versions/<userId>/<fileId>/v<n>} for immutable version content</li>
 *     <li>{@code temp/<userId>/<uuid>/<filename>} for uploads not yet recorded as a version</li>
 * </ul>
 */
public final class StorageKeys {

    public static final String VERSIONS_NAMESPACE = "versions";
    public static final String TEMP_NAMESPACE = "temp";
    public static final String STAGING_NAMESPACE = ".staging";
    public static final String MULTIPART_NAMESPACE = ".multipart";
    private static final Set<String> INTERNAL_NAMESPACES = Set.of(STAGING_NAMESPACE, MULTIPART_NAMESPACE);

    private static final String DEFAULT_FILENAME = "upload";
    private static final Pattern ENCODED_SPECIAL = Pattern.compile("%(2e|2f|5c)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DRIVE_LETTER = Pattern.compile("^[A-Za-z]:.*");

    private StorageKeys() {
    }

    public static String fileKey(UUID userId, String logicalPath) {
        Objects.requireNonNull(userId, "userId");
        String relative = canonicalize(logicalPath == null ? "" : logicalPath.trim());
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        String key = relative.isEmpty() ? userId.toString() : userId + "/" + relative;
        return requireSafe(key, "fileKey");
    }

    public static String versionKey(UUID userId, UUID fileId, int versionNumber) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(fileId, "fileId");
        if (versionNumber < 1) {
            throw new IllegalArgumentException("version numbers start at 1, got " + versionNumber);
        }
        return VERSIONS_NAMESPACE + "/" + userId + "/" + fileId + "/v" + versionNumber;
    }

    public static String tempKey(UUID userId, String filename) {
        Objects.requireNonNull(userId, "userId");
        String key = TEMP_NAMESPACE + "/" + userId + "/" + UUID.randomUUID() + "/" + baseName(filename);
        return requireSafe(key, "tempKey");
    }

    public static boolean isTempKey(String key) {
        return key != null && key.startsWith(TEMP_NAMESPACE + "/");
    }

    public static String tempPrefix(UUID userId) {
        return TEMP_NAMESPACE + "/" + userId + "/";
    }

    public static boolean isSafe(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        if (key.startsWith("/") || key.startsWith("\\") || DRIVE_LETTER.matcher(key).matches()) {
            return false;
        }
        if (!canonicalize(key).equals(key)) {
            return false;
        }
        for (String segment : key.split("/")) {
            if ("..".equals(segment)) {
                return false;
            }
        }
        return true;
    }

    public static String requireSafe(String key, String operation) {
        if (!isSafe(key)) {
            throw new InvalidStorageKeyException("unsafe storage key", operation, key, null);
        }
        return key;
    }

    /**
     * Like {@link #requireSafe} but also rejects keys inside the namespaces backends keep for
     * their own staging and multipart parts.
     */
    public static String requireCallerKey(String key, String operation) {
        requireSafe(key, operation);
        int slash = key.indexOf('/');
        String firstSegment = slash < 0 ? key : key.substring(0, slash);
        if (INTERNAL_NAMESPACES.contains(firstSegment)) {
            throw new InvalidStorageKeyException("key addresses a reserved namespace", operation, key, null);
        }
        return key;
    }

    /**
     * Decodes percent-encoded dots and separators, unifies separators and collapses {@code .},
     * {@code ..} and empty segments. A leading {@code /} survives, a trailing one does not.
     */
    static String canonicalize(String key) {
        String decoded = decodeSpecial(key).replace('\0', ' ').replace('\\', '/');
        boolean absolute = decoded.startsWith("/");
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : decoded.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }
        String joined = String.join("/", segments);
        return absolute ? "/" + joined : joined;
    }

    public static String mimeTypeOf(String filename) {
        if (filename == null || filename.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM_VALUE;
        }
        return MediaTypeFactory.getMediaType(filename)
                .map(MediaType::toString)
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }

    public static String baseName(String filename) {
        if (filename == null) {
            return DEFAULT_FILENAME;
        }
        String unified = decodeSpecial(filename).replace('\\', '/');
        String name = unified.substring(unified.lastIndexOf('/') + 1).replace('\0', '_').trim();
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            return DEFAULT_FILENAME;
        }
        return name;
    }

    private static String decodeSpecial(String value) {
        Matcher matcher = ENCODED_SPECIAL.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement;
            switch (matcher.group(1).toLowerCase()) {
                case "2e":
                    replacement = ".";
                    break;
                case "2f":
                    replacement = "/";
                    break;
                default:
                    replacement = "\\\\";
                    break;
            }
            matcher.appendReplacement(sb, replacement);
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
