package org.qbitspark.fileboxstorage.globeadvice.exceptions;

import lombok.Getter;

/**
 * Root of every error raised by the storage core.
 *
 * <p>Carries the {@link StorageErrorCode}, the operation that failed and, where one was involved,
 * the storage key. Backend failures keep the original exception as the cause.
 */
@Getter
public class StorageException extends RuntimeException {

    private final StorageErrorCode code;
    private final String operation;
    private final String key;

    public StorageException(StorageErrorCode code, String message) {
        this(code, message, null, null, null);
    }

    public StorageException(StorageErrorCode code, String message, String operation, String key, Throwable cause) {
        super(buildMessage(code, message, operation, key, cause), cause);
        this.code = code;
        this.operation = operation;
        this.key = key;
    }

    private static String buildMessage(StorageErrorCode code, String message, String operation, String key, Throwable cause) {
        StringBuilder sb = new StringBuilder(message != null ? message : code.getDescription());
        if (operation != null) {
            sb.append(" [op=").append(operation);
            if (key != null) {
                sb.append(", key=").append(key);
            }
            sb.append(']');
        }
        if (cause != null && cause.getMessage() != null) {
            sb.append(": ").append(cause.getMessage());
        }
        return sb.toString();
    }
}
