package org.qbitspark.fileboxstorage.storage_service.utils;

import com.google.common.base.Throwables;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DeleteFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.DownloadFailedException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.OperationCancelledException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageErrorCode;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.StorageException;
import org.qbitspark.fileboxstorage.globeadvice.exceptions.UploadFailedException;

import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.nio.channels.ClosedByInterruptException;

/**
 * Maps raw backend failures onto the storage exception hierarchy, keeping operation, key and cause.
 */
public final class StorageFailures {

    private StorageFailures() {
    }

    public static StorageException translate(StorageErrorCode failure, String operation, String key, Throwable cause) {
        if (cause instanceof StorageException) {
            return (StorageException) cause;
        }
        if (isCancellation(cause)) {
            return new OperationCancelledException("transfer cancelled", operation, key, cause);
        }
        switch (failure) {
            case DOWNLOAD_FAILED:
                return new DownloadFailedException("read failed", operation, key, cause);
            case DELETE_FAILED:
                return new DeleteFailedException("delete failed", operation, key, cause);
            case UPLOAD_FAILED:
                return new UploadFailedException("write failed", operation, key, cause);
            default:
                return new StorageException(failure, failure.getDescription(), operation, key, cause);
        }
    }

    /**
     * Socket timeouts are transport failures, not cancellations, even though they share a supertype.
     */
    public static boolean isCancellation(Throwable error) {
        if (error == null) {
            return false;
        }
        for (Throwable t : Throwables.getCausalChain(error)) {
            if (t instanceof SocketTimeoutException) {
                continue;
            }
            if (t instanceof InterruptedIOException
                    || t instanceof InterruptedException
                    || t instanceof ClosedByInterruptException
                    || t instanceof OperationCancelledException) {
                return true;
            }
        }
        return false;
    }
}
