package vn.com.fecredit.chunkeddownload.core.exception;

/**
 * Base type for every failure raised while downloading or re-chunking content.
 *
 * <p>
 * Unchecked so that failures surface through {@link java.util.Iterator#next()}
 * at the point they occur.
 */
public class ChunkedDownloadException extends RuntimeException {

    public ChunkedDownloadException(String message) {
        super(message);
    }

    public ChunkedDownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
