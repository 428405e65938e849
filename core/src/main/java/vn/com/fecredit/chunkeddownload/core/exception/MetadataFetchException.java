package vn.com.fecredit.chunkeddownload.core.exception;

/**
 * The size/offset metadata of a content object could not be obtained or was invalid.
 * Raised before any chunk is requested.
 */
public class MetadataFetchException extends ChunkedDownloadException {

    public MetadataFetchException(String message) {
        super(message);
    }

    public MetadataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
