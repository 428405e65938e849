package vn.com.fecredit.chunkeddownload.core.exception;

import java.math.BigInteger;

/**
 * A single chunk request did not succeed. Aborts the whole download.
 */
public class ChunkFetchException extends ChunkedDownloadException {

    private final BigInteger offset;

    public ChunkFetchException(BigInteger offset, String message) {
        super(message);
        this.offset = offset;
    }

    public ChunkFetchException(BigInteger offset, String message, Throwable cause) {
        super(message, cause);
        this.offset = offset;
    }

    /**
     * @return the absolute offset that was requested
     */
    public BigInteger getOffset() {
        return offset;
    }
}
