package vn.com.fecredit.chunkeddownload.core.exception;

/**
 * A pop request asked for more bytes than are currently buffered.
 */
public class InsufficientBufferException extends ChunkedDownloadException {

    private final int requested;
    private final long available;

    public InsufficientBufferException(int requested, long available) {
        super("Cannot pop " + requested + " bytes, only " + available + " buffered");
        this.requested = requested;
        this.available = available;
    }

    public int getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
