package vn.com.fecredit.chunkeddownload.stream;

import vn.com.fecredit.chunkeddownload.core.exception.InsufficientBufferException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ordered queue of byte segments that can be drained in exact-length pieces.
 *
 * <p>
 * Segments are kept as pushed. A {@link #pop(int)} that ends inside a segment
 * leaves the rest of that segment at the head of the queue for the next call.
 *
 * <p>
 * Thread safety:
 * <ul>
 * <li>Not safe for concurrent use; callers must synchronize externally</li>
 * <li>Pushed arrays are not copied, callers must not modify them afterwards</li>
 * </ul>
 */
public class ChunkBuffer {

    private final Deque<byte[]> segments = new ArrayDeque<>();

    /** Bytes of the head segment that were already popped. */
    private int headPosition;

    /** Number of buffered bytes not yet popped or flushed. */
    private long length;

    /**
     * Appends a segment to the tail of the buffer. Empty segments are accepted and ignored.
     *
     * @param data bytes to append
     */
    public void push(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        if (data.length == 0) {
            return;
        }
        segments.addLast(data);
        length += data.length;
    }

    /**
     * Removes exactly {@code n} bytes from the head of the buffer.
     *
     * @param n number of bytes to remove
     * @return the removed bytes, in push order
     * @throws InsufficientBufferException if fewer than {@code n} bytes are buffered;
     *                                     the buffer is left untouched
     */
    public byte[] pop(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative: " + n);
        }
        if (n > length) {
            throw new InsufficientBufferException(n, length);
        }
        byte[] out = new byte[n];
        int written = 0;
        while (written < n) {
            byte[] head = segments.peekFirst();
            int headRemaining = head.length - headPosition;
            int take = Math.min(headRemaining, n - written);
            System.arraycopy(head, headPosition, out, written, take);
            written += take;
            if (take == headRemaining) {
                segments.removeFirst();
                headPosition = 0;
            } else {
                headPosition += take;
            }
        }
        length -= n;
        return out;
    }

    /**
     * Returns every buffered byte and empties the buffer.
     *
     * @return the buffered bytes, or an empty array if nothing is buffered
     */
    public byte[] flush() {
        if (length > Integer.MAX_VALUE) {
            throw new IllegalStateException("Buffered length " + length + " does not fit in a byte array");
        }
        byte[] out = pop((int) length);
        segments.clear();
        headPosition = 0;
        return out;
    }

    /**
     * @return number of bytes currently buffered
     */
    public long length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }
}
