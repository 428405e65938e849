package vn.com.fecredit.chunkeddownload.stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Re-slices a sequence of arbitrarily sized byte arrays into arrays of exactly
 * {@code chunkSize} bytes.
 *
 * <p>
 * Behaviour at the end of the input:
 * <ul>
 * <li>{@code flush = false}: an incomplete remainder is dropped</li>
 * <li>{@code flush = true}: a non-empty remainder is emitted as a final, shorter array</li>
 * </ul>
 *
 * <p>
 * A chunker is single-use: each instance transforms exactly one input. Build a
 * new instance to process another input.
 *
 * <pre>
 * Iterator&lt;byte[]&gt; chunks = new Chunker(256 * 1024, true).transform(inputStream);
 * </pre>
 */
public class Chunker {

    private static final Logger log = LoggerFactory.getLogger(Chunker.class);

    /** Read size used when the input is an {@link InputStream}. */
    static final int READ_BLOCK_SIZE = 64 * 1024;

    private final int chunkSize;
    private final boolean flush;
    private final AtomicBoolean used = new AtomicBoolean();

    /**
     * Creates a chunker that drops an incomplete trailing chunk.
     *
     * @param chunkSize size of every emitted chunk, must be positive
     */
    public Chunker(int chunkSize) {
        this(chunkSize, false);
    }

    /**
     * @param chunkSize size of every emitted chunk, must be positive
     * @param flush     whether to emit a shorter trailing chunk
     */
    public Chunker(int chunkSize, boolean flush) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.flush = flush;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public boolean isFlush() {
        return flush;
    }

    /**
     * Lazily re-chunks the given input. Input arrays are pulled only as needed to
     * complete the next chunk.
     *
     * @param input source arrays, in byte order
     * @return fixed-size chunks in the same byte order
     * @throws IllegalStateException if this chunker was already used
     */
    public Iterator<byte[]> transform(Iterator<byte[]> input) {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("Chunker instances are single-use");
        }
        return new ChunkIterator(input);
    }

    /**
     * Stream variant of {@link #transform(Iterator)}. Closing the returned stream closes the input stream.
     */
    public Stream<byte[]> transform(Stream<byte[]> input) {
        Iterator<byte[]> chunks = transform(input.iterator());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(chunks, Spliterator.ORDERED), false)
                .onClose(input::close);
    }

    /**
     * Re-chunks everything readable from {@code in}. The stream is read in blocks
     * of up to {@value #READ_BLOCK_SIZE} bytes and is not closed by this method.
     *
     * @throws UncheckedIOException from the returned iterator if reading fails
     */
    public Iterator<byte[]> transform(InputStream in) {
        return transform(new BlockIterator(in));
    }

    private final class ChunkIterator implements Iterator<byte[]> {
        private final Iterator<byte[]> input;
        private final ChunkBuffer buffer = new ChunkBuffer();
        private byte[] next;
        private boolean exhausted;
        private long emitted;

        private ChunkIterator(Iterator<byte[]> input) {
            this.input = input;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !exhausted) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            byte[] chunk = next;
            next = null;
            emitted++;
            return chunk;
        }

        private byte[] advance() {
            while (buffer.length() < chunkSize && input.hasNext()) {
                buffer.push(input.next());
            }
            if (buffer.length() >= chunkSize) {
                return buffer.pop(chunkSize);
            }
            exhausted = true;
            if (flush && !buffer.isEmpty()) {
                log.debug("Flushing trailing chunk of {} bytes after {} full chunks", buffer.length(), emitted);
                return buffer.flush();
            }
            if (!buffer.isEmpty()) {
                log.debug("Dropping incomplete trailing chunk of {} bytes after {} full chunks", buffer.length(), emitted);
            }
            return null;
        }
    }

    private static final class BlockIterator implements Iterator<byte[]> {
        private final InputStream in;
        private byte[] next;
        private boolean eof;

        private BlockIterator(InputStream in) {
            this.in = in;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !eof) {
                next = read();
            }
            return next != null;
        }

        @Override
        public byte[] next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            byte[] block = next;
            next = null;
            return block;
        }

        private byte[] read() {
            byte[] block = new byte[READ_BLOCK_SIZE];
            try {
                int read = in.read(block);
                if (read < 0) {
                    eof = true;
                    return null;
                }
                return read == block.length ? block : Arrays.copyOf(block, read);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read input stream", e);
            }
        }
    }
}
