package vn.com.fecredit.chunkeddownload.core;

import lombok.Getter;
import vn.com.fecredit.chunkeddownload.core.exception.MetadataFetchException;
import vn.com.fecredit.chunkeddownload.model.ChunkMetadataResponse;

import java.math.BigInteger;

/**
 * Chunk boundaries of one content object, derived from its size/offset metadata.
 *
 * <p>
 * All offset arithmetic uses {@link BigInteger}; sizes and offsets in the store's
 * address space can exceed the range of a {@code long}.
 */
@Getter
public class ChunkPlan {

    /** Nominal size of a stored chunk in bytes. */
    public static final int MAX_CHUNK_SIZE = 256 * 1024;

    /** Smallest chunk the store produces when it rebalances the last two chunks. */
    public static final int MIN_CHUNK_SIZE = 32 * 1024;

    private static final BigInteger MAX_CHUNK = BigInteger.valueOf(MAX_CHUNK_SIZE);

    /** Declared content size in bytes. */
    private final BigInteger size;
    /** Absolute offset of the content's last byte. */
    private final BigInteger endOffset;
    /** Absolute offset of the content's first byte. */
    private final BigInteger startOffset;
    /** {@code ceil(size / MAX_CHUNK_SIZE)}. */
    private final long chunkCount;

    private ChunkPlan(BigInteger size, BigInteger endOffset) {
        this.size = size;
        this.endOffset = endOffset;
        this.startOffset = endOffset.subtract(size).add(BigInteger.ONE);
        BigInteger[] qr = size.divideAndRemainder(MAX_CHUNK);
        BigInteger count = qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
        if (count.bitLength() > 63) {
            throw new MetadataFetchException("Content of " + size + "B has too many chunks to address");
        }
        this.chunkCount = count.longValue();
    }

    /**
     * Parses and validates gateway metadata.
     *
     * @throws MetadataFetchException if a value is missing, not a decimal integer, negative,
     *                                or the offset lies before {@code size - 1}
     */
    public static ChunkPlan from(ChunkMetadataResponse metadata) {
        if (metadata == null) {
            throw new MetadataFetchException("Missing content metadata");
        }
        BigInteger size = parse("size", metadata.getSize());
        BigInteger offset = parse("offset", metadata.getOffset());
        if (size.signum() < 0) {
            throw new MetadataFetchException("Invalid content metadata: negative size " + size);
        }
        if (offset.compareTo(size.subtract(BigInteger.ONE)) < 0) {
            throw new MetadataFetchException("Invalid content metadata: offset " + offset + " is smaller than size - 1 (size " + size + ")");
        }
        return new ChunkPlan(size, offset);
    }

    /**
     * Offset of the content's first byte: {@code offset - size + 1}.
     */
    public static BigInteger firstChunkOffset(ChunkMetadataResponse metadata) {
        return from(metadata).getStartOffset();
    }

    /**
     * Absolute offset requested for the chunk at {@code index}.
     */
    public BigInteger offsetOf(long index) {
        return startOffset.add(MAX_CHUNK.multiply(BigInteger.valueOf(index)));
    }

    private static BigInteger parse(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MetadataFetchException("Invalid content metadata: missing " + field);
        }
        try {
            return new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new MetadataFetchException("Invalid content metadata: " + field + " is not a decimal integer: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "ChunkPlan{start=" + startOffset + ", size=" + size + ", chunks=" + chunkCount + "}";
    }
}
