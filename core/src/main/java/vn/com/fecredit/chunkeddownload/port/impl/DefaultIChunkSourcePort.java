package vn.com.fecredit.chunkeddownload.port.impl;

import vn.com.fecredit.chunkeddownload.core.ChunkPlan;
import vn.com.fecredit.chunkeddownload.core.exception.ChunkFetchException;
import vn.com.fecredit.chunkeddownload.core.exception.MetadataFetchException;
import vn.com.fecredit.chunkeddownload.model.ChunkMetadataResponse;
import vn.com.fecredit.chunkeddownload.port.interfaces.IChunkSourcePort;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Default in-memory implementation of IChunkSourcePort.
 *
 * <p>
 * Content objects are laid out back to back in a single address space and split
 * into chunks the way the remote store splits them: {@link ChunkPlan#MAX_CHUNK_SIZE}
 * chunks, except that when the bytes left after a full chunk would be a non-empty
 * piece smaller than {@link ChunkPlan#MIN_CHUNK_SIZE}, the last two chunks share
 * the remainder evenly. A chunk request returns the whole chunk containing the
 * requested offset.
 */
public class DefaultIChunkSourcePort implements IChunkSourcePort {

    /** Chunks keyed by the absolute offset of their last byte. */
    private final NavigableMap<BigInteger, StoredChunk> chunksByEndOffset = new ConcurrentSkipListMap<>();
    private final Map<String, ChunkMetadataResponse> metadataById = new ConcurrentHashMap<>();
    private BigInteger nextFreeOffset;

    public DefaultIChunkSourcePort() {
        this(BigInteger.ZERO);
    }

    /**
     * @param baseOffset absolute offset at which the first stored content starts
     */
    public DefaultIChunkSourcePort(BigInteger baseOffset) {
        this.nextFreeOffset = baseOffset;
    }

    /**
     * Stores a content object after all previously stored ones.
     *
     * @return the metadata the store reports for it
     */
    public synchronized ChunkMetadataResponse addContent(String id, byte[] data) {
        if (id == null || data == null) {
            throw new IllegalArgumentException("id and data cannot be null");
        }
        BigInteger start = nextFreeOffset;
        BigInteger position = start;
        for (byte[] chunk : layoutChunks(data)) {
            BigInteger end = position.add(BigInteger.valueOf(chunk.length - 1L));
            chunksByEndOffset.put(end, new StoredChunk(position, chunk));
            position = end.add(BigInteger.ONE);
        }
        nextFreeOffset = position;
        BigInteger size = BigInteger.valueOf(data.length);
        ChunkMetadataResponse metadata = new ChunkMetadataResponse(size.toString(),
                start.add(size).subtract(BigInteger.ONE).toString());
        metadataById.put(id, metadata);
        return metadata;
    }

    /**
     * Replaces the reported metadata of a stored content object.
     */
    public void overrideMetadata(String id, ChunkMetadataResponse metadata) {
        metadataById.put(id, metadata);
    }

    public Optional<ChunkMetadataResponse> findMetadata(String id) {
        return Optional.ofNullable(metadataById.get(id));
    }

    @Override
    public ChunkMetadataResponse getTransactionMetadata(String id) {
        return findMetadata(id)
                .orElseThrow(() -> new MetadataFetchException("Failed to get transaction offset: " + id + " not found"));
    }

    @Override
    public CompletableFuture<byte[]> getChunkData(BigInteger offset) {
        Map.Entry<BigInteger, StoredChunk> entry = chunksByEndOffset.ceilingEntry(offset);
        if (entry == null || entry.getValue().start.compareTo(offset) > 0) {
            return CompletableFuture.failedFuture(
                    new ChunkFetchException(offset, "Failed to get chunk: no chunk at offset " + offset));
        }
        return CompletableFuture.completedFuture(entry.getValue().data);
    }

    /**
     * Splits content into the chunks the store would keep for it.
     */
    public static List<byte[]> layoutChunks(byte[] data) {
        List<byte[]> chunks = new ArrayList<>();
        int position = 0;
        int rest = data.length;
        while (rest >= ChunkPlan.MAX_CHUNK_SIZE) {
            int chunkSize = ChunkPlan.MAX_CHUNK_SIZE;
            int nextChunkSize = rest - ChunkPlan.MAX_CHUNK_SIZE;
            if (nextChunkSize > 0 && nextChunkSize < ChunkPlan.MIN_CHUNK_SIZE) {
                chunkSize = (rest + 1) / 2;
            }
            chunks.add(Arrays.copyOfRange(data, position, position + chunkSize));
            position += chunkSize;
            rest -= chunkSize;
        }
        if (rest > 0) {
            chunks.add(Arrays.copyOfRange(data, position, data.length));
        }
        return chunks;
    }

    private static final class StoredChunk {
        private final BigInteger start;
        private final byte[] data;

        private StoredChunk(BigInteger start, byte[] data) {
            this.start = start;
            this.data = data;
        }
    }
}
