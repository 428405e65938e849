package vn.com.fecredit.chunkeddownload.port.interfaces;

import vn.com.fecredit.chunkeddownload.model.ChunkMetadataResponse;

import java.io.IOException;
import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * Port interface for reading content metadata and chunks from the remote store.
 * This defines what the download core needs, regardless of the transport used.
 *
 * <p>
 * Implementations own timeouts, authentication and any retry policy; the core
 * never retries.
 */
public interface IChunkSourcePort {

    /**
     * Fetches the size/offset metadata of a content object.
     *
     * @param id content identifier
     * @return the metadata as reported by the store
     * @throws vn.com.fecredit.chunkeddownload.core.exception.MetadataFetchException if the store answers with a failure
     * @throws IOException          on a transport failure
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ChunkMetadataResponse getTransactionMetadata(String id) throws IOException, InterruptedException;

    /**
     * Starts fetching the raw bytes of the chunk containing {@code offset}.
     *
     * @param offset absolute offset in the store's address space
     * @return a future completed with the decoded chunk bytes, or completed exceptionally with a
     * {@link vn.com.fecredit.chunkeddownload.core.exception.ChunkFetchException}
     */
    CompletableFuture<byte[]> getChunkData(BigInteger offset);
}
