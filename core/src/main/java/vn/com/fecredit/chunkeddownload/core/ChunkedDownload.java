package vn.com.fecredit.chunkeddownload.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.chunkeddownload.core.exception.ChunkFetchException;
import vn.com.fecredit.chunkeddownload.core.exception.MetadataFetchException;
import vn.com.fecredit.chunkeddownload.core.exception.SizeMismatchException;
import vn.com.fecredit.chunkeddownload.model.ChunkMetadataResponse;
import vn.com.fecredit.chunkeddownload.port.interfaces.IChunkSourcePort;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Lazy, strictly ordered download of one content object, chunk by chunk.
 *
 * <p>
 * Phases of a download:
 * <ul>
 * <li>Metadata: fetched on the first call to {@link #hasNext()}, {@link #next()} or {@link #plan()}</li>
 * <li>Parallel: all chunks but the last two are fetched through a FIFO window of at most
 * {@code min(chunkCount - 2, concurrency)} outstanding requests</li>
 * <li>Tail: the last two chunk slots are fetched one at a time; the very last slot only
 * if bytes are still missing, because the store may have rebalanced the last two chunks</li>
 * <li>Verification: the yielded byte total must equal the declared size</li>
 * </ul>
 *
 * <p>
 * Chunks are always yielded in ascending index order: the iterator waits on the
 * oldest outstanding request, whatever order the requests complete in.
 *
 * <p>
 * Each instance serves one download, is not restartable and is not thread-safe.
 * {@link #close()} stops scheduling; requests already issued are not aborted.
 */
public class ChunkedDownload implements Iterator<byte[]>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChunkedDownload.class);

    public static final int DEFAULT_CONCURRENCY = 10;

    private enum Phase { NEW, PARALLEL, TAIL, LAST, VERIFY, DONE }

    private final IChunkSourcePort source;
    @Getter
    private final String id;
    private final int configuredConcurrency;
    private final Deque<PendingChunk> processing = new ArrayDeque<>();

    private ChunkPlan plan;
    private Phase phase = Phase.NEW;
    private long nextIndex;
    private long parallelChunks;
    private int concurrency;
    @Getter
    private BigInteger processedBytes = BigInteger.ZERO;
    private byte[] next;

    public ChunkedDownload(IChunkSourcePort source, String id) {
        this(source, id, DEFAULT_CONCURRENCY);
    }

    /**
     * @param source      where metadata and chunks are read from
     * @param id          content identifier
     * @param concurrency maximum number of outstanding chunk requests, must be positive
     */
    public ChunkedDownload(IChunkSourcePort source, String id, int concurrency) {
        if (source == null || id == null) {
            throw new IllegalArgumentException("source and id are required");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        }
        this.source = source;
        this.id = id;
        this.configuredConcurrency = concurrency;
    }

    /**
     * Returns the chunk plan, fetching the metadata first if that has not happened yet.
     *
     * @throws MetadataFetchException if the metadata cannot be fetched or is invalid
     */
    public ChunkPlan plan() {
        if (phase == Phase.NEW) {
            try {
                start();
            } catch (RuntimeException e) {
                abort();
                throw e;
            }
        }
        if (plan == null) {
            throw new IllegalStateException("Download " + id + " was closed before its metadata was fetched");
        }
        return plan;
    }

    @Override
    public boolean hasNext() {
        if (next == null && phase != Phase.DONE) {
            try {
                next = advance();
            } catch (RuntimeException e) {
                abort();
                throw e;
            }
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
        return chunk;
    }

    /**
     * Stops the download. Outstanding requests are left to complete and their results discarded.
     */
    @Override
    public void close() {
        if (phase != Phase.DONE && !processing.isEmpty()) {
            log.debug("Closing download {} with {} chunk requests still outstanding", id, processing.size());
        }
        abort();
    }

    /**
     * @return number of chunk requests issued and not yet yielded
     */
    public int getOutstandingRequests() {
        return processing.size();
    }

    private byte[] advance() {
        switch (phase) {
            case NEW:
                start();
                return advance();
            case PARALLEL:
                fillWindow();
                failFastOnCompletedError();
                PendingChunk head = processing.pollFirst();
                if (head != null) {
                    return await(head);
                }
                phase = Phase.TAIL;
                return advance();
            case TAIL:
                phase = Phase.LAST;
                return await(schedule(nextIndex++));
            case LAST:
                phase = Phase.VERIFY;
                if (processedBytes.compareTo(plan.getSize()) < 0 && nextIndex < plan.getChunkCount()) {
                    return await(schedule(nextIndex++));
                }
                return advance();
            case VERIFY:
                phase = Phase.DONE;
                if (!processedBytes.equals(plan.getSize())) {
                    throw new SizeMismatchException(plan.getSize(), processedBytes);
                }
                log.info("Downloaded {}: {} bytes in {} chunk requests", id, processedBytes, nextIndex);
                return null;
            default:
                return null;
        }
    }

    private void start() {
        plan = ChunkPlan.from(fetchMetadata());
        parallelChunks = plan.getChunkCount() - 2;
        concurrency = (int) Math.max(0, Math.min(parallelChunks, configuredConcurrency));
        log.info("Downloading {}: start {} size {} chunks {} concurrency {}",
                id, plan.getStartOffset(), plan.getSize(), plan.getChunkCount(), concurrency);
        phase = plan.getChunkCount() == 0 ? Phase.VERIFY : Phase.PARALLEL;
    }

    private ChunkMetadataResponse fetchMetadata() {
        try {
            return source.getTransactionMetadata(id);
        } catch (IOException e) {
            throw new MetadataFetchException("Failed to get transaction offset for " + id, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataFetchException("Interrupted while getting transaction offset for " + id, e);
        }
    }

    private void fillWindow() {
        while (nextIndex < parallelChunks && processing.size() < concurrency) {
            processing.addLast(schedule(nextIndex++));
        }
    }

    /**
     * Surfaces a failure of any queued request as soon as it is known instead of
     * waiting for the request to reach the head of the queue.
     */
    private void failFastOnCompletedError() {
        for (PendingChunk pending : processing) {
            if (pending.future.isCompletedExceptionally()) {
                await(pending);
            }
        }
    }

    private PendingChunk schedule(long index) {
        BigInteger offset = plan.offsetOf(index);
        log.debug("Requesting chunk {} of {} at offset {}", index, id, offset);
        CompletableFuture<byte[]> future;
        try {
            future = source.getChunkData(offset);
        } catch (ChunkFetchException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.failedFuture(new ChunkFetchException(offset, "No chunk request issued for offset " + offset));
        }
        return new PendingChunk(index, offset, future);
    }

    private byte[] await(PendingChunk pending) {
        byte[] data;
        try {
            data = pending.future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChunkFetchException(pending.offset, "Interrupted while getting chunk at offset " + pending.offset, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ChunkFetchException) {
                throw (ChunkFetchException) cause;
            }
            throw new ChunkFetchException(pending.offset, "Failed to get chunk at offset " + pending.offset + ": " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new ChunkFetchException(pending.offset, "Chunk request at offset " + pending.offset + " was cancelled", e);
        }
        if (data == null) {
            throw new ChunkFetchException(pending.offset, "Failed to get chunk at offset " + pending.offset + ": empty response");
        }
        processedBytes = processedBytes.add(BigInteger.valueOf(data.length));
        log.debug("Received chunk {} of {}: {} bytes, {}/{}", pending.index, id, data.length, processedBytes, plan.getSize());
        return data;
    }

    private void abort() {
        phase = Phase.DONE;
        next = null;
        processing.clear();
    }

    private static final class PendingChunk {
        private final long index;
        private final BigInteger offset;
        private final CompletableFuture<byte[]> future;

        private PendingChunk(long index, BigInteger offset, CompletableFuture<byte[]> future) {
            this.index = index;
            this.offset = offset;
            this.future = future;
        }
    }
}
