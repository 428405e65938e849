package vn.com.fecredit.chunkeddownload.core;

import vn.com.fecredit.chunkeddownload.model.ChunkMetadataResponse;
import vn.com.fecredit.chunkeddownload.port.impl.DefaultIChunkSourcePort;
import vn.com.fecredit.chunkeddownload.port.interfaces.IChunkSourcePort;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Wraps the in-memory port, completes chunk requests on another thread after a
 * per-offset delay and records what the downloader asked for.
 */
class ControlledChunkSourcePort implements IChunkSourcePort {

    private final DefaultIChunkSourcePort delegate;
    private final Function<BigInteger, Long> delayMillis;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final AtomicInteger metadataRequests = new AtomicInteger();
    private final List<BigInteger> requestedOffsets = Collections.synchronizedList(new ArrayList<>());
    private final List<BigInteger> completedOffsets = Collections.synchronizedList(new ArrayList<>());

    ControlledChunkSourcePort(DefaultIChunkSourcePort delegate, Function<BigInteger, Long> delayMillis) {
        this.delegate = delegate;
        this.delayMillis = delayMillis;
    }

    @Override
    public ChunkMetadataResponse getTransactionMetadata(String id) {
        metadataRequests.incrementAndGet();
        return delegate.getTransactionMetadata(id);
    }

    @Override
    public CompletableFuture<byte[]> getChunkData(BigInteger offset) {
        requestedOffsets.add(offset);
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        CompletableFuture.runAsync(() -> {
            completedOffsets.add(offset);
            inFlight.decrementAndGet();
            delegate.getChunkData(offset).whenComplete((data, error) -> {
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(data);
                }
            });
        }, CompletableFuture.delayedExecutor(delayMillis.apply(offset), TimeUnit.MILLISECONDS));
        return result;
    }

    int getMaxInFlight() {
        return maxInFlight.get();
    }

    int getMetadataRequests() {
        return metadataRequests.get();
    }

    List<BigInteger> getRequestedOffsets() {
        synchronized (requestedOffsets) {
            return new ArrayList<>(requestedOffsets);
        }
    }

    List<BigInteger> getCompletedOffsets() {
        synchronized (completedOffsets) {
            return new ArrayList<>(completedOffsets);
        }
    }
}
