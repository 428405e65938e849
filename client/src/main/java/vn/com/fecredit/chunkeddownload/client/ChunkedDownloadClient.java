package vn.com.fecredit.chunkeddownload.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.com.fecredit.chunkeddownload.core.ChunkPlan;
import vn.com.fecredit.chunkeddownload.core.ChunkedDownload;
import vn.com.fecredit.chunkeddownload.core.exception.ChunkFetchException;
import vn.com.fecredit.chunkeddownload.core.exception.MetadataFetchException;
import vn.com.fecredit.chunkeddownload.core.exception.SizeMismatchException;
import vn.com.fecredit.chunkeddownload.model.ChunkMetadataResponse;
import vn.com.fecredit.chunkeddownload.model.ChunkResponse;
import vn.com.fecredit.chunkeddownload.model.util.Base64UrlUtil;
import vn.com.fecredit.chunkeddownload.port.interfaces.IChunkSourcePort;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Client for downloading chunked content from a gateway.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Concurrent chunk fetches through a bounded, ordered window</li>
 * <li>Arbitrary-precision offset arithmetic</li>
 * <li>Exact byte accounting against the declared size</li>
 * <li>Streaming to a file or collecting into memory</li>
 * </ul>
 *
 * <p>
 * Usage:
 * <pre>
 * ChunkedDownloadClient client = new ChunkedDownloadClient.Builder()
 *     .gatewayUrl("https://gateway.example")
 *     .concurrency(8)
 *     .build();
 *
 * byte[] data = client.downloadChunkedData(id);
 * </pre>
 *
 * <p>
 * Failed requests are not retried; callers own any retry policy.
 */
public class ChunkedDownloadClient {

    private static final Logger log = LoggerFactory.getLogger(ChunkedDownloadClient.class);

    /** Largest array the JVM reliably allocates. */
    static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

    /**
     * Pluggable transport layer for talking to the gateway.
     *
     * <p>
     * This interface abstracts the HTTP communication details, allowing:
     * <ul>
     * <li>Customizable HTTP client implementations</li>
     * <li>Mocking for testing scenarios</li>
     * <li>Gateways with different authentication or retry needs</li>
     * </ul>
     *
     * @see DefaultDownloadTransport
     */
    public interface DownloadTransport extends IChunkSourcePort {

        /**
         * Calls the gateway {@code /chunk/{offset}} endpoint.
         *
         * @param offset absolute offset inside the wanted chunk
         * @return a future completed with the parsed response, or completed exceptionally with
         * a {@link ChunkFetchException}
         */
        CompletableFuture<ChunkResponse> getChunk(BigInteger offset);

        @Override
        default CompletableFuture<byte[]> getChunkData(BigInteger offset) {
            return getChunk(offset).thenApply(response -> {
                try {
                    return Base64UrlUtil.decode(response.getChunk());
                } catch (IllegalArgumentException e) {
                    throw new ChunkFetchException(offset, "Failed to decode chunk at offset " + offset, e);
                }
            });
        }
    }

    public static class DefaultDownloadTransport implements DownloadTransport {
        /** Thread-safe JSON mapper for response deserialization */
        private final ObjectMapper objectMapper;

        /** Shared HTTP client with connection pooling */
        private final HttpClient httpClient;

        private final String gatewayUrl;

        /**
         * @param gatewayUrl base gateway URL, without trailing slash
         * @param httpClient optional custom HttpClient; a default client is created when null
         */
        public DefaultDownloadTransport(String gatewayUrl, HttpClient httpClient) {
            this.objectMapper = new ObjectMapper();
            this.httpClient = httpClient != null ? httpClient : HttpClient.newHttpClient();
            this.gatewayUrl = gatewayUrl.endsWith("/") ? gatewayUrl.substring(0, gatewayUrl.length() - 1) : gatewayUrl;
        }

        @Override
        public ChunkMetadataResponse getTransactionMetadata(String id) throws IOException, InterruptedException {
            URI uri;
            try {
                uri = URI.create(gatewayUrl + "/tx/" + id + "/offset");
            } catch (IllegalArgumentException e) {
                throw new MetadataFetchException("Failed to get transaction offset: invalid id " + id, e);
            }
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new MetadataFetchException("Failed to get transaction offset: " + response.statusCode() + " " + response.body());
            }
            return objectMapper.readValue(response.body(), ChunkMetadataResponse.class);
        }

        @Override
        public CompletableFuture<ChunkResponse> getChunk(BigInteger offset) {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(gatewayUrl + "/chunk/" + offset))
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                    .handle((response, error) -> {
                        if (error != null) {
                            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                            throw new ChunkFetchException(offset, "Failed to get chunk at offset " + offset, cause);
                        }
                        if (response.statusCode() != 200) {
                            throw new ChunkFetchException(offset, "Failed to get chunk at offset " + offset + ": "
                                    + response.statusCode() + " " + response.body());
                        }
                        try {
                            return objectMapper.readValue(response.body(), ChunkResponse.class);
                        } catch (JsonProcessingException e) {
                            throw new ChunkFetchException(offset, "Failed to parse chunk at offset " + offset, e);
                        }
                    });
        }
    }

    private final int concurrency;
    private final DownloadTransport transport;

    private ChunkedDownloadClient(Builder builder) {
        this.concurrency = builder.concurrency;
        this.transport = builder.transport != null ? builder.transport
                : new DefaultDownloadTransport(builder.gatewayUrl, builder.httpClient);
    }

    /**
     * Fetches the size/offset metadata of a content object.
     *
     * @throws MetadataFetchException if the gateway does not answer with success
     */
    public ChunkMetadataResponse getTransactionMetadata(String id) {
        try {
            return transport.getTransactionMetadata(id);
        } catch (IOException e) {
            throw new MetadataFetchException("Failed to get transaction offset for " + id, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataFetchException("Interrupted while getting transaction offset for " + id, e);
        }
    }

    /**
     * Fetches one chunk with its proof paths.
     */
    public CompletableFuture<ChunkResponse> getChunk(BigInteger offset) {
        return transport.getChunk(offset);
    }

    /**
     * Fetches and decodes the bytes of the chunk containing {@code offset}.
     */
    public CompletableFuture<byte[]> getChunkData(BigInteger offset) {
        return transport.getChunkData(offset);
    }

    /**
     * Absolute offset of the first byte of the content described by {@code metadata}.
     */
    public BigInteger firstChunkOffset(ChunkMetadataResponse metadata) {
        return ChunkPlan.firstChunkOffset(metadata);
    }

    /**
     * Starts a lazy download with the configured concurrency.
     */
    public ChunkedDownload concurrentDownloadChunkedData(String id) {
        return concurrentDownloadChunkedData(id, concurrency);
    }

    /**
     * Starts a lazy download. Nothing is requested until the returned iterator is first used.
     *
     * @param id          content identifier
     * @param concurrency maximum number of outstanding chunk requests
     */
    public ChunkedDownload concurrentDownloadChunkedData(String id, int concurrency) {
        return new ChunkedDownload(transport, id, concurrency);
    }

    /**
     * Downloads a whole content object into memory.
     *
     * @return the content bytes, exactly as long as the declared size
     * @throws IllegalStateException if the declared size does not fit in a byte array
     */
    public byte[] downloadChunkedData(String id) {
        try (ChunkedDownload download = concurrentDownloadChunkedData(id)) {
            BigInteger size = download.plan().getSize();
            if (size.compareTo(BigInteger.valueOf(MAX_ARRAY_SIZE)) > 0) {
                throw new IllegalStateException("Content " + id + " of " + size + "B is too large to download into memory");
            }
            byte[] data = new byte[size.intValue()];
            int position = 0;
            while (download.hasNext()) {
                byte[] chunk = download.next();
                if (position + (long) chunk.length > data.length) {
                    throw new SizeMismatchException(size, BigInteger.valueOf(position + (long) chunk.length));
                }
                System.arraycopy(chunk, 0, data, position, chunk.length);
                position += chunk.length;
            }
            return data;
        }
    }

    /**
     * Streams a content object to a file. The metadata is fetched before the file is
     * opened; an existing file is left untouched if that fails. Once opened, the file
     * is replaced and deleted again if the download fails.
     *
     * @return number of bytes written
     */
    public long downloadToFile(String id, Path target, int concurrency) throws IOException {
        try (ChunkedDownload download = concurrentDownloadChunkedData(id, concurrency)) {
            download.plan();
            long written = 0;
            OutputStream out = Files.newOutputStream(target);
            try (out) {
                while (download.hasNext()) {
                    byte[] chunk = download.next();
                    out.write(chunk);
                    written += chunk.length;
                }
            } catch (IOException | RuntimeException e) {
                log.warn("Download of {} to {} failed after {} bytes: {}", id, target, written, e.getMessage());
                Files.deleteIfExists(target);
                throw e;
            }
            log.info("Wrote {} bytes of {} to {}", written, id, target);
            return written;
        }
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Builder for creating ChunkedDownloadClient instances with custom configuration.
     *
     * <p>
     * Required parameters:
     * <ul>
     * <li>gatewayUrl - gateway base URL, unless a transport is given</li>
     * </ul>
     *
     * <p>
     * Optional parameters:
     * <ul>
     * <li>concurrency - maximum outstanding chunk requests (default: 10)</li>
     * <li>httpClient - custom HttpClient instance</li>
     * <li>transport - custom download transport implementation</li>
     * </ul>
     */
    public static class Builder {
        private String gatewayUrl;
        private int concurrency = ChunkedDownload.DEFAULT_CONCURRENCY;
        private HttpClient httpClient;
        private DownloadTransport transport;

        /**
         * @param gatewayUrl base URL of the gateway (e.g. https://gateway.example)
         * @return this builder instance
         */
        public Builder gatewayUrl(String gatewayUrl) {
            this.gatewayUrl = gatewayUrl;
            return this;
        }

        /**
         * @param concurrency maximum outstanding chunk requests (default: 10)
         * @return this builder instance
         */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder transport(DownloadTransport transport) {
            this.transport = transport;
            return this;
        }

        public ChunkedDownloadClient build() {
            if (gatewayUrl == null && transport == null) {
                throw new IllegalStateException("gatewayUrl is required");
            }
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
            }
            return new ChunkedDownloadClient(this);
        }
    }
}
