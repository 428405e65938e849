package vn.com.fecredit.chunkeddownload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response returned by the gateway's {@code chunk/{offset}} endpoint.
 *
 * <p>
 * The {@code chunk} field holds the raw chunk bytes encoded as base64url. The
 * two proof paths are carried through untouched; nothing in this project
 * verifies them.
 *
 * @see vn.com.fecredit.chunkeddownload.model.util.Base64UrlUtil
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkResponse {

    /** Chunk bytes, base64url encoded. */
    private String chunk;

    /** Opaque merkle proof of the chunk within its content. */
    @JsonProperty("data_path")
    private String dataPath;

    /** Opaque merkle proof of the content within its block. */
    @JsonProperty("tx_path")
    private String txPath;

    /**
     * Default constructor for JSON deserialization.
     */
    public ChunkResponse() {
    }

    public ChunkResponse(String chunk, String dataPath, String txPath) {
        this.chunk = chunk;
        this.dataPath = dataPath;
        this.txPath = txPath;
    }

    public String getChunk() { return chunk; }
    public void setChunk(String chunk) { this.chunk = chunk; }
    public String getDataPath() { return dataPath; }
    public void setDataPath(String dataPath) { this.dataPath = dataPath; }
    public String getTxPath() { return txPath; }
    public void setTxPath(String txPath) { this.txPath = txPath; }
}
