package vn.com.fecredit.chunkeddownload.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response returned by the gateway's {@code tx/{id}/offset} endpoint.
 *
 * <p>
 * Both values are transmitted as decimal strings because they can exceed the
 * range of a {@code long}:
 * <ul>
 * <li>{@code size} - total byte length of the content</li>
 * <li>{@code offset} - absolute position of the content's last byte in the
 * store's address space</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChunkMetadataResponse {

    /** Total size of the content in bytes, as a decimal string. */
    private String size;

    /** Absolute end offset of the content, as a decimal string. */
    private String offset;

    /**
     * Default constructor for JSON deserialization.
     */
    public ChunkMetadataResponse() {
    }

    public ChunkMetadataResponse(String size, String offset) {
        this.size = size;
        this.offset = offset;
    }

    public String getSize() { return size; }
    public void setSize(String size) { this.size = size; }
    public String getOffset() { return offset; }
    public void setOffset(String offset) { this.offset = offset; }

    @Override
    public String toString() {
        return "ChunkMetadataResponse{size=" + size + ", offset=" + offset + "}";
    }
}
