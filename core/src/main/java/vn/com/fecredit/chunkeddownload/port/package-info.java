/**
 * Ports through which the download core reaches the remote store.
 * The core only depends on {@link vn.com.fecredit.chunkeddownload.port.interfaces.IChunkSourcePort};
 * adapters (HTTP, in-memory) live in the client module and in {@code port.impl}.
 */
package vn.com.fecredit.chunkeddownload.port;
