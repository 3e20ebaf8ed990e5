package discord4j.shards.common.compression;

/**
 * A stateful transform from compressed transport chunks to whole decompressed frames. One instance serves exactly one
 * connection; a new connection requires a freshly initialized instance.
 */
public interface Decompressor {

    /**
     * Allocate a fresh decompression context, discarding any previous one.
     */
    void initialize();

    /**
     * Feed one chunk received from the transport.
     *
     * @param chunk the compressed bytes
     * @return the decompressed bytes of one complete frame, or an empty array if more chunks are required
     * @throws DecompressionException if the chunk is oversized or the stream is corrupt
     */
    byte[] decompress(byte[] chunk);

    /**
     * Discard buffered data and restart the context.
     */
    void reset();

    /**
     * Release the context. Further calls to {@link #decompress(byte[])} fail until {@link #initialize()} is called.
     */
    void destroy();

    long getBytesIn();

    long getBytesOut();
}
