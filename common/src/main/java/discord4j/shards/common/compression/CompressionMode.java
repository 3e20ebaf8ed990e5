package discord4j.shards.common.compression;

import reactor.util.annotation.Nullable;

/**
 * Transport compression negotiated when connecting. Fixed for the lifetime of a connection.
 */
public enum CompressionMode {

    NONE(null),
    ZLIB_STREAM("zlib-stream"),
    ZSTD_STREAM("zstd-stream");

    @Nullable
    private final String queryValue;

    CompressionMode(@Nullable String queryValue) {
        this.queryValue = queryValue;
    }

    /**
     * Return the value of the {@code compress} query parameter, or {@code null} if none is sent.
     *
     * @return the query value
     */
    @Nullable
    public String getQueryValue() {
        return queryValue;
    }

    /**
     * Create a new, uninitialized decompressor for this mode.
     *
     * @param maxChunkSize the largest accepted chunk, in bytes
     * @return a decompressor, or {@code null} for {@link #NONE}
     */
    @Nullable
    public Decompressor createDecompressor(int maxChunkSize) {
        switch (this) {
            case ZLIB_STREAM:
                return new ZlibStreamDecompressor(maxChunkSize);
            case ZSTD_STREAM:
                return new ZstdStreamDecompressor(maxChunkSize);
            default:
                return null;
        }
    }
}
