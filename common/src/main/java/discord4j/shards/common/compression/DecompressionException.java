package discord4j.shards.common.compression;

import discord4j.shards.common.ShardGatewayException;

/**
 * Raised when the compressed inbound stream is corrupted or a chunk exceeds the configured maximum. The stream is then
 * desynchronized, so the owning connection must be dropped together with its {@link Decompressor}.
 */
public class DecompressionException extends ShardGatewayException {

    public DecompressionException(String message) {
        super(message);
    }

    public DecompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
