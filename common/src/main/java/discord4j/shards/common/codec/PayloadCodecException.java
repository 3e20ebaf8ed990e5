package discord4j.shards.common.codec;

import discord4j.shards.common.ShardGatewayException;

/**
 * Raised when a single payload cannot be encoded or decoded. The failure is local to that payload: inbound frames that
 * fail to decode are dropped and the connection stays open.
 */
public class PayloadCodecException extends ShardGatewayException {

    public PayloadCodecException(String message) {
        super(message);
    }

    public PayloadCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
