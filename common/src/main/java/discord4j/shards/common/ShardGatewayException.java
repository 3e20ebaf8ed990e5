package discord4j.shards.common;

/**
 * Base type for every failure raised by the sharded gateway client.
 */
public class ShardGatewayException extends RuntimeException {

    public ShardGatewayException() {
    }

    public ShardGatewayException(String message) {
        super(message);
    }

    public ShardGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public ShardGatewayException(Throwable cause) {
        super(cause);
    }
}
