package discord4j.shards.common.transport;

import discord4j.shards.common.ShardGatewayException;
import reactor.util.annotation.Nullable;

/**
 * Raised when the underlying socket fails to connect, send or receive.
 */
public class GatewayTransportException extends ShardGatewayException {

    @Nullable
    private final CloseStatus closeStatus;

    public GatewayTransportException(String message) {
        this(message, null, null);
    }

    public GatewayTransportException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public GatewayTransportException(String message, @Nullable CloseStatus closeStatus, @Nullable Throwable cause) {
        super(message, cause);
        this.closeStatus = closeStatus;
    }

    @Nullable
    public CloseStatus getCloseStatus() {
        return closeStatus;
    }
}
