package discord4j.shards.common.gateway;

import discord4j.shards.common.ShardGatewayException;
import discord4j.shards.common.transport.CloseStatus;

/**
 * Raised when the Gateway closes a shard connection with a code that forbids reconnecting.
 */
public class GatewayClosedException extends ShardGatewayException {

    private final int shardId;
    private final CloseStatus closeStatus;

    public GatewayClosedException(int shardId, CloseStatus closeStatus) {
        super("Shard " + shardId + " closed with non-recoverable status " + closeStatus);
        this.shardId = shardId;
        this.closeStatus = closeStatus;
    }

    public int getShardId() {
        return shardId;
    }

    public CloseStatus getCloseStatus() {
        return closeStatus;
    }
}
