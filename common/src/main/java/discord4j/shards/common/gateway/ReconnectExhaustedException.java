package discord4j.shards.common.gateway;

import discord4j.shards.common.ShardGatewayException;

public class ReconnectExhaustedException extends ShardGatewayException {

    private final int shardId;
    private final int attempts;

    public ReconnectExhaustedException(int shardId, int attempts, Throwable cause) {
        super("Shard " + shardId + " gave up after " + attempts + " reconnect attempts", cause);
        this.shardId = shardId;
        this.attempts = attempts;
    }

    public int getShardId() {
        return shardId;
    }

    public int getAttempts() {
        return attempts;
    }
}
