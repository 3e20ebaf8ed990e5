package discord4j.shards.common.shard;

import discord4j.shards.common.ShardGatewayException;

/**
 * Raised at spawn time when the requested shard layout is invalid. It is never retried automatically.
 */
public class ShardConfigurationException extends ShardGatewayException {

    public ShardConfigurationException(String message) {
        super(message);
    }

    static ShardConfigurationException invalidShardId(int shardId, int numShards) {
        return new ShardConfigurationException("Invalid shard ID " + shardId + ", must be >= 0 and < " + numShards);
    }

    static ShardConfigurationException invalidShardCount(int numShards) {
        return new ShardConfigurationException("Cannot spawn " + numShards + " shards");
    }

    static ShardConfigurationException tooManyGuilds(int guildsPerShard, int maxGuildsPerShard) {
        return new ShardConfigurationException("Computed " + guildsPerShard + " guilds per shard, maximum is "
                + maxGuildsPerShard);
    }

    static ShardConfigurationException concurrencyOutOfBounds(int maxConcurrency, int ceiling) {
        return new ShardConfigurationException("Max concurrency " + maxConcurrency + " must be between 1 and "
                + ceiling);
    }
}
