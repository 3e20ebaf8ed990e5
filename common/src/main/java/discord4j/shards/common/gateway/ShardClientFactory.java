package discord4j.shards.common.gateway;

import discord4j.shards.common.event.GatewayEventSink;

/**
 * Creates the client of one shard.
 */
@FunctionalInterface
public interface ShardClientFactory {

    ShardClient create(int shardId, int numShards, int maxConcurrency, GatewayEventSink eventSink);

    static ShardClientFactory fromOptions(GatewayOptions options) {
        return (shardId, numShards, maxConcurrency, eventSink) ->
                new DefaultShardClient(options, shardId, numShards, maxConcurrency, eventSink);
    }
}
