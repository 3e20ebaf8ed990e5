package discord4j.shards.common.event;

import discord4j.shards.common.shard.ShardManagerStats;

public class StatsUpdateEvent extends GatewayEvent {

    private final ShardManagerStats stats;

    public StatsUpdateEvent(ShardManagerStats stats) {
        super(FLEET);
        this.stats = stats;
    }

    public ShardManagerStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "StatsUpdateEvent{" + stats + '}';
    }
}
