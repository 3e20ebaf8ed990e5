package discord4j.shards.common.shard;

import discord4j.shards.common.gateway.ShardInfo;

import java.time.Duration;
import java.util.List;

/**
 * Fleet-wide statistics computed from shard snapshots.
 */
public final class ShardManagerStats {

    private final int numShards;
    private final int managedShards;
    private final int connectedShards;
    private final int totalGuilds;
    private final double averageGuildsPerShard;
    private final Duration averageLatency;
    private final List<ShardInfo> shards;

    public ShardManagerStats(int numShards, int managedShards, int connectedShards, int totalGuilds,
                             double averageGuildsPerShard, Duration averageLatency, List<ShardInfo> shards) {
        this.numShards = numShards;
        this.managedShards = managedShards;
        this.connectedShards = connectedShards;
        this.totalGuilds = totalGuilds;
        this.averageGuildsPerShard = averageGuildsPerShard;
        this.averageLatency = averageLatency;
        this.shards = shards;
    }

    /**
     * Return the total shard count of the deployment, including shards owned by other managers.
     *
     * @return the total shard count
     */
    public int getNumShards() {
        return numShards;
    }

    public int getManagedShards() {
        return managedShards;
    }

    public int getConnectedShards() {
        return connectedShards;
    }

    public int getTotalGuilds() {
        return totalGuilds;
    }

    public double getAverageGuildsPerShard() {
        return averageGuildsPerShard;
    }

    public Duration getAverageLatency() {
        return averageLatency;
    }

    public List<ShardInfo> getShards() {
        return shards;
    }

    @Override
    public String toString() {
        return "ShardManagerStats{" +
                "numShards=" + numShards +
                ", managedShards=" + managedShards +
                ", connectedShards=" + connectedShards +
                ", totalGuilds=" + totalGuilds +
                ", averageGuildsPerShard=" + averageGuildsPerShard +
                ", averageLatency=" + averageLatency.toMillis() + "ms" +
                '}';
    }
}
