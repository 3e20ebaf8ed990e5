package discord4j.shards.common.gateway;

import reactor.util.annotation.Nullable;

import java.time.Duration;

/**
 * An immutable view of a {@link ShardSession}.
 */
public final class ShardInfo {

    private final int shardId;
    private final int numShards;
    private final int bucketId;
    private final ShardStatus status;
    @Nullable
    private final Integer sequence;
    @Nullable
    private final String sessionId;
    private final Duration latency;
    private final int guildCount;
    private final int connectAttempts;
    private final int reconnectAttempts;

    public ShardInfo(int shardId, int numShards, int bucketId, ShardStatus status, @Nullable Integer sequence,
                     @Nullable String sessionId, Duration latency, int guildCount, int connectAttempts,
                     int reconnectAttempts) {
        this.shardId = shardId;
        this.numShards = numShards;
        this.bucketId = bucketId;
        this.status = status;
        this.sequence = sequence;
        this.sessionId = sessionId;
        this.latency = latency;
        this.guildCount = guildCount;
        this.connectAttempts = connectAttempts;
        this.reconnectAttempts = reconnectAttempts;
    }

    public int getShardId() {
        return shardId;
    }

    public int getNumShards() {
        return numShards;
    }

    public int getBucketId() {
        return bucketId;
    }

    public ShardStatus getStatus() {
        return status;
    }

    @Nullable
    public Integer getSequence() {
        return sequence;
    }

    @Nullable
    public String getSessionId() {
        return sessionId;
    }

    public Duration getLatency() {
        return latency;
    }

    public int getGuildCount() {
        return guildCount;
    }

    public int getConnectAttempts() {
        return connectAttempts;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    @Override
    public String toString() {
        return "ShardInfo{" +
                "shardId=" + shardId +
                ", numShards=" + numShards +
                ", bucketId=" + bucketId +
                ", status=" + status +
                ", sequence=" + sequence +
                ", latency=" + latency.toMillis() + "ms" +
                ", guildCount=" + guildCount +
                ", reconnectAttempts=" + reconnectAttempts +
                '}';
    }
}
