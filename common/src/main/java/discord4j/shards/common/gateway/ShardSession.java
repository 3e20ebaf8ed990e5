package discord4j.shards.common.gateway;

import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one shard, kept across reconnects. Only the owning {@link DefaultShardClient} mutates it; others
 * read it through {@link #snapshot()}.
 */
public final class ShardSession {

    private final int shardId;
    private final int numShards;
    private final int bucketId;
    private final int largeThreshold;
    private final Set<String> guilds = ConcurrentHashMap.newKeySet();

    private volatile ShardStatus status = ShardStatus.IDLE;
    @Nullable
    private volatile Integer sequence;
    @Nullable
    private volatile String sessionId;
    @Nullable
    private volatile String resumeUrl;
    private volatile Duration latency = Duration.ZERO;
    private volatile int connectAttempts;
    private volatile int reconnectAttempts;
    private volatile boolean heartbeatAcked = true;
    private volatile boolean ready;

    ShardSession(int shardId, int numShards, int maxConcurrency, int largeThreshold) {
        this.shardId = shardId;
        this.numShards = numShards;
        this.bucketId = shardId % maxConcurrency;
        this.largeThreshold = largeThreshold;
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

    public int getLargeThreshold() {
        return largeThreshold;
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

    @Nullable
    public String getResumeUrl() {
        return resumeUrl;
    }

    public Duration getLatency() {
        return latency;
    }

    public int getGuildCount() {
        return guilds.size();
    }

    public int getConnectAttempts() {
        return connectAttempts;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public boolean isHeartbeatAcked() {
        return heartbeatAcked;
    }

    public boolean isReady() {
        return ready;
    }

    boolean canResume() {
        Integer seq = sequence;
        return sessionId != null && seq != null && seq > 0;
    }

    void setStatus(ShardStatus status) {
        this.status = status;
    }

    /**
     * Record a received sequence number. Sequence numbers never decrease while a session is kept.
     */
    void updateSequence(int value) {
        Integer current = sequence;
        if (current == null || value > current) {
            sequence = value;
        }
    }

    void onReady(@Nullable String sessionId, @Nullable String resumeUrl) {
        this.sessionId = sessionId;
        this.resumeUrl = resumeUrl;
        this.reconnectAttempts = 0;
        this.ready = true;
    }

    void onResumed() {
        this.reconnectAttempts = 0;
        this.ready = true;
    }

    /**
     * Forget the session so that the next connection identifies again.
     */
    void resetSession() {
        this.sessionId = null;
        this.resumeUrl = null;
        this.sequence = null;
        this.ready = false;
        this.guilds.clear();
    }

    void setLatency(Duration latency) {
        this.latency = latency;
    }

    void setHeartbeatAcked(boolean heartbeatAcked) {
        this.heartbeatAcked = heartbeatAcked;
    }

    void incrementConnectAttempts() {
        connectAttempts++;
    }

    int incrementReconnectAttempts() {
        return ++reconnectAttempts;
    }

    void resetAttempts() {
        connectAttempts = 0;
        reconnectAttempts = 0;
    }

    void addGuild(String guildId) {
        guilds.add(guildId);
    }

    void removeGuild(String guildId) {
        guilds.remove(guildId);
    }

    void clearGuilds() {
        guilds.clear();
    }

    public ShardInfo snapshot() {
        return new ShardInfo(shardId, numShards, bucketId, status, sequence, sessionId, latency, guilds.size(),
                connectAttempts, reconnectAttempts);
    }
}
