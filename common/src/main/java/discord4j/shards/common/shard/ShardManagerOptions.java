package discord4j.shards.common.shard;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Placement and spawn settings of a {@link ShardManager}.
 */
public class ShardManagerOptions {

    /**
     * Highest identify concurrency the Gateway grants.
     */
    public static final int MAX_CONCURRENCY_CEILING = 16;

    @Nullable
    private final Integer totalShards;
    @Nullable
    private final List<Integer> shardList;
    private final int shardCountBase;
    private final int maxGuildsPerShard;
    private final int maxConcurrency;
    private final Duration spawnDelay;
    private final Duration spawnTimeout;
    private final boolean gracefulHandoff;
    private final Duration handoffTimeout;
    private final Duration statsInterval;
    private final Scheduler scheduler;

    protected ShardManagerOptions(Builder builder) {
        this.totalShards = builder.totalShards;
        this.shardList = builder.shardList;
        this.shardCountBase = builder.shardCountBase;
        this.maxGuildsPerShard = builder.maxGuildsPerShard;
        this.maxConcurrency = builder.maxConcurrency;
        this.spawnDelay = builder.spawnDelay;
        this.spawnTimeout = builder.spawnTimeout;
        this.gracefulHandoff = builder.gracefulHandoff;
        this.handoffTimeout = builder.handoffTimeout;
        this.statsInterval = builder.statsInterval;
        this.scheduler = builder.scheduler;
    }

    public static ShardManagerOptions create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Return the fixed total shard count, or {@code null} to compute it when spawning.
     *
     * @return the total shard count
     */
    @Nullable
    public Integer getTotalShards() {
        return totalShards;
    }

    /**
     * Return the shard ids this manager owns, or {@code null} to own every shard.
     *
     * @return the shard ids
     */
    @Nullable
    public List<Integer> getShardList() {
        return shardList;
    }

    public int getShardCountBase() {
        return shardCountBase;
    }

    public int getMaxGuildsPerShard() {
        return maxGuildsPerShard;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getSpawnDelay() {
        return spawnDelay;
    }

    public Duration getSpawnTimeout() {
        return spawnTimeout;
    }

    public boolean isGracefulHandoff() {
        return gracefulHandoff;
    }

    public Duration getHandoffTimeout() {
        return handoffTimeout;
    }

    public Duration getStatsInterval() {
        return statsInterval;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Builder {

        @Nullable
        private Integer totalShards;
        @Nullable
        private List<Integer> shardList;
        private int shardCountBase = 1;
        private int maxGuildsPerShard = 2500;
        private int maxConcurrency = 1;
        private Duration spawnDelay = Duration.ofSeconds(5);
        private Duration spawnTimeout = Duration.ofSeconds(60);
        private boolean gracefulHandoff;
        private Duration handoffTimeout = Duration.ofSeconds(15);
        private Duration statsInterval = Duration.ofMinutes(1);
        private Scheduler scheduler = Schedulers.parallel();

        protected Builder() {
        }

        public Builder setTotalShards(@Nullable Integer totalShards) {
            this.totalShards = totalShards;
            return this;
        }

        public Builder setShardList(@Nullable List<Integer> shardList) {
            this.shardList = shardList == null ? null : Collections.unmodifiableList(new ArrayList<>(shardList));
            return this;
        }

        /**
         * Set the minimum number of shards a computed total may have.
         *
         * @param shardCountBase the lower bound, at least 1
         * @return this builder
         */
        public Builder setShardCountBase(int shardCountBase) {
            this.shardCountBase = shardCountBase;
            return this;
        }

        public Builder setMaxGuildsPerShard(int maxGuildsPerShard) {
            this.maxGuildsPerShard = maxGuildsPerShard;
            return this;
        }

        public Builder setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder setSpawnDelay(Duration spawnDelay) {
            this.spawnDelay = Objects.requireNonNull(spawnDelay);
            return this;
        }

        public Builder setSpawnTimeout(Duration spawnTimeout) {
            this.spawnTimeout = Objects.requireNonNull(spawnTimeout);
            return this;
        }

        /**
         * Keep a shard's previous connection serving until its replacement is ready when respawning.
         *
         * @param gracefulHandoff whether to overlap connections
         * @return this builder
         */
        public Builder setGracefulHandoff(boolean gracefulHandoff) {
            this.gracefulHandoff = gracefulHandoff;
            return this;
        }

        public Builder setHandoffTimeout(Duration handoffTimeout) {
            this.handoffTimeout = Objects.requireNonNull(handoffTimeout);
            return this;
        }

        /**
         * Set how often stats are published. {@link Duration#ZERO} disables periodic stats.
         *
         * @param statsInterval the period
         * @return this builder
         */
        public Builder setStatsInterval(Duration statsInterval) {
            this.statsInterval = Objects.requireNonNull(statsInterval);
            return this;
        }

        public Builder setScheduler(Scheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler);
            return this;
        }

        public ShardManagerOptions build() {
            return new ShardManagerOptions(this);
        }
    }
}
