package discord4j.shards.common.limiter;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;

/**
 * Budgets enforced by a {@link GatewayRateLimiter}.
 */
public class RateLimiterOptions {

    public static final int DEFAULT_COMMAND_CAPACITY = 120;
    public static final Duration DEFAULT_REFILL_INTERVAL = Duration.ofSeconds(60);
    public static final Duration DEFAULT_IDENTIFY_INTERVAL = Duration.ofSeconds(5);

    private final int commandCapacity;
    private final Duration refillInterval;
    private final Duration identifyInterval;
    private final int maxConcurrency;
    private final Scheduler scheduler;

    protected RateLimiterOptions(Builder builder) {
        this.commandCapacity = builder.commandCapacity;
        this.refillInterval = builder.refillInterval;
        this.identifyInterval = builder.identifyInterval;
        this.maxConcurrency = builder.maxConcurrency;
        this.scheduler = builder.scheduler;
    }

    public static RateLimiterOptions create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getCommandCapacity() {
        return commandCapacity;
    }

    public Duration getRefillInterval() {
        return refillInterval;
    }

    public Duration getIdentifyInterval() {
        return identifyInterval;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Builder {

        private int commandCapacity = DEFAULT_COMMAND_CAPACITY;
        private Duration refillInterval = DEFAULT_REFILL_INTERVAL;
        private Duration identifyInterval = DEFAULT_IDENTIFY_INTERVAL;
        private int maxConcurrency = 1;
        private Scheduler scheduler = Schedulers.parallel();

        protected Builder() {
        }

        /**
         * Set the number of commands each bucket grants per refill interval.
         *
         * @param commandCapacity the bucket capacity, at least 1
         * @return this builder
         */
        public Builder setCommandCapacity(int commandCapacity) {
            if (commandCapacity < 1) {
                throw new IllegalArgumentException("commandCapacity must be positive");
            }
            this.commandCapacity = commandCapacity;
            return this;
        }

        public Builder setRefillInterval(Duration refillInterval) {
            if (refillInterval.isNegative() || refillInterval.isZero()) {
                throw new IllegalArgumentException("refillInterval must be positive");
            }
            this.refillInterval = refillInterval;
            return this;
        }

        /**
         * Set the minimum time between two identify grants of the same concurrency bucket.
         *
         * @param identifyInterval the cooldown
         * @return this builder
         */
        public Builder setIdentifyInterval(Duration identifyInterval) {
            this.identifyInterval = Objects.requireNonNull(identifyInterval);
            return this;
        }

        public Builder setMaxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be positive");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder setScheduler(Scheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler);
            return this;
        }

        public RateLimiterOptions build() {
            return new RateLimiterOptions(this);
        }
    }
}
