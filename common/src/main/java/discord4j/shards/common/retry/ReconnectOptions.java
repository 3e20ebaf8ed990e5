package discord4j.shards.common.retry;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff parameters used when a connection has to be established again.
 */
public class ReconnectOptions {

    private final Duration firstBackoff;
    private final Duration maxBackoffInterval;
    private final long maxRetries;
    private final int backoffFactor;
    private final double jitterFactor;
    private final Scheduler backoffScheduler;

    protected ReconnectOptions(Builder builder) {
        this.firstBackoff = builder.firstBackoff;
        this.maxBackoffInterval = builder.maxBackoffInterval;
        this.maxRetries = builder.maxRetries;
        this.backoffFactor = builder.backoffFactor;
        this.jitterFactor = builder.jitterFactor;
        this.backoffScheduler = builder.backoffScheduler;
    }

    /**
     * Create options with one second first backoff, thirty seconds maximum backoff, a factor of two, 20% jitter and up
     * to five attempts.
     *
     * @return default options
     */
    public static ReconnectOptions create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getFirstBackoff() {
        return firstBackoff;
    }

    public Duration getMaxBackoffInterval() {
        return maxBackoffInterval;
    }

    public long getMaxRetries() {
        return maxRetries;
    }

    public int getBackoffFactor() {
        return backoffFactor;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }

    public Scheduler getBackoffScheduler() {
        return backoffScheduler;
    }

    /**
     * Compute the delay before the given attempt.
     *
     * @param attempt the attempt number, starting at 1
     * @return the jittered delay, never above the maximum backoff
     */
    public Duration getBackoff(long attempt) {
        long base = firstBackoff.toMillis();
        long max = maxBackoffInterval.toMillis();
        for (long i = 1; i < attempt && base < max; i++) {
            base *= backoffFactor;
        }
        base = Math.min(base, max);
        double jitter = jitterFactor == 0 ? 0 :
                ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        long delay = Math.round(base * (1 + jitter));
        return Duration.ofMillis(Math.max(0, Math.min(delay, max)));
    }

    /**
     * Express these options as a Reactor retry specification, for reconnecting clients built on {@code retryWhen}.
     *
     * @return a backoff retry spec honoring first and maximum backoff, jitter, attempts and scheduler
     */
    public RetryBackoffSpec toRetrySpec() {
        return Retry.backoff(maxRetries, firstBackoff)
                .maxBackoff(maxBackoffInterval)
                .jitter(jitterFactor)
                .scheduler(backoffScheduler)
                .transientErrors(true);
    }

    public static class Builder {

        private Duration firstBackoff = Duration.ofSeconds(1);
        private Duration maxBackoffInterval = Duration.ofSeconds(30);
        private long maxRetries = 5;
        private int backoffFactor = 2;
        private double jitterFactor = 0.2;
        private Scheduler backoffScheduler = Schedulers.parallel();

        protected Builder() {
        }

        public Builder setFirstBackoff(Duration firstBackoff) {
            this.firstBackoff = Objects.requireNonNull(firstBackoff);
            return this;
        }

        public Builder setMaxBackoffInterval(Duration maxBackoffInterval) {
            this.maxBackoffInterval = Objects.requireNonNull(maxBackoffInterval);
            return this;
        }

        /**
         * Set the number of consecutive reconnect attempts after which a connection is given up.
         *
         * @param maxRetries the attempt ceiling
         * @return this builder
         */
        public Builder setMaxRetries(long maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder setBackoffFactor(int backoffFactor) {
            this.backoffFactor = backoffFactor;
            return this;
        }

        /**
         * Set the random spread applied to each delay, between 0 and 1.
         *
         * @param jitterFactor the jitter factor
         * @return this builder
         */
        public Builder setJitterFactor(double jitterFactor) {
            if (jitterFactor < 0 || jitterFactor > 1) {
                throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
            }
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder setBackoffScheduler(Scheduler backoffScheduler) {
            this.backoffScheduler = Objects.requireNonNull(backoffScheduler);
            return this;
        }

        public ReconnectOptions build() {
            return new ReconnectOptions(this);
        }
    }
}
