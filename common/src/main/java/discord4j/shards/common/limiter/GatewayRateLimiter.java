/*
 * This file is part of Discord4J.
 *
 * Discord4J is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Discord4J is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Discord4J. If not, see <http://www.gnu.org/licenses/>.
 */

package discord4j.shards.common.limiter;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide arbiter of the two Gateway budgets: named token buckets for outbound commands and a per concurrency
 * bucket identify queue. A single instance should be shared by every shard of a process.
 * <p>
 * Waiting callers are released with a {@link LimiterAbortedException} on {@link #reset()} and {@link #destroy()}.
 */
public class GatewayRateLimiter implements IdentifyLimiter {

    private static final Logger log = Loggers.getLogger(GatewayRateLimiter.class);

    /**
     * The bucket used for general commands and heartbeats.
     */
    public static final String GLOBAL_BUCKET = "global";

    private final RateLimiterOptions options;
    private final Scheduler scheduler;
    private final long refillMillis;
    private final long identifyIntervalMillis;

    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();
    private final Map<Integer, IdentifyQueue> identifyQueues = new ConcurrentHashMap<>();
    private final AtomicReference<Sinks.One<Void>> abortSignal = new AtomicReference<>(Sinks.one());
    private final AtomicBoolean destroyed = new AtomicBoolean();

    public GatewayRateLimiter() {
        this(RateLimiterOptions.create());
    }

    public GatewayRateLimiter(RateLimiterOptions options) {
        this.options = options;
        this.scheduler = options.getScheduler();
        this.refillMillis = options.getRefillInterval().toMillis();
        this.identifyIntervalMillis = options.getIdentifyInterval().toMillis();
    }

    public RateLimiterOptions getOptions() {
        return options;
    }

    /**
     * Take one token from the global bucket, waiting for a refill if it is empty.
     *
     * @return a {@link Mono} completing once a token was debited
     */
    public Mono<Void> acquire() {
        return acquire(GLOBAL_BUCKET);
    }

    /**
     * Take one token from the given bucket, waiting for a refill if it is empty. The bucket is created on first use.
     *
     * @param bucketKey the bucket name
     * @return a {@link Mono} completing once a token was debited, failing with {@link BucketBlockedException} if the
     * bucket is blocked and empty, or with {@link LimiterAbortedException} if the limiter is reset while waiting
     */
    public Mono<Void> acquire(String bucketKey) {
        return Mono.defer(() -> {
            if (destroyed.get()) {
                return Mono.error(new LimiterAbortedException("Rate limiter was destroyed"));
            }
            Sinks.One<Void> abort = abortSignal.get();
            long now = now();
            RateLimitBucket bucket = buckets.computeIfAbsent(bucketKey,
                    k -> new RateLimitBucket(k, options.getCommandCapacity(), refillMillis, now));
            long wait = bucket.tryAcquire(now);
            if (wait == 0) {
                return Mono.empty();
            }
            if (wait < 0) {
                return Mono.error(new BucketBlockedException(bucketKey));
            }
            log.debug("Bucket '{}' exhausted, waiting {} ms", bucketKey, wait);
            return Mono.firstWithSignal(
                    Mono.delay(Duration.ofMillis(wait), scheduler).then(Mono.defer(() -> acquire(bucketKey))),
                    abort.asMono().then(Mono.<Void>error(() ->
                            new LimiterAbortedException("Wait on bucket '" + bucketKey + "' was aborted"))));
        });
    }

    /**
     * Wait for an identify grant using the configured maximum concurrency.
     *
     * @param shardId the shard about to identify
     * @return a {@link Mono} completing when the shard may identify
     */
    public Mono<Void> acquireIdentify(int shardId) {
        return acquireIdentify(shardId, options.getMaxConcurrency());
    }

    @Override
    public Mono<Void> acquireIdentify(int shardId, int maxConcurrency) {
        return Mono.defer(() -> {
            if (destroyed.get()) {
                return Mono.error(new LimiterAbortedException("Rate limiter was destroyed"));
            }
            int bucketId = shardId % maxConcurrency;
            IdentifyQueueItem item = new IdentifyQueueItem(shardId, bucketId, now());
            IdentifyQueue queue = identifyQueues.computeIfAbsent(bucketId, IdentifyQueue::new);
            log.debug("[shard={}] Queued identify in bucket {}", shardId, bucketId);
            queue.enqueue(item);
            return item.asMono().doOnCancel(() -> queue.remove(item));
        });
    }

    public boolean isRateLimited() {
        return isRateLimited(GLOBAL_BUCKET);
    }

    /**
     * Return whether a call to {@link #acquire(String)} would have to wait. Does not modify the bucket.
     *
     * @param bucketKey the bucket name
     * @return {@code true} if the bucket has no token available
     */
    public boolean isRateLimited(String bucketKey) {
        RateLimitBucket bucket = buckets.get(bucketKey);
        return bucket != null && bucket.availableTokens(now()) == 0;
    }

    @Nullable
    public BucketInfo getBucketInfo(String bucketKey) {
        RateLimitBucket bucket = buckets.get(bucketKey);
        return bucket == null ? null : bucket.snapshot(now());
    }

    /**
     * Return the number of shards waiting for an identify grant in the given concurrency bucket.
     *
     * @param bucketId the concurrency bucket
     * @return the queue length
     */
    public int getPendingIdentifies(int bucketId) {
        IdentifyQueue queue = identifyQueues.get(bucketId);
        return queue == null ? 0 : queue.size();
    }

    /**
     * Mark a bucket as blocked: once empty, callers fail with {@link BucketBlockedException} instead of waiting.
     *
     * @param bucketKey the bucket name
     */
    public void block(String bucketKey) {
        long now = now();
        buckets.computeIfAbsent(bucketKey, k -> new RateLimitBucket(k, options.getCommandCapacity(), refillMillis, now))
                .setBlocked(true);
    }

    public void unblock(String bucketKey) {
        RateLimitBucket bucket = buckets.get(bucketKey);
        if (bucket != null) {
            bucket.setBlocked(false);
        }
    }

    /**
     * Clear every bucket and release all waiters with a {@link LimiterAbortedException}.
     */
    public void reset() {
        abortAll("Rate limiter was reset");
    }

    /**
     * Release all waiters and reject every further request.
     */
    public void destroy() {
        if (destroyed.compareAndSet(false, true)) {
            abortAll("Rate limiter was destroyed");
        }
    }

    private void abortAll(String reason) {
        Sinks.One<Void> previous = abortSignal.getAndSet(Sinks.one());
        previous.tryEmitEmpty();
        List<IdentifyQueue> queues = new ArrayList<>(identifyQueues.values());
        identifyQueues.clear();
        buckets.clear();
        int aborted = 0;
        for (IdentifyQueue queue : queues) {
            aborted += queue.abort(reason);
        }
        log.debug("{}: released {} identify waiters", reason, aborted);
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private class IdentifyQueue {

        private final int bucketId;
        private final Deque<IdentifyQueueItem> items = new ArrayDeque<>();
        private long nextGrantAt = Long.MIN_VALUE;
        @Nullable
        private Disposable scheduled;
        private boolean aborted;

        IdentifyQueue(int bucketId) {
            this.bucketId = bucketId;
        }

        synchronized void enqueue(IdentifyQueueItem item) {
            if (aborted) {
                item.reject(new LimiterAbortedException("Identify queue " + bucketId + " was aborted"));
                return;
            }
            items.add(item);
            drain();
        }

        synchronized void remove(IdentifyQueueItem item) {
            item.cancel();
            items.remove(item);
        }

        synchronized int size() {
            return items.size();
        }

        private void drain() {
            if (scheduled != null) {
                return;
            }
            while (!items.isEmpty()) {
                long now = now();
                if (now < nextGrantAt) {
                    scheduled = scheduler.schedule(this::onCooldownElapsed, nextGrantAt - now, TimeUnit.MILLISECONDS);
                    return;
                }
                IdentifyQueueItem item = items.poll();
                if (item.grant()) {
                    log.debug("[shard={}] Identify granted in bucket {} after {} ms", item.getShardId(), bucketId,
                            now - item.getEnqueuedAt());
                    nextGrantAt = now + identifyIntervalMillis;
                }
            }
        }

        private synchronized void onCooldownElapsed() {
            scheduled = null;
            if (!aborted) {
                drain();
            }
        }

        synchronized int abort(String reason) {
            aborted = true;
            if (scheduled != null) {
                scheduled.dispose();
                scheduled = null;
            }
            int count = items.size();
            IdentifyQueueItem item;
            while ((item = items.poll()) != null) {
                item.reject(new LimiterAbortedException(reason + " while shard " + item.getShardId()
                        + " waited to identify"));
            }
            return count;
        }
    }
}
