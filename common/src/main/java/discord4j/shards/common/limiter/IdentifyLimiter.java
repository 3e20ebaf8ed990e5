package discord4j.shards.common.limiter;

import reactor.core.publisher.Mono;

/**
 * Grants permission to identify. Shards sharing a concurrency bucket are granted one at a time, separated by the
 * identify interval.
 */
@FunctionalInterface
public interface IdentifyLimiter {

    /**
     * Wait for an identify grant.
     *
     * @param shardId the shard about to identify
     * @param maxConcurrency the number of concurrency buckets, the shard's bucket being {@code shardId % maxConcurrency}
     * @return a {@link Mono} completing when the shard may identify, or failing with a
     * {@link LimiterAbortedException} if the limiter is shut down first
     */
    Mono<Void> acquireIdentify(int shardId, int maxConcurrency);
}
