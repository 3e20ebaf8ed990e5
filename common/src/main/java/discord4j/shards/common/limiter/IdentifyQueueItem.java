package discord4j.shards.common.limiter;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A shard waiting for an identify grant.
 */
final class IdentifyQueueItem {

    private final int shardId;
    private final int bucketId;
    private final long enqueuedAt;
    private final Sinks.One<Void> completion = Sinks.one();
    private volatile boolean cancelled;

    IdentifyQueueItem(int shardId, int bucketId, long enqueuedAt) {
        this.shardId = shardId;
        this.bucketId = bucketId;
        this.enqueuedAt = enqueuedAt;
    }

    int getShardId() {
        return shardId;
    }

    int getBucketId() {
        return bucketId;
    }

    long getEnqueuedAt() {
        return enqueuedAt;
    }

    Mono<Void> asMono() {
        return completion.asMono();
    }

    boolean grant() {
        return !cancelled && completion.tryEmitEmpty().isSuccess();
    }

    void reject(Throwable error) {
        completion.tryEmitError(error);
    }

    void cancel() {
        cancelled = true;
    }
}
