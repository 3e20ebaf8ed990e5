package discord4j.shards.common.limiter;

import discord4j.shards.common.ShardGatewayException;

/**
 * Signaled to callers still waiting on a rate limiter when it is reset or destroyed, or when the waiting session is
 * torn down.
 */
public class LimiterAbortedException extends ShardGatewayException {

    public LimiterAbortedException(String message) {
        super(message);
    }
}
