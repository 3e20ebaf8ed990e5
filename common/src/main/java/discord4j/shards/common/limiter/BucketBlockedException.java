package discord4j.shards.common.limiter;

import discord4j.shards.common.ShardGatewayException;

/**
 * Raised when acquiring from a bucket that was explicitly blocked and has no tokens left.
 */
public class BucketBlockedException extends ShardGatewayException {

    private final String bucketKey;

    public BucketBlockedException(String bucketKey) {
        super("Rate limit bucket '" + bucketKey + "' is blocked");
        this.bucketKey = bucketKey;
    }

    public String getBucketKey() {
        return bucketKey;
    }
}
