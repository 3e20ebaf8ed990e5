package discord4j.shards.common.limiter;

/**
 * A token pool refilled to capacity once per elapsed refill interval. Refills are computed on access.
 */
final class RateLimitBucket {

    private final String key;
    private final int capacity;
    private final long refillMillis;

    private int tokens;
    private long lastRefill;
    private boolean blocked;

    RateLimitBucket(String key, int capacity, long refillMillis, long now) {
        this.key = key;
        this.capacity = capacity;
        this.refillMillis = refillMillis;
        this.tokens = capacity;
        this.lastRefill = now;
    }

    /**
     * Debit one token if possible.
     *
     * @param now the current time in milliseconds
     * @return {@code 0} if a token was debited, the milliseconds until the next refill otherwise, or {@code -1} if the
     * bucket is blocked and empty
     */
    synchronized long tryAcquire(long now) {
        refill(now);
        if (tokens > 0) {
            tokens--;
            return 0;
        }
        if (blocked) {
            return -1;
        }
        return Math.max(1, lastRefill + refillMillis - now);
    }

    private void refill(long now) {
        long intervals = (now - lastRefill) / refillMillis;
        if (intervals > 0) {
            tokens = capacity;
            lastRefill += intervals * refillMillis;
        }
    }

    synchronized int availableTokens(long now) {
        return now - lastRefill >= refillMillis ? capacity : tokens;
    }

    synchronized void setBlocked(boolean blocked) {
        this.blocked = blocked;
    }

    synchronized BucketInfo snapshot(long now) {
        int available = availableTokens(now);
        long elapsedIntervals = (now - lastRefill) / refillMillis;
        long nextRefill = lastRefill + (elapsedIntervals + 1) * refillMillis;
        return new BucketInfo(key, available, capacity, lastRefill, nextRefill - now, blocked);
    }
}
