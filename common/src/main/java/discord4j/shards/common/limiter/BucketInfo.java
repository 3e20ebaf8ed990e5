package discord4j.shards.common.limiter;

import java.time.Duration;

/**
 * A point-in-time view of one rate limit bucket.
 */
public final class BucketInfo {

    private final String key;
    private final int remaining;
    private final int capacity;
    private final long lastRefill;
    private final long resetAfterMillis;
    private final boolean blocked;

    BucketInfo(String key, int remaining, int capacity, long lastRefill, long resetAfterMillis, boolean blocked) {
        this.key = key;
        this.remaining = remaining;
        this.capacity = capacity;
        this.lastRefill = lastRefill;
        this.resetAfterMillis = resetAfterMillis;
        this.blocked = blocked;
    }

    public String getKey() {
        return key;
    }

    public int getRemaining() {
        return remaining;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Return the scheduler time, in milliseconds, of the last refill.
     *
     * @return the last refill timestamp
     */
    public long getLastRefill() {
        return lastRefill;
    }

    public Duration getResetAfter() {
        return Duration.ofMillis(resetAfterMillis);
    }

    public boolean isBlocked() {
        return blocked;
    }

    @Override
    public String toString() {
        return "BucketInfo{" +
                "key='" + key + '\'' +
                ", remaining=" + remaining +
                ", capacity=" + capacity +
                ", resetAfter=" + resetAfterMillis + "ms" +
                ", blocked=" + blocked +
                '}';
    }
}
