package discord4j.shards.common.event;

/**
 * Base type for notifications published by shards and their manager.
 */
public abstract class GatewayEvent {

    /**
     * Shard id used by events that concern the whole fleet.
     */
    public static final int FLEET = -1;

    private final int shardId;

    protected GatewayEvent(int shardId) {
        this.shardId = shardId;
    }

    /**
     * Return the shard this event originates from, or {@link #FLEET}.
     *
     * @return the shard id
     */
    public int getShardId() {
        return shardId;
    }
}
