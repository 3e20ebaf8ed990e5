package discord4j.shards.common.gateway;

/**
 * Connection state of one shard.
 */
public enum ShardStatus {

    IDLE,
    CONNECTING,
    IDENTIFYING,
    RESUMING,
    CONNECTED,
    RECONNECTING,
    DISCONNECTED,
    DESTROYED;

    public boolean isTerminal() {
        return this == DESTROYED;
    }
}
