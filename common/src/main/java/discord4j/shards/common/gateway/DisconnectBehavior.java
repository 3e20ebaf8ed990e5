package discord4j.shards.common.gateway;

/**
 * What a shard does after its connection closes.
 */
public enum DisconnectBehavior {

    /**
     * Reconnect and resume the current session.
     */
    RESUME,

    /**
     * Reconnect, discarding the session and identifying again.
     */
    REIDENTIFY,

    /**
     * Do not reconnect: the close is not recoverable.
     */
    STOP
}
