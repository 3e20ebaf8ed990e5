package discord4j.shards.common.event;

import discord4j.shards.common.transport.CloseStatus;
import reactor.util.annotation.Nullable;

/**
 * A change in a shard's connection state, or a diagnostic message.
 */
public class LifecycleEvent extends GatewayEvent {

    public enum Type {
        CONNECTING,
        CONNECTED,
        RECONNECTING,
        SHARD_READY,
        SHARD_DISCONNECT,
        ALL_SHARDS_READY,
        DEBUG,
        WARN,
        ERROR
    }

    private final Type type;
    private final String message;
    @Nullable
    private final Throwable cause;
    @Nullable
    private final CloseStatus closeStatus;

    public LifecycleEvent(int shardId, Type type, String message) {
        this(shardId, type, message, null, null);
    }

    public LifecycleEvent(int shardId, Type type, String message, @Nullable Throwable cause,
                          @Nullable CloseStatus closeStatus) {
        super(shardId);
        this.type = type;
        this.message = message;
        this.cause = cause;
        this.closeStatus = closeStatus;
    }

    public Type getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Nullable
    public Throwable getCause() {
        return cause;
    }

    @Nullable
    public CloseStatus getCloseStatus() {
        return closeStatus;
    }

    @Override
    public String toString() {
        return "LifecycleEvent{" +
                "shardId=" + getShardId() +
                ", type=" + type +
                ", message='" + message + '\'' +
                (cause != null ? ", cause=" + cause : "") +
                (closeStatus != null ? ", closeStatus=" + closeStatus : "") +
                '}';
    }
}
