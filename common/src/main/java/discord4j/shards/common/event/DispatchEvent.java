package discord4j.shards.common.event;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.util.annotation.Nullable;

/**
 * A decoded dispatch, published in the order it was received by its shard.
 */
public class DispatchEvent extends GatewayEvent {

    private final String eventName;
    @Nullable
    private final JsonNode data;
    @Nullable
    private final Integer sequence;

    public DispatchEvent(int shardId, String eventName, @Nullable JsonNode data, @Nullable Integer sequence) {
        super(shardId);
        this.eventName = eventName;
        this.data = data;
        this.sequence = sequence;
    }

    public String getEventName() {
        return eventName;
    }

    @Nullable
    public JsonNode getData() {
        return data;
    }

    @Nullable
    public Integer getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "DispatchEvent{" +
                "shardId=" + getShardId() +
                ", eventName='" + eventName + '\'' +
                ", sequence=" + sequence +
                '}';
    }
}
