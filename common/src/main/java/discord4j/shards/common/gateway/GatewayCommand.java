package discord4j.shards.common.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import discord4j.shards.common.codec.GatewayPayload;
import discord4j.shards.common.codec.Opcode;
import reactor.util.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An outbound request sent to the Gateway on behalf of a collaborator. Guild scoped commands carry the guild ids used
 * to route them to the owning shard.
 */
public final class GatewayCommand {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final Opcode opcode;
    private final JsonNode data;
    private final List<String> guildIds;

    private GatewayCommand(Opcode opcode, JsonNode data, List<String> guildIds) {
        if (!opcode.isSendable()) {
            throw new IllegalArgumentException(opcode + " cannot be sent by a client");
        }
        this.opcode = opcode;
        this.data = data;
        this.guildIds = guildIds;
    }

    /**
     * Create a command without routing information. It is sent through any connected shard.
     *
     * @param opcode the operation
     * @param data the operation data
     * @return a new command
     */
    public static GatewayCommand of(Opcode opcode, JsonNode data) {
        return new GatewayCommand(opcode, data, Collections.emptyList());
    }

    public static GatewayCommand updatePresence(JsonNode presence) {
        return new GatewayCommand(Opcode.PRESENCE_UPDATE, presence, Collections.emptyList());
    }

    public static GatewayCommand requestGuildMembers(String guildId, ObjectNode data) {
        ObjectNode copy = data.deepCopy();
        copy.put("guild_id", guildId);
        return new GatewayCommand(Opcode.REQUEST_GUILD_MEMBERS, copy, Collections.singletonList(guildId));
    }

    public static GatewayCommand updateVoiceState(String guildId, @Nullable String channelId, boolean selfMute,
                                                  boolean selfDeaf) {
        ObjectNode data = NODES.objectNode();
        data.put("guild_id", guildId);
        data.put("channel_id", channelId);
        data.put("self_mute", selfMute);
        data.put("self_deaf", selfDeaf);
        return new GatewayCommand(Opcode.VOICE_STATE_UPDATE, data, Collections.singletonList(guildId));
    }

    public static GatewayCommand requestSoundboardSounds(List<String> guildIds) {
        ArrayNode ids = NODES.arrayNode();
        guildIds.forEach(ids::add);
        ObjectNode data = NODES.objectNode();
        data.set("guild_ids", ids);
        return new GatewayCommand(Opcode.REQUEST_SOUNDBOARD_SOUNDS, data,
                Collections.unmodifiableList(new ArrayList<>(guildIds)));
    }

    /**
     * Return a copy of a soundboard request restricted to the given guilds.
     *
     * @param subset guild ids, all owned by the same shard
     * @return a new command
     */
    public GatewayCommand withGuildIds(List<String> subset) {
        if (opcode != Opcode.REQUEST_SOUNDBOARD_SOUNDS) {
            throw new IllegalStateException("Only soundboard requests can be split");
        }
        return requestSoundboardSounds(subset);
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public JsonNode getData() {
        return data;
    }

    /**
     * Return the guilds this command targets, empty if it is not guild scoped.
     *
     * @return the guild ids
     */
    public List<String> getGuildIds() {
        return guildIds;
    }

    public GatewayPayload toPayload() {
        return GatewayPayload.outbound(opcode, data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GatewayCommand that = (GatewayCommand) o;
        return opcode == that.opcode && data.equals(that.data) && guildIds.equals(that.guildIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, data, guildIds);
    }

    @Override
    public String toString() {
        return "GatewayCommand{opcode=" + opcode + ", guildIds=" + guildIds + '}';
    }
}
