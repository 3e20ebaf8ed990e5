/*
 * This file is part of Discord4J.
 *
 * Discord4J is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Discord4J is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Discord4J. If not, see <http://www.gnu.org/licenses/>.
 */

package discord4j.shards.common.codec;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.util.annotation.Nullable;

import java.util.Objects;

/**
 * The wire envelope shared by every Gateway message, independent of the encoding used to carry it.
 */
public final class GatewayPayload {

    private final int op;
    @Nullable
    private final JsonNode data;
    @Nullable
    private final Integer sequence;
    @Nullable
    private final String eventName;

    public GatewayPayload(int op, @Nullable JsonNode data, @Nullable Integer sequence, @Nullable String eventName) {
        this.op = op;
        this.data = data == null || data.isNull() || data.isMissingNode() ? null : data;
        this.sequence = sequence;
        this.eventName = eventName;
    }

    /**
     * Create an outbound payload. Outbound payloads never carry a sequence or an event name.
     *
     * @param opcode the operation to send
     * @param data the operation data, or {@code null}
     * @return a new payload
     */
    public static GatewayPayload outbound(Opcode opcode, @Nullable JsonNode data) {
        return new GatewayPayload(opcode.getRawOp(), data, null, null);
    }

    public int getOp() {
        return op;
    }

    @Nullable
    public Opcode getOpcode() {
        return Opcode.forRaw(op);
    }

    @Nullable
    public JsonNode getData() {
        return data;
    }

    @Nullable
    public Integer getSequence() {
        return sequence;
    }

    @Nullable
    public String getEventName() {
        return eventName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GatewayPayload that = (GatewayPayload) o;
        return op == that.op && Objects.equals(data, that.data) && Objects.equals(sequence, that.sequence)
                && Objects.equals(eventName, that.eventName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, data, sequence, eventName);
    }

    @Override
    public String toString() {
        return "GatewayPayload{" +
                "op=" + op +
                ", data=" + data +
                ", sequence=" + sequence +
                ", eventName='" + eventName + '\'' +
                '}';
    }
}
