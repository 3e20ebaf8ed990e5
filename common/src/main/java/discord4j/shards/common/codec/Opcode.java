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

import reactor.util.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Gateway operation codes handled by this client.
 */
public enum Opcode {

    DISPATCH(0, true, false),
    HEARTBEAT(1, true, true),
    IDENTIFY(2, false, true),
    PRESENCE_UPDATE(3, false, true),
    VOICE_STATE_UPDATE(4, false, true),
    RESUME(6, false, true),
    RECONNECT(7, true, false),
    REQUEST_GUILD_MEMBERS(8, false, true),
    INVALID_SESSION(9, true, false),
    HELLO(10, true, false),
    HEARTBEAT_ACK(11, true, false),
    REQUEST_SOUNDBOARD_SOUNDS(31, false, true);

    private static final Map<Integer, Opcode> byRaw = new HashMap<>();

    static {
        for (Opcode opcode : values()) {
            byRaw.put(opcode.rawOp, opcode);
        }
    }

    private final int rawOp;
    private final boolean receivable;
    private final boolean sendable;

    Opcode(int rawOp, boolean receivable, boolean sendable) {
        this.rawOp = rawOp;
        this.receivable = receivable;
        this.sendable = sendable;
    }

    public int getRawOp() {
        return rawOp;
    }

    public boolean isReceivable() {
        return receivable;
    }

    public boolean isSendable() {
        return sendable;
    }

    @Nullable
    public static Opcode forRaw(int rawOp) {
        return byRaw.get(rawOp);
    }
}
