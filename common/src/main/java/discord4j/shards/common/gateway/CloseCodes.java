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

package discord4j.shards.common.gateway;

import java.util.HashMap;
import java.util.Map;

/**
 * Websocket close codes sent by the Gateway and the action each one calls for.
 */
public final class CloseCodes {

    public static final int UNKNOWN_ERROR = 4000;
    public static final int UNKNOWN_OPCODE = 4001;
    public static final int DECODE_ERROR = 4002;
    public static final int NOT_AUTHENTICATED = 4003;
    public static final int AUTHENTICATION_FAILED = 4004;
    public static final int ALREADY_AUTHENTICATED = 4005;
    public static final int INVALID_SEQ = 4007;
    public static final int RATE_LIMITED = 4008;
    public static final int SESSION_TIMED_OUT = 4009;
    public static final int INVALID_SHARD = 4010;
    public static final int SHARDING_REQUIRED = 4011;
    public static final int INVALID_API_VERSION = 4012;
    public static final int INVALID_INTENTS = 4013;
    public static final int DISALLOWED_INTENTS = 4014;

    /**
     * Code used when this client closes a connection it intends to resume. Codes 1000 and 1001 would invalidate the
     * session.
     */
    public static final int RESUMABLE_CLOSE = 4900;

    private static final Map<Integer, DisconnectBehavior> BEHAVIORS = new HashMap<>();

    static {
        BEHAVIORS.put(1000, DisconnectBehavior.REIDENTIFY);
        BEHAVIORS.put(1001, DisconnectBehavior.REIDENTIFY);
        BEHAVIORS.put(INVALID_SEQ, DisconnectBehavior.REIDENTIFY);
        BEHAVIORS.put(SESSION_TIMED_OUT, DisconnectBehavior.REIDENTIFY);
        BEHAVIORS.put(AUTHENTICATION_FAILED, DisconnectBehavior.STOP);
        BEHAVIORS.put(INVALID_SHARD, DisconnectBehavior.STOP);
        BEHAVIORS.put(SHARDING_REQUIRED, DisconnectBehavior.STOP);
        BEHAVIORS.put(INVALID_API_VERSION, DisconnectBehavior.STOP);
        BEHAVIORS.put(INVALID_INTENTS, DisconnectBehavior.STOP);
        BEHAVIORS.put(DISALLOWED_INTENTS, DisconnectBehavior.STOP);
    }

    private CloseCodes() {
    }

    /**
     * Classify a close code. Codes not listed, including 1006 and the 4000-4008 client errors, allow resuming.
     *
     * @param code the websocket close code
     * @return the behavior to apply
     */
    public static DisconnectBehavior behaviorFor(int code) {
        return BEHAVIORS.getOrDefault(code, DisconnectBehavior.RESUME);
    }

    public static boolean isFatal(int code) {
        return behaviorFor(code) == DisconnectBehavior.STOP;
    }
}
