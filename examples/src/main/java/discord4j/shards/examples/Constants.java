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

package discord4j.shards.examples;

import reactor.util.annotation.Nullable;

import java.net.InetAddress;
import java.net.UnknownHostException;

public final class Constants {

    public static final String BOT_TOKEN = System.getenv("BOT_TOKEN");

    // shard metadata, normally taken from the gateway bot endpoint
    public static final Integer SHARD_COUNT = intOrNull("SHARD_COUNT", System.getenv("SHARD_COUNT"));
    public static final Integer MAX_CONCURRENCY = intOrNull("MAX_CONCURRENCY", System.getenv("MAX_CONCURRENCY"));
    public static final Integer GUILD_COUNT = intOrNull("GUILD_COUNT", System.getenv("GUILD_COUNT"));

    // rsocket variables
    private static String LOCALHOST;
    static {
        try {
            LOCALHOST = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LOCALHOST = "0.0.0.0";
        }
    }
    private static final String RSOCKET_IDENTIFY_HOST = System.getenv("RSOCKET_IDENTIFY_HOST");
    public static final String IDENTIFY_SERVER_HOST = (null == RSOCKET_IDENTIFY_HOST || RSOCKET_IDENTIFY_HOST.isEmpty())
            ? LOCALHOST : RSOCKET_IDENTIFY_HOST;
    public static final int IDENTIFY_SERVER_PORT = 33332;

    private Constants() {
    }

    @Nullable
    static Integer intOrNull(String name, @Nullable String value) {
        if (null == value || value.trim().isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + name + " is not an integer: " + value, e);
        }
    }
}
