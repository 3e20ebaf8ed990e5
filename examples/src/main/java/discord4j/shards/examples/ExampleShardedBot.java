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

import discord4j.shards.common.event.DispatchEvent;
import discord4j.shards.common.event.LifecycleEvent;
import discord4j.shards.common.gateway.GatewayOptions;
import discord4j.shards.common.shard.GatewayBotInfo;
import discord4j.shards.common.shard.ShardManager;
import discord4j.shards.common.shard.ShardManagerOptions;
import discord4j.shards.examples.support.ShardStatsHttpServer;
import discord4j.shards.rsocket.RSocketIdentifyLimiter;
import reactor.util.Logger;
import reactor.util.Loggers;

import java.net.InetSocketAddress;

/**
 * A sharded bot logging every dispatch it receives. Shard metadata comes from the {@code SHARD_COUNT},
 * {@code MAX_CONCURRENCY} and {@code GUILD_COUNT} environment variables. Set {@code RSOCKET_IDENTIFY_HOST} to share
 * the identify budget through an {@link ExampleIdentifyLimiterServer}.
 */
public class ExampleShardedBot {

    private static final Logger log = Loggers.getLogger(ExampleShardedBot.class);

    public static void main(String[] args) {
        if (Constants.BOT_TOKEN == null) {
            throw new IllegalStateException("BOT_TOKEN is not set");
        }
        GatewayOptions.Builder gateway = GatewayOptions.builder(Constants.BOT_TOKEN)
                .setIntents(1 | (1 << 9)); // GUILDS, GUILD_MESSAGES
        if (System.getenv("RSOCKET_IDENTIFY_HOST") != null) {
            gateway.setIdentifyLimiter(new RSocketIdentifyLimiter(
                    new InetSocketAddress(Constants.IDENTIFY_SERVER_HOST, Constants.IDENTIFY_SERVER_PORT)));
        }

        ShardManager manager = new ShardManager(gateway.build(), ShardManagerOptions.builder()
                .setGracefulHandoff(true)
                .build());

        manager.dispatch()
                .subscribe(ExampleShardedBot::onDispatch);
        manager.on(LifecycleEvent.class)
                .filter(event -> event.getType() != LifecycleEvent.Type.DEBUG)
                .subscribe(event -> log.info("{}", event));

        ShardStatsHttpServer.startAsync(manager);
        Runtime.getRuntime().addShutdownHook(new Thread(manager::destroy));

        GatewayBotInfo botInfo = new GatewayBotInfo(Constants.SHARD_COUNT, Constants.MAX_CONCURRENCY,
                Constants.GUILD_COUNT);
        manager.spawn(botInfo).block();
        manager.events().blockLast();
    }

    private static void onDispatch(DispatchEvent event) {
        if ("MESSAGE_CREATE".equals(event.getEventName()) && event.getData() != null) {
            log.info("[shard={}] Message in {}: {}", event.getShardId(),
                    event.getData().path("channel_id").asText(), event.getData().path("content").asText());
        } else {
            log.debug("[shard={}] {}", event.getShardId(), event.getEventName());
        }
    }
}
