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

package discord4j.shards.examples.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import discord4j.shards.common.gateway.ShardInfo;
import discord4j.shards.common.shard.ShardManager;
import discord4j.shards.common.shard.ShardManagerStats;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServer;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * A basic {@link HttpServer} exposing fleet statistics on {@code /stats} and shard respawns on
 * {@code /respawn/{shardId}} and {@code /respawn}.
 */
public class ShardStatsHttpServer {

    private static final Logger log = Loggers.getLogger(ShardStatsHttpServer.class);

    private final ShardManager manager;
    private final ObjectMapper mapper = new ObjectMapper();

    public ShardStatsHttpServer(ShardManager manager) {
        this.manager = manager;
    }

    public static void startAsync(ShardManager manager) {
        new ShardStatsHttpServer(manager).start();
    }

    public void start() {
        HttpServer.create()
                .port(0) // use an ephemeral port
                .route(routes -> routes
                        .get("/stats",
                                (req, res) -> res.addHeader("content-type", "application/json")
                                        .status(200)
                                        .chunkedTransfer(false)
                                        .sendString(Mono.fromCallable(() -> renderStats(manager.getStats()))))
                        .post("/respawn/{shardId}",
                                (req, res) -> Mono.fromCallable(() -> Integer.parseInt(req.param("shardId")))
                                        .flatMap(manager::respawnShard)
                                        .then(Mono.from(res.status(202).sendString(Mono.just("OK"))))
                                        .onErrorResume(e -> Mono.from(res.status(400)
                                                .sendString(Mono.just(String.valueOf(e.getMessage()))))))
                        .post("/respawn",
                                (req, res) -> {
                                    manager.respawnAll()
                                            .subscribe(null, e -> log.error("Respawn failed", e));
                                    return res.status(202).sendString(Mono.just("OK"));
                                })
                )
                .bind()
                .doOnNext(facade -> {
                    log.info("*************************************************************");
                    log.info("Stats server started at {}:{}", facade.host(), facade.port());
                    log.info("*************************************************************");
                    // kill the server on JVM exit
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> facade.disposeNow()));
                })
                .subscribe();
    }

    String renderStats(ShardManagerStats stats) throws Exception {
        ObjectNode root = mapper.createObjectNode();
        root.put("shard_count", stats.getNumShards());
        root.put("managed", stats.getManagedShards());
        root.put("connected", stats.getConnectedShards());
        root.put("guilds", stats.getTotalGuilds());
        root.put("average_guilds", stats.getAverageGuildsPerShard());
        root.put("average_latency_ms", stats.getAverageLatency().toMillis());
        ArrayNode shards = root.putArray("shards");
        for (ShardInfo info : stats.getShards()) {
            shards.addObject()
                    .put("id", info.getShardId())
                    .put("bucket", info.getBucketId())
                    .put("status", info.getStatus().name())
                    .put("guilds", info.getGuildCount())
                    .put("latency_ms", info.getLatency().toMillis())
                    .put("reconnects", info.getReconnectAttempts());
        }
        return mapper.writeValueAsString(root);
    }
}
