package discord4j.shards.examples.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import discord4j.shards.common.gateway.ShardInfo;
import discord4j.shards.common.gateway.ShardStatus;
import discord4j.shards.common.shard.ShardManager;
import discord4j.shards.common.shard.ShardManagerOptions;
import discord4j.shards.common.shard.ShardManagerStats;
import org.junit.Test;

import java.time.Duration;
import java.util.Arrays;

import static org.junit.Assert.*;

public class ShardStatsHttpServerTest {

    @Test
    public void renderStatsAsJson() throws Exception {
        ShardManager manager = new ShardManager(ShardManagerOptions.create(),
                (shardId, numShards, maxConcurrency, sink) -> {
                    throw new IllegalStateException("not used");
                });
        ShardStatsHttpServer server = new ShardStatsHttpServer(manager);
        ShardManagerStats stats = new ShardManagerStats(2, 2, 1, 30, 15.0, Duration.ofMillis(42), Arrays.asList(
                new ShardInfo(0, 2, 0, ShardStatus.CONNECTED, 12, "abc", Duration.ofMillis(42), 20, 1, 0),
                new ShardInfo(1, 2, 0, ShardStatus.RECONNECTING, null, null, Duration.ZERO, 10, 3, 2)));

        JsonNode json = new ObjectMapper().readTree(server.renderStats(stats));

        assertEquals(2, json.get("shard_count").intValue());
        assertEquals(1, json.get("connected").intValue());
        assertEquals(30, json.get("guilds").intValue());
        assertEquals(42, json.get("average_latency_ms").intValue());
        assertEquals("RECONNECTING", json.get("shards").get(1).get("status").asText());
        assertEquals(2, json.get("shards").get(1).get("reconnects").intValue());
        manager.destroy();
    }
}
