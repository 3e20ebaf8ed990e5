package discord4j.shards.common.shard;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.util.annotation.Nullable;

/**
 * Bot connection metadata fetched once before spawning.
 */
public final class GatewayBotInfo {

    @Nullable
    private final Integer recommendedShards;
    @Nullable
    private final Integer maxConcurrency;
    @Nullable
    private final Integer guildCount;

    public GatewayBotInfo(@Nullable Integer recommendedShards, @Nullable Integer maxConcurrency,
                          @Nullable Integer guildCount) {
        this.recommendedShards = recommendedShards;
        this.maxConcurrency = maxConcurrency;
        this.guildCount = guildCount;
    }

    /**
     * Read the {@code shards} and {@code session_start_limit.max_concurrency} fields of a bot gateway response.
     *
     * @param response the response body
     * @param guildCount the guild count, if known
     * @return the metadata
     */
    public static GatewayBotInfo fromResponse(JsonNode response, @Nullable Integer guildCount) {
        JsonNode shards = response.path("shards");
        JsonNode concurrency = response.path("session_start_limit").path("max_concurrency");
        return new GatewayBotInfo(shards.isInt() ? shards.intValue() : null,
                concurrency.isInt() ? concurrency.intValue() : null, guildCount);
    }

    @Nullable
    public Integer getRecommendedShards() {
        return recommendedShards;
    }

    @Nullable
    public Integer getMaxConcurrency() {
        return maxConcurrency;
    }

    @Nullable
    public Integer getGuildCount() {
        return guildCount;
    }

    @Override
    public String toString() {
        return "GatewayBotInfo{" +
                "recommendedShards=" + recommendedShards +
                ", maxConcurrency=" + maxConcurrency +
                ", guildCount=" + guildCount +
                '}';
    }
}
