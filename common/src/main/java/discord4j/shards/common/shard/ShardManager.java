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

package discord4j.shards.common.shard;

import discord4j.shards.common.event.DispatchEvent;
import discord4j.shards.common.event.GatewayEvent;
import discord4j.shards.common.event.GatewayEventSink;
import discord4j.shards.common.event.LifecycleEvent;
import discord4j.shards.common.event.StatsUpdateEvent;
import discord4j.shards.common.gateway.GatewayCommand;
import discord4j.shards.common.gateway.GatewayOptions;
import discord4j.shards.common.gateway.ShardClient;
import discord4j.shards.common.gateway.ShardClientFactory;
import discord4j.shards.common.gateway.ShardInfo;
import discord4j.shards.common.gateway.ShardStatus;
import discord4j.shards.common.transport.GatewayTransportException;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Places shards, spawns them bucket by bucket and routes outbound commands to them.
 * <p>
 * Shards are grouped into concurrency buckets by {@code shardId % maxConcurrency}. Shards of one bucket are started
 * together; the next bucket starts once the previous one is ready and the spawn delay has elapsed. A failing shard
 * never aborts its siblings: it keeps reconnecting on its own and failures are reported as {@link LifecycleEvent
 * lifecycle events}.
 */
public class ShardManager {

    private static final Logger log = Loggers.getLogger(ShardManager.class);

    private final ShardManagerOptions options;
    private final ShardClientFactory clientFactory;
    private final Scheduler scheduler;
    private final GatewayEventSink events = new GatewayEventSink();
    private final Map<Integer, ShardClient> clients = new ConcurrentHashMap<>();
    private final AtomicInteger nextShard = new AtomicInteger();
    private final AtomicBoolean allReadyPublished = new AtomicBoolean();
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private final Disposable.Swap statsTask = Disposables.swap();
    private final Disposable readyWatcher;

    private volatile int numShards;
    private volatile int maxConcurrency = 1;
    private volatile List<Integer> shardIds = Collections.emptyList();

    public ShardManager(GatewayOptions gatewayOptions, ShardManagerOptions options) {
        this(options, ShardClientFactory.fromOptions(gatewayOptions));
    }

    public ShardManager(ShardManagerOptions options, ShardClientFactory clientFactory) {
        this.options = options;
        this.clientFactory = clientFactory;
        this.scheduler = options.getScheduler();
        this.readyWatcher = events.on(LifecycleEvent.class)
                .filter(event -> event.getType() == LifecycleEvent.Type.SHARD_READY)
                .subscribe(event -> checkAllReady());
    }

    /**
     * Spawn shards using the configured total shard count, or a single shard if none is configured.
     *
     * @return a {@link Mono} completing once every bucket was started
     */
    public Mono<Void> spawn() {
        return spawn(null, null, null);
    }

    public Mono<Void> spawn(GatewayBotInfo botInfo) {
        return spawn(botInfo.getGuildCount(), botInfo.getMaxConcurrency(), botInfo.getRecommendedShards());
    }

    /**
     * Compute the shard total, validate it and spawn every owned shard bucket by bucket.
     *
     * @param guildCount the number of guilds of the bot, if known
     * @param maxConcurrency the identify concurrency granted to the bot, or {@code null} for the configured value
     * @param recommendedShards the shard count recommended by the Gateway, if known
     * @return a {@link Mono} completing once every bucket was started, or failing with a
     * {@link ShardConfigurationException} for invalid settings
     */
    public Mono<Void> spawn(@Nullable Integer guildCount, @Nullable Integer maxConcurrency,
                            @Nullable Integer recommendedShards) {
        return Mono.defer(() -> {
            if (destroyed.get()) {
                return Mono.error(new ShardConfigurationException("Shard manager was destroyed"));
            }
            if (!clients.isEmpty()) {
                return Mono.error(new ShardConfigurationException("Shards are already spawned"));
            }
            int concurrency = maxConcurrency != null ? maxConcurrency : options.getMaxConcurrency();
            if (concurrency < 1 || concurrency > ShardManagerOptions.MAX_CONCURRENCY_CEILING) {
                return Mono.error(ShardConfigurationException.concurrencyOutOfBounds(concurrency,
                        ShardManagerOptions.MAX_CONCURRENCY_CEILING));
            }
            int total = computeTotalShards(guildCount, recommendedShards);
            List<Integer> ids = resolveShardIds(total);

            this.numShards = total;
            this.maxConcurrency = concurrency;
            this.shardIds = ids;
            this.allReadyPublished.set(false);

            log.info("Spawning {} of {} shards with max concurrency {}", ids.size(), total, concurrency);
            startStats();
            return spawnBuckets(groupIntoBuckets(ids, concurrency));
        });
    }

    /**
     * Compute the total shard count from the configured total, the Gateway recommendation and the guild count.
     *
     * @param guildCount the number of guilds, if known
     * @param recommendedShards the recommended shard count, if known
     * @return the total shard count
     * @throws ShardConfigurationException if the resulting guilds per shard exceed the configured maximum
     */
    int computeTotalShards(@Nullable Integer guildCount, @Nullable Integer recommendedShards) {
        int maxGuilds = options.getMaxGuildsPerShard();
        int total;
        if (options.getTotalShards() != null) {
            total = options.getTotalShards();
        } else if (recommendedShards != null) {
            total = recommendedShards;
            if (guildCount != null && recommendedShards > 0 && ceilDiv(guildCount, recommendedShards) > maxGuilds) {
                total = ceilDiv(guildCount, maxGuilds);
            }
        } else if (guildCount != null) {
            total = ceilDiv(guildCount, maxGuilds);
        } else {
            total = 1;
        }
        if (options.getTotalShards() == null) {
            total = Math.max(total, options.getShardCountBase());
        }
        if (total < 1) {
            throw ShardConfigurationException.invalidShardCount(total);
        }
        if (guildCount != null) {
            int guildsPerShard = ceilDiv(guildCount, total);
            if (guildsPerShard > maxGuilds) {
                throw ShardConfigurationException.tooManyGuilds(guildsPerShard, maxGuilds);
            }
        }
        return total;
    }

    private List<Integer> resolveShardIds(int total) {
        List<Integer> configured = options.getShardList();
        if (configured == null) {
            List<Integer> ids = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                ids.add(i);
            }
            return ids;
        }
        for (int id : configured) {
            if (id < 0 || id >= total) {
                throw ShardConfigurationException.invalidShardId(id, total);
            }
        }
        return configured.stream().distinct().sorted().collect(Collectors.toList());
    }

    /**
     * Group shard ids by concurrency bucket, in ascending bucket order.
     *
     * @param ids the shard ids
     * @param concurrency the number of buckets
     * @return bucket id to shard ids
     */
    static Map<Integer, List<Integer>> groupIntoBuckets(List<Integer> ids, int concurrency) {
        Map<Integer, List<Integer>> buckets = new TreeMap<>();
        for (int id : ids) {
            buckets.computeIfAbsent(id % concurrency, k -> new ArrayList<>()).add(id);
        }
        return buckets;
    }

    private Mono<Void> spawnBuckets(Map<Integer, List<Integer>> buckets) {
        return Flux.fromIterable(buckets.entrySet())
                .index()
                .concatMap(indexed -> {
                    int bucketId = indexed.getT2().getKey();
                    List<Integer> ids = indexed.getT2().getValue();
                    Mono<Void> bucket = Mono.defer(() -> spawnBucket(bucketId, ids));
                    if (indexed.getT1() == 0) {
                        return bucket;
                    }
                    return Mono.delay(options.getSpawnDelay(), scheduler).then(bucket);
                })
                .then()
                .doOnSuccess(v -> log.info("All {} buckets started", buckets.size()));
    }

    private Mono<Void> spawnBucket(int bucketId, List<Integer> ids) {
        log.debug("Starting bucket {} with shards {}", bucketId, ids);
        return Flux.fromIterable(ids)
                .flatMap(this::spawnShard)
                .then();
    }

    private Mono<Void> spawnShard(int shardId) {
        if (destroyed.get()) {
            return Mono.empty();
        }
        ShardClient client = clientFactory.create(shardId, numShards, maxConcurrency, events);
        ShardClient previous = clients.put(shardId, client);
        if (previous != null) {
            previous.destroy();
        }
        return client.connect()
                .timeout(options.getSpawnTimeout(), scheduler)
                .doOnSuccess(v -> log.info("[shard={}] Spawned", shardId))
                .onErrorResume(error -> {
                    log.error("[shard={}] Failed to spawn: {}", shardId, error.toString());
                    events.publish(new LifecycleEvent(shardId, LifecycleEvent.Type.ERROR,
                            "Failed to spawn: " + error.getMessage(), error, null));
                    return Mono.empty();
                });
    }

    /**
     * Replace one shard with a new connection. With graceful handoff, the previous connection keeps serving until the
     * new one is ready or the handoff timeout elapses.
     *
     * @param shardId the shard to replace
     * @return a {@link Mono} completing when the replacement is ready, or when the handoff timed out
     */
    public Mono<Void> respawnShard(int shardId) {
        return Mono.defer(() -> {
            if (shardId < 0 || shardId >= numShards) {
                return Mono.error(ShardConfigurationException.invalidShardId(shardId, numShards));
            }
            ShardClient old = clients.get(shardId);
            if (!options.isGracefulHandoff() || old == null || !old.isConnected()) {
                log.info("[shard={}] Respawning", shardId);
                allReadyPublished.set(false);
                return spawnShard(shardId);
            }
            log.info("[shard={}] Respawning with graceful handoff", shardId);
            ShardClient fresh = clientFactory.create(shardId, numShards, maxConcurrency, events);
            return fresh.connect()
                    .timeout(options.getHandoffTimeout(), scheduler)
                    .then(Mono.fromRunnable(() -> handOff(shardId, old, fresh)))
                    .onErrorResume(TimeoutException.class, e -> {
                        log.warn("[shard={}] Replacement not ready within {}, switching anyway", shardId,
                                options.getHandoffTimeout());
                        handOff(shardId, old, fresh);
                        return Mono.empty();
                    })
                    .doOnError(e -> {
                        log.error("[shard={}] Replacement failed, keeping previous connection: {}", shardId,
                                e.toString());
                        fresh.destroy();
                    })
                    .doOnCancel(fresh::destroy)
                    .then();
        });
    }

    private void handOff(int shardId, ShardClient old, ShardClient fresh) {
        if (!clients.replace(shardId, old, fresh)) {
            fresh.destroy();
            return;
        }
        old.destroy();
        log.info("[shard={}] Handoff complete", shardId);
    }

    /**
     * Destroy every shard and spawn them again with the same placement.
     *
     * @return a {@link Mono} completing once every bucket was started again
     */
    public Mono<Void> respawnAll() {
        return Mono.defer(() -> {
            if (shardIds.isEmpty()) {
                return Mono.error(new ShardConfigurationException("No shards were spawned"));
            }
            log.info("Respawning all {} shards", shardIds.size());
            destroyClients();
            allReadyPublished.set(false);
            return spawnBuckets(groupIntoBuckets(shardIds, maxConcurrency));
        });
    }

    /**
     * Return the next connected shard in round-robin order.
     *
     * @return a connected shard, or empty if none is connected
     */
    public Optional<ShardClient> getNextShard() {
        List<ShardClient> connected = connectedClients();
        if (connected.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(connected.get(Math.floorMod(nextShard.getAndIncrement(), connected.size())));
    }

    public Optional<ShardClient> getShard(int shardId) {
        return Optional.ofNullable(clients.get(shardId));
    }

    /**
     * Return the shard receiving events for the given guild.
     *
     * @param guildId the guild snowflake
     * @return a shard id between 0 and the total shard count
     */
    public int calculateShardId(String guildId) {
        return calculateShardId(guildId, numShards);
    }

    public static int calculateShardId(String guildId, int numShards) {
        if (numShards < 1) {
            throw ShardConfigurationException.invalidShardCount(numShards);
        }
        long id;
        try {
            id = Long.parseUnsignedLong(guildId);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid guild id: " + guildId, e);
        }
        return (int) ((id >>> 22) % numShards);
    }

    /**
     * Send a command through the shard it belongs to. Guild scoped commands go to the owning shard, soundboard
     * requests are split by owning shard, presence updates go to every connected shard and anything else to the next
     * shard in round-robin order.
     *
     * @param command the command
     * @return a {@link Mono} completing once every involved shard queued the command
     */
    public Mono<Void> send(GatewayCommand command) {
        return Mono.defer(() -> {
            switch (command.getOpcode()) {
                case REQUEST_GUILD_MEMBERS:
                case VOICE_STATE_UPDATE:
                    return ownerOf(command.getGuildIds().get(0)).flatMap(client -> client.send(command));
                case REQUEST_SOUNDBOARD_SOUNDS:
                    Map<Integer, List<String>> byShard = new LinkedHashMap<>();
                    for (String guildId : command.getGuildIds()) {
                        byShard.computeIfAbsent(calculateShardId(guildId), k -> new ArrayList<>()).add(guildId);
                    }
                    return Flux.fromIterable(byShard.entrySet())
                            .flatMap(entry -> clientFor(entry.getKey())
                                    .flatMap(client -> client.send(command.withGuildIds(entry.getValue()))))
                            .then();
                case PRESENCE_UPDATE:
                    List<ShardClient> connected = connectedClients();
                    if (connected.isEmpty()) {
                        return Mono.error(new GatewayTransportException("No shard is connected"));
                    }
                    return Flux.fromIterable(connected).flatMap(client -> client.send(command)).then();
                default:
                    return getNextShard()
                            .map(client -> client.send(command))
                            .orElseGet(() -> Mono.error(new GatewayTransportException("No shard is connected")));
            }
        });
    }

    /**
     * Send a command through one specific shard.
     *
     * @param shardId the shard to use
     * @param command the command
     * @return a {@link Mono} completing once the shard queued the command
     */
    public Mono<Void> send(int shardId, GatewayCommand command) {
        return clientFor(shardId).flatMap(client -> client.send(command));
    }

    private Mono<ShardClient> ownerOf(String guildId) {
        return Mono.defer(() -> clientFor(calculateShardId(guildId)));
    }

    private Mono<ShardClient> clientFor(int shardId) {
        ShardClient client = clients.get(shardId);
        if (client == null) {
            return Mono.error(new GatewayTransportException("Shard " + shardId + " is not managed here"));
        }
        return Mono.just(client);
    }

    private List<ShardClient> connectedClients() {
        return clients.values().stream()
                .filter(ShardClient::isConnected)
                .sorted(Comparator.comparingInt(ShardClient::getShardId))
                .collect(Collectors.toList());
    }

    public ShardManagerStats getStats() {
        List<ShardInfo> infos = clients.values().stream()
                .map(ShardClient::getInfo)
                .sorted(Comparator.comparingInt(ShardInfo::getShardId))
                .collect(Collectors.toList());
        int connected = 0;
        int totalGuilds = 0;
        long latencySum = 0;
        for (ShardInfo info : infos) {
            totalGuilds += info.getGuildCount();
            if (info.getStatus() == ShardStatus.CONNECTED) {
                connected++;
                latencySum += info.getLatency().toMillis();
            }
        }
        double averageGuilds = infos.isEmpty() ? 0 : (double) totalGuilds / infos.size();
        Duration averageLatency = connected == 0 ? Duration.ZERO : Duration.ofMillis(latencySum / connected);
        return new ShardManagerStats(numShards, infos.size(), connected, totalGuilds, averageGuilds, averageLatency,
                Collections.unmodifiableList(infos));
    }

    private void startStats() {
        Duration interval = options.getStatsInterval();
        if (interval.isZero() || interval.isNegative()) {
            return;
        }
        statsTask.update(Flux.interval(interval, scheduler)
                .subscribe(tick -> events.publish(new StatsUpdateEvent(getStats()))));
    }

    private void checkAllReady() {
        List<Integer> expected = shardIds;
        if (expected.isEmpty() || allReadyPublished.get()) {
            return;
        }
        for (int id : expected) {
            ShardClient client = clients.get(id);
            if (client == null || !client.isConnected()) {
                return;
            }
        }
        if (allReadyPublished.compareAndSet(false, true)) {
            log.info("All {} shards are ready", expected.size());
            events.publish(new LifecycleEvent(GatewayEvent.FLEET, LifecycleEvent.Type.ALL_SHARDS_READY,
                    "All " + expected.size() + " shards are ready"));
        }
    }

    public int getNumShards() {
        return numShards;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public List<Integer> getShardIds() {
        return shardIds;
    }

    public Flux<GatewayEvent> events() {
        return events.asFlux();
    }

    public Flux<DispatchEvent> dispatch() {
        return events.on(DispatchEvent.class);
    }

    public <E extends GatewayEvent> Flux<E> on(Class<E> type) {
        return events.on(type);
    }

    /**
     * Destroy every shard and complete the event streams. The manager cannot be used afterwards.
     */
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        statsTask.dispose();
        destroyClients();
        readyWatcher.dispose();
        events.complete();
        log.info("Shard manager destroyed");
    }

    private void destroyClients() {
        List<ShardClient> current = new ArrayList<>(clients.values());
        clients.clear();
        current.forEach(ShardClient::destroy);
    }

    private static int ceilDiv(int dividend, int divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
