package discord4j.shards.common.gateway;

import reactor.core.publisher.Mono;

/**
 * One shard's connection to the Gateway.
 */
public interface ShardClient {

    int getShardId();

    /**
     * Start connecting. The shard keeps reconnecting on its own until it is destroyed or a fatal close occurs.
     *
     * @return a {@link Mono} completing when the shard is first ready, or failing if it cannot connect at all
     */
    Mono<Void> connect();

    /**
     * Send a command through this shard, once the global command budget allows it.
     *
     * @param command the command
     * @return a {@link Mono} completing when the command was queued on the socket
     */
    Mono<Void> send(GatewayCommand command);

    /**
     * Tear down the connection and cancel every pending wait. Idempotent; the client cannot be reused.
     */
    void destroy();

    ShardSession getSession();

    default ShardInfo getInfo() {
        return getSession().snapshot();
    }

    default boolean isConnected() {
        return getSession().getStatus() == ShardStatus.CONNECTED;
    }
}
