package discord4j.shards.common.transport;

/**
 * Creates the transport used by one shard.
 */
@FunctionalInterface
public interface TransportFactory {

    GatewayTransport create(int shardId);
}
