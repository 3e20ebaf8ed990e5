package discord4j.shards.common.event;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.concurrent.Queues;

import java.util.concurrent.locks.LockSupport;

/**
 * Multicasts {@link GatewayEvent gateway events} to every subscriber. Each subscriber gets its own unbounded
 * buffer, so a slow subscriber never causes events to be dropped for the others. Up to
 * {@link Queues#SMALL_BUFFER_SIZE} events are retained until the first subscriber arrives.
 */
public class GatewayEventSink {

    private static final Logger log = Loggers.getLogger(GatewayEventSink.class);

    private final Sinks.Many<GatewayEvent> sink =
            Sinks.many().multicast().onBackpressureBuffer(Queues.SMALL_BUFFER_SIZE, false);

    public void publish(GatewayEvent event) {
        Sinks.EmitResult result;
        while ((result = sink.tryEmitNext(event)) == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
            LockSupport.parkNanos(10);
        }
        if (result.isFailure()) {
            if (sink.currentSubscriberCount() > 0) {
                log.warn("Unable to deliver {}: {}", event, result);
            } else if (log.isDebugEnabled()) {
                log.debug("No subscriber for {}: {}", event, result);
            }
        }
    }

    public Flux<GatewayEvent> asFlux() {
        return sink.asFlux().onBackpressureBuffer();
    }

    public <E extends GatewayEvent> Flux<E> on(Class<E> type) {
        return asFlux().ofType(type);
    }

    public void complete() {
        sink.tryEmitComplete();
    }
}
