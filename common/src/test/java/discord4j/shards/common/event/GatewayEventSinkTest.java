package discord4j.shards.common.event;

import org.junit.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.Assert.assertEquals;

public class GatewayEventSinkTest {

    @Test
    public void slowSubscriberReceivesEveryEventInOrder() {
        GatewayEventSink sink = new GatewayEventSink();
        List<Integer> fast = new CopyOnWriteArrayList<>();
        sink.on(DispatchEvent.class).subscribe(event -> fast.add(event.getSequence()));

        StepVerifier.create(sink.on(DispatchEvent.class).map(DispatchEvent::getSequence), 1)
                .then(() -> {
                    for (int i = 0; i < 1000; i++) {
                        sink.publish(new DispatchEvent(0, "MESSAGE_CREATE", null, i));
                    }
                })
                .expectNext(0)
                .thenRequest(Long.MAX_VALUE)
                .expectNextSequence(range(1, 1000))
                .then(sink::complete)
                .verifyComplete();

        assertEquals(range(0, 1000), fast);
    }

    @Test
    public void retainEventsUntilFirstSubscriber() {
        GatewayEventSink sink = new GatewayEventSink();
        sink.publish(new DispatchEvent(1, "READY", null, 1));
        sink.complete();

        StepVerifier.create(sink.on(DispatchEvent.class).map(DispatchEvent::getShardId))
                .expectNext(1)
                .verifyComplete();
    }

    private static List<Integer> range(int from, int to) {
        List<Integer> values = new CopyOnWriteArrayList<>();
        for (int i = from; i < to; i++) {
            values.add(i);
        }
        return values;
    }
}
