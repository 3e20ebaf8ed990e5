package discord4j.shards.common.limiter;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import reactor.core.Disposable;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class GatewayRateLimiterTest {

    private VirtualTimeScheduler scheduler;
    private GatewayRateLimiter limiter;

    @Before
    public void setUp() {
        scheduler = VirtualTimeScheduler.create();
        limiter = new GatewayRateLimiter(RateLimiterOptions.builder()
                .setScheduler(scheduler)
                .build());
    }

    @After
    public void tearDown() {
        limiter.destroy();
        scheduler.dispose();
    }

    @Test
    public void commandBudgetWaitsForRefill() {
        for (int i = 0; i < 120; i++) {
            limiter.acquire().block();
        }
        assertTrue(limiter.isRateLimited());
        assertEquals(0, limiter.getBucketInfo(GatewayRateLimiter.GLOBAL_BUCKET).getRemaining());

        AtomicBoolean acquired = new AtomicBoolean();
        limiter.acquire().subscribe(null, null, () -> acquired.set(true));

        scheduler.advanceTimeBy(Duration.ofSeconds(59));
        assertFalse(acquired.get());
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertTrue(acquired.get());
        assertEquals(119, limiter.getBucketInfo(GatewayRateLimiter.GLOBAL_BUCKET).getRemaining());
    }

    @Test
    public void bucketsAreIndependent() {
        for (int i = 0; i < 120; i++) {
            limiter.acquire("presence").block();
        }
        assertTrue(limiter.isRateLimited("presence"));
        assertFalse(limiter.isRateLimited());
        assertNull(limiter.getBucketInfo("unknown"));
    }

    @Test
    public void bucketInfoReportsResetAfter() {
        limiter.acquire().block();
        scheduler.advanceTimeBy(Duration.ofSeconds(20));

        BucketInfo info = limiter.getBucketInfo(GatewayRateLimiter.GLOBAL_BUCKET);

        assertEquals(119, info.getRemaining());
        assertEquals(120, info.getCapacity());
        assertEquals(Duration.ofSeconds(40), info.getResetAfter());
        assertFalse(info.isBlocked());
    }

    @Test
    public void blockedBucketFailsWhenEmpty() {
        limiter.block("voice");
        for (int i = 0; i < 120; i++) {
            limiter.acquire("voice").block();
        }
        AtomicReference<Throwable> error = new AtomicReference<>();
        limiter.acquire("voice").subscribe(null, error::set);

        assertTrue(error.get() instanceof BucketBlockedException);
        assertEquals("voice", ((BucketBlockedException) error.get()).getBucketKey());

        limiter.unblock("voice");
        AtomicBoolean acquired = new AtomicBoolean();
        limiter.acquire("voice").subscribe(null, null, () -> acquired.set(true));
        scheduler.advanceTimeBy(Duration.ofSeconds(60));
        assertTrue(acquired.get());
    }

    @Test
    public void identifiesInOneBucketAreSpaced() {
        Map<Integer, Long> grantedAt = new ConcurrentHashMap<>();
        for (int shardId : new int[]{0, 2, 4}) {
            limiter.acquireIdentify(shardId, 2)
                    .subscribe(null, null, () -> grantedAt.put(shardId, scheduler.now(TimeUnit.MILLISECONDS)));
        }

        assertEquals(Long.valueOf(0), grantedAt.get(0));
        assertEquals(2, limiter.getPendingIdentifies(0));

        scheduler.advanceTimeBy(Duration.ofSeconds(4));
        assertNull(grantedAt.get(2));
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals(Long.valueOf(5000), grantedAt.get(2));
        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertEquals(Long.valueOf(10000), grantedAt.get(4));
        assertEquals(0, limiter.getPendingIdentifies(0));
    }

    @Test
    public void identifiesInDifferentBucketsOverlap() {
        Map<Integer, Long> grantedAt = new ConcurrentHashMap<>();
        for (int shardId = 0; shardId < 4; shardId++) {
            int id = shardId;
            limiter.acquireIdentify(id, 2)
                    .subscribe(null, null, () -> grantedAt.put(id, scheduler.now(TimeUnit.MILLISECONDS)));
        }

        assertEquals(Long.valueOf(0), grantedAt.get(0));
        assertEquals(Long.valueOf(0), grantedAt.get(1));

        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertEquals(Long.valueOf(5000), grantedAt.get(2));
        assertEquals(Long.valueOf(5000), grantedAt.get(3));
    }

    @Test
    public void cancelledIdentifyLeavesQueue() {
        limiter.acquireIdentify(0, 1).block();
        Disposable waiting = limiter.acquireIdentify(1, 1).subscribe();
        assertEquals(1, limiter.getPendingIdentifies(0));

        waiting.dispose();
        assertEquals(0, limiter.getPendingIdentifies(0));

        AtomicBoolean granted = new AtomicBoolean();
        limiter.acquireIdentify(2, 1).subscribe(null, null, () -> granted.set(true));
        scheduler.advanceTimeBy(Duration.ofSeconds(5));
        assertTrue(granted.get());
    }

    @Test
    public void resetAbortsWaiters() {
        for (int i = 0; i < 120; i++) {
            limiter.acquire().block();
        }
        AtomicReference<Throwable> commandError = new AtomicReference<>();
        limiter.acquire().subscribe(null, commandError::set);
        limiter.acquireIdentify(0, 1).block();
        AtomicReference<Throwable> identifyError = new AtomicReference<>();
        limiter.acquireIdentify(1, 1).subscribe(null, identifyError::set);

        limiter.reset();

        assertTrue(commandError.get() instanceof LimiterAbortedException);
        assertTrue(identifyError.get() instanceof LimiterAbortedException);
        assertFalse(limiter.isRateLimited());

        AtomicBoolean granted = new AtomicBoolean();
        limiter.acquireIdentify(2, 1).subscribe(null, null, () -> granted.set(true));
        assertTrue(granted.get());
    }

    @Test
    public void destroyRejectsFurtherRequests() {
        limiter.destroy();

        AtomicReference<Throwable> commandError = new AtomicReference<>();
        AtomicReference<Throwable> identifyError = new AtomicReference<>();
        limiter.acquire().subscribe(null, commandError::set);
        limiter.acquireIdentify(0, 1).subscribe(null, identifyError::set);

        assertTrue(commandError.get() instanceof LimiterAbortedException);
        assertTrue(identifyError.get() instanceof LimiterAbortedException);
    }
}
