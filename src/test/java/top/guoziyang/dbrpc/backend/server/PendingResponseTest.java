package top.guoziyang.dbrpc.backend.server;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;
import top.guoziyang.dbrpc.transport.Result;

public class PendingResponseTest {

    @Test
    public void testCompleteWakesWaiter() throws Exception {
        PendingResponse pending = new PendingResponse("r1");
        Result result = Result.success(Collections.singletonMap("row_id", 1L));
        new Thread(() -> pending.complete(result)).start();

        assertSame(result, pending.await(5_000L));
        assertFalse(pending.complete(Result.success(null)));
    }

    @Test
    public void testTimeoutThenLateResultIsDropped() throws Exception {
        PendingResponse pending = new PendingResponse("r1");
        assertNull(pending.await(20L));
        assertTrue(pending.abandon());

        assertFalse(pending.complete(Result.success(null)));
        assertNull(pending.getResult());
        assertTrue(pending.isAbandoned());
    }

    @Test
    public void testAbandonLosesToEarlierResult() {
        PendingResponse pending = new PendingResponse("r1");
        assertTrue(pending.complete(Result.success("done")));
        assertFalse(pending.abandon());
        assertEquals(Result.success("done"), pending.getResult());
    }

    @Test
    public void testExactlyOnceUnderRace() throws Exception {
        for (int round = 0; round < 200; round++) {
            PendingResponse pending = new PendingResponse("r" + round);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger delivered = new AtomicInteger();
            Thread worker = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    return;
                }
                if (pending.complete(Result.success("late"))) {
                    delivered.incrementAndGet();
                }
            });
            worker.start();
            start.countDown();
            if (pending.abandon()) {
                delivered.incrementAndGet();
            }
            worker.join(TimeUnit.SECONDS.toMillis(5));
            assertEquals(1, delivered.get());
        }
    }

    @Test
    public void testRegistryCountsLateResults() {
        PendingResponseRegistry registry = new PendingResponseRegistry();
        PendingResponse pending = registry.register("r1");
        try {
            registry.register("r1");
            fail("expected DUPLICATE_REQUEST");
        } catch (DriverException e) {
            assertEquals(ErrorCode.DUPLICATE_REQUEST, e.getCode());
        }
        assertTrue(registry.isWaiting("r1"));

        pending.abandon();
        assertFalse(registry.isWaiting("r1"));
        assertFalse(registry.complete("r1", Result.success(null)));
        registry.remove("r1", pending);
        assertFalse(registry.complete("r1", Result.success(null)));

        assertEquals(2, registry.lateResults());
        assertEquals(0, registry.size());
    }
}
