package dao.tron.bridge.service;

import dao.tron.bridge.exception.BridgeErrorCode;
import dao.tron.bridge.exception.StateConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OperationGuardTest {

    private final OperationGuard guard = new OperationGuard();

    @Test
    @DisplayName("Nested operation is rejected while another is in flight")
    void rejectsNestedCall() {
        StateConflictException ex = assertThrows(StateConflictException.class,
                () -> guard.execute("outer", () -> guard.execute("inner", () -> 1)));

        assertEquals(BridgeErrorCode.REENTRANT_CALL, ex.getCode());
        assertEquals("outer", ex.getDetails().get("inFlight"));
    }

    @Test
    @DisplayName("Guard is free again after an operation throws")
    void releasesAfterFailure() {
        assertThrows(IllegalStateException.class, () -> guard.run("boom", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(2, guard.execute("next", () -> 2));
    }

    @Test
    @DisplayName("Reads are allowed inside an operation")
    void readInsideOperation() {
        assertEquals("ok", guard.execute("op", () -> guard.read(() -> "ok")));
    }

    @Test
    @DisplayName("Operations from many threads never overlap")
    void serializesThreads() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger active = new AtomicInteger();
        List<Integer> maxSeen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            pool.submit(() -> {
                try {
                    guard.run("work", () -> {
                        maxSeen.add(active.incrementAndGet());
                        active.decrementAndGet();
                    });
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(200, maxSeen.size());
        assertTrue(maxSeen.stream().allMatch(n -> n == 1));
    }
}
