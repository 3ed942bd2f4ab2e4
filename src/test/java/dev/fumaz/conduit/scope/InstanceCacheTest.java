package dev.fumaz.conduit.scope;

import dev.fumaz.conduit.exception.ProvisionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstanceCacheTest {

    @Test
    void computesOncePerSlot() {
        InstanceCache cache = new InstanceCache();
        AtomicInteger builds = new AtomicInteger();

        Object first = cache.getOrCompute("slot", () -> {
            builds.incrementAndGet();
            return new Object();
        });
        Object second = cache.getOrCompute("slot", () -> {
            builds.incrementAndGet();
            return new Object();
        });

        assertSame(first, second);
        assertEquals(1, builds.get());
        assertEquals(1, cache.size());
    }

    @Test
    void slotsAreIndependent() {
        InstanceCache cache = new InstanceCache();

        Object first = cache.getOrCompute("first", Object::new);
        Object second = cache.getOrCompute("second", Object::new);

        assertNotSame(first, second);
        assertEquals(2, cache.size());
    }

    @Test
    void failedBuildLeavesSlotEmpty() {
        InstanceCache cache = new InstanceCache();
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalStateException.class, () -> cache.getOrCompute("slot", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("boom");
        }));

        assertNull(cache.peek("slot"));
        assertFalse(cache.contains("slot"));

        Object instance = cache.getOrCompute("slot", () -> {
            attempts.incrementAndGet();
            return "built";
        });

        assertEquals("built", instance);
        assertEquals(2, attempts.get());
    }

    @Test
    void nullResultIsNotCached() {
        InstanceCache cache = new InstanceCache();
        AtomicInteger attempts = new AtomicInteger();

        assertNull(cache.getOrCompute("slot", () -> {
            attempts.incrementAndGet();
            return null;
        }));
        assertFalse(cache.contains("slot"));

        assertEquals("built", cache.getOrCompute("slot", () -> {
            attempts.incrementAndGet();
            return "built";
        }));
        assertEquals(2, attempts.get());
    }

    @Test
    void concurrentCallersShareOneBuild() throws Exception {
        InstanceCache cache = new InstanceCache();
        AtomicInteger builds = new AtomicInteger();
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<Object>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return cache.getOrCompute("slot", () -> {
                        builds.incrementAndGet();
                        sleep(50);
                        return new Object();
                    });
                }));
            }

            start.countDown();

            Object expected = futures.get(0).get(5, TimeUnit.SECONDS);

            for (Future<Object> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }

            assertEquals(1, builds.get(), "the build function should run exactly once");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void waitingOnASlotHeldByAThreadWaitingForUsFails() throws Exception {
        InstanceCache cache = new InstanceCache();
        CountDownLatch firstHeld = new CountDownLatch(1);
        CountDownLatch secondHeld = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<String> first = executor.submit(() -> cache.<String>getOrCompute("first", () -> {
                firstHeld.countDown();
                await(secondHeld);
                return cache.getOrCompute("second", () -> "second");
            }));
            Future<String> second = executor.submit(() -> cache.<String>getOrCompute("second", () -> {
                secondHeld.countDown();
                await(firstHeld);
                return cache.getOrCompute("first", () -> "first");
            }));

            int failures = 0;

            for (Future<String> future : List.of(first, second)) {
                try {
                    future.get(10, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    assertInstanceOf(ProvisionException.class, e.getCause());
                    failures++;
                }
            }

            assertTrue(failures >= 1, "at least one side of the cycle should fail");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void globalSingletonsCanBeReset() {
        Object slot = new Object();

        try {
            Object first = GlobalSingletons.cache().getOrCompute(slot, Object::new);
            assertTrue(GlobalSingletons.contains(slot));
            assertSame(first, GlobalSingletons.cache().getOrCompute(slot, Object::new));

            GlobalSingletons.reset();

            assertFalse(GlobalSingletons.contains(slot));
            assertNotSame(first, GlobalSingletons.cache().getOrCompute(slot, Object::new));
        } finally {
            GlobalSingletons.reset();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
