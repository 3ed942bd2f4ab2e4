package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.exception.ProvisionException;
import dev.fumaz.conduit.module.ConduitModule;
import dev.fumaz.conduit.scope.GlobalSingletons;
import org.junit.jupiter.api.AfterEach;
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
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SingletonConcurrencyTest {

    static class Catalog {
    }

    static class Left {
    }

    static class Right {
    }

    @AfterEach
    void resetGlobals() {
        GlobalSingletons.reset();
    }

    @Test
    void globalSingletonIsBuiltOnceAcrossThreadsAndInjectors() throws Exception {
        AtomicInteger builds = new AtomicInteger();

        ConduitModule module = new ConduitModule() {
            @Override
            public void configure() {
                bind(Catalog.class).asGlobalSingleton().toFactory(resolver -> {
                    builds.incrementAndGet();
                    Thread.sleep(50);
                    return new Catalog();
                });
            }
        };

        List<Injector> injectors = List.of(Injector.create(module), Injector.create(module));
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<Catalog>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                Injector injector = injectors.get(i % injectors.size());

                futures.add(executor.submit(() -> {
                    start.await();
                    return injector.resolve(Catalog.class);
                }));
            }

            start.countDown();

            Catalog expected = futures.get(0).get(5, TimeUnit.SECONDS);

            for (Future<Catalog> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS));
            }

            assertEquals(1, builds.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void singletonCycleSplitAcrossThreadsFailsInsteadOfHanging() throws Exception {
        CountDownLatch leftEntered = new CountDownLatch(1);
        CountDownLatch rightEntered = new CountDownLatch(1);

        Injector injector = Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(Left.class).asSingleton().toFactory(resolver -> {
                    leftEntered.countDown();
                    rightEntered.await(5, TimeUnit.SECONDS);
                    resolver.resolve(Right.class);
                    return new Left();
                });
                bind(Right.class).asSingleton().toFactory(resolver -> {
                    rightEntered.countDown();
                    leftEntered.await(5, TimeUnit.SECONDS);
                    resolver.resolve(Left.class);
                    return new Right();
                });
            }
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<Left> left = executor.submit(() -> injector.resolve(Left.class));
            Future<Right> right = executor.submit(() -> injector.resolve(Right.class));

            ExecutionException leftFailure = assertThrows(ExecutionException.class, () -> left.get(10, TimeUnit.SECONDS));
            ExecutionException rightFailure = assertThrows(ExecutionException.class, () -> right.get(10, TimeUnit.SECONDS));

            assertInstanceOf(ProvisionException.class, leftFailure.getCause());
            assertInstanceOf(ProvisionException.class, rightFailure.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
