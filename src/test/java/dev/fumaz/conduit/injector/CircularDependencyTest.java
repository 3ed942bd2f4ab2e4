package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.annotation.Named;
import dev.fumaz.conduit.bind.Key;
import dev.fumaz.conduit.exception.CyclicDependencyException;
import dev.fumaz.conduit.module.ConduitModule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CircularDependencyTest {

    @Test
    void reportsOrderedCycleForConstructorInjection() {
        Injector injector = Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(FirstComponent.class).toSelf();
                bind(SecondComponent.class).toSelf();
                bind(ThirdComponent.class).toSelf();
            }
        });

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
                () -> injector.resolve(FirstComponent.class));

        assertEquals(List.of(Key.of(FirstComponent.class), Key.of(SecondComponent.class),
                Key.of(ThirdComponent.class), Key.of(FirstComponent.class)), exception.getCycle());

        String message = exception.getMessage();
        assertNotNull(message, "cycle detection should report a message");
        assertTrue(message.contains("Dependency cycle detected while resolving"),
                "message should mention cycle detection");
        assertTrue(message.contains("Cycle path:"), "message should include the cycle path header");
        assertTrue(message.contains(SecondComponent.class.getName()),
                "message should mention the types participating in the cycle");
    }

    @Test
    void cycleStartsAtTheRepeatedKey() {
        Injector injector = Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(Entry.class).toConstructor(FirstComponent.class, Entry::new);
                bind(FirstComponent.class).toSelf();
                bind(SecondComponent.class).toSelf();
                bind(ThirdComponent.class).toSelf();
            }
        });

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
                () -> injector.resolve(Entry.class));

        assertEquals(Key.of(FirstComponent.class), exception.getCycle().get(0));
        assertEquals(Key.of(Entry.class), exception.getResolutionPath().get(0));
    }

    @Test
    void singletonDependingOnItselfFailsWithoutDeadlock() {
        Injector injector = Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(Node.class).asSingleton().toConstructor(Node.class, Node::new);
            }
        });

        CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
                () -> injector.resolve(Node.class));

        assertEquals(List.of(Key.of(Node.class), Key.of(Node.class)), exception.getCycle());
        assertThrows(CyclicDependencyException.class, () -> injector.resolve(Node.class),
                "a failed singleton should stay unbuilt");
    }

    @Test
    void cycleThroughFactoryIsDetected() {
        Injector injector = Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(Node.class).toFactory(resolver -> new Node(resolver.resolve(Node.class)));
            }
        });

        assertThrows(CyclicDependencyException.class, () -> injector.resolve(Node.class));
    }

    @Test
    void allowsReentrantResolutionWhenQualifiersDiffer() {
        Injector injector = Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(QualifiedService.class).named("two").to(QualifiedSecondary.class);
                bind(QualifiedService.class).named("one").to(QualifiedPrimary.class);
                bind(QualifiedConsumer.class).toSelf();
            }
        });

        QualifiedConsumer consumer = injector.resolve(QualifiedConsumer.class);

        assertNotNull(consumer, "consumer should be constructed successfully");
        assertInstanceOf(QualifiedPrimary.class, consumer.primary,
                "primary service should resolve the @Named(\"one\") binding");
        assertInstanceOf(QualifiedSecondary.class, ((QualifiedPrimary) consumer.primary).secondary,
                "primary service should receive the @Named(\"two\") dependency");
    }

    static class FirstComponent {
        FirstComponent(SecondComponent second) {
        }
    }

    static class SecondComponent {
        SecondComponent(ThirdComponent third) {
        }
    }

    static class ThirdComponent {
        ThirdComponent(FirstComponent first) {
        }
    }

    static class Entry {
        Entry(FirstComponent first) {
        }
    }

    static class Node {
        final Node next;

        Node(Node next) {
            this.next = next;
        }
    }

    interface QualifiedService {
    }

    static class QualifiedPrimary implements QualifiedService {
        final QualifiedService secondary;

        @Inject
        QualifiedPrimary(@Named("two") QualifiedService secondary) {
            this.secondary = secondary;
        }
    }

    static class QualifiedSecondary implements QualifiedService {
    }

    static class QualifiedConsumer {
        final QualifiedService primary;

        @Inject
        QualifiedConsumer(@Named("one") QualifiedService primary) {
            this.primary = primary;
        }
    }
}
