package dev.fumaz.conduit.injector;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.annotation.Named;
import dev.fumaz.conduit.bind.Dependency;
import dev.fumaz.conduit.exception.ProvisionException;
import dev.fumaz.conduit.exception.UnboundDependencyException;
import dev.fumaz.conduit.module.ConduitModule;
import dev.fumaz.conduit.reflection.ReflectionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MembersInjectorTest {

    static class Alpha {
    }

    static class Beta {
    }

    static class Missing {
    }

    static class Base {
        final List<String> events = new ArrayList<>();

        @Inject
        Alpha alpha;

        @Inject
        void baseReady(Alpha alpha) {
            events.add("base");
        }
    }

    static class Target extends Base {
        @Inject
        @Named("label")
        String label;

        @Inject(optional = true)
        Missing missing;

        Beta beta;

        @Inject
        void setBeta(Beta beta) {
            this.beta = beta;
            events.add("target");
        }
    }

    static class FinalField {
        @Inject
        final Alpha alpha = null;
    }

    static class Holder {
        Alpha first;
        Missing second;
        Beta third;
    }

    static class ThrowingSetter {
        @Inject
        void setAlpha(Alpha alpha) throws Exception {
            throw new Exception("rejected");
        }
    }

    private static Injector injector() {
        return Injector.create(new ConduitModule() {
            @Override
            public void configure() {
                bind(Alpha.class).asSingleton().toSelf();
                bind(Beta.class).toSelf();
                bind(String.class).named("label").toInstance("hello");
            }
        });
    }

    @Test
    void injectsAnnotatedFieldsAndMethods() {
        Injector injector = injector();
        Target target = new Target();

        injector.injectMembers(target);

        assertSame(injector.resolve(Alpha.class), target.alpha);
        assertNotNull(target.beta);
        assertEquals("hello", target.label);
        assertNull(target.missing);
        assertEquals(List.of("base", "target"), target.events, "superclass members are injected first");
    }

    @Test
    void planListsSuperclassMembersFirst() {
        List<MemberSlot> slots = MembersInjector.forType(Target.class);

        assertEquals(5, slots.size());
        assertEquals("field " + Base.class.getName() + ".alpha", slots.get(0).getDescription());
        assertEquals("method " + Base.class.getName() + ".baseReady", slots.get(1).getDescription());
        assertSame(slots, MembersInjector.forType(Target.class));
    }

    @Test
    void keepsAssignedMembersWhenLaterSlotFails() {
        Injector injector = injector();
        Holder holder = new Holder();

        List<MemberSlot> slots = List.of(
                MemberSlot.of("first", Dependency.required(Alpha.class),
                        (target, values) -> ((Holder) target).first = (Alpha) values[0]),
                MemberSlot.of("second", Dependency.required(Missing.class),
                        (target, values) -> ((Holder) target).second = (Missing) values[0]),
                MemberSlot.of("third", Dependency.required(Beta.class),
                        (target, values) -> ((Holder) target).third = (Beta) values[0]));

        UnboundDependencyException exception = assertThrows(UnboundDependencyException.class,
                () -> injector.injectMembers(holder, slots));

        assertEquals(Missing.class, exception.getKey().getType());
        assertNotNull(holder.first, "members assigned before the failure stay assigned");
        assertNull(holder.third, "members after the failure are not touched");
    }

    @Test
    void rejectsFinalFields() {
        assertThrows(ReflectionException.class, () -> injector().injectMembers(new FinalField()));
    }

    @Test
    void wrapsFailingInjectionMethod() {
        ProvisionException exception = assertThrows(ProvisionException.class,
                () -> injector().injectMembers(new ThrowingSetter()));

        assertEquals("rejected", exception.getCause().getMessage());
    }
}
