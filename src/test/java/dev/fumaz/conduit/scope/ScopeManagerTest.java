package dev.fumaz.conduit.scope;

import dev.fumaz.conduit.bind.BindingScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class ScopeManagerTest {

    @AfterEach
    void resetGlobals() {
        GlobalSingletons.reset();
    }

    @Test
    void transientAlwaysComputes() {
        ScopeManager manager = new ScopeManager();
        AtomicInteger builds = new AtomicInteger();

        Object first = manager.get("slot", BindingScope.TRANSIENT, () -> builds.incrementAndGet() + "");
        Object second = manager.get("slot", BindingScope.TRANSIENT, () -> builds.incrementAndGet() + "");

        assertNotSame(first, second);
        assertEquals(2, builds.get());
        assertNull(manager.peek("slot", BindingScope.TRANSIENT));
    }

    @Test
    void injectorSingletonsArePerManager() {
        ScopeManager first = new ScopeManager();
        ScopeManager second = new ScopeManager();

        Object a = first.get("slot", BindingScope.INJECTOR_SINGLETON, Object::new);
        Object b = first.get("slot", BindingScope.INJECTOR_SINGLETON, Object::new);
        Object c = second.get("slot", BindingScope.INJECTOR_SINGLETON, Object::new);

        assertSame(a, b);
        assertNotSame(a, c);
        assertSame(a, first.peek("slot", BindingScope.INJECTOR_SINGLETON));
        assertEquals(1, first.getInjectorSingletonCount());
    }

    @Test
    void globalSingletonsAreSharedAcrossManagers() {
        Object slot = new Object();

        Object a = new ScopeManager().get(slot, BindingScope.GLOBAL_SINGLETON, Object::new);
        Object b = new ScopeManager().get(slot, BindingScope.GLOBAL_SINGLETON, Object::new);

        assertSame(a, b);
        assertEquals(0, new ScopeManager().getInjectorSingletonCount());
    }
}
