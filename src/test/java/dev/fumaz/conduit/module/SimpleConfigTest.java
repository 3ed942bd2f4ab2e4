package dev.fumaz.conduit.module;

import dev.fumaz.conduit.annotation.Singleton;
import dev.fumaz.conduit.bind.BindingScope;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.scope.GlobalSingletons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimpleConfigTest {

    interface Greeter {
        String greet();
    }

    static class English implements Greeter {
        @Override
        public String greet() {
            return "hello";
        }
    }

    static class French implements Greeter {
        @Override
        public String greet() {
            return "bonjour";
        }
    }

    @Singleton
    static class Registry {
    }

    static class Settings {
    }

    @AfterEach
    void resetGlobals() {
        GlobalSingletons.reset();
    }

    @Test
    void registersImplementations() {
        Injector injector = Injector.create(new SimpleConfig().register(Greeter.class, English.class));

        assertEquals("hello", injector.resolve(Greeter.class).greet());
    }

    @Test
    void laterRegistrationReplacesEarlierOne() {
        SimpleConfig config = new SimpleConfig()
                .register(Greeter.class, English.class)
                .register(Greeter.class, French.class);

        assertInstanceOf(French.class, Injector.create(config).resolve(Greeter.class));
    }

    @Test
    void honoursSingletonAnnotationAndExplicitScope() {
        Injector annotated = Injector.create(new SimpleConfig().register(Registry.class, Registry.class));
        assertSame(annotated.resolve(Registry.class), annotated.resolve(Registry.class));

        Injector transientScope = Injector.create(new SimpleConfig()
                .register(Registry.class, Registry.class, BindingScope.TRANSIENT));
        assertNotSame(transientScope.resolve(Registry.class), transientScope.resolve(Registry.class));

        SimpleConfig global = new SimpleConfig().register(Registry.class, Registry.class, BindingScope.GLOBAL_SINGLETON);
        assertSame(Injector.create(global).resolve(Registry.class), Injector.create(global).resolve(Registry.class));
    }

    @Test
    void registersInstancesAndFactories() {
        Settings settings = new Settings();
        SimpleConfig config = new SimpleConfig()
                .registerInstance(Settings.class, settings)
                .registerFactory(Greeter.class, resolver -> new English(), BindingScope.INJECTOR_SINGLETON);

        Injector injector = Injector.create(config);

        assertSame(settings, injector.resolve(Settings.class));
        assertSame(injector.resolve(Greeter.class), injector.resolve(Greeter.class));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void rejectsMismatchedTypesAtRegistration() {
        SimpleConfig config = new SimpleConfig();

        assertThrows(IllegalArgumentException.class, () -> config.register((Class) Greeter.class, (Class) Settings.class));
        assertThrows(IllegalArgumentException.class, () -> config.registerInstance((Class) Greeter.class, new Settings()));
    }

    @Test
    void configCanBeReused() {
        SimpleConfig config = new SimpleConfig().register(Greeter.class, English.class);

        Injector.create(config);
        Injector injector = Injector.create(config);

        assertEquals(2, injector.getBindings().size(), "one greeter binding plus the injector itself");
    }
}
