package dev.fumaz.conduit.benchmark;

import dev.fumaz.conduit.annotation.Inject;
import dev.fumaz.conduit.bind.Key;
import dev.fumaz.conduit.injector.Injector;
import dev.fumaz.conduit.module.ConduitModule;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class InjectorBenchmark {

    private static final Key<CompositeService> EXPLICIT_COMPOSITE = Key.named(CompositeService.class, "explicit");

    @State(Scope.Benchmark)
    public static class InjectorState {

        Injector injector;

        @Setup(Level.Trial)
        public void setUp() {
            injector = Injector.create(new BenchmarkModule());
        }
    }

    @Benchmark
    public Object resolveSingleton(InjectorState state) {
        return state.injector.resolve(SingletonService.class);
    }

    @Benchmark
    public Object resolveCompositeGraph(InjectorState state) {
        return state.injector.resolve(CompositeService.class);
    }

    @Benchmark
    public Object resolveExplicitCompositeGraph(InjectorState state) {
        return state.injector.resolve(EXPLICIT_COMPOSITE);
    }

    @Benchmark
    public Object resolveAllPlugins(InjectorState state) {
        return state.injector.resolveAll(Plugin.class);
    }

    @Benchmark
    public void unboundOptionalLookup(InjectorState state, Blackhole blackhole) {
        blackhole.consume(state.injector.resolveOptional(UnboundType.class));
    }

    private static class BenchmarkModule extends ConduitModule {
        @Override
        public void configure() {
            bind(SingletonService.class).asSingleton().toSelf();
            bind(HeavyComputation.class).toSelf();
            bind(ExpensiveDependency.class).toSelf();
            bind(TransientService.class).toSelf();
            bind(CompositeService.class).toSelf();
            bind(EXPLICIT_COMPOSITE).toConstructor(SingletonService.class, TransientService.class,
                    ExpensiveDependency.class, CompositeService::new);

            for (int i = 0; i < 8; i++) {
                bindMulti(Plugin.class).toConstructor(HeavyComputation.class, Plugin::new);
            }
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        @Inject
        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class TransientService {
        private final ExpensiveDependency dependency;

        @Inject
        public TransientService(ExpensiveDependency dependency) {
            this.dependency = dependency;
        }

        public int compute() {
            return dependency.value();
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final TransientService transientService;
        private final ExpensiveDependency expensiveDependency;

        @Inject
        public CompositeService(SingletonService singletonService,
                                TransientService transientService,
                                ExpensiveDependency expensiveDependency) {
            this.singletonService = singletonService;
            this.transientService = transientService;
            this.expensiveDependency = expensiveDependency;
        }

        public int aggregate() {
            return singletonService.compute() + transientService.compute() + expensiveDependency.value();
        }
    }

    public static class ExpensiveDependency {
        private final HeavyComputation heavyComputation;

        @Inject
        public ExpensiveDependency(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int value() {
            return heavyComputation.compute();
        }
    }

    public static class Plugin {
        private final HeavyComputation heavyComputation;

        public Plugin(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class UnboundType {
    }
}
