package io.delegate.benchmark;

import io.delegate.ConsumerDelegate;
import io.delegate.DelegateConfig;
import io.delegate.FunctionDelegate;
import io.delegate.InvocationMode;
import io.delegate.lifetime.Observer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Measures invocation cost per subscriber count and invocation mode.
 *
 * <p>Run: {@code java -jar delegate-benchmarks/target/benchmarks.jar DelegateInvokeBenchmark}
 * <p>Contended: {@code java -jar delegate-benchmarks/target/benchmarks.jar -t 4 DelegateInvokeBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
@Threads(1)
public class DelegateInvokeBenchmark {

    @Param({"SNAPSHOT", "LOCKED"})
    private InvocationMode mode;

    @Param({"1", "10", "100"})
    private int subscribers;

    private ConsumerDelegate<Long> consumers;
    private FunctionDelegate<Long, Long> functions;
    private ConsumerDelegate<Long> churned;
    private final List<Observer> observers = new ArrayList<>();

    @Setup(Level.Trial)
    public void setup() {
        DelegateConfig config = new DelegateConfig().setInvocationMode(mode);
        consumers = new ConsumerDelegate<>(config);
        functions = new FunctionDelegate<>(config);
        for (int i = 0; i < subscribers; i++) {
            Observer observer = new Observer();
            observers.add(observer);
            consumers.add(value -> {}, observer);
            functions.add(value -> value + 1, observer);
        }
        churned = new ConsumerDelegate<>(config);
    }

    @Benchmark
    public void invokeVoid() {
        consumers.invoke(42L);
    }

    @Benchmark
    public void invokeCollecting(Blackhole blackhole) {
        blackhole.consume(functions.invoke(42L));
    }

    /**
     * One subscriber registered, invoked, and evicted per operation.
     */
    @Benchmark
    public void subscribeInvokeEvict() {
        Observer observer = new Observer();
        churned.add(value -> {}, observer);
        churned.invoke(42L);
        observer.close();
        churned.purgeExpired();
    }
}
