package io.delegate.micrometer;

import io.delegate.ActionDelegate;
import io.delegate.DelegateConfig;
import io.delegate.FunctionDelegate;
import io.delegate.Registration;
import io.delegate.lifetime.Observer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerDelegateMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerDelegateMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerDelegateMetrics(registry);
    }

    @Test
    void recordInvocation() {
        metrics.recordInvocation(3);
        metrics.recordInvocation(1);

        assertEquals(2.0, counter("delegate.invocations").count());
        assertEquals(4.0, counter("delegate.callbacks").count());
        assertEquals(2L, summary("delegate.invocation.fanout").count());
        assertEquals(4.0, summary("delegate.invocation.fanout").totalAmount());
    }

    @Test
    void incrementEvicted() {
        metrics.incrementEvicted(2);
        assertEquals(2.0, counter("delegate.registrations.evicted").count());
    }

    @Test
    void incrementRemoved() {
        metrics.incrementRemoved(5);
        assertEquals(5.0, counter("delegate.registrations.removed").count());
    }

    @Test
    void incrementCallbackFailure() {
        metrics.incrementCallbackFailure();
        assertEquals(1.0, counter("delegate.callbacks.failed").count());
    }

    @Test
    void adjustRegistrations() {
        metrics.adjustRegistrations(12);
        assertEquals(12.0, gauge("delegate.registrations").value());

        metrics.adjustRegistrations(-12);
        assertEquals(0.0, gauge("delegate.registrations").value());
    }

    @Test
    void recordInvocationDurationNanos() {
        metrics.recordInvocationDurationNanos(1500L);
        assertEquals(1L, summary("delegate.invocation.duration.ns").count());
        assertEquals(1500.0, summary("delegate.invocation.duration.ns").totalAmount());
    }

    @Test
    void reflectsDelegateActivity() {
        FunctionDelegate<Integer, Integer> delegate =
                new FunctionDelegate<>(new DelegateConfig().setMetrics(metrics));
        Observer observer = new Observer();
        delegate.add(x -> x + 1);
        delegate.add(x -> x * 2, observer);
        Registration<Function<? super Integer, ? extends Integer>> third = delegate.add(x -> x - 1);

        observer.close();
        delegate.invoke(3);
        third.cancel();

        assertEquals(1.0, counter("delegate.invocations").count());
        assertEquals(2.0, counter("delegate.callbacks").count());
        assertEquals(1.0, counter("delegate.registrations.evicted").count());
        assertEquals(1.0, counter("delegate.registrations.removed").count());
        assertEquals(1.0, gauge("delegate.registrations").value());
    }

    @Test
    void sharedInstanceGaugeShowsTotalAcrossDelegates() {
        DelegateConfig config = new DelegateConfig().setMetrics(metrics);
        ActionDelegate first = new ActionDelegate(config);
        ActionDelegate second = new ActionDelegate(config);

        for (int i = 0; i < 5; i++) {
            first.add(() -> {});
        }
        second.add(() -> {});
        assertEquals(6.0, gauge("delegate.registrations").value());

        first.clear();
        assertEquals(1.0, gauge("delegate.registrations").value());
        assertEquals(5.0, counter("delegate.registrations.removed").count());
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerDelegateMetrics(registry, "orders.placed");
        custom.recordInvocation(2);
        custom.adjustRegistrations(4);

        assertEquals(1.0, counter("orders.placed.invocations").count());
        assertEquals(4.0, gauge("orders.placed.registrations").value());
    }

    @Test
    void closeRemovesMetersAndStopsRecording() {
        metrics.recordInvocation(1);
        metrics.close();
        metrics.recordInvocation(1);

        assertNull(registry.find("delegate.invocations").counter());
        assertNull(registry.find("delegate.registrations").gauge());
    }

    @Test
    void nullRegistryThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerDelegateMetrics(null));
    }

    @Test
    void nullPrefixThrows() {
        assertThrows(NullPointerException.class, () -> new MicrometerDelegateMetrics(registry, null));
    }

    @Test
    void emptyPrefixThrows() {
        assertThrows(IllegalArgumentException.class, () -> new MicrometerDelegateMetrics(registry, ""));
    }

    @Test
    void prefixEndingWithDotThrows() {
        assertThrows(IllegalArgumentException.class, () -> new MicrometerDelegateMetrics(registry, "orders."));
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private Gauge gauge(String name) {
        Gauge g = registry.find(name).gauge();
        assertNotNull(g, "Gauge not found: " + name);
        return g;
    }

    private DistributionSummary summary(String name) {
        DistributionSummary s = registry.find(name).summary();
        assertNotNull(s, "Summary not found: " + name);
        return s;
    }
}
