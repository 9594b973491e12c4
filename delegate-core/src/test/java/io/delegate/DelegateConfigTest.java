package io.delegate;

import io.delegate.spi.DelegateMetrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DelegateConfigTest {

    @Test
    void defaults() {
        DelegateConfig config = new DelegateConfig();

        assertEquals("delegate", config.getName());
        assertEquals(InvocationMode.LOCKED, config.getInvocationMode());
        assertSame(DelegateMetrics.NOOP, config.getMetrics());
    }

    @Test
    void settersChain() {
        RecordingMetrics metrics = new RecordingMetrics();

        DelegateConfig config = new DelegateConfig()
                .setName("clicks")
                .setInvocationMode(InvocationMode.SNAPSHOT)
                .setMetrics(metrics);

        assertEquals("clicks", config.getName());
        assertEquals(InvocationMode.SNAPSHOT, config.getInvocationMode());
        assertSame(metrics, config.getMetrics());
    }

    @Test
    void rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new DelegateConfig().setName("  "));
        assertThrows(NullPointerException.class, () -> new DelegateConfig().setName(null));
    }

    @Test
    void rejectsNullModeAndMetrics() {
        assertThrows(NullPointerException.class, () -> new DelegateConfig().setInvocationMode(null));
        assertThrows(NullPointerException.class, () -> new DelegateConfig().setMetrics(null));
    }

    @Test
    void delegateReadsConfigOnce() {
        DelegateConfig config = new DelegateConfig().setName("first");
        ActionDelegate delegate = new ActionDelegate(config);

        config.setName("second").setInvocationMode(InvocationMode.SNAPSHOT);

        assertEquals("first", delegate.name());
        assertEquals(InvocationMode.LOCKED, delegate.invocationMode());
    }

    @Test
    void noopMetricsAcceptEverything() {
        DelegateMetrics metrics = DelegateMetrics.NOOP;

        assertDoesNotThrow(() -> {
            metrics.recordInvocation(3);
            metrics.incrementEvicted(1);
            metrics.incrementRemoved(1);
            metrics.adjustRegistrations(-1);
            metrics.incrementCallbackFailure();
            metrics.recordInvocationDurationNanos(10L);
        });
    }
}
