package io.delegate.demo;

import io.delegate.ConsumerDelegate;
import io.delegate.DelegateConfig;
import io.delegate.FunctionDelegate;
import io.delegate.InvocationMode;
import io.delegate.Registration;
import io.delegate.lifetime.LivenessToken;
import io.delegate.lifetime.Lifetime;
import io.delegate.lifetime.Observer;
import io.delegate.value.DelegateValue;

import java.util.List;
import java.util.function.Consumer;

/**
 * Walks through observer-bound subscriptions, the value wrapper, and result collection.
 * <p>
 * Run with: mvn -pl samples/delegate-demo exec:java
 */
public final class DelegateDemo {

    public static void main(String[] args) {
        // 1. A value whose changes are broadcast
        DelegateValue<Integer> volume = new DelegateValue<>(5, new DelegateConfig().setName("volume"));

        // 2. A subscriber that is itself an observer (inheritance)
        Speaker speaker = new Speaker("left", volume);

        // 3. A subscriber that holds an observer (composition)
        Meter meter = new Meter(volume);

        volume.set(7);
        System.out.println("[Demo] volume is now " + volume.get());

        // 4. Destroy the speaker; its subscription disappears without unsubscribing
        speaker.close();
        volume.set(3);
        System.out.println("[Demo] subscriptions after speaker closed: " + volume.size());

        meter.dispose();
        volume.set(0);
        System.out.println("[Demo] subscriptions after meter disposed: " + volume.size());

        // 5. Collecting results in registration order
        FunctionDelegate<String, Boolean> validators = new FunctionDelegate<>(
                new DelegateConfig().setName("validators").setInvocationMode(InvocationMode.LOCKED));
        validators.add(input -> !input.isBlank());
        validators.add(input -> input.length() <= 8);
        Registration<?> digits = validators.add(input -> input.chars().anyMatch(Character::isDigit));

        List<Boolean> results = validators.invoke("secret1");
        System.out.println("[Demo] validator results for 'secret1': " + results);

        digits.cancel();
        System.out.println("[Demo] validator results without digit rule: " + validators.invoke("secret"));

        // 6. Delegates are callables too, so they chain
        ConsumerDelegate<String> log = new ConsumerDelegate<>();
        log.add(line -> System.out.println("[Log] " + line));
        ConsumerDelegate<String> events = new ConsumerDelegate<>();
        events.add(log);
        events.invoke("demo finished");
    }

    private static final class Speaker extends Observer {
        private final String channel;

        Speaker(String channel, DelegateValue<Integer> volume) {
            this.channel = channel;
            volume.add(this::onVolume, this);
        }

        private void onVolume(int level) {
            System.out.println("[Speaker " + channel + "] volume -> " + level);
        }
    }

    private static final class Meter implements Lifetime {
        private final Observer observer = new Observer();

        Meter(DelegateValue<Integer> volume) {
            Consumer<Integer> render = level -> System.out.println("[Meter] " + "#".repeat(level));
            volume.add(render, this);
        }

        @Override
        public LivenessToken livenessToken() {
            return observer.livenessToken();
        }

        void dispose() {
            observer.close();
        }
    }
}
