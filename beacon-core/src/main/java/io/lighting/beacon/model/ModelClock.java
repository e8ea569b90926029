package io.lighting.beacon.model;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Process-wide time source for audit timestamps, used by models whose {@link ModelConfig} has no
 * clock of its own.
 * <p>
 * Meant to be overridden from test setup. Reads are safe from any thread; set the clock before
 * starting workers that depend on it.
 */
public final class ModelClock {
    private static volatile Clock current = Clock.systemDefaultZone();

    private ModelClock() {
    }

    public static Clock current() {
        return current;
    }

    public static Instant now() {
        return current.instant();
    }

    public static void set(Clock clock) {
        current = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Uses {@code now} for the current instant, in the system default zone.
     */
    public static void set(Supplier<Instant> now) {
        set(new SupplierClock(Objects.requireNonNull(now, "now"), ZoneId.systemDefault()));
    }

    public static void reset() {
        current = Clock.systemDefaultZone();
    }

    private static final class SupplierClock extends Clock {
        private final Supplier<Instant> now;
        private final ZoneId zone;

        private SupplierClock(Supplier<Instant> now, ZoneId zone) {
            this.now = now;
            this.zone = zone;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return new SupplierClock(now, zone);
        }

        @Override
        public Instant instant() {
            return now.get();
        }
    }
}
