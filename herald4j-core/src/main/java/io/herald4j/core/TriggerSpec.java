package io.herald4j.core;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Timing of a scheduled message: either a repeating interval or a single local date-time.
 * Exactly one of {@code interval} / {@code fireAt} is set, matching {@code type}.
 *
 * <p>Intervals are whole seconds between 1 second and {@link #MAX_INTERVAL}, the precision they are stored with.
 */
public record TriggerSpec(
        TriggerType type,
        Duration interval,
        LocalDateTime fireAt
) {

    public static final Duration MAX_INTERVAL = Duration.ofDays(3650);

    public TriggerSpec {
        Objects.requireNonNull(type, "type must not be null");
        switch (type) {
            case INTERVAL -> {
                Objects.requireNonNull(interval, "interval must not be null for INTERVAL triggers");
                if (interval.isZero() || interval.isNegative()) {
                    throw new IllegalArgumentException("interval must be a positive duration");
                }
                if (interval.getNano() != 0) {
                    throw new IllegalArgumentException("interval must be a whole number of seconds: " + interval);
                }
                if (interval.compareTo(MAX_INTERVAL) > 0) {
                    throw new IllegalArgumentException("interval must not exceed " + MAX_INTERVAL.toDays() + " days: " + interval);
                }
                if (fireAt != null) {
                    throw new IllegalArgumentException("INTERVAL trigger must not carry fireAt");
                }
            }
            case FIRE_AT -> {
                Objects.requireNonNull(fireAt, "fireAt must not be null for FIRE_AT triggers");
                if (interval != null) {
                    throw new IllegalArgumentException("FIRE_AT trigger must not carry an interval");
                }
            }
        }
    }

    public static TriggerSpec everySeconds(long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("interval seconds must be positive: " + seconds);
        }
        return new TriggerSpec(TriggerType.INTERVAL, Duration.ofSeconds(seconds), null);
    }

    public static TriggerSpec every(Duration interval) {
        return new TriggerSpec(TriggerType.INTERVAL, interval, null);
    }

    public static TriggerSpec at(LocalDateTime fireAt) {
        return new TriggerSpec(TriggerType.FIRE_AT, null, fireAt);
    }

    public boolean isRecurring() {
        return type.isRecurring();
    }
}
