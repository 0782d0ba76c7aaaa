package io.herald4j.internal;

import io.herald4j.MutableClock;
import io.herald4j.core.TriggerSpec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class TriggerSetTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-06-01T12:00:00Z"));
    private final TriggerSet triggers = new TriggerSet(clock);

    @Test
    void installShouldReturnCancellationTag() {
        assertThat(triggers.install("7", "-100", TriggerSpec.everySeconds(10))).isEqualTo("job_7");
        assertThat(triggers.contains("7")).isTrue();
    }

    @Test
    void tickShouldReportDueJobsAndMoveThemForward() {
        triggers.install("7", "-100", TriggerSpec.everySeconds(10));

        assertThat(triggers.tick()).isEmpty();
        clock.advance(Duration.ofSeconds(10));

        assertThat(triggers.tick()).containsExactly(new TriggerSet.Firing("7", "-100", true));
        assertThat(triggers.nextFireAt("7")).contains(clock.instant().plusSeconds(10));
        assertThat(triggers.tick()).isEmpty();
    }

    @Test
    void lateTickShouldFireOnceNotCatchUp() {
        triggers.install("7", "-100", TriggerSpec.everySeconds(10));
        clock.advance(Duration.ofSeconds(35));

        assertThat(triggers.tick()).hasSize(1);
        assertThat(triggers.tick()).isEmpty();
    }

    @Test
    void fireAtTriggerShouldStayLatentForNextDay() {
        triggers.install("8", "-100", TriggerSpec.at(LocalDateTime.of(2026, 6, 1, 12, 0, 5)));
        clock.advance(Duration.ofSeconds(5));

        assertThat(triggers.tick()).containsExactly(new TriggerSet.Firing("8", "-100", false));
        assertThat(triggers.nextFireAt("8")).contains(Instant.parse("2026-06-02T12:00:05Z"));
    }

    @Test
    void installShouldReplaceExistingTimer() {
        triggers.install("7", "-100", TriggerSpec.everySeconds(10));
        triggers.install("7", "-100", TriggerSpec.everySeconds(100));

        assertThat(triggers.size()).isEqualTo(1);
        assertThat(triggers.nextFireAt("7")).contains(clock.instant().plusSeconds(100));
    }

    @Test
    void failuresAndReschedulesShouldOnlyAffectLiveTimers() {
        assertThat(triggers.recordFailure("missing")).isZero();
        assertThat(triggers.reschedule("missing", clock.instant())).isFalse();

        triggers.install("7", "-100", TriggerSpec.everySeconds(10));
        assertThat(triggers.recordFailure("7")).isEqualTo(1);
        assertThat(triggers.recordFailure("7")).isEqualTo(2);
        assertThat(triggers.reschedule("7", clock.instant().plusSeconds(3))).isTrue();
        assertThat(triggers.nextFireAt("7")).contains(clock.instant().plusSeconds(3));
    }

    @Test
    void cancelShouldRemoveTimer() {
        triggers.install("7", "-100", TriggerSpec.everySeconds(10));

        assertThat(triggers.cancel("7")).isTrue();
        assertThat(triggers.cancel("7")).isFalse();
        clock.advance(Duration.ofMinutes(1));
        assertThat(triggers.tick()).isEmpty();
    }
}
