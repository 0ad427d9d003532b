package com.example.measure.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeTest {

    @Test
    @DisplayName("No failures means success")
    void noFailuresIsSuccess() {
        Outcome<TimeUnit> outcome = Outcome.ofFailures(List.<TimeUnit>of());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.isUsable()).isTrue();
        assertThat(outcome.failed()).isEmpty();
    }

    @Test
    @DisplayName("Failed groups make the outcome partial")
    void failedGroupsArePartial() {
        Outcome<TimeUnit> outcome = Outcome.ofFailures(EnumSet.of(TimeUnit.SECONDS));

        assertThat(outcome.isPartial()).isTrue();
        assertThat(outcome.isUsable()).isTrue();
        assertThat(outcome.failedSet(TimeUnit.class)).containsExactly(TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Merging keeps every failed group and lets FAILED win")
    void mergeOutcomes() {
        // Given
        Outcome<TimeUnit> seconds = Outcome.ofFailures(EnumSet.of(TimeUnit.SECONDS));
        Outcome<TimeUnit> minutes = Outcome.ofFailures(EnumSet.of(TimeUnit.MINUTES));
        Outcome<TimeUnit> failed = Outcome.failed("gone");

        // Then
        assertThat(seconds.and(minutes).failed()).containsExactlyInAnyOrder(TimeUnit.SECONDS, TimeUnit.MINUTES);
        assertThat(seconds.and(Outcome.<TimeUnit>success())).isEqualTo(seconds);
        assertThat(seconds.and(failed).isFailed()).isTrue();
        assertThat(failed.and(seconds).reason()).isEqualTo("gone");
    }
}
