package com.example.measure.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InitializationTest {

    @Test
    @DisplayName("A failed initialization carries no snapshot")
    void failedCarriesNoSnapshot() {
        Initialization<String, TimeUnit> init = Initialization.failed("no such process");

        assertThat(init.isFailed()).isTrue();
        assertThat(init.snapshot()).isEmpty();
        assertThatThrownBy(init::orElseThrow)
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("no such process");
    }

    @Test
    @DisplayName("A failed outcome cannot be paired with a snapshot")
    void failedOutcomeRejectsSnapshot() {
        assertThatThrownBy(() -> Initialization.of("snapshot", Outcome.<TimeUnit>failed("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
