package com.example.measure.system;

/**
 * Cumulative ticks a CPU has spent at one frequency.
 *
 * @param frequencyKhz the frequency (kHz)
 * @param ticks        ticks spent at that frequency since boot
 */
public record FrequencyResidency(long frequencyKhz, long ticks) {
}
