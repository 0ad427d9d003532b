package com.example.measure.system;

/**
 * Installed memory, constant for the lifetime of a system's Common Data.
 *
 * @param memTotalKb  total usable physical memory (kB)
 * @param swapTotalKb total swap space (kB)
 */
public record MemoryTotals(long memTotalKb, long swapTotalKb) {
}
