package com.example.measure.system;

/**
 * Point-in-time memory figures from meminfo, all in kB.
 *
 * @param freeKb       unused physical memory
 * @param buffersKb    memory used for file buffers
 * @param cachedKb     page cache
 * @param swapFreeKb   unused swap
 * @param swapCachedKb swap also present in memory
 */
public record MemoryUsage(
        long freeKb,
        long buffersKb,
        long cachedKb,
        long swapFreeKb,
        long swapCachedKb
) {
    /**
     * Memory in use, counting swap: everything installed minus what is free or
     * reclaimable caches.
     */
    public long usedKb(MemoryTotals totals) {
        return totals.memTotalKb() + totals.swapTotalKb()
                - freeKb - cachedKb - buffersKb - swapFreeKb - swapCachedKb;
    }
}
