package com.example.measure.process;

/**
 * Memory of one process, summed over all of its mappings, in kB.
 *
 * @param privateClean  private pages unchanged since they were loaded
 * @param privateDirty  private pages modified by the process
 * @param swap          pages swapped out
 * @param size          mapped virtual size
 * @param sharedClean   shared pages unchanged since they were loaded
 * @param sharedDirty   shared pages modified
 * @param pss           proportional set size
 * @param rss           resident set size
 * @param referenced    pages recently accessed
 */
public record ProcessMemory(
        long privateClean,
        long privateDirty,
        long swap,
        long size,
        long sharedClean,
        long sharedDirty,
        long pss,
        long rss,
        long referenced
) {
    /**
     * Memory the process alone is responsible for: private dirty plus swapped pages.
     */
    public long privateDirtySum() {
        return privateDirty + swap;
    }
}
