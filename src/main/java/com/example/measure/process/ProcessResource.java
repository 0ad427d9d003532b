package com.example.measure.process;

import java.util.EnumSet;

/**
 * Process resource groups that can be requested when refreshing a
 * {@link ProcessSnapshot}.
 */
public enum ProcessResource {

    /** Memory figures summed over every mapping in /proc/&lt;pid&gt;/smaps. */
    MEM_USAGE,
    /** User and system mode ticks from /proc/&lt;pid&gt;/stat. */
    CPU_USAGE;

    public static EnumSet<ProcessResource> all() {
        return EnumSet.allOf(ProcessResource.class);
    }
}
